package mc.supervisor.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import mc.supervisor.config.SupervisorProperties;
import mc.supervisor.exception.InstanceOperationException;
import mc.supervisor.model.InstanceConfig;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class LaunchCommandBuilder {
    static final String USER_JVM_ARGS_FILE = "user_jvm_args.txt";
    static final String USER_JVM_ARGS_HEADER = "# JVM flags managed by MC Supervisor\n";

    private final SupervisorProperties properties;

    /**
     * Command line for {@code config}. An explicit start command wins; its JVM flags are handed
     * over through {@code user_jvm_args.txt} instead.
     */
    public List<String> build(InstanceConfig config) {
        Path dir = Paths.get(config.getDir());
        List<String> flags = JvmFlagPreset.resolve(config.getFlags(), config.isAlwaysPreTouch());

        if (config.getStartCommand() != null && !config.getStartCommand().isEmpty()) {
            writeUserJvmArgs(dir.resolve(USER_JVM_ARGS_FILE), flags);
            return new ArrayList<>(config.getStartCommand());
        }

        String jar = config.getJarFile() == null || config.getJarFile().isBlank() ? "server.jar" : config.getJarFile();
        Path jarPath = dir.resolve(jar);
        if (!Files.isRegularFile(jarPath)) {
            throw new InstanceOperationException("server jar not found at " + jarPath
                    + ". The server may still be installing or the download failed");
        }

        List<String> command = new ArrayList<>();
        command.add(properties.getJavaCommand());
        if (hasText(config.getMaxRam())) {
            command.add("-Xmx" + config.getMaxRam());
        }
        if (hasText(config.getMinRam())) {
            command.add("-Xms" + config.getMinRam());
        }
        command.addAll(flags);
        command.add("-jar");
        command.add(jar);
        command.add("nogui");
        return command;
    }

    private void writeUserJvmArgs(Path file, List<String> flags) {
        StringBuilder content = new StringBuilder(USER_JVM_ARGS_HEADER);
        flags.forEach(flag -> content.append(flag).append('\n'));
        try {
            if (Files.exists(file) && Files.readString(file, StandardCharsets.UTF_8).contentEquals(content)) {
                return;
            }
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InstanceOperationException("failed to write " + USER_JVM_ARGS_FILE + ": " + e.getMessage(), e);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
