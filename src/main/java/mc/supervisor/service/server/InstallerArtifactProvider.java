package mc.supervisor.service.server;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/** Flavours whose server is produced by running a downloaded installer jar in the target directory. */
@Slf4j
abstract class InstallerArtifactProvider implements ArtifactProvider {
    private static final Duration INSTALLER_TIMEOUT = Duration.ofMinutes(30);
    private static final int OUTPUT_TAIL = 2000;

    protected final ArtifactHttpClient http;
    private final String javaCommand;

    protected InstallerArtifactProvider(ArtifactHttpClient http, String javaCommand) {
        this.http = http;
        this.javaCommand = javaCommand;
    }

    protected void downloadAndRunInstaller(String label, String installerUrl, Path targetDir, Consumer<String> progress)
            throws IOException, InterruptedException {
        String installerName = label.toLowerCase() + "-installer.jar";
        Path installer = targetDir.resolve(installerName);
        progress.accept("Downloading " + label + " installer...");
        http.download(installerUrl, installer);

        progress.accept("Running " + label + " installer (this may take a few minutes)...");
        runInstaller(label, List.of(javaCommand, "-jar", installerName, "--installServer"), targetDir, INSTALLER_TIMEOUT);

        Files.deleteIfExists(installer);
        Files.deleteIfExists(targetDir.resolve(installerName + ".log"));
        progress.accept(label + " installation complete.");
    }

    /**
     * Runs the installer with its output going to a scratch file, so the timeout applies no matter
     * how much or how little the installer prints.
     */
    static void runInstaller(String label, List<String> command, Path dir, Duration timeout)
            throws IOException, InterruptedException {
        Path output = dir.resolve(label.toLowerCase() + "-installer.out");
        Process process = new ProcessBuilder(command)
                .directory(dir.toFile())
                .redirectErrorStream(true)
                .redirectOutput(output.toFile())
                .start();
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                process.waitFor(10, TimeUnit.SECONDS);
                throw new IOException(label + " installer timed out");
            }
            if (process.exitValue() != 0) {
                String text = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
                throw new IOException(label + " installer failed (exit " + process.exitValue() + "): "
                        + text.substring(Math.max(0, text.length() - OUTPUT_TAIL)));
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        } finally {
            Files.deleteIfExists(output);
        }
    }
}
