package mc.supervisor.service;

import lombok.extern.slf4j.Slf4j;
import mc.supervisor.exception.InstanceOperationException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Writes and edits {@code server.properties} and {@code eula.txt} in an instance directory. */
@Slf4j
@Service
public class ServerPropertiesService {
    static final String PROPERTIES_FILE = "server.properties";
    static final String EULA_FILE = "eula.txt";

    /** Seeds a fresh directory with an accepted EULA and the basic properties. */
    public void writeInitialFiles(Path dir, int port, int maxPlayers) {
        try {
            Files.writeString(dir.resolve(EULA_FILE), "eula=true\n", StandardCharsets.UTF_8);
            Files.writeString(dir.resolve(PROPERTIES_FILE), String.format(
                    "server-port=%d\nmotd=A Minecraft Server\nmax-players=%d\nonline-mode=true\nview-distance=10\n",
                    port, maxPlayers), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InstanceOperationException("failed to write server files: " + e.getMessage(), e);
        }
    }

    /** Rewrites the given keys in place, appending any that are missing. No-op if the file does not exist. */
    public void updateProperties(Path dir, Map<String, String> updates) {
        Path file = dir.resolve(PROPERTIES_FILE);
        if (!Files.exists(file)) {
            log.debug("No {} in {}, skipping update", PROPERTIES_FILE, dir);
            return;
        }
        try {
            List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
            Map<String, String> pending = new LinkedHashMap<>(updates);
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                if (line.startsWith("#") || !line.contains("=")) {
                    continue;
                }
                String key = line.split("=", 2)[0].trim();
                String value = pending.remove(key);
                if (value != null) {
                    lines.set(i, key + "=" + value);
                }
            }
            pending.forEach((key, value) -> lines.add(key + "=" + value));
            Files.write(file, lines, StandardCharsets.UTF_8);
            log.info("Updated {} in {}", updates.keySet(), file);
        } catch (IOException e) {
            throw new InstanceOperationException("failed to update " + PROPERTIES_FILE + ": " + e.getMessage(), e);
        }
    }
}
