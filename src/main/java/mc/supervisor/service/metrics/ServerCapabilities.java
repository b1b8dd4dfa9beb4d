package mc.supervisor.service.metrics;

import lombok.extern.slf4j.Slf4j;
import mc.supervisor.model.InstanceConfig;
import mc.supervisor.model.LatencySupport;
import mc.supervisor.model.ServerType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Which polling commands an instance understands, judged from its flavour and the add-on jars in
 * its working directory.
 */
@Slf4j
@Component
public class ServerCapabilities {
    public static final String MISSING_PING_MOD = "missing_pingplayer_mod";
    public static final String UNSUPPORTED_TYPE = "unsupported_server_type";
    public static final String MISSING_PING_PLUGIN = "missing_pingplayer";

    /** Command that reports tick rate, or null if none is available. */
    public String tpsCommand(InstanceConfig config) {
        ServerType type = config.getType();
        if (type == null || type.isProxy()) {
            return null;
        }
        if (type == ServerType.FABRIC && !hasFabricTps(config)) {
            return null;
        }
        return type.tpsCommand();
    }

    public boolean hasFabricTps(InstanceConfig config) {
        return hasJar(Paths.get(config.getDir(), "mods"), "fabric-tps", "fabric_tps", "fabrictps");
    }

    public LatencySupport latencySupport(InstanceConfig config) {
        ServerType type = config.getType();
        Path dir = Paths.get(config.getDir());
        if (type != null && type.isModded()) {
            return hasJar(dir.resolve("mods"), "player-ping", "player_ping", "playerping", "pingplayer")
                    ? LatencySupport.available()
                    : LatencySupport.unavailable(MISSING_PING_MOD);
        }
        if (type == ServerType.VANILLA) {
            return LatencySupport.unavailable(UNSUPPORTED_TYPE);
        }
        return hasJar(dir.resolve("plugins"), "pingplayer")
                ? LatencySupport.available()
                : LatencySupport.unavailable(MISSING_PING_PLUGIN);
    }

    private boolean hasJar(Path dir, String... fragments) {
        if (!Files.isDirectory(dir)) {
            return false;
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(path -> path.getFileName().toString().toLowerCase(Locale.ROOT))
                    .filter(name -> name.endsWith(".jar"))
                    .anyMatch(name -> Stream.of(fragments).anyMatch(name::contains));
        } catch (IOException e) {
            log.warn("Could not list {}: {}", dir, e.getMessage());
            return false;
        }
    }
}
