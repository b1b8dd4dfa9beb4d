package mc.supervisor.service.metrics;

import mc.supervisor.model.InstanceConfig;
import mc.supervisor.model.LatencySupport;
import mc.supervisor.model.ServerType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ServerCapabilitiesTest {

    @TempDir
    Path dir;

    private final ServerCapabilities capabilities = new ServerCapabilities();

    @Test
    void paperPollsTpsAndNeedsPingPlugin() throws Exception {
        InstanceConfig paper = config(ServerType.PAPER);

        assertThat(capabilities.tpsCommand(paper)).isEqualTo(ServerType.PAPER.tpsCommand());
        assertThat(capabilities.latencySupport(paper))
                .isEqualTo(LatencySupport.unavailable(ServerCapabilities.MISSING_PING_PLUGIN));

        Files.createDirectories(dir.resolve("plugins"));
        Files.writeString(dir.resolve("plugins").resolve("PingPlayer-1.2.jar"), "jar");

        assertThat(capabilities.latencySupport(paper)).isEqualTo(LatencySupport.available());
    }

    @Test
    void fabricNeedsTpsMod() throws Exception {
        InstanceConfig fabric = config(ServerType.FABRIC);
        assertThat(capabilities.tpsCommand(fabric)).isNull();

        Files.createDirectories(dir.resolve("mods"));
        Files.writeString(dir.resolve("mods").resolve("fabric-tps-1.3.jar"), "jar");

        assertThat(capabilities.tpsCommand(fabric)).isNotNull();
        assertThat(capabilities.latencySupport(fabric))
                .isEqualTo(LatencySupport.unavailable(ServerCapabilities.MISSING_PING_MOD));
    }

    @Test
    void proxiesHaveNoTpsAndVanillaNoLatency() {
        assertThat(capabilities.tpsCommand(config(ServerType.VELOCITY))).isNull();
        assertThat(capabilities.latencySupport(config(ServerType.VANILLA)))
                .isEqualTo(LatencySupport.unavailable(ServerCapabilities.UNSUPPORTED_TYPE));
    }

    private InstanceConfig config(ServerType type) {
        return InstanceConfig.builder().id("abc12345").type(type).dir(dir.toString()).build();
    }
}
