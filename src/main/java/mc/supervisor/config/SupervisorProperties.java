package mc.supervisor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "supervisor")
public class SupervisorProperties {
    private String baseDir = "./data/mcsupervisor";
    private String javaCommand = "java";
    private Duration stopTimeout = Duration.ofSeconds(30);
    private Duration autoStartDelay = Duration.ofSeconds(2);

    private Console console = new Console();

    private Metrics metrics = new Metrics();

    private Restart restart = new Restart();

    private Versions versions = new Versions();

    private Http http = new Http();

    public Path basePath() {
        return Paths.get(baseDir).toAbsolutePath().normalize();
    }

    public Path serversPath() {
        return basePath().resolve("Servers");
    }

    public Path backupsPath() {
        return basePath().resolve("Backups");
    }

    public Path registryFile() {
        return basePath().resolve("servers.json");
    }

    @Data
    public static class Console {
        private int maxHistory = 2000;
        private int trimSize = 200;
        private int subscriberCapacity = 1000;
        private Duration readyRosterDelay = Duration.ofSeconds(2);
        private Duration playerEventRosterDelay = Duration.ofMillis(200);
    }

    @Data
    public static class Metrics {
        private Duration interval = Duration.ofSeconds(2);
        private int tpsEveryTicks = 15;
        private int rosterResyncEveryTicks = 60;
        private int latencyEveryTicks = 10;
        private Duration latencyQuerySpacing = Duration.ofMillis(200);
    }

    @Data
    public static class Restart {
        private Duration warningLead = Duration.ofSeconds(10);
        private Duration finalNotice = Duration.ofSeconds(1);
        private Duration settleDelay = Duration.ofSeconds(3);
    }

    @Data
    public static class Versions {
        private Duration cacheTtl = Duration.ofMinutes(15);
    }

    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(15);
        private String userAgent = "mc-supervisor/0.0.1";
    }
}
