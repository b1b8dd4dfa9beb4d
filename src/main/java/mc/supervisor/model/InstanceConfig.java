package mc.supervisor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Durable definition of a managed server, persisted in the registry file.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public class InstanceConfig {
    private String id;
    private String name;
    private ServerType type;
    private String version;
    private int port;
    @Builder.Default
    private String jarFile = "server.jar";
    private String minRam;
    private String maxRam;
    private int maxPlayers;
    private String dir;
    @Builder.Default
    private List<String> startCommand = new ArrayList<>();
    private boolean autoStart;
    private String flags;
    private boolean alwaysPreTouch;
    private BackupCadence backupSchedule;
    private String lastScheduledBackup;

    public InstanceConfig copy() {
        return toBuilder().startCommand(new ArrayList<>(startCommand == null ? List.of() : startCommand)).build();
    }
}
