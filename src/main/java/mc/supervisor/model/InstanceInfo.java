package mc.supervisor.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Combined durable and runtime view of one instance. */
@Value
@Builder
public class InstanceInfo {
    String id;
    String name;
    ServerType type;
    String version;
    int port;
    InstanceStatus status;
    double cpu;
    long ramMb;
    String minRam;
    String maxRam;
    int maxPlayers;
    int players;
    double tps;
    boolean tpsAvailable;
    long pid;
    boolean autoStart;
    String flags;
    boolean alwaysPreTouch;
    String installError;
    Instant restartAt;
    String dir;
}
