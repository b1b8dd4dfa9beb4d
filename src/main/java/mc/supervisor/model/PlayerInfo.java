package mc.supervisor.model;

import lombok.Builder;
import lombok.Value;

/** Read-only view of an online player. */
@Value
@Builder
public class PlayerInfo {
    String name;
    String address;
    int ping;
    String world;
    String onlineTime;
}
