package mc.supervisor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlayerSession {
    private String name;
    private String address;
    @Builder.Default
    private int latency = -1;
    private String world;
    private Instant joinedAt;

    public static PlayerSession joined(String name, String address, Instant now) {
        return PlayerSession.builder()
                .name(name)
                .address(address)
                .joinedAt(now)
                .build();
    }
}
