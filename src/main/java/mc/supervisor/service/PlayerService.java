package mc.supervisor.service;

import lombok.RequiredArgsConstructor;
import mc.supervisor.exception.InstanceValidationException;
import mc.supervisor.model.InstanceConfig;
import mc.supervisor.model.InstanceStatus;
import mc.supervisor.model.LatencySupport;
import mc.supervisor.model.PlayerInfo;
import mc.supervisor.model.PlayerSession;
import mc.supervisor.service.metrics.ServerCapabilities;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Roster queries and player moderation through the server console. */
@Service
@RequiredArgsConstructor
public class PlayerService {
    private final InstanceRegistry registry;
    private final ProcessSupervisor processSupervisor;
    private final ServerCapabilities capabilities;

    /** Players currently online, sorted by name. Empty unless the server is running. */
    public List<PlayerInfo> listPlayers(String id) {
        InstanceRuntime runtime = registry.runtime(id);
        Instant now = Instant.now();
        List<PlayerInfo> players = new ArrayList<>();
        try (LockHold ignored = runtime.getLock().read()) {
            if (runtime.getStatus() != InstanceStatus.RUNNING) {
                return players;
            }
            for (PlayerSession session : runtime.getPlayers().values()) {
                players.add(PlayerInfo.builder()
                        .name(session.getName())
                        .address(session.getAddress())
                        .ping(session.getLatency())
                        .world(session.getWorld())
                        .onlineTime(formatOnlineTime(session.getJoinedAt(), now))
                        .build());
            }
        }
        players.sort(Comparator.comparing(PlayerInfo::getName));
        return players;
    }

    public void kickPlayer(String id, String playerName, String reason) {
        processSupervisor.sendCommand(id, withReason("kick " + requireName(playerName), reason));
    }

    public void banPlayer(String id, String playerName, String reason) {
        processSupervisor.sendCommand(id, withReason("ban " + requireName(playerName), reason));
    }

    public void killPlayer(String id, String playerName) {
        processSupervisor.sendCommand(id, "kill " + requireName(playerName));
    }

    /**
     * Whether per-player latency can be polled. A live runtime reports what was detected at
     * launch; otherwise the working directory is inspected.
     */
    public LatencySupport getLatencySupport(String id) {
        InstanceConfig config = registry.config(id);
        InstanceRuntime runtime = registry.runtime(id);
        try (LockHold ignored = runtime.getLock().read()) {
            String reason = runtime.getLatencyReason();
            if (runtime.isLatencySupported()) {
                return LatencySupport.available();
            }
            if (reason != null && !reason.isEmpty()) {
                return LatencySupport.unavailable(reason);
            }
        }
        return capabilities.latencySupport(config);
    }

    static String formatOnlineTime(Instant joinedAt, Instant now) {
        Duration online = joinedAt == null ? Duration.ZERO : Duration.between(joinedAt, now);
        long hours = online.toHours();
        long minutes = online.toMinutesPart();
        return hours > 0 ? hours + "h " + minutes + "m" : minutes + "m";
    }

    private static String requireName(String playerName) {
        if (playerName == null || playerName.isBlank()) {
            throw new InstanceValidationException("player name is required");
        }
        String name = playerName.trim();
        if (name.chars().anyMatch(Character::isWhitespace)) {
            throw new InstanceValidationException("invalid player name: " + name.replaceAll("\\s", " "));
        }
        return name;
    }

    /** Each stdin line is one console command, so a reason may not span lines. */
    private static String withReason(String command, String reason) {
        if (reason == null || reason.isBlank()) {
            return command;
        }
        if (reason.indexOf('\n') >= 0 || reason.indexOf('\r') >= 0) {
            throw new InstanceValidationException("reason must be a single line");
        }
        return command + " " + reason.trim();
    }
}
