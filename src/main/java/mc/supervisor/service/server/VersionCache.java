package mc.supervisor.service.server;

import mc.supervisor.config.SupervisorProperties;
import mc.supervisor.model.ServerType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Version lists per flavour, kept for a fixed time to spare the upstream APIs. */
@Component
public class VersionCache {
    private final Duration ttl;
    private final Clock clock;
    private final Map<ServerType, Entry> entries = new EnumMap<>(ServerType.class);

    private record Entry(List<GameVersion> versions, Instant expiresAt) {
    }

    @Autowired
    public VersionCache(SupervisorProperties properties) {
        this(properties.getVersions().getCacheTtl(), Clock.systemUTC());
    }

    VersionCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    public synchronized Optional<List<GameVersion>> get(ServerType type) {
        Entry entry = entries.get(type);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(type);
            return Optional.empty();
        }
        return Optional.of(entry.versions());
    }

    public synchronized void put(ServerType type, List<GameVersion> versions) {
        entries.put(type, new Entry(List.copyOf(versions), clock.instant().plus(ttl)));
    }

    public synchronized void evict(ServerType type) {
        entries.remove(type);
    }
}
