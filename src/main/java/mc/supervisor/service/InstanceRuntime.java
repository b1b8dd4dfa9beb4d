package mc.supervisor.service;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import mc.supervisor.model.InstanceStatus;
import mc.supervisor.model.PlayerSession;
import mc.supervisor.service.console.ConsoleBuffer;

import java.io.Writer;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;

/**
 * Volatile state of one managed instance. Every field is read and written with {@link #getLock()}
 * held; the accessors themselves do no locking.
 */
@Getter
@Setter
public class InstanceRuntime {
    @Setter(AccessLevel.NONE)
    private final String id;
    @Setter(AccessLevel.NONE)
    private final InstanceLock lock = new InstanceLock();
    @Setter(AccessLevel.NONE)
    private final ConsoleBuffer console;

    private InstanceStatus status;
    private Process process;
    private ProcessLaunch launch;
    private Writer stdin;
    private long pid;
    private double cpu;
    private long ramMb;
    private double tps;

    @Setter(AccessLevel.NONE)
    private final Map<String, PlayerSession> players = new LinkedHashMap<>();
    @Setter(AccessLevel.NONE)
    private final Set<String> latencyExcluded = new HashSet<>();

    private Instant lastTpsCommand = Instant.EPOCH;
    private Instant lastRosterCommand = Instant.EPOCH;
    private Instant lastLatencyCommand = Instant.EPOCH;
    private String lastLatencyPlayer;

    private boolean rosterRefreshPending;
    private Instant rosterRefreshDue;

    private boolean latencySupported;
    private String latencyReason = "";
    private boolean fabricTpsAvailable;

    private ScheduledFuture<?> restartTimer;
    private Instant restartAt;

    private String installError;

    public InstanceRuntime(String id, InstanceStatus status, ConsoleBuffer console) {
        this.id = id;
        this.status = status;
        this.console = console;
    }

    /** Requests a roster query after {@code delay}; an earlier pending request is kept. */
    public void scheduleRosterRefresh(Duration delay, Instant now) {
        Instant due = now.plus(delay);
        if (!rosterRefreshPending || rosterRefreshDue == null || due.isBefore(rosterRefreshDue)) {
            rosterRefreshDue = due;
        }
        rosterRefreshPending = true;
    }

    public void clearRosterRefresh() {
        rosterRefreshPending = false;
        rosterRefreshDue = null;
    }

    public boolean isRosterRefreshDue(Instant now) {
        return rosterRefreshPending && rosterRefreshDue != null && !now.isBefore(rosterRefreshDue);
    }

    public void clearPlayers() {
        players.clear();
        latencyExcluded.clear();
    }

    public void clearMetrics() {
        cpu = 0;
        ramMb = 0;
        pid = 0;
    }

    public boolean recentlyIssued(Instant issuedAt, Duration window, Instant now) {
        return issuedAt != null && Duration.between(issuedAt, now).compareTo(window) < 0;
    }
}
