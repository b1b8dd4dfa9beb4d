package mc.supervisor.service.console;

import lombok.extern.slf4j.Slf4j;
import mc.supervisor.config.SupervisorProperties;
import mc.supervisor.model.ConsoleEntry;
import mc.supervisor.model.InstanceStatus;
import mc.supervisor.model.PlayerSession;
import mc.supervisor.service.InstanceRegistry;
import mc.supervisor.service.InstanceRuntime;
import mc.supervisor.service.LockHold;
import mc.supervisor.service.console.ConsoleEvent.LatencyReported;
import mc.supervisor.service.console.ConsoleEvent.LatencyTargetMissing;
import mc.supervisor.service.console.ConsoleEvent.PlayerJoined;
import mc.supervisor.service.console.ConsoleEvent.PlayerLeft;
import mc.supervisor.service.console.ConsoleEvent.RosterReported;
import mc.supervisor.service.console.ConsoleEvent.ServerReady;
import mc.supervisor.service.console.ConsoleEvent.TpsReported;
import mc.supervisor.service.console.ConsoleEvent.WorldReported;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Feeds child output into runtime state and the console stream, and hands out resumable
 * subscriptions to it.
 */
@Slf4j
@Service
public class ConsolePipeline {
    static final Duration TPS_REPLY_WINDOW = Duration.ofSeconds(5);
    static final Duration ROSTER_REPLY_WINDOW = Duration.ofSeconds(10);
    static final Duration LATENCY_REPLY_WINDOW = Duration.ofSeconds(10);

    private final InstanceRegistry registry;
    private final TaskExecutor executor;
    private final Duration readyRosterDelay;
    private final Duration playerEventRosterDelay;
    private final Clock clock;

    @Autowired
    public ConsolePipeline(InstanceRegistry registry, ThreadPoolTaskExecutor supervisorExecutor,
                           SupervisorProperties properties) {
        this(registry, supervisorExecutor, properties, Clock.systemUTC());
    }

    public ConsolePipeline(InstanceRegistry registry, TaskExecutor executor, SupervisorProperties properties, Clock clock) {
        this.registry = registry;
        this.executor = executor;
        this.readyRosterDelay = properties.getConsole().getReadyRosterDelay();
        this.playerEventRosterDelay = properties.getConsole().getPlayerEventRosterDelay();
        this.clock = clock;
    }

    /** Starts one reader per output stream of {@code process}. */
    public void attach(InstanceRuntime runtime, Process process) {
        executor.execute(() -> readLines(runtime, process.getInputStream(), "stdout"));
        executor.execute(() -> readLines(runtime, process.getErrorStream(), "stderr"));
    }

    private void readLines(InstanceRuntime runtime, InputStream stream, String name) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                process(runtime, line);
            }
        } catch (IOException e) {
            log.debug("{} reader for server {} closed: {}", name, runtime.getId(), e.getMessage());
        }
    }

    /** Applies one line of child output and records it; returns the buffered entry. */
    public ConsoleEntry process(InstanceRuntime runtime, String line) {
        List<ConsoleEvent> events = ConsoleLineParser.parse(line);
        Instant now = clock.instant();
        try (LockHold ignored = runtime.getLock().write()) {
            boolean suppressed = false;
            for (ConsoleEvent event : events) {
                apply(runtime, event, now);
                if (event.family() != null && replyWindowOpen(runtime, event.family(), now)) {
                    suppressed = true;
                }
            }
            ConsoleEntry entry = runtime.getConsole().append(line);
            if (!suppressed) {
                runtime.getConsole().broadcast(entry);
            }
            return entry;
        }
    }

    /** Appends and broadcasts a line that did not come from the child, such as installer progress. */
    public ConsoleEntry publish(InstanceRuntime runtime, String line) {
        try (LockHold ignored = runtime.getLock().write()) {
            ConsoleEntry entry = runtime.getConsole().append(line);
            runtime.getConsole().broadcast(entry);
            return entry;
        }
    }

    public ConsoleSubscription subscribe(String id, long lastSeq) {
        return registry.findRuntime(id)
                .map(runtime -> {
                    try (LockHold ignored = runtime.getLock().write()) {
                        return runtime.getConsole().subscribe(lastSeq);
                    }
                })
                .orElseGet(ConsoleSubscription::closedEmpty);
    }

    private void apply(InstanceRuntime runtime, ConsoleEvent event, Instant now) {
        Map<String, PlayerSession> players = runtime.getPlayers();
        if (event instanceof ServerReady) {
            if (runtime.getStatus() == InstanceStatus.BOOTING) {
                runtime.setStatus(InstanceStatus.RUNNING);
                runtime.scheduleRosterRefresh(readyRosterDelay, now);
                log.info("Server {} is now running", runtime.getId());
            }
        } else if (event instanceof PlayerJoined joined) {
            players.put(joined.name(), PlayerSession.joined(joined.name(), joined.address(), now));
            runtime.getLatencyExcluded().remove(joined.name());
            runtime.scheduleRosterRefresh(playerEventRosterDelay, now);
        } else if (event instanceof PlayerLeft left) {
            players.remove(left.name());
            runtime.getLatencyExcluded().remove(left.name());
            runtime.scheduleRosterRefresh(playerEventRosterDelay, now);
        } else if (event instanceof TpsReported reported) {
            runtime.setTps(reported.tps());
        } else if (event instanceof WorldReported reported) {
            PlayerSession session = players.get(reported.name());
            if (session != null) {
                session.setWorld(reported.world());
            }
        } else if (event instanceof RosterReported roster) {
            reconcileRoster(runtime, roster.names(), now);
        } else if (event instanceof LatencyReported reported) {
            PlayerSession session = players.get(reported.name());
            if (session != null) {
                session.setLatency(reported.latency());
            }
        } else if (event instanceof LatencyTargetMissing) {
            String target = runtime.getLastLatencyPlayer();
            if (target != null && replyWindowOpen(runtime, CommandFamily.LATENCY, now)) {
                runtime.getLatencyExcluded().add(target);
                PlayerSession session = players.get(target);
                if (session != null) {
                    session.setLatency(-1);
                }
            }
        }
    }

    /** The roster reply is authoritative: unknown names are added, absent names dropped. */
    static void reconcileRoster(InstanceRuntime runtime, List<String> names, Instant now) {
        Map<String, PlayerSession> players = runtime.getPlayers();
        if (names.isEmpty()) {
            players.clear();
            return;
        }
        Set<String> online = new HashSet<>(names);
        for (String name : names) {
            players.computeIfAbsent(name, n -> PlayerSession.joined(n, null, now));
        }
        players.keySet().removeIf(name -> {
            if (online.contains(name)) {
                return false;
            }
            runtime.getLatencyExcluded().remove(name);
            return true;
        });
    }

    private static boolean replyWindowOpen(InstanceRuntime runtime, CommandFamily family, Instant now) {
        switch (family) {
            case TPS:
                return runtime.recentlyIssued(runtime.getLastTpsCommand(), TPS_REPLY_WINDOW, now);
            case ROSTER:
                return runtime.recentlyIssued(runtime.getLastRosterCommand(), ROSTER_REPLY_WINDOW, now);
            case LATENCY:
                return runtime.recentlyIssued(runtime.getLastLatencyCommand(), LATENCY_REPLY_WINDOW, now);
            default:
                return false;
        }
    }
}
