package mc.supervisor.service.metrics;

import lombok.extern.slf4j.Slf4j;
import mc.supervisor.config.SupervisorProperties;
import mc.supervisor.model.InstanceConfig;
import mc.supervisor.model.InstanceStatus;
import mc.supervisor.service.ConsoleInput;
import mc.supervisor.service.InstanceRuntime;
import mc.supervisor.service.LockHold;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Per-process polling loop: samples resource usage every tick and, on slower cadences, asks the
 * server for its tick rate, roster and player latencies. Replies are picked up by the console
 * pipeline.
 */
@Slf4j
@Service
public class MetricsPoller {
    private final TaskScheduler scheduler;
    private final TaskExecutor executor;
    private final ProcessMetricsSampler sampler;
    private final ServerCapabilities capabilities;
    private final SupervisorProperties.Metrics settings;
    private final Clock clock;

    @Autowired
    public MetricsPoller(ThreadPoolTaskScheduler supervisorScheduler, ThreadPoolTaskExecutor supervisorExecutor,
                         ProcessMetricsSampler sampler, ServerCapabilities capabilities,
                         SupervisorProperties properties) {
        this(supervisorScheduler, supervisorExecutor, sampler, capabilities, properties.getMetrics(), Clock.systemUTC());
    }

    MetricsPoller(TaskScheduler scheduler, TaskExecutor executor, ProcessMetricsSampler sampler,
                  ServerCapabilities capabilities, SupervisorProperties.Metrics settings, Clock clock) {
        this.scheduler = scheduler;
        this.executor = executor;
        this.sampler = sampler;
        this.capabilities = capabilities;
        this.settings = settings;
        this.clock = clock;
    }

    /** Starts the loop for a freshly launched process. Cancel the returned future to stop it. */
    public ScheduledFuture<?> start(InstanceConfig config, InstanceRuntime runtime) {
        MetricsLoop loop = newLoop(config, runtime);
        Duration interval = settings.getInterval();
        return scheduler.scheduleAtFixedRate(loop::run, clock.instant().plus(interval), interval);
    }

    MetricsLoop newLoop(InstanceConfig config, InstanceRuntime runtime) {
        return new MetricsLoop(runtime, capabilities.tpsCommand(config), config.getType().rosterCommand(),
                config.getType().isProxy());
    }

    final class MetricsLoop {
        private final InstanceRuntime runtime;
        private final String tpsCommand;
        private final String rosterCommand;
        private final boolean proxy;
        private long tick;
        private int resyncTick;

        MetricsLoop(InstanceRuntime runtime, String tpsCommand, String rosterCommand, boolean proxy) {
            this.runtime = runtime;
            this.tpsCommand = tpsCommand;
            this.rosterCommand = rosterCommand;
            this.proxy = proxy;
        }

        void run() {
            try {
                tick(clock.instant());
            } catch (Exception e) {
                log.warn("Metrics tick failed for server {}", runtime.getId(), e);
            }
        }

        void tick(Instant now) {
            tick++;
            long pid;
            InstanceStatus status;
            try (LockHold ignored = runtime.getLock().read()) {
                pid = runtime.getPid();
                status = runtime.getStatus();
            }
            if (pid == 0) {
                return;
            }

            ProcessMetricsSampler.Sample sample = sampler.sample(pid);
            if (sample != null) {
                try (LockHold ignored = runtime.getLock().write()) {
                    if (runtime.getPid() == pid) {
                        runtime.setCpu(sample.cpuPercent());
                        runtime.setRamMb(sample.ramMb());
                    }
                }
            }

            boolean running = status == InstanceStatus.RUNNING;
            if (running && tpsCommand != null && tick % settings.getTpsEveryTicks() == 0) {
                try (LockHold ignored = runtime.getLock().write()) {
                    runtime.setLastTpsCommand(now);
                }
                send(tpsCommand);
            }

            if (!proxy) {
                pollRoster(running, now);
            }

            if (running && tick % settings.getLatencyEveryTicks() == 0) {
                pollLatency(now);
            }
        }

        private void pollRoster(boolean running, Instant now) {
            boolean due;
            try (LockHold ignored = runtime.getLock().write()) {
                if (!running) {
                    resyncTick = 0;
                    return;
                }
                resyncTick++;
                if (resyncTick >= settings.getRosterResyncEveryTicks()) {
                    resyncTick = 0;
                    runtime.scheduleRosterRefresh(Duration.ZERO, now);
                }
                due = runtime.isRosterRefreshDue(now);
                if (due) {
                    runtime.clearRosterRefresh();
                    runtime.setLastRosterCommand(now);
                }
            }
            if (due) {
                send(rosterCommand);
            }
        }

        private void pollLatency(Instant now) {
            List<String> targets;
            try (LockHold ignored = runtime.getLock().write()) {
                if (!runtime.isLatencySupported() || runtime.getPlayers().isEmpty()) {
                    return;
                }
                runtime.setLastLatencyCommand(now);
                targets = runtime.getPlayers().keySet().stream()
                        .filter(name -> !runtime.getLatencyExcluded().contains(name))
                        .toList();
            }
            if (targets.isEmpty()) {
                return;
            }
            executor.execute(() -> {
                for (String name : targets) {
                    try (LockHold ignored = runtime.getLock().write()) {
                        runtime.setLastLatencyPlayer(name);
                    }
                    send("ping " + name);
                    if (!pause(settings.getLatencyQuerySpacing())) {
                        return;
                    }
                }
            });
        }

        private void send(String command) {
            try {
                if (!ConsoleInput.writeLine(runtime, command)) {
                    log.debug("Server {} has no stdin, skipped '{}'", runtime.getId(), command);
                }
            } catch (IOException e) {
                log.debug("Failed to send '{}' to server {}: {}", command, runtime.getId(), e.getMessage());
            }
        }
    }

    private static boolean pause(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
