package mc.supervisor.service.schedule;

import lombok.extern.slf4j.Slf4j;
import mc.supervisor.config.SupervisorProperties;
import mc.supervisor.exception.InstanceStateException;
import mc.supervisor.exception.InstanceValidationException;
import mc.supervisor.model.InstanceStatus;
import mc.supervisor.service.InstanceRegistry;
import mc.supervisor.service.InstanceRuntime;
import mc.supervisor.service.LockHold;
import mc.supervisor.service.ProcessSupervisor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One-shot timed restarts with in-game warnings. The timer only hands the restart to the worker
 * pool, since warnings, stop and settle take the better part of a minute.
 */
@Slf4j
@Service
public class RestartScheduler {
    private final InstanceRegistry registry;
    private final ProcessSupervisor supervisor;
    private final TaskScheduler scheduler;
    private final TaskExecutor executor;
    private final SupervisorProperties.Restart settings;
    private final Clock clock;

    @Autowired
    public RestartScheduler(InstanceRegistry registry, ProcessSupervisor supervisor,
                            ThreadPoolTaskScheduler supervisorScheduler, ThreadPoolTaskExecutor supervisorExecutor,
                            SupervisorProperties properties) {
        this(registry, supervisor, supervisorScheduler, supervisorExecutor, properties.getRestart(), Clock.systemUTC());
    }

    RestartScheduler(InstanceRegistry registry, ProcessSupervisor supervisor, TaskScheduler scheduler,
                     TaskExecutor executor, SupervisorProperties.Restart settings, Clock clock) {
        this.registry = registry;
        this.supervisor = supervisor;
        this.scheduler = scheduler;
        this.executor = executor;
        this.settings = settings;
        this.clock = clock;
    }

    /** Arms a restart {@code delaySeconds} from now, replacing any pending one. */
    public Instant scheduleRestart(String id, long delaySeconds) {
        if (delaySeconds < 0) {
            throw new InstanceValidationException("delaySeconds must not be negative");
        }
        InstanceRuntime runtime = registry.runtime(id);
        Instant at = clock.instant().plusSeconds(delaySeconds);
        try (LockHold ignored = runtime.getLock().write()) {
            if (runtime.getStatus() != InstanceStatus.RUNNING) {
                throw new InstanceStateException("server must be running to schedule a restart", runtime.getStatus());
            }
            if (runtime.getRestartTimer() != null) {
                runtime.getRestartTimer().cancel(false);
            }
            AtomicReference<ScheduledFuture<?>> self = new AtomicReference<>();
            ScheduledFuture<?> timer = scheduler.schedule(() -> executor.execute(() -> fire(runtime, self)), at);
            self.set(timer);
            runtime.setRestartTimer(timer);
            runtime.setRestartAt(at);
        }
        log.info("Restart of server {} scheduled at {}", id, at);
        return at;
    }

    public void cancelRestart(String id) {
        InstanceRuntime runtime = registry.runtime(id);
        ScheduledFuture<?> timer;
        try (LockHold ignored = runtime.getLock().write()) {
            timer = runtime.getRestartTimer();
            if (timer == null) {
                throw new InstanceValidationException("no restart scheduled for server " + id);
            }
            runtime.setRestartTimer(null);
            runtime.setRestartAt(null);
        }
        timer.cancel(false);
        log.info("Restart of server {} cancelled", id);
    }

    public Optional<Instant> getRestartTime(String id) {
        InstanceRuntime runtime = registry.runtime(id);
        try (LockHold ignored = runtime.getLock().read()) {
            return Optional.ofNullable(runtime.getRestartAt());
        }
    }

    private void fire(InstanceRuntime runtime, AtomicReference<ScheduledFuture<?>> timer) {
        String id = runtime.getId();
        try (LockHold ignored = runtime.getLock().write()) {
            if (runtime.getRestartTimer() == null || runtime.getRestartTimer() != timer.get()) {
                // cancelled or replaced after the trigger was already running
                return;
            }
            runtime.setRestartTimer(null);
            runtime.setRestartAt(null);
        }

        try {
            supervisor.sendCommand(id, "say Server restarting in " + settings.getWarningLead().toSeconds() + " seconds...");
            sleep(settings.getWarningLead());
            supervisor.sendCommand(id, "say Server restarting now!");
            sleep(settings.getFinalNotice());
            supervisor.stop(id);
            sleep(settings.getSettleDelay());
            supervisor.start(id);
            log.info("Scheduled restart of server {} completed", id);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Scheduled restart of server {} interrupted", id);
        } catch (RuntimeException e) {
            log.error("Scheduled restart of server {} failed", id, e);
        }
    }

    private static void sleep(Duration duration) throws InterruptedException {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis());
        }
    }
}
