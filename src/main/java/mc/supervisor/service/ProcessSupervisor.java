package mc.supervisor.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import mc.supervisor.config.SupervisorProperties;
import mc.supervisor.exception.InstanceOperationException;
import mc.supervisor.exception.InstanceStateException;
import mc.supervisor.model.InstanceConfig;
import mc.supervisor.model.InstanceStatus;
import mc.supervisor.model.LatencySupport;
import mc.supervisor.service.console.ConsolePipeline;
import mc.supervisor.service.metrics.MetricsPoller;
import mc.supervisor.service.metrics.ServerCapabilities;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Launches, watches and tears down the child process of each instance. At most one live process
 * exists per instance; the exit watcher reconciles state whichever way the process ends.
 */
@Slf4j
@Service
public class ProcessSupervisor {
    static final String DISABLED_SUFFIX = "_disabled";
    private static final List<String> SAFE_MODE_DIRS = List.of("plugins", "mods");
    private static final Duration EXIT_HANDLING_TIMEOUT = Duration.ofSeconds(10);

    private final InstanceRegistry registry;
    private final ConsolePipeline consolePipeline;
    private final MetricsPoller metricsPoller;
    private final ServerCapabilities capabilities;
    private final LaunchCommandBuilder launchCommandBuilder;
    private final TaskExecutor executor;
    private final Duration stopTimeout;

    @Autowired
    public ProcessSupervisor(InstanceRegistry registry, ConsolePipeline consolePipeline, MetricsPoller metricsPoller,
                             ServerCapabilities capabilities, LaunchCommandBuilder launchCommandBuilder,
                             ThreadPoolTaskExecutor supervisorExecutor, SupervisorProperties properties) {
        this(registry, consolePipeline, metricsPoller, capabilities, launchCommandBuilder,
                (TaskExecutor) supervisorExecutor, properties.getStopTimeout());
    }

    ProcessSupervisor(InstanceRegistry registry, ConsolePipeline consolePipeline, MetricsPoller metricsPoller,
                      ServerCapabilities capabilities, LaunchCommandBuilder launchCommandBuilder,
                      TaskExecutor executor, Duration stopTimeout) {
        this.registry = registry;
        this.consolePipeline = consolePipeline;
        this.metricsPoller = metricsPoller;
        this.capabilities = capabilities;
        this.launchCommandBuilder = launchCommandBuilder;
        this.executor = executor;
        this.stopTimeout = stopTimeout;
    }

    /** Launches the instance. On return the status is {@link InstanceStatus#BOOTING} or later. */
    public void start(String id) {
        launch(id, List.of());
    }

    /**
     * Starts with {@code plugins} and {@code mods} renamed out of the way. They are put back when
     * the process exits, or immediately if the launch fails.
     */
    public void startSafeMode(String id) {
        InstanceConfig config = registry.config(id);
        InstanceRuntime runtime = registry.runtime(id);
        try (LockHold ignored = runtime.getLock().read()) {
            requireStartable(id, runtime.getStatus());
        }
        Path dir = Paths.get(config.getDir());

        List<Path> disabled = new ArrayList<>();
        try {
            for (String name : SAFE_MODE_DIRS) {
                Path source = dir.resolve(name);
                if (Files.isDirectory(source)) {
                    Path target = dir.resolve(name + DISABLED_SUFFIX);
                    Files.move(source, target);
                    disabled.add(target);
                }
            }
        } catch (IOException e) {
            restoreDisabled(disabled);
            throw new InstanceOperationException("failed to prepare safe mode: " + e.getMessage(), e);
        }

        try {
            launch(id, disabled);
        } catch (RuntimeException e) {
            restoreDisabled(disabled);
            throw e;
        }
        log.info("[{}] Started in safe mode, disabled {}", config.getName(), disabled);
    }

    private void launch(String id, List<Path> disabled) {
        InstanceConfig config = registry.config(id);
        InstanceRuntime runtime = registry.runtime(id);
        awaitPreviousExit(id, runtime);

        InstanceStatus previous;
        try (LockHold ignored = runtime.getLock().write()) {
            previous = runtime.getStatus();
            requireStartable(id, previous);
            // claims the slot so a concurrent start fails the check above
            runtime.setStatus(InstanceStatus.BOOTING);
        }

        Process process;
        try {
            List<String> command = launchCommandBuilder.build(config);
            ProcessBuilder processBuilder = new ProcessBuilder(command);
            processBuilder.directory(Paths.get(config.getDir()).toFile());
            process = processBuilder.start();
        } catch (IOException | RuntimeException e) {
            try (LockHold ignored = runtime.getLock().write()) {
                runtime.setStatus(previous);
            }
            if (e instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new InstanceOperationException("failed to start server: " + e.getMessage(), e);
        }

        ProcessLaunch launch = new ProcessLaunch(process, disabled);
        LatencySupport latency = capabilities.latencySupport(config);
        try (LockHold ignored = runtime.getLock().write()) {
            runtime.setLaunch(launch);
            runtime.setProcess(process);
            runtime.setStdin(new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8)));
            runtime.setPid(process.pid());
            runtime.setStatus(InstanceStatus.BOOTING);
            runtime.getConsole().reset();
            runtime.clearPlayers();
            runtime.clearRosterRefresh();
            runtime.setTps(0);
            runtime.setLastTpsCommand(Instant.EPOCH);
            runtime.setLastRosterCommand(Instant.EPOCH);
            runtime.setLastLatencyCommand(Instant.EPOCH);
            runtime.setLastLatencyPlayer(null);
            runtime.setLatencySupported(latency.supported());
            runtime.setLatencyReason(latency.reason());
            runtime.setFabricTpsAvailable(capabilities.hasFabricTps(config));
        }

        consolePipeline.attach(runtime, process);
        launch.setMetricsTask(metricsPoller.start(config, runtime));
        executor.execute(() -> watchExit(config, runtime, launch));
        log.info("[{}] Server starting (PID: {})", config.getName(), process.pid());
    }

    private static void requireStartable(String id, InstanceStatus status) {
        if (status == InstanceStatus.INSTALLING) {
            throw new InstanceStateException("server " + id + " is still installing", status);
        }
        if (status.isLive()) {
            throw new InstanceStateException("server " + id + " is already " + status.label().toLowerCase(), status);
        }
    }

    /** A process that exited but whose watcher has not caught up yet still owns its cleanup. */
    private void awaitPreviousExit(String id, InstanceRuntime runtime) {
        ProcessLaunch previous;
        try (LockHold ignored = runtime.getLock().read()) {
            previous = runtime.getStatus().isLive() ? null : runtime.getLaunch();
        }
        if (previous != null) {
            awaitExitHandled(id, previous);
        }
    }

    /**
     * Asks the server to stop, force-kills it after the stop timeout, and leaves the instance
     * {@link InstanceStatus#STOPPED} with any pending restart cancelled. Returns once the exit has
     * been handled, safe-mode directories included.
     */
    public void stop(String id) {
        InstanceRuntime runtime = registry.runtime(id);
        ProcessLaunch launch;
        try (LockHold ignored = runtime.getLock().read()) {
            InstanceStatus status = runtime.getStatus();
            if (!status.isLive()) {
                throw new InstanceStateException(
                        "server " + id + " is not running (status: " + status.label() + ")", status);
            }
            launch = runtime.getLaunch();
        }
        if (launch != null) {
            launch.setStopRequested(true);
        }

        try {
            if (!ConsoleInput.writeLine(runtime, "stop")) {
                log.warn("Server {} has no stdin, killing it", id);
            }
        } catch (IOException e) {
            log.warn("Could not send stop to server {}: {}", id, e.getMessage());
        }

        if (launch != null) {
            awaitOrKill(id, launch.getProcess());
            awaitExitHandled(id, launch);
        }

        ScheduledFuture<?> restartTimer;
        try (LockHold ignored = runtime.getLock().write()) {
            runtime.setStatus(InstanceStatus.STOPPED);
            runtime.clearMetrics();
            runtime.clearPlayers();
            restartTimer = runtime.getRestartTimer();
            runtime.setRestartTimer(null);
            runtime.setRestartAt(null);
        }
        if (restartTimer != null) {
            restartTimer.cancel(false);
        }
        log.info("Server {} stopped", id);
    }

    private void awaitExitHandled(String id, ProcessLaunch launch) {
        try {
            launch.getExitHandled().get(EXIT_HANDLING_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Exit of server {} was not handled within {}", id, EXIT_HANDLING_TIMEOUT);
        } catch (ExecutionException e) {
            log.warn("Exit watcher of server {} failed: {}", id, e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void awaitOrKill(String id, Process process) {
        try {
            if (!process.waitFor(stopTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Server {} did not stop within {}, killing it", id, stopTimeout);
                process.destroyForcibly();
                process.waitFor(10, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }

    public void sendCommand(String id, String text) {
        InstanceRuntime runtime = registry.runtime(id);
        try (LockHold ignored = runtime.getLock().read()) {
            InstanceStatus status = runtime.getStatus();
            if (!status.isLive()) {
                throw new InstanceStateException("server " + id + " is not running", status);
            }
        }
        try {
            if (!ConsoleInput.writeLine(runtime, text)) {
                throw new InstanceOperationException("server " + id + " has no stdin");
            }
        } catch (IOException e) {
            throw new InstanceOperationException("failed to send command: " + e.getMessage(), e);
        }
    }

    /** Echoes an operator command into the console stream so every viewer sees it. */
    public void recordConsoleCommand(String id, String command) {
        consolePipeline.publish(registry.runtime(id), "> " + command);
    }

    @PreDestroy
    public void stopAll() {
        for (InstanceRuntime runtime : registry.runtimes()) {
            boolean live;
            try (LockHold ignored = runtime.getLock().read()) {
                live = runtime.getStatus().isLive();
            }
            if (!live) {
                continue;
            }
            try {
                stop(runtime.getId());
            } catch (RuntimeException e) {
                log.error("Failed to stop server {} during shutdown", runtime.getId(), e);
            }
        }
    }

    private void watchExit(InstanceConfig config, InstanceRuntime runtime, ProcessLaunch launch) {
        int exitCode;
        try {
            exitCode = launch.getProcess().waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            launch.getExitHandled().completeExceptionally(e);
            return;
        }

        try {
            InstanceStatus finalStatus = null;
            try (LockHold ignored = runtime.getLock().write()) {
                if (runtime.getLaunch() == launch) {
                    if (runtime.getStatus().isLive()) {
                        boolean clean = exitCode == 0 || launch.isStopRequested();
                        runtime.setStatus(clean ? InstanceStatus.STOPPED : InstanceStatus.CRASHED);
                    }
                    finalStatus = runtime.getStatus();
                    runtime.clearMetrics();
                    runtime.clearPlayers();
                    runtime.clearRosterRefresh();
                    runtime.setLaunch(null);
                    runtime.setProcess(null);
                    runtime.setStdin(null);
                }
            }
            // the loop and the directories belong to this process even if a newer one has taken over
            ScheduledFuture<?> metrics = launch.getMetricsTask();
            if (metrics != null) {
                metrics.cancel(false);
            }
            restoreDisabled(launch.getDisabled());

            if (finalStatus == InstanceStatus.CRASHED) {
                log.warn("[{}] Server exited with code {}", config.getName(), exitCode);
            } else {
                log.info("[{}] Server exited with code {}", config.getName(), exitCode);
            }
        } finally {
            launch.getExitHandled().complete(exitCode);
        }
    }

    private void restoreDisabled(List<Path> disabled) {
        for (Path target : disabled) {
            String name = target.getFileName().toString();
            Path original = target.resolveSibling(name.substring(0, name.length() - DISABLED_SUFFIX.length()));
            try {
                if (Files.exists(original)) {
                    log.warn("Not restoring {}: {} already exists", target, original);
                    continue;
                }
                Files.move(target, original);
            } catch (IOException e) {
                log.error("Failed to restore {} after safe mode", target, e);
            }
        }
    }
}
