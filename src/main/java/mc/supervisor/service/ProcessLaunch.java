package mc.supervisor.service;

import lombok.Getter;
import lombok.Setter;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * One launched child process and what has to be undone when it exits. The exit watcher of this
 * process cleans up its own metrics loop and safe-mode directories, then completes
 * {@link #getExitHandled()} with the exit code.
 */
@Getter
public class ProcessLaunch {
    private final Process process;
    private final List<Path> disabled;
    private final CompletableFuture<Integer> exitHandled = new CompletableFuture<>();

    @Setter
    private volatile ScheduledFuture<?> metricsTask;
    @Setter
    private volatile boolean stopRequested;

    public ProcessLaunch(Process process, List<Path> disabled) {
        this.process = process;
        this.disabled = List.copyOf(disabled);
    }
}
