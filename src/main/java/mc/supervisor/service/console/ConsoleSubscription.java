package mc.supervisor.service.console;

import mc.supervisor.model.ConsoleEntry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A viewer's handle on an instance's console: the catch-up snapshot taken at subscribe time plus a
 * bounded queue of live entries. Closing is idempotent.
 */
public class ConsoleSubscription implements AutoCloseable {
    private final List<ConsoleEntry> entries;
    private final boolean reset;
    private final BlockingQueue<ConsoleEntry> queue;
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile Runnable onClose;

    ConsoleSubscription(List<ConsoleEntry> entries, boolean reset, int capacity) {
        this.entries = List.copyOf(entries);
        this.reset = reset;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
    }

    /** Subscription for an instance that does not exist: empty and already closed. */
    public static ConsoleSubscription closedEmpty() {
        ConsoleSubscription subscription = new ConsoleSubscription(List.of(), false, 1);
        subscription.closed.set(true);
        return subscription;
    }

    void onClose(Runnable action) {
        this.onClose = action;
    }

    /** Non-blocking; returns false and drops the entry when the viewer has fallen behind. */
    boolean offer(ConsoleEntry entry) {
        return !closed.get() && queue.offer(entry);
    }

    public List<ConsoleEntry> getEntries() {
        return entries;
    }

    public boolean isReset() {
        return reset;
    }

    /** Next live entry, or null if none arrived within the timeout or the subscription is closed. */
    public ConsoleEntry poll(Duration timeout) throws InterruptedException {
        ConsoleEntry entry = queue.poll();
        if (entry != null || closed.get()) {
            return entry;
        }
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public List<ConsoleEntry> drain() {
        List<ConsoleEntry> drained = new ArrayList<>();
        queue.drainTo(drained);
        return drained;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            Runnable action = onClose;
            if (action != null) {
                action.run();
            }
        }
    }
}
