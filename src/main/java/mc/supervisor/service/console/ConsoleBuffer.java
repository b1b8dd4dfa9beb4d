package mc.supervisor.service.console;

import mc.supervisor.model.ConsoleEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Bounded, sequenced console history of one instance plus its live subscribers.
 * Not thread-safe: callers hold the owning instance's lock for {@link #append}, {@link #reset}
 * and {@link #subscribe}. Delivery to subscribers may happen after the lock is released.
 */
public class ConsoleBuffer {
    private final int maxHistory;
    private final int trimSize;
    private final int subscriberCapacity;

    private final List<ConsoleEntry> entries = new ArrayList<>();
    private final Set<ConsoleSubscription> subscribers = new CopyOnWriteArraySet<>();
    private long nextSeq = 1;

    public ConsoleBuffer(int maxHistory, int trimSize, int subscriberCapacity) {
        this.maxHistory = maxHistory;
        this.trimSize = Math.max(1, Math.min(trimSize, maxHistory));
        this.subscriberCapacity = subscriberCapacity;
    }

    /** Clears history and restarts numbering at 1. Subscribers stay attached. */
    public void reset() {
        entries.clear();
        nextSeq = 1;
    }

    public ConsoleEntry append(String line) {
        ConsoleEntry entry = new ConsoleEntry(nextSeq++, line);
        entries.add(entry);
        if (entries.size() > maxHistory) {
            entries.subList(0, trimSize).clear();
        }
        return entry;
    }

    public void broadcast(ConsoleEntry entry) {
        for (ConsoleSubscription subscriber : subscribers) {
            subscriber.offer(entry);
        }
    }

    /**
     * Registers a viewer that last saw {@code lastSeq}. The catch-up snapshot is the whole buffer
     * when the viewer is new, has a gap, or is ahead of this buffer (the latter also sets reset);
     * otherwise only the entries after {@code lastSeq}.
     */
    public ConsoleSubscription subscribe(long lastSeq) {
        List<ConsoleEntry> snapshot;
        boolean reset = false;
        if (entries.isEmpty()) {
            snapshot = List.of();
            reset = lastSeq > 0;
        } else {
            long oldest = entries.get(0).seq();
            long newest = entries.get(entries.size() - 1).seq();
            if (lastSeq == 0 || lastSeq + 1 < oldest || lastSeq > newest) {
                snapshot = entries;
                reset = lastSeq > newest;
            } else {
                int from = (int) (lastSeq + 1 - oldest);
                snapshot = entries.subList(from, entries.size());
            }
        }
        ConsoleSubscription subscription = new ConsoleSubscription(snapshot, reset, subscriberCapacity);
        subscribers.add(subscription);
        subscription.onClose(() -> subscribers.remove(subscription));
        return subscription;
    }

    public List<ConsoleEntry> snapshot() {
        return List.copyOf(entries);
    }

    /** Closes every subscriber; used when the instance is deleted. */
    public void closeAll() {
        for (ConsoleSubscription subscriber : subscribers) {
            subscriber.close();
        }
        subscribers.clear();
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public long getNextSeq() {
        return nextSeq;
    }
}
