package mc.supervisor.service;

/** A held lock, released by try-with-resources. */
@FunctionalInterface
public interface LockHold extends AutoCloseable {
    @Override
    void close();
}
