package mc.supervisor.service;

import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Guards the structure of the registry: which instances exist and their durable configs.
 * May be held while acquiring an {@link InstanceLock}, never the other way round.
 */
public final class RegistryLock {
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public LockHold read() {
        lock.readLock().lock();
        return lock.readLock()::unlock;
    }

    public LockHold write() {
        lock.writeLock().lock();
        return lock.writeLock()::unlock;
    }
}
