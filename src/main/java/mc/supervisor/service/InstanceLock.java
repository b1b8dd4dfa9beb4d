package mc.supervisor.service;

import java.util.concurrent.locks.ReentrantReadWriteLock;

/** Guards the mutable runtime fields of a single instance. Never held across process I/O. */
public final class InstanceLock {
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
