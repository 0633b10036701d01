package io.github.flameyossnowy.naturaldb.file.lock;

import io.github.flameyossnowy.naturaldb.api.exceptions.ErrorCode;
import io.github.flameyossnowy.naturaldb.api.exceptions.LockTimeoutException;
import io.github.flameyossnowy.naturaldb.api.exceptions.NaturalDbException;
import io.github.flameyossnowy.naturaldb.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry of reader/writer locks keyed by path string.
 *
 * <p>Locks are created on first use and never removed. Two keys that differ as strings
 * never contend. The locks are reentrant and only guard threads of this process.</p>
 */
public class LockManager {
    private final ConcurrentMap<String, ReentrantReadWriteLock> locks = new ConcurrentHashMap<>(64);
    private final @Nullable Duration timeout;

    public LockManager() {
        this(null);
    }

    /**
     * @param timeout the longest an acquire may wait before failing with a
     *                {@link LockTimeoutException}, or {@code null} to wait indefinitely
     */
    public LockManager(@Nullable Duration timeout) {
        this.timeout = timeout;
    }

    public void acquireRead(@NotNull String path) {
        acquire(path, lockFor(path).readLock());
    }

    public void releaseRead(@NotNull String path) {
        lockFor(path).readLock().unlock();
    }

    public void acquireWrite(@NotNull String path) {
        acquire(path, lockFor(path).writeLock());
    }

    public void releaseWrite(@NotNull String path) {
        lockFor(path).writeLock().unlock();
    }

    /** Number of distinct paths that have been locked so far. */
    public int size() {
        return locks.size();
    }

    @NotNull ReentrantReadWriteLock lockFor(@NotNull String path) {
        return locks.computeIfAbsent(path, key -> new ReentrantReadWriteLock());
    }

    private void acquire(String path, Lock lock) {
        if (timeout == null) {
            lock.lock();
            return;
        }
        try {
            if (!lock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                Logging.warn("Timed out waiting for lock on " + path);
                throw new LockTimeoutException(path, timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NaturalDbException(ErrorCode.LOCK_TIMEOUT, "Interrupted while waiting for lock", e).withPath(path);
        }
    }
}
