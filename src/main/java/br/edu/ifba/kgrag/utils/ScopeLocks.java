package br.edu.ifba.kgrag.utils;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-scope locks for graph rewrites.
 *
 * <p>Writes to different scopes commute because ids are deterministic, but two
 * concurrent re-indexes of the same scope would interleave their
 * delete-then-write cycles. Callers take the scope lock around the cycle.</p>
 *
 * <p>A lock entry lives only while some thread holds or waits for it, so the
 * table is bounded by the number of scopes in flight.</p>
 */
public final class ScopeLocks {

    private final ConcurrentHashMap<String, ScopeLock> locks = new ConcurrentHashMap<>();

    /**
     * Runs {@code action} while holding the lock of {@code scope}.
     */
    public <T> T withScopeLock(@NotNull String scope, @NotNull Supplier<T> action) {
        try (Held ignored = acquireInOrder(scope)) {
            return action.get();
        }
    }

    /**
     * Acquires locks for several scopes in sorted order so that two callers
     * locking overlapping sets cannot deadlock. Locks are reentrant.
     *
     * @param scopes scopes to lock
     * @return handle releasing every lock on close
     */
    @NotNull
    public Held acquireInOrder(@NotNull String... scopes) {
        List<String> sorted = Arrays.stream(scopes).distinct().sorted().toList();
        for (String scope : sorted) {
            ScopeLock entry = locks.compute(scope, (key, existing) -> {
                ScopeLock lock = existing != null ? existing : new ScopeLock();
                lock.users++;
                return lock;
            });
            entry.lock.lock();
        }
        return new Held(sorted);
    }

    /**
     * @return number of scopes currently held or awaited
     */
    public int activeScopes() {
        return locks.size();
    }

    /**
     * @return true when the current thread holds the lock of {@code scope}
     */
    public boolean isHeldByCurrentThread(@NotNull String scope) {
        ScopeLock entry = locks.get(scope);
        return entry != null && entry.lock.isHeldByCurrentThread();
    }

    private void release(String scope) {
        locks.computeIfPresent(scope, (key, entry) -> {
            entry.lock.unlock();
            return --entry.users == 0 ? null : entry;
        });
    }

    private static final class ScopeLock {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }

    /**
     * Locks taken by {@link #acquireInOrder(String...)}, released in reverse order.
     */
    public final class Held implements AutoCloseable {

        private final List<String> scopes;
        private boolean released;

        private Held(List<String> scopes) {
            this.scopes = scopes;
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            for (int i = scopes.size() - 1; i >= 0; i--) {
                release(scopes.get(i));
            }
        }
    }
}
