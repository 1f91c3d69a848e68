package fleetportal.core.ledger;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One mutex per key: work on the same key is strictly serialized,
 * work on different keys runs in parallel.
 * A key's lock lives only while some thread holds or waits for it, so
 * short-lived keys such as instance ids do not accumulate.
 */
public final class KeyedLocks {

    private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String key, Supplier<T> work) {
        Entry entry = acquire(key);
        try {
            return work.get();
        } finally {
            release(key, entry);
        }
    }

    /**
     * Like {@link #withLock(String, Supplier)} for work that throws checked exceptions.
     */
    public <T, E extends Exception> T call(String key, Work<T, E> work) throws E {
        Entry entry = acquire(key);
        try {
            return work.run();
        } finally {
            release(key, entry);
        }
    }

    public void withLock(String key, Runnable work) {
        withLock(key, () -> {
            work.run();
            return null;
        });
    }

    private Entry acquire(String key) {
        // users is bumped inside compute, so release() can never remove an entry a thread is about to lock
        Entry entry = locks.compute(key, (k, existing) -> {
            Entry e = existing != null ? existing : new Entry();
            e.users++;
            return e;
        });
        entry.lock.lock();
        return entry;
    }

    private void release(String key, Entry entry) {
        entry.lock.unlock();
        locks.computeIfPresent(key, (k, e) -> --e.users == 0 ? null : e);
    }

    @FunctionalInterface
    public interface Work<T, E extends Exception> {
        T run() throws E;
    }

    int size() {
        return locks.size();
    }

    /** Guarded by the map's per-bin locking in compute. */
    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
