package io.cronwarden.alert;

import io.cronwarden.core.Issue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Accumulates non-critical issues between digest deliveries.
 *
 * <p>{@link #flush()} swaps the buffer out under the same lock used by {@link #append},
 * so every appended issue is returned by exactly one flush.
 */
public class DigestQueue {

    private final ReentrantLock lock = new ReentrantLock();
    private List<Issue> pending = new ArrayList<>();

    public void append(Collection<Issue> issues) {
        if (issues == null || issues.isEmpty()) {
            return;
        }
        lock.lock();
        try {
            pending.addAll(issues);
        } finally {
            lock.unlock();
        }
    }

    public List<Issue> flush() {
        List<Issue> drained;
        lock.lock();
        try {
            drained = pending;
            pending = new ArrayList<>();
        } finally {
            lock.unlock();
        }
        return List.copyOf(drained);
    }

    /**
     * Put issues from a failed delivery back in front of anything appended since the flush.
     */
    public void requeue(Collection<Issue> issues) {
        if (issues == null || issues.isEmpty()) {
            return;
        }
        lock.lock();
        try {
            List<Issue> merged = new ArrayList<>(issues.size() + pending.size());
            merged.addAll(issues);
            merged.addAll(pending);
            pending = merged;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }
}
