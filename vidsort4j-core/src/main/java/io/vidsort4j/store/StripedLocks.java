package io.vidsort4j.store;

import java.util.Collection;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed pool of locks selected by key hash. Multi-key acquisition takes stripes in index order so two
 * callers with overlapping key sets cannot deadlock.
 */
public final class StripedLocks {

    private final ReentrantLock[] stripes;

    public StripedLocks(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive");
        }
        this.stripes = new ReentrantLock[size];
        for (int i = 0; i < size; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    /**
     * Locks every stripe covering {@code keys} and returns a handle that releases them.
     */
    public Held lockAll(Collection<String> keys) {
        TreeSet<Integer> indices = new TreeSet<>();
        for (String key : keys) {
            indices.add(Math.floorMod(key.hashCode(), stripes.length));
        }
        int[] taken = new int[indices.size()];
        int n = 0;
        try {
            for (int idx : indices) {
                stripes[idx].lock();
                taken[n++] = idx;
            }
        } catch (RuntimeException e) {
            release(taken, n);
            throw e;
        }
        int held = n;
        return () -> release(taken, held);
    }

    private void release(int[] taken, int count) {
        for (int i = count - 1; i >= 0; i--) {
            stripes[taken[i]].unlock();
        }
    }

    @FunctionalInterface
    public interface Held extends AutoCloseable {
        @Override
        void close();
    }
}
