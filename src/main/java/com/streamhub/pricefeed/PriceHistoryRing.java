package com.streamhub.pricefeed;

import com.streamhub.domain.model.PriceSnapshot;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Fixed-capacity window of price snapshots, oldest first. Recording beyond capacity drops
 * the oldest snapshot.
 */
public class PriceHistoryRing {

    private final int capacity;
    private final Deque<PriceSnapshot> snapshots;

    public PriceHistoryRing(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.snapshots = new ArrayDeque<>(capacity + 1);
    }

    public synchronized void record(PriceSnapshot snapshot) {
        snapshots.addLast(snapshot);
        while (snapshots.size() > capacity) {
            snapshots.removeFirst();
        }
    }

    /** Copy of the current contents, oldest first. */
    public synchronized List<PriceSnapshot> history() {
        return List.copyOf(snapshots);
    }

    public synchronized int size() {
        return snapshots.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
