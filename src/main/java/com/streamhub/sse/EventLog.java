package com.streamhub.sse;

import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * Source of event ids. Ids start at 1 and strictly increase across all rooms.
 */
@Component
public class EventLog {

    private final AtomicLong lastId = new AtomicLong();

    public long nextId() {
        return lastId.incrementAndGet();
    }

    /** Id of the most recently allocated event, 0 if none yet. */
    public long lastId() {
        return lastId.get();
    }

    /**
     * Moves the counter forward so the next id is greater than {@code floor}. Never moves it back.
     * Used at startup when rooms restored from a shared store already hold buffered events.
     */
    public void advanceTo(long floor) {
        lastId.accumulateAndGet(floor, Math::max);
    }
}
