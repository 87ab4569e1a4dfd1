package com.copytrader.aggregation;

import com.copytrader.domain.model.Fill;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Fills for one coin waiting to be committed, with their (possibly decayed) dollar volume.
 * A non-empty buffer always has positive volume and a start time.
 */
class PendingFills {

    private final List<Fill> fills = new ArrayList<>();
    private double volume;
    private Instant startedAt;

    void add(Fill fill, Instant now) {
        if (fills.isEmpty()) {
            startedAt = now;
        }
        fills.add(fill);
        volume += fill.notional();
    }

    List<Fill> drain() {
        List<Fill> drained = List.copyOf(fills);
        clear();
        return drained;
    }

    void clear() {
        fills.clear();
        volume = 0;
        startedAt = null;
    }

    boolean isEmpty() {
        return fills.isEmpty();
    }

    int size() {
        return fills.size();
    }

    double getVolume() {
        return volume;
    }

    void setVolume(double volume) {
        this.volume = volume;
    }

    Instant getStartedAt() {
        return startedAt;
    }
}
