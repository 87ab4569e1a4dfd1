package com.copytrader.monitor;

import com.copytrader.domain.model.Fill;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory record of fills already handed to the session, keyed by fill hash.
 *
 * <p>The venue window overlaps between polls, so the same fill is returned many times. Entries
 * are evicted by fill time once they fall out of every future window. Nothing survives a restart.
 */
public class ProcessedFillRegistry {

    private final Map<String, Instant> processed = new ConcurrentHashMap<>();

    public boolean contains(Fill fill) {
        return processed.containsKey(keyOf(fill));
    }

    /** Records the fill; returns false if it was already recorded. */
    public boolean markIfNew(Fill fill) {
        return processed.putIfAbsent(keyOf(fill), fill.timestamp()) == null;
    }

    /** Drops entries whose fill time is before {@code cutoff}; returns how many were removed. */
    public int evictOlderThan(Instant cutoff) {
        int before = processed.size();
        processed.values().removeIf(time -> time.isBefore(cutoff));
        return before - processed.size();
    }

    public int size() {
        return processed.size();
    }

    private static String keyOf(Fill fill) {
        if (fill.getHash() != null && !fill.getHash().isBlank()) {
            return fill.getHash();
        }
        return fill.getCoin() + ":" + fill.getTime() + ":" + fill.getSide() + ":" + fill.getSize() + ":" + fill.getPrice();
    }
}
