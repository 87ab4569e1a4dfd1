package com.copytrader.broker;

import com.copytrader.domain.model.Fill;
import java.time.Instant;
import java.util.List;

/** Supplies an account's fills for a time window, oldest first. */
public interface FillSource {

    /**
     * @throws com.copytrader.exception.VenueException if the venue cannot be queried
     */
    List<Fill> fetchFills(String account, Instant from, Instant to);
}
