package com.dataops.costanomaly.feed;

import com.dataops.costanomaly.model.DateBreakdown;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Source of per-date cost detail used to explain anomalies.
 */
public interface CostBreakdownProvider {

    /**
     * @return the breakdown, or empty when the feed has nothing for that date
     * @throws com.dataops.costanomaly.exception.CostFeedException if the lookup fails
     */
    Optional<DateBreakdown> fetchBreakdown(String sourceId, LocalDate date);
}
