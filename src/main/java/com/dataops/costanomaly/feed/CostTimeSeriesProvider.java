package com.dataops.costanomaly.feed;

import com.dataops.costanomaly.model.CostSample;

import java.util.List;

/**
 * Source of daily cost samples for a lookback window.
 */
public interface CostTimeSeriesProvider {

    /**
     * @param sourceId cost source to read
     * @param days     lookback window in days
     * @return samples ascending by date, at most one per day; zero-activity days may be absent
     * @throws com.dataops.costanomaly.exception.CostFeedException if the feed cannot be read
     */
    List<CostSample> fetchDailyCosts(String sourceId, int days);
}
