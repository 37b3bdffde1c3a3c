package com.dataops.costanomaly.feed;

import com.dataops.costanomaly.exception.CostFeedException;
import com.dataops.costanomaly.model.CostSample;
import com.dataops.costanomaly.model.DateBreakdown;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-process cost feed. Series and breakdowns are registered at runtime
 * (by the demo seeder or by tests) and held per source, keyed by date.
 *
 * The lookback window is anchored on the latest registered date for the
 * source, not on today, so a registered series stays analysable over time.
 */
@Component
@ConditionalOnProperty(prefix = "cost-feed", name = "mode", havingValue = "memory", matchIfMissing = true)
public class InMemoryCostFeed implements CostTimeSeriesProvider, CostBreakdownProvider {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCostFeed.class);

    private final Map<String, NavigableMap<LocalDate, CostSample>> series = new ConcurrentHashMap<>();
    private final Map<String, Map<LocalDate, DateBreakdown>> breakdowns = new ConcurrentHashMap<>();

    /**
     * Adds samples to a source. A sample for an already registered date replaces it.
     */
    public void registerSamples(String sourceId, List<CostSample> samples) {
        NavigableMap<LocalDate, CostSample> days =
                series.computeIfAbsent(sourceId, k -> new ConcurrentSkipListMap<>());
        for (CostSample sample : samples) {
            days.put(sample.getDate(), sample);
        }
        log.info("Registered {} cost samples for source {} ({} total)", samples.size(), sourceId, days.size());
    }

    public void registerBreakdown(String sourceId, DateBreakdown breakdown) {
        breakdowns.computeIfAbsent(sourceId, k -> new ConcurrentHashMap<>())
                .put(breakdown.getDate(), breakdown);
    }

    public void clear() {
        series.clear();
        breakdowns.clear();
    }

    @Override
    public List<CostSample> fetchDailyCosts(String sourceId, int days) {
        NavigableMap<LocalDate, CostSample> source = series.get(sourceId);
        if (source == null) {
            throw new CostFeedException("Unknown cost source: " + sourceId);
        }
        if (source.isEmpty()) {
            return new ArrayList<>();
        }
        LocalDate latest = source.lastKey();
        LocalDate from = latest.minusDays(days - 1L);
        return new ArrayList<>(source.subMap(from, true, latest, true).values());
    }

    @Override
    public Optional<DateBreakdown> fetchBreakdown(String sourceId, LocalDate date) {
        Map<LocalDate, DateBreakdown> source = breakdowns.get(sourceId);
        if (source == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(source.get(date));
    }
}
