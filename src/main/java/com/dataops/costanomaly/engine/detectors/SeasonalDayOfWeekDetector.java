package com.dataops.costanomaly.engine.detectors;

import com.dataops.costanomaly.config.DetectionConfig;
import com.dataops.costanomaly.engine.AnomalyDetector;
import com.dataops.costanomaly.engine.BaselineStats;
import com.dataops.costanomaly.engine.DeviationScorer;
import com.dataops.costanomaly.model.CostAnomaly;
import com.dataops.costanomaly.model.CostSample;
import com.dataops.costanomaly.model.DetectionMethod;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Judges each day against the history of its own weekday, so a day with
 * inherently heavier traffic (a weekly batch run, say) is not flagged just
 * for being busier than the rest of the week.
 *
 * A weekday needs at least 2 observations for a baseline; weekdays with fewer,
 * or with zero variance or zero mean, are skipped.
 * Confidence is capped at 0.8.
 */
@Component
public class SeasonalDayOfWeekDetector implements AnomalyDetector {

    private final DetectionConfig config;
    private final DeviationScorer scorer;

    public SeasonalDayOfWeekDetector(DetectionConfig config, DeviationScorer scorer) {
        this.config = config;
        this.scorer = scorer;
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.SEASONAL_DAY_OF_WEEK;
    }

    @Override
    public List<CostAnomaly> detect(List<CostSample> series, DetectionConfig.Thresholds thresholds,
                                   DetectionConfig.SeverityBands bands) {
        DetectionConfig.Detectors params = config.getDetectors();

        Map<Integer, List<Double>> costsByWeekday = new HashMap<>();
        for (CostSample sample : series) {
            int dow = sample.getDayOfWeek();
            if (dow >= 1 && dow <= 7) {
                costsByWeekday.computeIfAbsent(dow, k -> new ArrayList<>()).add(sample.getCost());
            }
        }

        Map<Integer, BaselineStats> baselines = new HashMap<>();
        costsByWeekday.forEach((dow, costs) -> {
            if (costs.size() >= params.getSeasonalMinBucketSamples()) {
                baselines.put(dow, BaselineStats.ofValues(costs));
            }
        });

        List<CostAnomaly> candidates = new ArrayList<>();
        for (CostSample sample : series) {
            BaselineStats baseline = baselines.get(sample.getDayOfWeek());
            if (baseline == null || baseline.getMean() <= 0) {
                continue;
            }
            scorer.score(sample, baseline.getMean(), baseline.getStdDev(), thresholds, bands,
                            params.getSeasonalConfidenceCap(), getMethod(), factorFor(sample.getDayOfWeek()))
                    .ifPresent(candidates::add);
        }
        return candidates;
    }

    /**
     * e.g. 2 (Monday in the feed's numbering) -> "unusual_monday_pattern".
     */
    static String factorFor(int feedDayOfWeek) {
        // feed: 1 = Sunday .. 7 = Saturday; ISO: 1 = Monday .. 7 = Sunday
        DayOfWeek day = DayOfWeek.of(feedDayOfWeek == 1 ? 7 : feedDayOfWeek - 1);
        return "unusual_" + day.name().toLowerCase(Locale.ROOT) + "_pattern";
    }
}
