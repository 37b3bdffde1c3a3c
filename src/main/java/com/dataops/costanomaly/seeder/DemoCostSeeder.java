package com.dataops.costanomaly.seeder;

import com.dataops.costanomaly.config.CostFeedConfig;
import com.dataops.costanomaly.feed.InMemoryCostFeed;
import com.dataops.costanomaly.model.CostSample;
import com.dataops.costanomaly.model.DateBreakdown;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Seeds the in-memory cost feed with a realistic daily spend series for local testing.
 * Only runs when the "seed" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=seed
 *
 * Generates 60 days ending yesterday:
 *   - weekdays around $120, weekends around $55
 *   - a heavier Monday batch run (+$45) every week
 *   - three injected spikes, each with a per-date breakdown naming the cause
 */
@Component
@Profile("seed")
@Order(1)
@ConditionalOnProperty(prefix = "cost-feed", name = "mode", havingValue = "memory", matchIfMissing = true)
public class DemoCostSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DemoCostSeeder.class);

    static final int SEED_DAYS = 60;

    // days-ago -> spike multiplier
    private static final Map<Integer, Double> SPIKES = Map.of(
            38, 3.2,
            17, 2.1,
            4, 4.5
    );

    private final InMemoryCostFeed feed;
    private final CostFeedConfig costFeedConfig;
    private final Random random = new Random(42); // fixed seed for reproducibility

    public DemoCostSeeder(InMemoryCostFeed feed, CostFeedConfig costFeedConfig) {
        this.feed = feed;
        this.costFeedConfig = costFeedConfig;
    }

    @Override
    public void run(String... args) {
        log.info("=== Starting cost feed seeding ===");

        String sourceId = costFeedConfig.getSourceId();
        LocalDate end = LocalDate.now(ZoneOffset.UTC).minusDays(1);
        List<CostSample> samples = new ArrayList<>(SEED_DAYS);
        int spikeDays = 0;

        for (int daysAgo = SEED_DAYS - 1; daysAgo >= 0; daysAgo--) {
            LocalDate date = end.minusDays(daysAgo);
            double cost = baselineCost(date);
            long queries = Math.round(1_500 + random.nextGaussian() * 120);
            double maxQueryCost = 4 + random.nextDouble() * 6;

            Double multiplier = SPIKES.get(daysAgo);
            if (multiplier != null) {
                cost *= multiplier;
                queries = Math.round(queries * (multiplier > 3 ? 2.6 : 1.2));
                maxQueryCost = cost * 0.35;
                feed.registerBreakdown(sourceId, spikeBreakdown(date, cost, queries, maxQueryCost, spikeDays));
                spikeDays++;
            }

            samples.add(CostSample.builder()
                    .date(date)
                    .cost(round2(cost))
                    .queryCount(Math.max(0, queries))
                    .uniqueUsers(25 + random.nextInt(15))
                    .avgDurationMs(round2(3_500 + random.nextGaussian() * 400))
                    .maxSingleQueryCost(round2(maxQueryCost))
                    .dayOfWeek(CostSample.dayOfWeekOf(date))
                    .build());
        }

        feed.registerSamples(sourceId, samples);
        log.info("=== Cost feed seeding complete: source={}, days={}, spikes={} ===", sourceId, samples.size(), spikeDays);
    }

    private double baselineCost(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            return 55 + random.nextGaussian() * 5;
        }
        double cost = 120 + random.nextGaussian() * 10;
        if (day == DayOfWeek.MONDAY) {
            cost += 45;
        }
        return cost;
    }

    private DateBreakdown spikeBreakdown(LocalDate date, double cost, long queries, double maxQueryCost, int index) {
        // Each spike gets a different dominant cause
        switch (index % 3) {
            case 0:
                return DateBreakdown.builder()
                        .date(date)
                        .totalCost(round2(cost))
                        .queryCount(queries)
                        .topUser("etl-runner@example.com")
                        .topUserCost(round2(cost * 0.7))
                        .maxQueryCost(round2(maxQueryCost))
                        .topDatasets(List.of("raw_events", "staging", "marts"))
                        .datasetConcentration(0.62)
                        .build();
            case 1:
                return DateBreakdown.builder()
                        .date(date)
                        .totalCost(round2(cost))
                        .queryCount(queries)
                        .topUser("analyst@example.com")
                        .topUserCost(round2(cost * 0.2))
                        .maxQueryCost(round2(Math.min(maxQueryCost, 20)))
                        .topDatasets(List.of("clickstream", "sessions"))
                        .datasetConcentration(0.91)
                        .build();
            default:
                return DateBreakdown.builder()
                        .date(date)
                        .totalCost(round2(cost))
                        .queryCount(queries)
                        .topUser("dashboard-service@example.com")
                        .topUserCost(round2(cost * 0.55))
                        .maxQueryCost(round2(maxQueryCost))
                        .topDatasets(List.of("finance", "raw_events"))
                        .datasetConcentration(0.48)
                        .build();
        }
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
