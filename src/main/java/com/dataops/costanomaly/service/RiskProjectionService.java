package com.dataops.costanomaly.service;

import com.dataops.costanomaly.config.DetectionConfig;
import com.dataops.costanomaly.engine.BaselineStats;
import com.dataops.costanomaly.model.CostAnomaly;
import com.dataops.costanomaly.model.CostSample;
import com.dataops.costanomaly.model.RiskAssessment;
import com.dataops.costanomaly.model.RiskLevel;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Forward-looking risk from the recent cost level, recent anomaly frequency and
 * overall volatility.
 *
 * Points: recent mean > 1.2 x overall mean (+2), more than 2 anomalies in the
 * last 7 samples (+3), coefficient of variation > 0.4 (+2).
 * Score >= 5 is HIGH, >= 3 MEDIUM, otherwise LOW.
 * Predicted weekly cost = recent daily mean x 7.
 */
@Service
public class RiskProjectionService {

    static final String FACTOR_TRENDING_UP = "costs_trending_upward";
    static final String FACTOR_RECENT_FREQUENCY = "recent_anomaly_frequency";
    static final String FACTOR_VOLATILITY = "high_cost_volatility";

    private final DetectionConfig detectionConfig;

    public RiskProjectionService(DetectionConfig detectionConfig) {
        this.detectionConfig = detectionConfig;
    }

    public RiskAssessment assess(List<CostSample> series, List<CostAnomaly> anomalies) {
        DetectionConfig.Risk params = detectionConfig.getRisk();
        int n = series.size();
        int recentFrom = Math.max(0, n - params.getRecentWindowDays());

        BaselineStats overall = BaselineStats.ofCosts(series);
        BaselineStats recent = BaselineStats.ofCosts(series, recentFrom, n);

        int score = 0;
        List<String> factors = new ArrayList<>();

        if (recent.getMean() > overall.getMean() * params.getTrendRatio()) {
            score += params.getTrendPoints();
            factors.add(FACTOR_TRENDING_UP);
        }

        if (n > 0) {
            LocalDate recentStart = series.get(recentFrom).getDate();
            long recentAnomalies = anomalies.stream()
                    .filter(a -> !a.getDate().isBefore(recentStart))
                    .count();
            if (recentAnomalies > params.getRecentAnomalyLimit()) {
                score += params.getFrequencyPoints();
                factors.add(FACTOR_RECENT_FREQUENCY);
            }
        }

        if (overall.getCoefficientOfVariation() > params.getVolatilityThreshold()) {
            score += params.getVolatilityPoints();
            factors.add(FACTOR_VOLATILITY);
        }

        RiskLevel level = RiskLevel.fromScore(score, params.getHighScore(), params.getMediumScore());

        List<String> recommendations = new ArrayList<>();
        if (level == RiskLevel.MEDIUM || level == RiskLevel.HIGH) {
            recommendations.add("Implement proactive cost monitoring and alerts");
            recommendations.add("Review recent changes in data processing workflows");
            recommendations.add("Consider setting up automated cost controls");
        }
        if (factors.contains(FACTOR_TRENDING_UP)) {
            recommendations.add("Investigate root causes of cost increases");
        }
        if (factors.contains(FACTOR_VOLATILITY)) {
            recommendations.add("Implement more predictable query scheduling");
        }

        double predictedWeekly = recent.getMean() * 7;
        String trend = recent.getMean() > overall.getMean() * params.getIncreasingTrendRatio()
                ? RiskAssessment.TREND_INCREASING
                : RiskAssessment.TREND_STABLE;

        return RiskAssessment.builder()
                .riskLevel(level)
                .riskScore(score)
                .riskFactors(factors)
                .recommendations(recommendations)
                .predictedWeeklyCost(Math.round(predictedWeekly * 100.0) / 100.0) // round to 2 decimal
                .costTrend(trend)
                .build();
    }
}
