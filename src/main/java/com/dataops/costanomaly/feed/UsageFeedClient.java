package com.dataops.costanomaly.feed;

import com.dataops.costanomaly.config.CostFeedConfig;
import com.dataops.costanomaly.exception.CostFeedException;
import com.dataops.costanomaly.model.CostSample;
import com.dataops.costanomaly.model.DateBreakdown;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Client of the billing/usage feed service.
 *
 * GET /sources/{sourceId}/daily-costs?days=N    -> JSON array of samples
 * GET /sources/{sourceId}/breakdowns/{date}     -> one breakdown, 404 when the feed has none
 *
 * Calls block with {@code cost-feed.timeout-ms}; transport and HTTP errors surface as CostFeedException.
 */
@Component
@ConditionalOnProperty(prefix = "cost-feed", name = "mode", havingValue = "http")
public class UsageFeedClient implements CostTimeSeriesProvider, CostBreakdownProvider {

    private static final Logger log = LoggerFactory.getLogger(UsageFeedClient.class);

    private final WebClient webClient;
    private final Duration timeout;

    public UsageFeedClient(WebClient.Builder webClientBuilder, CostFeedConfig config) {
        WebClient.Builder builder = webClientBuilder.clone()
                .baseUrl(config.getBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey());
        }
        this.webClient = builder.build();
        this.timeout = Duration.ofMillis(config.getTimeoutMs());
    }

    @Override
    public List<CostSample> fetchDailyCosts(String sourceId, int days) {
        try {
            List<CostSample> samples = webClient.get()
                    .uri(uri -> uri.path("/sources/{sourceId}/daily-costs")
                            .queryParam("days", days)
                            .build(sourceId))
                    .retrieve()
                    .bodyToFlux(CostSample.class)
                    .collectList()
                    .doOnError(e -> log.error("Daily cost fetch failed for source {}", sourceId, e))
                    .block(timeout);
            return samples == null ? new ArrayList<>() : withDayOfWeek(samples);
        } catch (WebClientException | IllegalStateException e) {
            throw new CostFeedException("Failed to fetch daily costs for source " + sourceId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<DateBreakdown> fetchBreakdown(String sourceId, LocalDate date) {
        try {
            DateBreakdown breakdown = webClient.get()
                    .uri("/sources/{sourceId}/breakdowns/{date}", sourceId, date.toString())
                    .exchangeToMono(response -> {
                        if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                            return Mono.empty();
                        }
                        if (response.statusCode().isError()) {
                            return response.createException().flatMap(Mono::error);
                        }
                        return response.bodyToMono(DateBreakdown.class);
                    })
                    .block(timeout);
            return Optional.ofNullable(breakdown);
        } catch (WebClientException | IllegalStateException e) {
            throw new CostFeedException("Failed to fetch breakdown for " + sourceId + " on " + date + ": " + e.getMessage(), e);
        }
    }

    // Some feeds omit day_of_week; derive it from the date in that case.
    private static List<CostSample> withDayOfWeek(List<CostSample> samples) {
        List<CostSample> normalized = new ArrayList<>(samples.size());
        for (CostSample s : samples) {
            if (s.getDayOfWeek() >= 1 && s.getDayOfWeek() <= 7) {
                normalized.add(s);
            } else {
                normalized.add(s.toBuilder().dayOfWeek(CostSample.dayOfWeekOf(s.getDate())).build());
            }
        }
        return normalized;
    }
}
