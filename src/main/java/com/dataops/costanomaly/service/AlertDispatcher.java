package com.dataops.costanomaly.service;

import com.dataops.costanomaly.model.AlertDispatchResult;
import com.dataops.costanomaly.model.CostAnomaly;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Hands detected anomalies to a notification channel. Implementations report
 * problems in the returned receipt; a failed dispatch never fails detection.
 */
public interface AlertDispatcher {

    CompletableFuture<AlertDispatchResult> dispatch(String sourceId, List<CostAnomaly> anomalies,
                                                    Map<String, Integer> severityBreakdown);
}
