package com.dataops.costanomaly.engine;

import com.dataops.costanomaly.model.CostAnomaly;
import com.dataops.costanomaly.model.DetectionMethod;
import lombok.Value;

import java.util.List;

/**
 * Raw candidates from one ensemble run, in detector order, plus the detectors
 * that completed without error.
 */
@Value
public class EnsembleOutcome {
    List<CostAnomaly> candidates;
    List<DetectionMethod> executedMethods;
}
