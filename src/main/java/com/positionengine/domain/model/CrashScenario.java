package com.positionengine.domain.model;

import java.math.BigDecimal;
import lombok.Value;

/**
 * A named worst-case loss fraction consumed by the downstream risk engine.
 *
 * <p>Severity is the fraction of position value lost in the scenario, in [0, 1]:
 * 0.80 for a single-stock crash, 0.05 for money-market cash.
 */
@Value
public class CrashScenario {

    String name;
    BigDecimal severity;
}
