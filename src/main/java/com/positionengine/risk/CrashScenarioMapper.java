package com.positionengine.risk;

import com.positionengine.domain.enums.SecurityType;
import com.positionengine.domain.model.CrashScenario;
import com.positionengine.exception.ConfigurationException;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only lookup from security type to the crash scenario the risk engine applies.
 *
 * <p>Types without their own row get the equity row, the most severe default. The table must
 * contain equity and every severity must lie in [0, 1]; anything else is rejected when the
 * mapper is built.
 */
public class CrashScenarioMapper {

    private static final Logger log = LoggerFactory.getLogger(CrashScenarioMapper.class);

    private final Map<SecurityType, CrashScenario> scenarios;
    private final CrashScenario fallback;

    public CrashScenarioMapper(Map<SecurityType, CrashScenario> scenarios) {
        if (scenarios == null || scenarios.isEmpty()) {
            throw new ConfigurationException("Crash scenario table is empty");
        }
        CrashScenario equity = scenarios.get(SecurityType.EQUITY);
        if (equity == null) {
            throw new ConfigurationException("Crash scenario table has no equity entry");
        }
        scenarios.forEach((type, scenario) -> validate(type.getWireName(), scenario));
        this.scenarios = Collections.unmodifiableMap(new EnumMap<>(scenarios));
        this.fallback = equity;
        log.info("Crash scenarios loaded for {}", this.scenarios.keySet());
    }

    /**
     * Builds the mapper from the {@code risk.crash-scenarios.*} properties, keyed by security
     * type wire name.
     */
    public static CrashScenarioMapper fromConfig(Map<String, String> names, Map<String, BigDecimal> severities) {
        Map<SecurityType, CrashScenario> table = new LinkedHashMap<>();
        names.forEach((typeName, scenarioName) -> {
            SecurityType type = SecurityType.fromWireName(typeName)
                    .orElseThrow(() -> new ConfigurationException(
                            "Crash scenario configured for unknown security type: " + typeName,
                            Map.of("securityType", typeName)));
            table.put(type, new CrashScenario(scenarioName, severities.get(typeName)));
        });
        return new CrashScenarioMapper(table);
    }

    public CrashScenario mapToScenario(SecurityType securityType) {
        if (securityType == null) {
            return fallback;
        }
        return scenarios.getOrDefault(securityType, fallback);
    }

    /** False when {@link #mapToScenario} would fall back to the equity row. */
    public boolean isMapped(SecurityType securityType) {
        return securityType != null && scenarios.containsKey(securityType);
    }

    private static void validate(String type, CrashScenario scenario) {
        if (scenario == null || scenario.getName() == null || scenario.getName().isBlank()) {
            throw new ConfigurationException("Crash scenario for " + type + " has no name", Map.of("securityType", type));
        }
        BigDecimal severity = scenario.getSeverity();
        if (severity == null || severity.compareTo(BigDecimal.ZERO) < 0 || severity.compareTo(BigDecimal.ONE) > 0) {
            throw new ConfigurationException(
                    "Crash severity for " + type + " must be within [0, 1]: " + severity,
                    Map.of("securityType", type, "severity", String.valueOf(severity)));
        }
    }
}
