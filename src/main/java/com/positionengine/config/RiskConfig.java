package com.positionengine.config;

import com.positionengine.risk.CrashScenarioMapper;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Crash-scenario table keyed by security type wire name.
 *
 * <pre>
 * risk.crash-scenarios.equity.name=single_stock_crash
 * risk.crash-scenarios.equity.severity=0.80
 * </pre>
 *
 * <p>The table is validated when the mapper is built; a malformed table stops startup.
 */
@Configuration
@ConfigurationProperties(prefix = "risk")
@Getter
@Setter
public class RiskConfig {

    private Map<String, Scenario> crashScenarios = new LinkedHashMap<>();

    @Bean
    public CrashScenarioMapper crashScenarioMapper() {
        Map<String, String> names = new LinkedHashMap<>();
        Map<String, BigDecimal> severities = new LinkedHashMap<>();
        crashScenarios.forEach((type, scenario) -> {
            names.put(type, scenario.getName());
            severities.put(type, scenario.getSeverity());
        });
        return CrashScenarioMapper.fromConfig(names, severities);
    }

    @Data
    public static class Scenario {
        private String name;
        private BigDecimal severity;
    }
}
