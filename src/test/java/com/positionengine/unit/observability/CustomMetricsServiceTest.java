package com.positionengine.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.positionengine.domain.enums.SecurityType;
import com.positionengine.domain.enums.SourceTier;
import com.positionengine.domain.enums.WarningType;
import com.positionengine.domain.model.CanonicalPosition;
import com.positionengine.domain.model.ConsolidationWarning;
import com.positionengine.domain.model.PipelineResult;
import com.positionengine.event.ConsolidationEvent;
import com.positionengine.observability.CustomMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CustomMetricsServiceTest {

    private SimpleMeterRegistry meterRegistry;
    private CustomMetricsService metricsService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metricsService = new CustomMetricsService(meterRegistry);
    }

    private static CanonicalPosition position(String ticker, SecurityType type, SourceTier tier) {
        return CanonicalPosition.builder()
                .ticker(ticker)
                .quantity(BigDecimal.ONE)
                .currency("USD")
                .securityType(type)
                .sourceTier(tier)
                .contributingProviders(Set.of("plaid"))
                .build();
    }

    @Test
    @DisplayName("Records run, duration, warnings by type and resolutions by tier")
    void recordsEvent() {
        PipelineResult result = new PipelineResult(
                List.of(
                        position("AAPL", SecurityType.EQUITY, SourceTier.MEMORY),
                        position("VTI", SecurityType.ETF, SourceTier.MEMORY),
                        position("QQQ", SecurityType.EQUITY, SourceTier.HEURISTIC),
                        position("CUR:USD", SecurityType.CASH, null)),
                List.of(
                        ConsolidationWarning.of(WarningType.AUTHORITATIVE_LOOKUP_TIMEOUT, "QQQ", null, "timeout"),
                        ConsolidationWarning.of(WarningType.MIXED_CURRENCY_SAME_TICKER, "SAP", "ibkr", "EUR vs USD")));

        metricsService.onConsolidationEvent(new ConsolidationEvent(this, result, Duration.ofMillis(120)));

        assertThat(meterRegistry.get("consolidation.runs").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("consolidation.duration").timer().count()).isEqualTo(1);
        assertThat(meterRegistry.get("consolidation.warnings").tag("type", "AUTHORITATIVE_LOOKUP_TIMEOUT")
                .counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("classification.resolutions").tag("tier", "MEMORY")
                .counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("classification.resolutions").tag("tier", "HEURISTIC")
                .counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.find("classification.resolutions").counters()).hasSize(2);
    }

    @Test
    @DisplayName("Counters accumulate across runs")
    void accumulatesAcrossRuns() {
        PipelineResult empty = new PipelineResult(
                List.of(), List.of(ConsolidationWarning.of(WarningType.EMPTY_INPUT, null, null, "Nothing to consolidate")));

        metricsService.onConsolidationEvent(new ConsolidationEvent(this, empty, Duration.ofMillis(1)));
        metricsService.onConsolidationEvent(new ConsolidationEvent(this, empty, Duration.ofMillis(2)));

        assertThat(meterRegistry.get("consolidation.runs").counter().count()).isEqualTo(2.0);
        assertThat(meterRegistry.get("consolidation.warnings").tag("type", "EMPTY_INPUT")
                .counter().count()).isEqualTo(2.0);
    }
}
