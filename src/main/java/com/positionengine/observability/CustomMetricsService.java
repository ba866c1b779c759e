package com.positionengine.observability;

import com.positionengine.domain.model.CanonicalPosition;
import com.positionengine.domain.model.ConsolidationWarning;
import com.positionengine.event.ConsolidationEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the engine's Micrometer metrics:
 * <ul>
 *   <li><b>consolidation.runs</b> (counter): one per pipeline run</li>
 *   <li><b>consolidation.duration</b> (timer): wall time per run</li>
 *   <li><b>consolidation.warnings</b> (counter, tag {@code type}): warnings by type</li>
 *   <li><b>classification.resolutions</b> (counter, tag {@code tier}): which tier classified
 *       each non-cash position</li>
 * </ul>
 *
 * <p>All values come from {@link ConsolidationEvent}; the pipeline itself has no metrics code.
 */
@Service
public class CustomMetricsService {

    private static final Logger log = LoggerFactory.getLogger(CustomMetricsService.class);

    private final MeterRegistry meterRegistry;
    private final Counter runsCounter;
    private final Timer durationTimer;

    public CustomMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.runsCounter = Counter.builder("consolidation.runs")
                .description("Total consolidation pipeline runs")
                .register(meterRegistry);

        this.durationTimer = Timer.builder("consolidation.duration")
                .description("Wall time of one consolidation pipeline run")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(30))
                .register(meterRegistry);
    }

    @EventListener
    public void onConsolidationEvent(ConsolidationEvent event) {
        runsCounter.increment();
        durationTimer.record(event.getDuration());

        for (ConsolidationWarning warning : event.getResult().getWarnings()) {
            Counter.builder("consolidation.warnings")
                    .description("Warnings raised during consolidation, by type")
                    .tag("type", warning.getType().name())
                    .register(meterRegistry)
                    .increment();
        }

        for (CanonicalPosition position : event.getResult().getPositions()) {
            if (position.getSourceTier() == null) {
                continue;
            }
            Counter.builder("classification.resolutions")
                    .description("Classified positions, by answering tier")
                    .tag("tier", position.getSourceTier().name())
                    .register(meterRegistry)
                    .increment();
        }

        if (event.getResult().hasWarnings()) {
            log.debug("Consolidation run recorded with {} warnings", event.getResult().getWarnings().size());
        }
    }
}
