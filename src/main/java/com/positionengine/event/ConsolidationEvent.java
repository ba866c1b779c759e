package com.positionengine.event;

import com.positionengine.domain.model.PipelineResult;
import java.time.Duration;
import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every consolidation pipeline run, including runs with empty input.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>CustomMetricsService - run, warning and classification-tier counters</li>
 * </ul>
 */
public class ConsolidationEvent extends ApplicationEvent {

    private final PipelineResult result;
    private final Duration duration;
    private final Instant completedAt;

    /**
     * @param source   the pipeline that ran
     * @param result   annotated positions and warnings
     * @param duration wall time of the run
     */
    public ConsolidationEvent(Object source, PipelineResult result, Duration duration) {
        super(source);
        this.result = result;
        this.duration = duration;
        this.completedAt = Instant.now();
    }

    public PipelineResult getResult() {
        return result;
    }

    public Duration getDuration() {
        return duration;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }
}
