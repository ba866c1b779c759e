package com.positionengine.domain.model;

import com.positionengine.domain.enums.WarningType;
import java.util.List;
import lombok.Value;

/**
 * What {@code ConsolidationPipeline.run} hands to the risk engine: risk-annotated canonical
 * positions and the union of every warning raised along the way.
 */
@Value
public class PipelineResult {

    List<CanonicalPosition> positions;
    List<ConsolidationWarning> warnings;

    public boolean hasWarnings() {
        return warnings != null && !warnings.isEmpty();
    }

    public long countWarnings(WarningType type) {
        return warnings == null ? 0 : warnings.stream().filter(w -> w.getType() == type).count();
    }
}
