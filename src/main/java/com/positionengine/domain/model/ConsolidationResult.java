package com.positionengine.domain.model;

import java.util.List;
import lombok.Value;

/**
 * Output of {@code PositionConsolidator.consolidate}: canonical positions in first-seen order
 * plus any warnings (malformed records, currency conflicts).
 */
@Value
public class ConsolidationResult {

    List<CanonicalPosition> positions;
    List<ConsolidationWarning> warnings;
}
