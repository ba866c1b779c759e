package com.positionengine.domain.model;

import java.util.List;
import lombok.Value;

/**
 * Output of one provider normalizer: the positions it could map and the records it dropped.
 */
@Value
public class NormalizationResult {

    List<Position> positions;
    List<ConsolidationWarning> warnings;

    public static NormalizationResult empty() {
        return new NormalizationResult(List.of(), List.of());
    }
}
