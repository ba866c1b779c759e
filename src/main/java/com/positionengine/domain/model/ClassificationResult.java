package com.positionengine.domain.model;

import com.positionengine.domain.enums.SecurityType;
import com.positionengine.domain.enums.SourceTier;
import java.util.List;
import java.util.Map;
import lombok.Value;

/**
 * Output of a batched classification: one type per requested ticker (always complete, the
 * heuristic tier guarantees an answer), which tier produced it, and the degradation warnings.
 */
@Value
public class ClassificationResult {

    Map<String, SecurityType> securityTypes;
    Map<String, SourceTier> sourceTiers;
    List<ConsolidationWarning> warnings;

    public SecurityType typeOf(String ticker) {
        return securityTypes.get(ticker);
    }

    public SourceTier tierOf(String ticker) {
        return sourceTiers.get(ticker);
    }
}
