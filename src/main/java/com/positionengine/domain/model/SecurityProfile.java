package com.positionengine.domain.model;

import com.positionengine.domain.enums.SecurityType;
import lombok.Builder;
import lombok.Value;

/**
 * Reference profile returned by the authoritative classification lookup.
 *
 * <p>Only the flags drive classification; exchange and name are kept for log context.
 */
@Value
@Builder
public class SecurityProfile {

    String ticker;
    boolean etf;
    boolean fund;
    boolean cashMarker;
    String exchange;
    String companyName;

    /** Cash marker wins, then ETF, then fund; anything else is an operating company. */
    public SecurityType toSecurityType() {
        if (cashMarker) {
            return SecurityType.CASH;
        }
        if (etf) {
            return SecurityType.ETF;
        }
        if (fund) {
            return SecurityType.MUTUAL_FUND;
        }
        return SecurityType.EQUITY;
    }
}
