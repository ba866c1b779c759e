package com.positionengine.unit.classification;

import static org.assertj.core.api.Assertions.assertThat;

import com.positionengine.classification.HeuristicClassifier;
import com.positionengine.config.ClassificationConfig;
import com.positionengine.domain.enums.SecurityType;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class HeuristicClassifierTest {

    private final HeuristicClassifier heuristicClassifier = new HeuristicClassifier(new ClassificationConfig());

    @ParameterizedTest(name = "{0} with hint ''{1}'' -> {2}")
    @CsvSource({
        "CUR:USD, , CASH",
        "SGOV, , CASH",
        "sgov, etf, CASH",
        "VTI, etf, ETF",
        "VTI, ET, ETF",
        "DSU, oef, MUTUAL_FUND",
        "DSU, mutual fund, MUTUAL_FUND",
        "PDI, cef, FUND",
        "AGG, fixed income, BOND",
        "BTC, cryptocurrency, CRYPTO",
        "SPXW, OPT, DERIVATIVE",
        "AAPL, cs, EQUITY",
        "AAPL, STK, EQUITY",
        "XYZ, money market, CASH",
        "GLD, CMDTY, COMMODITY"
    })
    void classifiesByTickerAndHint(String ticker, String hint, SecurityType expected) {
        assertThat(heuristicClassifier.classify(ticker, hint)).isEqualTo(expected);
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "AAPL  250117C00150000, DERIVATIVE",
        "SPY250321P00500000, DERIVATIVE",
        "BTC-USD, CRYPTO",
        "ETH-USDT, CRYPTO",
        "ACHR.WS, WARRANT",
        "LCID-WT, WARRANT",
        "VFIAX, MUTUAL_FUND",
        "FXAIX, MUTUAL_FUND",
        "QQQ, EQUITY",
        "SPY, EQUITY",
        "XOM, EQUITY"
    })
    void classifiesByTickerPattern(String ticker, SecurityType expected) {
        assertThat(heuristicClassifier.classify(ticker, null)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Unrecognized hint falls through to ticker patterns")
    void unrecognizedHintFallsThrough() {
        assertThat(heuristicClassifier.classify("VFIAX", "other")).isEqualTo(SecurityType.MUTUAL_FUND);
        assertThat(heuristicClassifier.classify("ZZZ", "  ")).isEqualTo(SecurityType.EQUITY);
    }

    @Test
    @DisplayName("Configured cash proxies replace the defaults")
    void configuredCashProxies() {
        ClassificationConfig config = new ClassificationConfig();
        config.setCashProxies(List.of("VMFXX"));
        HeuristicClassifier custom = new HeuristicClassifier(config);

        assertThat(custom.classify("VMFXX", null)).isEqualTo(SecurityType.CASH);
        assertThat(custom.classify("SGOV", null)).isEqualTo(SecurityType.EQUITY);
    }
}
