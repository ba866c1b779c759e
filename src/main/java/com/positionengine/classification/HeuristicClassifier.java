package com.positionengine.classification;

import com.positionengine.config.ClassificationConfig;
import com.positionengine.domain.enums.SecurityType;
import com.positionengine.domain.model.Position;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Last-resort classification from the ticker text and the provider hint alone.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>{@code CUR:} tickers and configured cash proxies are cash.</li>
 *   <li>A recognized provider hint ("etf", "oef", "fixed income", "OPT").</li>
 *   <li>OCC option symbols are derivatives.</li>
 *   <li>{@code -USD}/{@code -USDT} pairs are crypto.</li>
 *   <li>{@code .WS}, {@code -WT}, {@code .WT} suffixes are warrants.</li>
 *   <li>Five-letter symbols ending in X are mutual funds.</li>
 *   <li>Everything else is equity, the most conservative answer.</li>
 * </ol>
 *
 * <p>Deterministic and side-effect free. Tickers that look like ETFs (QQQ, SPY) are
 * deliberately not guessed: without a hint they fall through to equity.
 */
@Component
public class HeuristicClassifier {

    /** ROOT + YYMMDD + C|P + 8-digit strike, optional space padding after the root. */
    private static final Pattern OCC_OPTION = Pattern.compile("^[A-Z]{1,6}\\s*\\d{6}[CP]\\d{8}$");

    private static final Pattern CRYPTO_PAIR = Pattern.compile("^[A-Z0-9]{2,10}-(USD|USDT)$");

    private static final Pattern WARRANT = Pattern.compile("^[A-Z]{1,5}(\\.WS|\\.WT|-WT)$");

    private static final Pattern MUTUAL_FUND = Pattern.compile("^[A-Z]{4}X$");

    /** Whole-hint matches, checked before the substring rules. */
    private static final Map<String, SecurityType> EXACT_HINTS = new LinkedHashMap<>();

    /** Substring rules in precedence order: "mutual fund" before "fund", "crypto" before "currency". */
    private static final Map<String, SecurityType> HINT_TOKENS = new LinkedHashMap<>();

    static {
        EXACT_HINTS.put("cs", SecurityType.EQUITY);
        EXACT_HINTS.put("stk", SecurityType.EQUITY);
        EXACT_HINTS.put("equity", SecurityType.EQUITY);
        EXACT_HINTS.put("stock", SecurityType.EQUITY);
        EXACT_HINTS.put("et", SecurityType.ETF);
        EXACT_HINTS.put("oef", SecurityType.MUTUAL_FUND);
        EXACT_HINTS.put("cef", SecurityType.FUND);
        EXACT_HINTS.put("bnd", SecurityType.BOND);
        EXACT_HINTS.put("op", SecurityType.DERIVATIVE);
        EXACT_HINTS.put("opt", SecurityType.DERIVATIVE);
        EXACT_HINTS.put("fop", SecurityType.DERIVATIVE);
        EXACT_HINTS.put("fut", SecurityType.DERIVATIVE);
        EXACT_HINTS.put("war", SecurityType.WARRANT);
        EXACT_HINTS.put("cmdty", SecurityType.COMMODITY);
        EXACT_HINTS.put("commodity", SecurityType.COMMODITY);

        HINT_TOKENS.put("crypto", SecurityType.CRYPTO);
        HINT_TOKENS.put("money market", SecurityType.CASH);
        HINT_TOKENS.put("currency", SecurityType.CASH);
        HINT_TOKENS.put("cash", SecurityType.CASH);
        HINT_TOKENS.put("etf", SecurityType.ETF);
        HINT_TOKENS.put("mutual fund", SecurityType.MUTUAL_FUND);
        HINT_TOKENS.put("mutual_fund", SecurityType.MUTUAL_FUND);
        HINT_TOKENS.put("fund", SecurityType.FUND);
        HINT_TOKENS.put("fixed income", SecurityType.BOND);
        HINT_TOKENS.put("treasury", SecurityType.BOND);
        HINT_TOKENS.put("bond", SecurityType.BOND);
        HINT_TOKENS.put("warrant", SecurityType.WARRANT);
        HINT_TOKENS.put("option", SecurityType.DERIVATIVE);
        HINT_TOKENS.put("derivative", SecurityType.DERIVATIVE);
        HINT_TOKENS.put("future", SecurityType.DERIVATIVE);
    }

    private final Set<String> cashProxies;

    public HeuristicClassifier(ClassificationConfig classificationConfig) {
        Set<String> proxies = new HashSet<>();
        for (String proxy : classificationConfig.getCashProxies()) {
            if (proxy != null && !proxy.isBlank()) {
                proxies.add(proxy.trim().toUpperCase(Locale.ROOT));
            }
        }
        this.cashProxies = Set.copyOf(proxies);
    }

    public SecurityType classify(String ticker, String hint) {
        String symbol = ticker == null ? "" : ticker.trim().toUpperCase(Locale.ROOT);

        if (symbol.startsWith(Position.CASH_PREFIX) || cashProxies.contains(symbol)) {
            return SecurityType.CASH;
        }

        SecurityType fromHint = classifyHint(hint);
        if (fromHint != null) {
            return fromHint;
        }

        if (OCC_OPTION.matcher(symbol).matches()) {
            return SecurityType.DERIVATIVE;
        }
        if (CRYPTO_PAIR.matcher(symbol).matches()) {
            return SecurityType.CRYPTO;
        }
        if (WARRANT.matcher(symbol).matches()) {
            return SecurityType.WARRANT;
        }
        if (MUTUAL_FUND.matcher(symbol).matches()) {
            return SecurityType.MUTUAL_FUND;
        }
        return SecurityType.EQUITY;
    }

    /** Null when the hint is absent or says nothing recognizable. */
    SecurityType classifyHint(String hint) {
        if (hint == null || hint.isBlank()) {
            return null;
        }
        String normalized = hint.trim().toLowerCase(Locale.ROOT);
        SecurityType exact = EXACT_HINTS.get(normalized);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<String, SecurityType> token : HINT_TOKENS.entrySet()) {
            if (normalized.contains(token.getKey())) {
                return token.getValue();
            }
        }
        return null;
    }
}
