package com.positionengine.consolidation;

import com.positionengine.domain.enums.WarningType;
import com.positionengine.domain.model.CanonicalPosition;
import com.positionengine.domain.model.ConsolidationResult;
import com.positionengine.domain.model.ConsolidationWarning;
import com.positionengine.domain.model.Position;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Merges normalized positions from every provider into canonical positions.
 *
 * <p>Rules:
 * <ul>
 *   <li>Cash records collapse into one {@code CUR:<ccy>} position per currency; their
 *       quantities are always summed.</li>
 *   <li>Non-cash records merge by ticker only when their currencies match. The first currency
 *       seen for a ticker owns the plain ticker; records in any other currency are kept apart
 *       under {@code ticker__CCY} and flagged with MIXED_CURRENCY_SAME_TICKER.</li>
 *   <li>Quantities are summed exactly. Metadata comes from the highest-priority provider;
 *       equal priorities keep the first-seen record.</li>
 *   <li>Records without a ticker or quantity are dropped with MALFORMED_RECORD.</li>
 * </ul>
 *
 * <p>Output keeps first-seen order. Pure and single-threaded: no I/O, no shared state.
 * Feeding the output back in (via {@link CanonicalPosition#toPosition()}) yields the same
 * output.
 */
@Component
public class PositionConsolidator {

    private static final Logger log = LoggerFactory.getLogger(PositionConsolidator.class);

    private final CashCurrencyResolver cashCurrencyResolver;

    public PositionConsolidator(CashCurrencyResolver cashCurrencyResolver) {
        this.cashCurrencyResolver = cashCurrencyResolver;
    }

    public ConsolidationResult consolidate(List<Position> positions, ProviderPriorityConfig priorityConfig) {
        ProviderPriorityConfig priorities = priorityConfig != null ? priorityConfig : ProviderPriorityConfig.empty();
        List<ConsolidationWarning> warnings = new ArrayList<>();
        if (positions == null || positions.isEmpty()) {
            return new ConsolidationResult(List.of(), warnings);
        }

        // Keyed by output ticker + currency so a group never mixes currencies
        Map<String, MergeGroup> groups = new LinkedHashMap<>();
        Map<String, String> owningCurrencyByTicker = new HashMap<>();
        Set<String> reportedConflicts = new HashSet<>();

        for (Position position : positions) {
            if (position == null) {
                warnings.add(ConsolidationWarning.of(
                        WarningType.MALFORMED_RECORD, null, null, "Null position record skipped"));
                continue;
            }
            if (isBlank(position.getTicker()) || position.getQuantity() == null) {
                warnings.add(ConsolidationWarning.of(
                        WarningType.MALFORMED_RECORD,
                        position.getTicker(),
                        position.getProviderId(),
                        "Position without ticker or quantity skipped"));
                continue;
            }

            int priority = priorities.priorityOf(position.getProviderId());

            if (position.isCash()) {
                String currency = cashCurrencyResolver.resolve(position);
                String cashTicker = Position.cashTicker(currency);
                groups.computeIfAbsent(cashTicker + "|" + currency, k -> new MergeGroup(cashTicker, currency))
                        .add(position, priority);
                continue;
            }

            String ticker = position.getTicker().trim();
            String currency = cashCurrencyResolver.normalizeCurrency(position.getCurrency());
            String owningCurrency = owningCurrencyByTicker.putIfAbsent(ticker, currency);

            String outputTicker = ticker;
            if (owningCurrency != null && !owningCurrency.equals(currency)) {
                outputTicker = ticker + CanonicalPosition.CURRENCY_KEY_SEPARATOR + currency;
                if (reportedConflicts.add(outputTicker)) {
                    log.warn("Currency conflict for {}: {} already held in {}, keeping {} separately",
                            ticker, currency, owningCurrency, outputTicker);
                    warnings.add(ConsolidationWarning.of(
                            WarningType.MIXED_CURRENCY_SAME_TICKER,
                            ticker,
                            position.getProviderId(),
                            "Ticker " + ticker + " reported in " + currency + " and " + owningCurrency
                                    + "; kept as " + outputTicker));
                }
            }

            String key = outputTicker + "|" + currency;
            String groupTicker = outputTicker;
            groups.computeIfAbsent(key, k -> new MergeGroup(groupTicker, currency)).add(position, priority);
        }

        List<CanonicalPosition> consolidated = new ArrayList<>(groups.size());
        for (MergeGroup group : groups.values()) {
            consolidated.add(group.toCanonical());
        }

        log.debug("Consolidated {} records into {} positions ({} warnings)",
                positions.size(), consolidated.size(), warnings.size());
        return new ConsolidationResult(consolidated, warnings);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /** Accumulates one output position: running quantity, provider set, metadata winner. */
    private static final class MergeGroup {

        private final String ticker;
        private final String currency;
        private final Set<String> providers = new LinkedHashSet<>();
        private BigDecimal quantity = BigDecimal.ZERO;
        private Position winner;
        private int winnerPriority;

        private MergeGroup(String ticker, String currency) {
            this.ticker = ticker;
            this.currency = currency;
        }

        private void add(Position position, int priority) {
            quantity = quantity.add(position.getQuantity());
            if (position.getProviderId() != null) {
                for (String providerId : position.getProviderId().split(",")) {
                    if (!providerId.isBlank()) {
                        providers.add(providerId.trim());
                    }
                }
            }
            // Strictly greater: ties stay with the first-seen record
            if (winner == null || priority > winnerPriority) {
                winner = position;
                winnerPriority = priority;
            }
        }

        private CanonicalPosition toCanonical() {
            return CanonicalPosition.builder()
                    .ticker(ticker)
                    .quantity(quantity)
                    .currency(currency)
                    .securityTypeHint(winner.getSecurityTypeHint())
                    .accountId(winner.getAccountId())
                    .costBasis(winner.getCostBasis())
                    .contributingProviders(Collections.unmodifiableSet(providers))
                    .build();
        }
    }
}
