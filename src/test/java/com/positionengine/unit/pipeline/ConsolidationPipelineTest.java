package com.positionengine.unit.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.positionengine.classification.ClassificationCache;
import com.positionengine.consolidation.CashCurrencyResolver;
import com.positionengine.consolidation.PositionConsolidator;
import com.positionengine.consolidation.ProviderPriorityRegistry;
import com.positionengine.domain.enums.SecurityType;
import com.positionengine.domain.enums.SourceTier;
import com.positionengine.domain.enums.WarningType;
import com.positionengine.domain.model.CanonicalPosition;
import com.positionengine.domain.model.ClassificationResult;
import com.positionengine.domain.model.ConsolidationWarning;
import com.positionengine.domain.model.PipelineResult;
import com.positionengine.domain.model.ProviderPayload;
import com.positionengine.event.ConsolidationEvent;
import com.positionengine.pipeline.ConsolidationPipeline;
import com.positionengine.provider.IbkrPositionsNormalizer;
import com.positionengine.provider.PlaidHoldingsNormalizer;
import com.positionengine.provider.ProviderNormalizerRegistry;
import com.positionengine.provider.SnapTradeHoldingsNormalizer;
import com.positionengine.risk.CrashScenarioMapper;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Tests for ConsolidationPipeline with real normalizers and consolidator and a mocked
 * classification cache.
 */
@ExtendWith(MockitoExtension.class)
class ConsolidationPipelineTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private ClassificationCache classificationCache;

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private ConsolidationPipeline pipeline;

    @BeforeEach
    void setUp() {
        ProviderNormalizerRegistry normalizerRegistry = new ProviderNormalizerRegistry(List.of(
                new PlaidHoldingsNormalizer(), new SnapTradeHoldingsNormalizer(), new IbkrPositionsNormalizer()));
        PositionConsolidator consolidator =
                new PositionConsolidator(new CashCurrencyResolver(Map.of("CASH", "USD"), "USD"));
        ProviderPriorityRegistry priorityRegistry =
                new ProviderPriorityRegistry(Map.of("plaid", 30, "snaptrade", 20, "ibkr", 10));
        CrashScenarioMapper crashScenarioMapper = CrashScenarioMapper.fromConfig(
                Map.of("equity", "single_stock_crash", "etf", "etf_crash", "cash", "cash_crash"),
                Map.of("equity", new BigDecimal("0.80"), "etf", new BigDecimal("0.35"), "cash", new BigDecimal("0.05")));

        pipeline = new ConsolidationPipeline(
                normalizerRegistry,
                consolidator,
                priorityRegistry,
                classificationCache,
                crashScenarioMapper,
                applicationEventPublisher);
    }

    private JsonNode json(String body) throws Exception {
        return objectMapper.readTree(body);
    }

    private static ClassificationResult classified(Map<String, SecurityType> types, SourceTier tier) {
        Map<String, SourceTier> tiers = new LinkedHashMap<>();
        types.keySet().forEach(ticker -> tiers.put(ticker, tier));
        return new ClassificationResult(types, tiers, List.of());
    }

    private static CanonicalPosition position(PipelineResult result, String ticker) {
        return result.getPositions().stream()
                .filter(p -> p.getTicker().equals(ticker))
                .findFirst()
                .orElseThrow();
    }

    @Nested
    @DisplayName("End-to-end run")
    class EndToEnd {

        @Test
        @DisplayName("Merges providers, keeps the foreign-currency record apart and annotates every position")
        @SuppressWarnings("unchecked")
        void mergesAndAnnotates() throws Exception {
            ProviderPayload plaid = new ProviderPayload("plaid", json("""
                    {
                      "holdings": [
                        {"account_id": "acc-1", "security_id": "s1", "quantity": 10, "iso_currency_code": "USD"},
                        {"account_id": "acc-1", "security_id": "c1", "quantity": 2500}
                      ],
                      "securities": [
                        {"security_id": "s1", "ticker_symbol": "AAPL", "type": "equity"},
                        {"security_id": "c1", "type": "cash", "iso_currency_code": "CAD"}
                      ]
                    }
                    """));
            ProviderPayload ibkr = new ProviderPayload("ibkr", json("""
                    [
                      {"acctId": "U1", "ticker": "AAPL", "position": 5, "currency": "USD", "assetClass": "STK"},
                      {"acctId": "U1", "ticker": "VOO", "position": 2, "currency": "USD", "assetClass": "ETF"},
                      {"acctId": "U1", "ticker": "AAPL", "position": 3, "currency": "EUR", "assetClass": "STK"}
                    ]
                    """));
            when(classificationCache.resolve(anyCollection(), anyMap())).thenReturn(classified(
                    Map.of("AAPL", SecurityType.EQUITY, "VOO", SecurityType.ETF), SourceTier.AUTHORITATIVE));

            PipelineResult result = pipeline.run(List.of(plaid, ibkr));

            ArgumentCaptor<Collection<String>> tickers = ArgumentCaptor.forClass(Collection.class);
            ArgumentCaptor<Map<String, String>> hints = ArgumentCaptor.forClass(Map.class);
            verify(classificationCache).resolve(tickers.capture(), hints.capture());
            assertThat(tickers.getValue()).containsExactly("AAPL", "VOO");
            assertThat(hints.getValue()).containsEntry("AAPL", "equity").containsEntry("VOO", "ETF");

            assertThat(result.getPositions()).extracting(CanonicalPosition::getTicker)
                    .containsExactly("AAPL", "CUR:CAD", "VOO", "AAPL__EUR");

            CanonicalPosition aapl = position(result, "AAPL");
            assertThat(aapl.getQuantity()).isEqualByComparingTo("15");
            assertThat(aapl.getContributingProviders()).containsExactly("plaid", "ibkr");
            assertThat(aapl.getSecurityType()).isEqualTo(SecurityType.EQUITY);
            assertThat(aapl.getSourceTier()).isEqualTo(SourceTier.AUTHORITATIVE);
            assertThat(aapl.getCrashScenario().getName()).isEqualTo("single_stock_crash");

            CanonicalPosition aaplEur = position(result, "AAPL__EUR");
            assertThat(aaplEur.getQuantity()).isEqualByComparingTo("3");
            assertThat(aaplEur.getSecurityType()).isEqualTo(SecurityType.EQUITY);

            CanonicalPosition cash = position(result, "CUR:CAD");
            assertThat(cash.getSecurityType()).isEqualTo(SecurityType.CASH);
            assertThat(cash.getSourceTier()).isNull();
            assertThat(cash.getCrashScenario().getSeverity()).isEqualByComparingTo("0.05");

            assertThat(position(result, "VOO").getCrashScenario().getName()).isEqualTo("etf_crash");
            assertThat(result.getWarnings()).extracting(ConsolidationWarning::getType)
                    .containsExactly(WarningType.MIXED_CURRENCY_SAME_TICKER);
        }

        @Test
        @DisplayName("Classification warnings are carried into the result")
        void classificationWarningsPropagate() throws Exception {
            ProviderPayload ibkr = new ProviderPayload("ibkr", json("""
                    [{"ticker": "QQQ", "position": 4, "currency": "USD"}]
                    """));
            ConsolidationWarning timeout = ConsolidationWarning.of(
                    WarningType.AUTHORITATIVE_LOOKUP_TIMEOUT, "QQQ", null, "Lookup exceeded PT5S");
            when(classificationCache.resolve(anyCollection(), anyMap())).thenReturn(new ClassificationResult(
                    Map.of("QQQ", SecurityType.EQUITY), Map.of("QQQ", SourceTier.HEURISTIC), List.of(timeout)));

            PipelineResult result = pipeline.run(List.of(ibkr));

            assertThat(result.getWarnings()).containsExactly(timeout);
            assertThat(position(result, "QQQ").getSourceTier()).isEqualTo(SourceTier.HEURISTIC);
        }

        @Test
        @DisplayName("Types without a crash scenario use equity and warn once per type")
        void unmappedTypeWarnsOnce() throws Exception {
            ProviderPayload ibkr = new ProviderPayload("ibkr", json("""
                    [
                      {"ticker": "TLT", "position": 4, "currency": "USD", "assetClass": "BOND"},
                      {"ticker": "IEF", "position": 6, "currency": "USD", "assetClass": "BOND"}
                    ]
                    """));
            when(classificationCache.resolve(anyCollection(), anyMap())).thenReturn(classified(
                    Map.of("TLT", SecurityType.BOND, "IEF", SecurityType.BOND), SourceTier.PERSISTENT));

            PipelineResult result = pipeline.run(List.of(ibkr));

            assertThat(result.getPositions()).allSatisfy(p -> {
                assertThat(p.getSecurityType()).isEqualTo(SecurityType.BOND);
                assertThat(p.getCrashScenario().getName()).isEqualTo("single_stock_crash");
            });
            assertThat(result.countWarnings(WarningType.UNMAPPED_SECURITY_TYPE)).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Degenerate input")
    class DegenerateInput {

        @Test
        @DisplayName("Null payload list is rejected")
        void nullListRejected() {
            assertThatThrownBy(() -> pipeline.run(null)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Empty input yields an empty result with EMPTY_INPUT and still publishes the event")
        void emptyInput() {
            PipelineResult result = pipeline.run(List.of());

            assertThat(result.getPositions()).isEmpty();
            assertThat(result.getWarnings()).extracting(ConsolidationWarning::getType)
                    .containsExactly(WarningType.EMPTY_INPUT);
            verifyNoInteractions(classificationCache);

            ArgumentCaptor<ConsolidationEvent> event = ArgumentCaptor.forClass(ConsolidationEvent.class);
            verify(applicationEventPublisher).publishEvent(event.capture());
            assertThat(event.getValue().getResult()).isSameAs(result);
        }

        @Test
        @DisplayName("Unknown provider and null payload are skipped with warnings")
        void unknownProviderAndNullPayload() throws Exception {
            ProviderPayload robinhood = new ProviderPayload("robinhood", json("{\"positions\": []}"));

            PipelineResult result = pipeline.run(Arrays.asList(robinhood, null));

            assertThat(result.getWarnings()).extracting(ConsolidationWarning::getType).containsExactly(
                    WarningType.UNKNOWN_PROVIDER, WarningType.MALFORMED_RECORD, WarningType.EMPTY_INPUT);
            assertThat(result.getWarnings().get(0).getProviderId()).isEqualTo("robinhood");
        }

        @Test
        @DisplayName("Cash-only input never reaches the classification cache")
        void cashOnlySkipsCache() throws Exception {
            ProviderPayload ibkr = new ProviderPayload("ibkr", json("""
                    [{"ticker": "EUR.USD", "position": 150, "currency": "EUR", "assetClass": "CASH"}]
                    """));

            PipelineResult result = pipeline.run(List.of(ibkr));

            assertThat(result.getPositions()).singleElement().satisfies(p -> {
                assertThat(p.getTicker()).isEqualTo("CUR:EUR");
                assertThat(p.getSecurityType()).isEqualTo(SecurityType.CASH);
            });
            verifyNoInteractions(classificationCache);
        }
    }
}
