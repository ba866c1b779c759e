package com.positionengine.pipeline;

import com.positionengine.classification.ClassificationCache;
import com.positionengine.consolidation.PositionConsolidator;
import com.positionengine.consolidation.ProviderPriorityConfig;
import com.positionengine.consolidation.ProviderPriorityRegistry;
import com.positionengine.domain.enums.SecurityType;
import com.positionengine.domain.enums.WarningType;
import com.positionengine.domain.model.CanonicalPosition;
import com.positionengine.domain.model.ClassificationResult;
import com.positionengine.domain.model.ConsolidationResult;
import com.positionengine.domain.model.ConsolidationWarning;
import com.positionengine.domain.model.NormalizationResult;
import com.positionengine.domain.model.PipelineResult;
import com.positionengine.domain.model.Position;
import com.positionengine.domain.model.ProviderPayload;
import com.positionengine.event.ConsolidationEvent;
import com.positionengine.provider.ProviderNormalizer;
import com.positionengine.provider.ProviderNormalizerRegistry;
import com.positionengine.risk.CrashScenarioMapper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Turns raw provider payloads into risk-annotated canonical positions.
 *
 * <p>Steps:
 * <ol>
 *   <li>Normalize each payload with its provider's normalizer.</li>
 *   <li>Consolidate, using the priority snapshot taken when the run started.</li>
 *   <li>Classify the distinct non-cash tickers in one batch. Cash is cash by construction
 *       and never reaches the cache.</li>
 *   <li>Attach security type, answering tier and crash scenario.</li>
 * </ol>
 *
 * <p>Per-record and per-ticker problems become warnings in the result. Only a null payload
 * list is rejected. A {@link ConsolidationEvent} is published after every run.
 */
@Service
public class ConsolidationPipeline {

    private static final Logger log = LoggerFactory.getLogger(ConsolidationPipeline.class);

    private final ProviderNormalizerRegistry providerNormalizerRegistry;
    private final PositionConsolidator positionConsolidator;
    private final ProviderPriorityRegistry providerPriorityRegistry;
    private final ClassificationCache classificationCache;
    private final CrashScenarioMapper crashScenarioMapper;
    private final ApplicationEventPublisher applicationEventPublisher;

    public ConsolidationPipeline(
            ProviderNormalizerRegistry providerNormalizerRegistry,
            PositionConsolidator positionConsolidator,
            ProviderPriorityRegistry providerPriorityRegistry,
            ClassificationCache classificationCache,
            CrashScenarioMapper crashScenarioMapper,
            ApplicationEventPublisher applicationEventPublisher) {
        this.providerNormalizerRegistry = providerNormalizerRegistry;
        this.positionConsolidator = positionConsolidator;
        this.providerPriorityRegistry = providerPriorityRegistry;
        this.classificationCache = classificationCache;
        this.crashScenarioMapper = crashScenarioMapper;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public PipelineResult run(List<ProviderPayload> providerPayloads) {
        if (providerPayloads == null) {
            throw new IllegalArgumentException("providerPayloads must not be null");
        }
        long startTime = System.nanoTime();
        ProviderPriorityConfig priorityConfig = providerPriorityRegistry.current();
        List<ConsolidationWarning> warnings = new ArrayList<>();

        // Normalize
        List<Position> positions = new ArrayList<>();
        for (ProviderPayload payload : providerPayloads) {
            if (payload == null) {
                warnings.add(ConsolidationWarning.of(WarningType.MALFORMED_RECORD, null, null, "Null provider payload"));
                continue;
            }
            Optional<ProviderNormalizer> normalizer = providerNormalizerRegistry.find(payload.getProviderId());
            if (normalizer.isEmpty()) {
                log.warn("No normalizer for provider {}, payload skipped", payload.getProviderId());
                warnings.add(ConsolidationWarning.of(
                        WarningType.UNKNOWN_PROVIDER,
                        null,
                        payload.getProviderId(),
                        "No normalizer registered for provider " + payload.getProviderId()));
                continue;
            }
            NormalizationResult normalized = normalizer.get().normalize(payload.getBody(), payload.getProviderId());
            positions.addAll(normalized.getPositions());
            warnings.addAll(normalized.getWarnings());
        }

        if (positions.isEmpty()) {
            warnings.add(ConsolidationWarning.of(WarningType.EMPTY_INPUT, null, null, "Nothing to consolidate"));
            return finish(new PipelineResult(List.of(), Collections.unmodifiableList(warnings)), startTime);
        }

        // Consolidate
        ConsolidationResult consolidated = positionConsolidator.consolidate(positions, priorityConfig);
        warnings.addAll(consolidated.getWarnings());

        // Classify
        Set<String> tickers = new LinkedHashSet<>();
        Map<String, String> hints = new LinkedHashMap<>();
        for (CanonicalPosition position : consolidated.getPositions()) {
            if (position.isCash()) {
                continue;
            }
            String ticker = position.getClassificationTicker();
            tickers.add(ticker);
            if (position.getSecurityTypeHint() != null) {
                hints.putIfAbsent(ticker, position.getSecurityTypeHint());
            }
        }
        ClassificationResult classification = tickers.isEmpty()
                ? new ClassificationResult(Map.of(), Map.of(), List.of())
                : classificationCache.resolve(tickers, hints);
        warnings.addAll(classification.getWarnings());

        // Annotate
        List<CanonicalPosition> annotated = new ArrayList<>(consolidated.getPositions().size());
        Set<SecurityType> reportedUnmapped = EnumSet.noneOf(SecurityType.class);
        for (CanonicalPosition position : consolidated.getPositions()) {
            CanonicalPosition.CanonicalPositionBuilder builder = position.toBuilder();
            SecurityType type;
            if (position.isCash()) {
                type = SecurityType.CASH;
                builder.sourceTier(null);
            } else {
                String ticker = position.getClassificationTicker();
                type = classification.typeOf(ticker);
                builder.sourceTier(classification.tierOf(ticker));
            }
            if (!crashScenarioMapper.isMapped(type) && reportedUnmapped.add(type)) {
                warnings.add(ConsolidationWarning.of(
                        WarningType.UNMAPPED_SECURITY_TYPE,
                        position.getTicker(),
                        null,
                        "No crash scenario for " + type.getWireName() + ", using the equity scenario"));
            }
            annotated.add(builder.securityType(type).crashScenario(crashScenarioMapper.mapToScenario(type)).build());
        }

        return finish(
                new PipelineResult(Collections.unmodifiableList(annotated), Collections.unmodifiableList(warnings)),
                startTime);
    }

    private PipelineResult finish(PipelineResult result, long startTime) {
        Duration duration = Duration.ofNanos(System.nanoTime() - startTime);
        log.info("Consolidation run complete: positions={}, warnings={}, durationMs={}",
                result.getPositions().size(), result.getWarnings().size(), duration.toMillis());
        applicationEventPublisher.publishEvent(new ConsolidationEvent(this, result, duration));
        return result;
    }
}
