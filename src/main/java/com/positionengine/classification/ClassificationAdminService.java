package com.positionengine.classification;

import com.positionengine.domain.enums.SourceTier;
import com.positionengine.domain.model.ClassificationResult;
import com.positionengine.repository.ClassificationStore;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Operator actions on the classification cache.
 *
 * <p>Unlike the pipeline path, store failures here propagate as
 * {@code ClassificationStoreException}: an operator asked for a store operation and should
 * see it fail.
 */
@Service
public class ClassificationAdminService {

    private static final Logger log = LoggerFactory.getLogger(ClassificationAdminService.class);

    private final ClassificationCache classificationCache;
    private final ClassificationStore classificationStore;

    public ClassificationAdminService(ClassificationCache classificationCache, ClassificationStore classificationStore) {
        this.classificationCache = classificationCache;
        this.classificationStore = classificationStore;
    }

    /**
     * Re-resolves one ticker from the authoritative source, ignoring cached answers.
     * The returned result says which tier answered and carries any warnings.
     */
    public ClassificationResult forceResolve(String ticker) {
        log.info("Forced classification refresh for {}", ticker);
        ClassificationResult result = classificationCache.refresh(List.of(ticker));
        if (result.tierOf(ticker) != SourceTier.AUTHORITATIVE) {
            log.warn("Forced refresh of {} could not reach the authoritative source, kept {}",
                    ticker, result.typeOf(ticker));
        }
        return result;
    }

    /** Re-resolves every stored ticker resolved longer ago than {@code maxAge}. */
    public ClassificationResult refreshStale(Duration maxAge) {
        List<String> stale = classificationStore.listStale(maxAge);
        log.info("Refreshing {} classifications older than {}", stale.size(), maxAge);
        return classificationCache.refresh(stale);
    }

    /** Removes a ticker from memory and from the store; the next resolve starts from scratch. */
    public void evict(String ticker) {
        classificationCache.invalidateMemory(ticker);
        classificationStore.delete(ticker);
        log.info("Evicted classification for {}", ticker);
    }
}
