package com.positionengine.provider;

import com.positionengine.exception.ConfigurationException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Looks up the normalizer for a provider id. Every {@link ProviderNormalizer} bean registers
 * itself; adding a provider means adding one bean.
 */
@Component
public class ProviderNormalizerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderNormalizerRegistry.class);

    private final Map<String, ProviderNormalizer> normalizers = new LinkedHashMap<>();

    public ProviderNormalizerRegistry(List<ProviderNormalizer> normalizers) {
        for (ProviderNormalizer normalizer : normalizers) {
            ProviderNormalizer previous = this.normalizers.put(key(normalizer.providerId()), normalizer);
            if (previous != null) {
                throw new ConfigurationException("Duplicate normalizer for provider " + normalizer.providerId());
            }
        }
        log.info("Registered provider normalizers: {}", this.normalizers.keySet());
    }

    public Optional<ProviderNormalizer> find(String providerId) {
        if (providerId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(normalizers.get(key(providerId)));
    }

    public Set<String> providerIds() {
        return normalizers.keySet();
    }

    private static String key(String providerId) {
        return providerId.trim().toLowerCase(Locale.ROOT);
    }
}
