package com.positionengine.unit.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.positionengine.exception.ConfigurationException;
import com.positionengine.provider.IbkrPositionsNormalizer;
import com.positionengine.provider.PlaidHoldingsNormalizer;
import com.positionengine.provider.ProviderNormalizerRegistry;
import com.positionengine.provider.SnapTradeHoldingsNormalizer;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ProviderNormalizerRegistryTest {

    private final ProviderNormalizerRegistry registry = new ProviderNormalizerRegistry(List.of(
            new PlaidHoldingsNormalizer(), new SnapTradeHoldingsNormalizer(), new IbkrPositionsNormalizer()));

    @Test
    @DisplayName("Finds normalizers case-insensitively")
    void findsCaseInsensitively() {
        assertThat(registry.find("Plaid")).containsInstanceOf(PlaidHoldingsNormalizer.class);
        assertThat(registry.find(" snaptrade ")).containsInstanceOf(SnapTradeHoldingsNormalizer.class);
        assertThat(registry.providerIds()).containsExactly("plaid", "snaptrade", "ibkr");
    }

    @Test
    @DisplayName("Unknown or null provider id is empty")
    void unknownProvider() {
        assertThat(registry.find("robinhood")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
    }

    @Test
    @DisplayName("Two normalizers for the same provider fail at startup")
    void duplicateProviderRejected() {
        assertThatThrownBy(() -> new ProviderNormalizerRegistry(
                        List.of(new PlaidHoldingsNormalizer(), new PlaidHoldingsNormalizer())))
                .isInstanceOf(ConfigurationException.class);
    }
}
