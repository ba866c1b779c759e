package com.positionengine.config;

import com.positionengine.consolidation.CashCurrencyResolver;
import com.positionengine.consolidation.ProviderPriorityRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for position consolidation.
 *
 * <p>Binds to the {@code consolidation.*} prefix:
 * <pre>
 * consolidation.provider-priority.plaid=30
 * consolidation.provider-priority.snaptrade=20
 * consolidation.cash.aliases.SPAXX=USD
 * consolidation.cash.default-currency=USD
 * </pre>
 *
 * <p>Provider priorities seed the {@link ProviderPriorityRegistry}; they can be replaced at
 * runtime via {@link ProviderPriorityRegistry#reload(Map)} without a restart.
 */
@Configuration
@ConfigurationProperties(prefix = "consolidation")
@Getter
@Setter
public class ConsolidationConfig {

    /** Provider id to priority. Higher wins metadata; unlisted providers rank 0. */
    private Map<String, Integer> providerPriority = new LinkedHashMap<>();

    private Cash cash = new Cash();

    @Bean
    public ProviderPriorityRegistry providerPriorityRegistry() {
        return new ProviderPriorityRegistry(providerPriority);
    }

    @Bean
    public CashCurrencyResolver cashCurrencyResolver() {
        return new CashCurrencyResolver(cash.getAliases(), cash.getDefaultCurrency());
    }

    @Data
    public static class Cash {
        /** Provider cash symbols (sweep funds, "CASH") mapped to the currency they hold. */
        private Map<String, String> aliases = new LinkedHashMap<>();

        private String defaultCurrency = "USD";
    }
}
