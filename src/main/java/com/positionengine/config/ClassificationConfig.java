package com.positionengine.config;

import com.positionengine.classification.AuthoritativeRetryPolicy;
import com.positionengine.exception.ConfigurationException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

/**
 * Configuration properties and bean definitions for the tiered classification cache.
 *
 * <p>Binds to the {@code classification.*} prefix in application.properties. Provides:
 * <ul>
 *   <li>The bounded executor for authoritative lookups. Its pool size is the fan-out limit:
 *       no more than {@code authoritative.concurrency} external calls run at once.</li>
 *   <li>The {@link AuthoritativeRetryPolicy} built from {@code authoritative.retry.*}.</li>
 *   <li>A {@link RestClient} for the Financial Modeling Prep profile endpoint.</li>
 *   <li>The shared {@link Clock} used for staleness checks.</li>
 * </ul>
 *
 * <p>Non-positive sizes or timeouts are malformed configuration and stop startup.
 */
@Configuration
@ConfigurationProperties(prefix = "classification")
@Getter
@Setter
public class ClassificationConfig {

    private static final Logger log = LoggerFactory.getLogger(ClassificationConfig.class);

    private Memory memory = new Memory();
    private Authoritative authoritative = new Authoritative();
    private Store store = new Store();
    private Fmp fmp = new Fmp();

    /** Tickers treated as cash by the heuristic tier (money-market proxies). */
    private List<String> cashProxies = new ArrayList<>(List.of("SGOV", "BIL", "SHV", "USFR"));

    @Bean
    public Clock classificationClock() {
        return Clock.systemUTC();
    }

    @Bean("classificationLookupExecutor")
    public ThreadPoolTaskExecutor classificationLookupExecutor() {
        int concurrency = authoritative.getConcurrency();
        if (concurrency <= 0) {
            throw new ConfigurationException("classification.authoritative.concurrency must be positive: " + concurrency);
        }
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(authoritative.getQueueCapacity());
        executor.setThreadNamePrefix("classification-lookup-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean
    public AuthoritativeRetryPolicy authoritativeRetryPolicy() {
        Retry retry = authoritative.getRetry();
        requirePositive("classification.authoritative.call-timeout", authoritative.getCallTimeout());
        requirePositive("classification.authoritative.batch-timeout", authoritative.getBatchTimeout());
        requirePositive("classification.authoritative.ttl", authoritative.getTtl());
        requirePositive("classification.memory.heuristic-ttl", memory.getHeuristicTtl());
        return new AuthoritativeRetryPolicy(retry.getMaxAttempts(), retry.getInitialBackoff(), retry.getMultiplier());
    }

    @Bean
    public RestClient fmpRestClient() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(fmp.getConnectTimeout());
        requestFactory.setReadTimeout(fmp.getReadTimeout());
        log.info("Creating FMP RestClient for {}", fmp.getBaseUrl());
        return RestClient.builder()
                .baseUrl(fmp.getBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }

    private static void requirePositive(String property, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new ConfigurationException(property + " must be a positive duration: " + value);
        }
    }

    @Data
    public static class Memory {
        /** Upper bound on in-process entries; Caffeine evicts by frequency once reached. */
        private long maximumSize = 10_000;

        /** How long a provisional heuristic answer is reused before recomputing. */
        private Duration heuristicTtl = Duration.ofMinutes(10);
    }

    @Data
    public static class Authoritative {
        /** Lifetime of an authoritative answer; security types rarely change. */
        private Duration ttl = Duration.ofDays(90);

        private int concurrency = 8;
        private int queueCapacity = 1_000;

        /** Bound on one ticker's lookup, retries included. */
        private Duration callTimeout = Duration.ofSeconds(5);

        /** Bound on waiting for a whole batch; unresolved tickers go to the heuristic tier. */
        private Duration batchTimeout = Duration.ofSeconds(15);

        private Retry retry = new Retry();
    }

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(200);
        private double multiplier = 2.0;
    }

    @Data
    public static class Store {
        /** "redis" (default) or "memory" for local runs without Redis. */
        private String type = "redis";
    }

    @Data
    public static class Fmp {
        private String baseUrl = "https://financialmodelingprep.com";
        private String apiKey;
        private Duration connectTimeout = Duration.ofSeconds(2);
        private Duration readTimeout = Duration.ofSeconds(4);
    }
}
