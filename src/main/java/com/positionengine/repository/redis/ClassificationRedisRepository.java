package com.positionengine.repository.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.positionengine.config.RedisConfig;
import com.positionengine.domain.model.ClassificationCacheEntry;
import com.positionengine.exception.ClassificationStoreException;
import com.positionengine.repository.ClassificationStore;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * Redis-backed persistent classification tier.
 *
 * <p>Each entry is a JSON string under {@code pce:classification:{ticker}}. A sorted set
 * ({@code pce:classification:resolved-at}) scores tickers by resolve time in epoch millis so
 * stale entries can be listed without a key scan. Entry and index are written in one
 * MULTI/EXEC so readers never see one without the other.
 *
 * <p>Redis errors surface as {@link ClassificationStoreException}. An entry that no longer
 * parses is treated as a miss and overwritten on the next authoritative resolve.
 */
@Repository
@ConditionalOnProperty(name = "classification.store.type", havingValue = "redis", matchIfMissing = true)
public class ClassificationRedisRepository implements ClassificationStore {

    private static final Logger log = LoggerFactory.getLogger(ClassificationRedisRepository.class);

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ClassificationRedisRepository(StringRedisTemplate stringRedisTemplate, ObjectMapper objectMapper, Clock clock) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Optional<ClassificationCacheEntry> get(String ticker) {
        String json;
        try {
            json = stringRedisTemplate.opsForValue().get(key(ticker));
        } catch (DataAccessException e) {
            throw new ClassificationStoreException("Redis read failed for " + ticker, e);
        }
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, ClassificationCacheEntry.class));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable classification entry for {}, treating as miss: {}", ticker, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(ClassificationCacheEntry entry) {
        String json;
        try {
            json = objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new ClassificationStoreException("Cannot serialize classification for " + entry.getTicker(), e);
        }
        String key = key(entry.getTicker());
        double score = entry.getResolvedAt().toEpochMilli();
        try {
            stringRedisTemplate.execute(new SessionCallback<List<Object>>() {
                @Override
                @SuppressWarnings("unchecked")
                public <K, V> List<Object> execute(RedisOperations<K, V> operations) {
                    RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                    ops.multi();
                    ops.opsForValue().set(key, json, RedisConfig.CLASSIFICATION_RETENTION);
                    ops.opsForZSet().add(RedisConfig.CLASSIFICATION_INDEX_KEY, entry.getTicker(), score);
                    return ops.exec();
                }
            });
        } catch (DataAccessException e) {
            throw new ClassificationStoreException("Redis write failed for " + entry.getTicker(), e);
        }
        log.debug("Stored classification {} -> {}", entry.getTicker(), entry.getSecurityType());
    }

    @Override
    public List<String> listStale(Duration maxAge) {
        double cutoff = clock.instant().minus(maxAge).toEpochMilli();
        Set<String> tickers;
        try {
            tickers = stringRedisTemplate.opsForZSet()
                    .rangeByScore(RedisConfig.CLASSIFICATION_INDEX_KEY, Double.NEGATIVE_INFINITY, cutoff);
        } catch (DataAccessException e) {
            throw new ClassificationStoreException("Redis stale scan failed", e);
        }
        return tickers == null ? List.of() : new ArrayList<>(tickers);
    }

    @Override
    public void delete(String ticker) {
        try {
            stringRedisTemplate.delete(key(ticker));
            stringRedisTemplate.opsForZSet().remove(RedisConfig.CLASSIFICATION_INDEX_KEY, ticker);
        } catch (DataAccessException e) {
            throw new ClassificationStoreException("Redis delete failed for " + ticker, e);
        }
    }

    private static String key(String ticker) {
        return RedisConfig.CLASSIFICATION_KEY + ticker;
    }
}
