package com.example.handoff.service;

import com.example.handoff.config.ChatProperties;
import com.example.handoff.domain.QueueStats;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.codec.TypedJsonJacksonCodec;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Shares computed statistics across instances. A Redis failure degrades to recomputing on every read.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "chat.redis", name = "enabled", havingValue = "true")
public class RedissonQueueStatsCache implements QueueStatsCache {

    private final RedissonClient redissonClient;
    private final ChatProperties chatProperties;
    private final ObjectMapper objectMapper;

    private TypedJsonJacksonCodec statsCodec;

    @Override
    public Optional<QueueStats> get() {
        try {
            return Optional.ofNullable(bucket().get());
        } catch (RedisException ex) {
            log.warn("Unable to read cached queue stats: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(QueueStats stats, Duration ttl) {
        try {
            bucket().set(stats, ttl.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RedisException ex) {
            log.warn("Unable to cache queue stats: {}", ex.getMessage());
        }
    }

    private RBucket<QueueStats> bucket() {
        return redissonClient.getBucket(chatProperties.getRedis().getKeyPrefix() + ":queue:stats", statsCodec());
    }

    private TypedJsonJacksonCodec statsCodec() {
        if (statsCodec == null) {
            statsCodec = new TypedJsonJacksonCodec(QueueStats.class, objectMapper);
        }
        return statsCodec;
    }
}
