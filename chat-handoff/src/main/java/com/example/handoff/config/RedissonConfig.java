package com.example.handoff.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

@Configuration
@ConditionalOnProperty(prefix = "chat.redis", name = "enabled", havingValue = "true")
public class RedissonConfig {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public RedissonClient redissonClient(RedisProperties redisProperties, ChatProperties chatProperties) {
        ChatProperties.Redis redis = chatProperties.getRedis();
        Config config = new Config();
        SingleServerConfig server = config.useSingleServer()
                .setAddress(resolveAddress(redisProperties, redis))
                .setDatabase(redisProperties.getDatabase())
                .setClientName(redis.getClientName())
                .setConnectionPoolSize(redis.getConnectionPoolSize())
                .setConnectionMinimumIdleSize(Math.min(redis.getConnectionPoolSize(), 2));

        if (StringUtils.hasText(redisProperties.getUsername())) {
            server.setUsername(redisProperties.getUsername());
        }
        if (StringUtils.hasText(redisProperties.getPassword())) {
            server.setPassword(redisProperties.getPassword());
        }
        if (redisProperties.getTimeout() != null) {
            server.setTimeout((int) redisProperties.getTimeout().toMillis());
        }
        if (redisProperties.getConnectTimeout() != null) {
            server.setConnectTimeout((int) redisProperties.getConnectTimeout().toMillis());
        }
        return Redisson.create(config);
    }

    private String resolveAddress(RedisProperties redisProperties, ChatProperties.Redis redis) {
        if (StringUtils.hasText(redis.getUrl())) {
            return redis.getUrl();
        }
        boolean ssl = redisProperties.getSsl() != null && redisProperties.getSsl().isEnabled();
        return (ssl ? "rediss://" : "redis://") + redisProperties.getHost() + ":" + redisProperties.getPort();
    }
}
