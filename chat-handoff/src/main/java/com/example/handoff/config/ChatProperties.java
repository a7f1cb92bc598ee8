package com.example.handoff.config;

import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "chat")
public class ChatProperties {

    @NestedConfigurationProperty
    private final Redis redis = new Redis();

    @NestedConfigurationProperty
    private final Kafka kafka = new Kafka();

    @NestedConfigurationProperty
    private final Queue queue = new Queue();

    @NestedConfigurationProperty
    private final Conversation conversation = new Conversation();

    @NestedConfigurationProperty
    private final Recommendation recommendation = new Recommendation();

    public Redis getRedis() {
        return redis;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public Queue getQueue() {
        return queue;
    }

    public Conversation getConversation() {
        return conversation;
    }

    public Recommendation getRecommendation() {
        return recommendation;
    }

    @Validated
    public static class Redis {

        /**
         * Enables the Redisson client and the Redis-backed statistics cache.
         */
        private boolean enabled = false;

        /**
         * Prefix applied to all Redis keys controlled by the handoff module.
         */
        private String keyPrefix = "handoff";

        /**
         * Full Redis URL, e.g. {@code rediss://cache.internal:6380}. Overrides host and port from
         * {@code spring.data.redis} when set.
         */
        private String url;

        private int connectionPoolSize = 8;

        private String clientName = "live-chat-handoff";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public int getConnectionPoolSize() {
            return connectionPoolSize;
        }

        public void setConnectionPoolSize(int connectionPoolSize) {
            this.connectionPoolSize = connectionPoolSize;
        }

        public String getClientName() {
            return clientName;
        }

        public void setClientName(String clientName) {
            this.clientName = clientName;
        }
    }

    @Validated
    public static class Kafka {

        /**
         * Relays lifecycle and message events to Kafka.
         */
        private boolean enabled = false;

        /**
         * Kafka topic to publish conversation lifecycle events.
         */
        private String lifecycleTopic = "chat.lifecycle";

        /**
         * Kafka topic to publish message events.
         */
        private String messageTopic = "chat.messages";

        /**
         * Partitions for topics created at startup. Events are keyed by conversation id.
         */
        private int partitions = 6;

        private int replicas = 1;

        /**
         * Upper bound on how long a send may block waiting for metadata or buffer space.
         */
        private Duration maxBlock = Duration.ofSeconds(2);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getLifecycleTopic() {
            return lifecycleTopic;
        }

        public void setLifecycleTopic(String lifecycleTopic) {
            this.lifecycleTopic = lifecycleTopic;
        }

        public String getMessageTopic() {
            return messageTopic;
        }

        public void setMessageTopic(String messageTopic) {
            this.messageTopic = messageTopic;
        }

        public int getPartitions() {
            return partitions;
        }

        public void setPartitions(int partitions) {
            this.partitions = partitions;
        }

        public int getReplicas() {
            return replicas;
        }

        public void setReplicas(int replicas) {
            this.replicas = replicas;
        }

        public Duration getMaxBlock() {
            return maxBlock;
        }

        public void setMaxBlock(Duration maxBlock) {
            this.maxBlock = maxBlock;
        }
    }

    @Validated
    public static class Queue {

        /**
         * Maximum number of conversations an operator can hold simultaneously. Zero disables the cap.
         */
        private int maxConcurrentByOperator = 5;

        /**
         * How long computed queue statistics may be served from cache. Zero disables caching.
         */
        private Duration statsTtl = Duration.ofSeconds(5);

        /**
         * Only queue entries enqueued within this window feed the latency averages.
         */
        private Duration statsWindow = Duration.ofDays(1);

        /**
         * Zone that defines the start of "today" for the resolved-today counter.
         */
        private ZoneId statsZone = ZoneId.of("UTC");

        public int getMaxConcurrentByOperator() {
            return maxConcurrentByOperator;
        }

        public void setMaxConcurrentByOperator(int maxConcurrentByOperator) {
            this.maxConcurrentByOperator = maxConcurrentByOperator;
        }

        public Duration getStatsTtl() {
            return statsTtl;
        }

        public void setStatsTtl(Duration statsTtl) {
            this.statsTtl = statsTtl;
        }

        public Duration getStatsWindow() {
            return statsWindow;
        }

        public void setStatsWindow(Duration statsWindow) {
            this.statsWindow = statsWindow;
        }

        public ZoneId getStatsZone() {
            return statsZone;
        }

        public void setStatsZone(ZoneId statsZone) {
            this.statsZone = statsZone;
        }
    }

    @Validated
    public static class Conversation {

        /**
         * Idle time after which an active, never escalated conversation is closed by the idle sweep.
         */
        private Duration inactivityTimeout = Duration.ofMinutes(30);

        /**
         * Window in which an open conversation blocks an exclusive conversation for the same session.
         */
        private Duration sessionWindow = Duration.ofHours(12);

        /**
         * Upper bound on message content length.
         */
        private int maxMessageLength = 10_000;

        public Duration getInactivityTimeout() {
            return inactivityTimeout;
        }

        public void setInactivityTimeout(Duration inactivityTimeout) {
            this.inactivityTimeout = inactivityTimeout;
        }

        public Duration getSessionWindow() {
            return sessionWindow;
        }

        public void setSessionWindow(Duration sessionWindow) {
            this.sessionWindow = sessionWindow;
        }

        public int getMaxMessageLength() {
            return maxMessageLength;
        }

        public void setMaxMessageLength(int maxMessageLength) {
            this.maxMessageLength = maxMessageLength;
        }
    }

    @Validated
    public static class Recommendation {

        /**
         * Calls the retrieval-augmented answer endpoint to draft replies.
         */
        private boolean enabled = false;

        /**
         * Absolute URL of the answer endpoint.
         */
        private String endpoint = "http://localhost:8000/api/v1/rag/ask";

        private String language = "id";

        private int maxSources = 3;

        private double similarityThreshold = 0.7;

        private Duration connectTimeout = Duration.ofSeconds(5);

        private Duration readTimeout = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getLanguage() {
            return language;
        }

        public void setLanguage(String language) {
            this.language = language;
        }

        public int getMaxSources() {
            return maxSources;
        }

        public void setMaxSources(int maxSources) {
            this.maxSources = maxSources;
        }

        public double getSimilarityThreshold() {
            return similarityThreshold;
        }

        public void setSimilarityThreshold(double similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }
}
