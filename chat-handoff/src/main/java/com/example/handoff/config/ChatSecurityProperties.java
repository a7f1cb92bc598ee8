package com.example.handoff.config;

import com.example.handoff.domain.OperatorRole;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "chat.security")
public class ChatSecurityProperties {

    private final RateLimit rateLimit = new RateLimit();

    /**
     * Operator credentials known to the configured operator directory.
     */
    private List<Operator> operators = new ArrayList<>();

    /**
     * Browser origins allowed to call {@code /api/**}.
     */
    private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public List<Operator> getOperators() {
        return operators;
    }

    public void setOperators(List<Operator> operators) {
        this.operators = operators;
    }

    public List<String> getAllowedOrigins() {
        return allowedOrigins;
    }

    public void setAllowedOrigins(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    @Validated
    /**
     * Per caller and path token bucket applied to {@code /api/**}.
     */
    public static class RateLimit {

        private boolean enabled = true;

        /**
         * Burst size: requests a fresh caller may send back to back.
         */
        @Positive
        private long capacity = 300;

        @Positive
        private long tokensPerPeriod = 300;

        private Duration period = Duration.ofMinutes(1);

        /**
         * Bucket count above which fully refilled buckets are dropped before a new one is created.
         */
        @Positive
        private int maxTrackedBuckets = 10_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getCapacity() {
            return capacity;
        }

        public void setCapacity(long capacity) {
            this.capacity = capacity;
        }

        public long getTokensPerPeriod() {
            return tokensPerPeriod;
        }

        public void setTokensPerPeriod(long tokensPerPeriod) {
            this.tokensPerPeriod = tokensPerPeriod;
        }

        public Duration getPeriod() {
            return period;
        }

        public void setPeriod(Duration period) {
            this.period = period;
        }

        public int getMaxTrackedBuckets() {
            return maxTrackedBuckets;
        }

        public void setMaxTrackedBuckets(int maxTrackedBuckets) {
            this.maxTrackedBuckets = maxTrackedBuckets;
        }
    }

    public static class Operator {

        private String id;

        /**
         * Opaque credential presented in the {@code X-Operator-Token} header.
         */
        private String token;

        private OperatorRole role = OperatorRole.ADMIN;

        private boolean active = true;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public OperatorRole getRole() {
            return role;
        }

        public void setRole(OperatorRole role) {
            this.role = role;
        }

        public boolean isActive() {
            return active;
        }

        public void setActive(boolean active) {
            this.active = active;
        }
    }
}
