package com.example.handoff.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Token bucket per caller and API route. Operators are keyed by their token, everyone else by client address.
 * Polling clients hit the sync endpoints repeatedly, so one route running dry does not block the rest of the API.
 * Conversation ids are collapsed out of the route, so a caller polling many conversations shares one bucket.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class RateLimitingFilter extends OncePerRequestFilter {

    static final String REMAINING_HEADER = "X-Rate-Limit-Remaining";

    private static final String API_PREFIX = "/api/";
    private static final String OPERATOR_TOKEN_HEADER = "X-Operator-Token";
    private static final Duration DEFAULT_REFILL_PERIOD = Duration.ofMinutes(1);
    private static final Pattern CONVERSATION_ROUTE =
            Pattern.compile("^(/api/(?:operator/)?conversations/)([^/]+)(.*)$");
    private static final Set<String> FIXED_CONVERSATION_SEGMENTS = Set.of("inbound", "transcripts");

    private final ChatSecurityProperties securityProperties;
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    public RateLimitingFilter(ChatSecurityProperties securityProperties) {
        this.securityProperties = securityProperties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !securityProperties.getRateLimit().isEnabled()
                || "OPTIONS".equalsIgnoreCase(request.getMethod())
                || !request.getRequestURI().startsWith(API_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        if (buckets.size() >= securityProperties.getRateLimit().getMaxTrackedBuckets()) {
            evictIdleBuckets();
        }
        String key = callerKey(request) + "|" + route(request.getRequestURI());
        Bucket bucket = buckets.computeIfAbsent(key, ignored -> newBucket());
        ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(1);
        if (probe.isConsumed()) {
            response.setHeader(REMAINING_HEADER, String.valueOf(probe.getRemainingTokens()));
            filterChain.doFilter(request, response);
            return;
        }
        rejectRequest(response, probe);
    }

    int trackedBuckets() {
        return buckets.size();
    }

    static String route(String uri) {
        Matcher matcher = CONVERSATION_ROUTE.matcher(uri);
        if (!matcher.matches() || FIXED_CONVERSATION_SEGMENTS.contains(matcher.group(2))) {
            return uri;
        }
        return matcher.group(1) + "{id}" + matcher.group(3);
    }

    /**
     * A bucket that has refilled to capacity is indistinguishable from a new one, so dropping it loses nothing.
     */
    private void evictIdleBuckets() {
        long capacity = Math.max(securityProperties.getRateLimit().getCapacity(), 1);
        buckets.values().removeIf(bucket -> bucket.getAvailableTokens() >= capacity);
    }

    private Bucket newBucket() {
        ChatSecurityProperties.RateLimit limits = securityProperties.getRateLimit();
        Duration period = limits.getPeriod();
        if (period == null || period.isZero() || period.isNegative()) {
            period = DEFAULT_REFILL_PERIOD;
        }
        Bandwidth bandwidth = Bandwidth.builder()
                .capacity(Math.max(limits.getCapacity(), 1))
                .refillGreedy(Math.max(limits.getTokensPerPeriod(), 1), period)
                .build();
        return Bucket.builder().addLimit(bandwidth).build();
    }

    private void rejectRequest(HttpServletResponse response, ConsumptionProbe probe) throws IOException {
        long waitSeconds = Math.max(TimeUnit.NANOSECONDS.toSeconds(probe.getNanosToWaitForRefill()), 1);
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setHeader("Retry-After", String.valueOf(waitSeconds));
        response.setHeader(REMAINING_HEADER, "0");
        response.getWriter()
                .write("{\"error\":\"Too many requests, retry in " + waitSeconds + "s\",\"code\":\"RATE_LIMITED\"}");
    }

    private String callerKey(HttpServletRequest request) {
        String token = request.getHeader(OPERATOR_TOKEN_HEADER);
        if (StringUtils.hasText(token)) {
            return "operator:" + token;
        }
        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (StringUtils.hasText(forwardedFor)) {
            return "ip:" + forwardedFor.split(",")[0].trim();
        }
        return "ip:" + request.getRemoteAddr();
    }
}
