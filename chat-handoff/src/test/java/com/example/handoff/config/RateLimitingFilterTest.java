package com.example.handoff.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RateLimitingFilterTest {

    private ChatSecurityProperties properties;
    private RateLimitingFilter filter;

    @BeforeEach
    void setUp() {
        properties = new ChatSecurityProperties();
        properties.getRateLimit().setCapacity(2);
        properties.getRateLimit().setTokensPerPeriod(2);
        properties.getRateLimit().setPeriod(Duration.ofMinutes(1));
        filter = new RateLimitingFilter(properties);
    }

    @Test
    void rejectsRequestsBeyondCapacity() throws Exception {
        assertThat(call("GET", "/api/conversations/c-1/messages").getStatus()).isEqualTo(200);
        assertThat(call("GET", "/api/conversations/c-1/messages").getStatus()).isEqualTo(200);

        MockHttpServletResponse limited = call("GET", "/api/conversations/c-1/messages");

        assertThat(limited.getStatus()).isEqualTo(429);
        assertThat(Long.parseLong(limited.getHeader("Retry-After"))).isBetween(1L, 30L);
        assertThat(limited.getHeader("X-Rate-Limit-Remaining")).isEqualTo("0");
        assertThat(limited.getContentAsString()).contains("\"code\":\"RATE_LIMITED\"");
    }

    @Test
    void reportsRemainingTokens() throws Exception {
        assertThat(call("GET", "/api/operator/queue").getHeader("X-Rate-Limit-Remaining")).isEqualTo("1");
        assertThat(call("GET", "/api/operator/queue").getHeader("X-Rate-Limit-Remaining")).isEqualTo("0");
    }

    @Test
    void operatorsBehindOneAddressGetSeparateBuckets() throws Exception {
        MockHttpServletRequest ani = new MockHttpServletRequest("GET", "/api/operator/queue");
        ani.setRemoteAddr("203.0.113.7");
        ani.addHeader("X-Operator-Token", "token-ani");
        for (int i = 0; i < 2; i++) {
            filter.doFilter(ani, new MockHttpServletResponse(), new MockFilterChain());
        }

        MockHttpServletRequest budi = new MockHttpServletRequest("GET", "/api/operator/queue");
        budi.setRemoteAddr("203.0.113.7");
        budi.addHeader("X-Operator-Token", "token-budi");
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(budi, response, new MockFilterChain());

        assertThat(response.getStatus()).isEqualTo(200);
    }

    @Test
    void bucketsArePerPath() throws Exception {
        call("GET", "/api/conversations/c-1/messages");
        call("GET", "/api/conversations/c-1/messages");

        assertThat(call("GET", "/api/operator/queue").getStatus()).isEqualTo(200);
    }

    @Test
    void conversationIdsShareOneBucketPerRoute() throws Exception {
        properties.getRateLimit().setCapacity(1_000);
        for (int i = 0; i < 200; i++) {
            call("GET", "/api/conversations/" + UUID.randomUUID() + "/messages");
            call("POST", "/api/operator/conversations/c-" + i + "/claim");
        }

        assertThat(filter.trackedBuckets()).isEqualTo(2);
    }

    @Test
    void routeKeepsFixedSegments() {
        assertThat(RateLimitingFilter.route("/api/conversations/3f2a/messages"))
                .isEqualTo("/api/conversations/{id}/messages");
        assertThat(RateLimitingFilter.route("/api/operator/conversations/abc/recommendations/approve"))
                .isEqualTo("/api/operator/conversations/{id}/recommendations/approve");
        assertThat(RateLimitingFilter.route("/api/conversations/inbound")).isEqualTo("/api/conversations/inbound");
        assertThat(RateLimitingFilter.route("/api/operator/queue/stats")).isEqualTo("/api/operator/queue/stats");
    }

    @Test
    void refilledBucketsAreDroppedOnceTheLimitIsReached() throws Exception {
        properties.getRateLimit().setPeriod(Duration.ofMillis(1));
        properties.getRateLimit().setMaxTrackedBuckets(5);

        for (int i = 0; i < 50; i++) {
            MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/operator/queue");
            request.setRemoteAddr("198.51.100." + i);
            filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());
            Thread.sleep(5);
        }

        assertThat(filter.trackedBuckets()).isLessThanOrEqualTo(5);
    }

    @Test
    void ignoresNonApiPathsAndPreflight() throws Exception {
        for (int i = 0; i < 5; i++) {
            assertThat(call("GET", "/swagger-ui/index.html").getStatus()).isEqualTo(200);
            assertThat(call("OPTIONS", "/api/operator/queue").getStatus()).isEqualTo(200);
        }
    }

    @Test
    void disabledLimiterLetsEverythingThrough() throws Exception {
        properties.getRateLimit().setEnabled(false);

        for (int i = 0; i < 5; i++) {
            assertThat(call("POST", "/api/conversations/inbound").getStatus()).isEqualTo(200);
        }
    }

    private MockHttpServletResponse call(String method, String uri) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest(method, uri);
        request.setRemoteAddr("203.0.113.7");
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, new MockFilterChain());
        return response;
    }
}
