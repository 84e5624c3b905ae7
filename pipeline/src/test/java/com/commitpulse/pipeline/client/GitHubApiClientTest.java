package com.commitpulse.pipeline.client;

import com.commitpulse.pipeline.model.RepositoryInfo;
import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link GitHubApiClient} covering request building, rate-limit
 * waits, the retry ceiling and error classification.
 */
class GitHubApiClientTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private MockWebServer server;
    private List<Duration> sleeps;
    private OkHttpClient httpClient;
    private GitHubApiClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        httpClient = new OkHttpClient.Builder()
                .connectTimeout(5, TimeUnit.SECONDS)
                .readTimeout(5, TimeUnit.SECONDS)
                .build();

        sleeps = new ArrayList<>();
        client = newClient("test-token");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private GitHubApiClient newClient(String token) {
        return new GitHubApiClient(token, server.url("/").toString(), httpClient,
                sleeps::add, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static String resetIn(long seconds) {
        return String.valueOf(NOW.getEpochSecond() + seconds);
    }

    // =========================================================================
    // Request building tests
    // =========================================================================

    @Test
    @DisplayName("fetch sends bearer token, media type and API version headers")
    void fetch_sendsGitHubHeaders() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("[]"));

        client.fetch("repos/octo/demo/commits", Map.of());

        RecordedRequest recorded = server.takeRequest();
        assertEquals("Bearer test-token", recorded.getHeader("Authorization"));
        assertEquals("application/vnd.github+json", recorded.getHeader("Accept"));
        assertEquals("2022-11-28", recorded.getHeader("X-GitHub-Api-Version"));
        assertEquals("/repos/octo/demo/commits", recorded.getRequestUrl().encodedPath());
    }

    @Test
    @DisplayName("fetch omits Authorization when no token is configured")
    void fetch_withoutToken_hasNoAuthorization() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("[]"));

        newClient("").fetch("repos/octo/demo/commits", Map.of());

        assertNull(server.takeRequest().getHeader("Authorization"));
    }

    @Test
    @DisplayName("fetch appends query parameters in order")
    void fetch_appendsQueryParameters() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("[]"));

        Map<String, String> params = new LinkedHashMap<>();
        params.put("since", "2024-01-01T00:00:00Z");
        params.put("page", "2");
        client.fetch("/repos/octo/demo/commits", params);

        RecordedRequest recorded = server.takeRequest();
        assertEquals("2024-01-01T00:00:00Z", recorded.getRequestUrl().queryParameter("since"));
        assertEquals("2", recorded.getRequestUrl().queryParameter("page"));
        assertEquals("/repos/octo/demo/commits", recorded.getRequestUrl().encodedPath());
    }

    @Test
    @DisplayName("fetch parses the JSON body of a 2xx response")
    void fetch_returnsParsedBody() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .setHeader("X-RateLimit-Remaining", "4999")
                .setHeader("X-RateLimit-Reset", resetIn(3600))
                .setBody("[{\"sha\": \"abc\"}, {\"sha\": \"def\"}]"));

        JsonNode body = client.fetch("repos/octo/demo/commits", Map.of());

        assertTrue(body.isArray());
        assertEquals(2, body.size());
        assertEquals("def", body.get(1).get("sha").asText());
        assertTrue(sleeps.isEmpty());
    }

    // =========================================================================
    // Rate limit tests
    // =========================================================================

    @Test
    @DisplayName("Exhausted quota on 403 waits until reset once and the retry succeeds")
    void quotaExhausted_oneSuspendThenSuccess() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(403)
                .setHeader("X-RateLimit-Remaining", "0")
                .setHeader("X-RateLimit-Reset", resetIn(5))
                .setBody("{\"message\": \"API rate limit exceeded\"}"));
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .setHeader("X-RateLimit-Remaining", "4999")
                .setHeader("X-RateLimit-Reset", resetIn(3600))
                .setBody("[]"));

        JsonNode body = client.fetch("repos/octo/demo/commits", Map.of());

        assertEquals(0, body.size());
        assertEquals(2, server.getRequestCount());
        assertEquals(List.of(Duration.ofSeconds(6)), sleeps);
    }

    @Test
    @DisplayName("A successful response with zero remaining delays the next request until reset")
    void zeroRemainingOnSuccess_nextRequestWaits() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .setHeader("X-RateLimit-Remaining", "0")
                .setHeader("X-RateLimit-Reset", resetIn(10))
                .setBody("[]"));
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .setHeader("X-RateLimit-Remaining", "5000")
                .setHeader("X-RateLimit-Reset", resetIn(3600))
                .setBody("[]"));

        client.fetch("repos/octo/demo/commits", Map.of());
        assertTrue(sleeps.isEmpty(), "First call must not wait");

        client.fetch("repos/octo/demo/commits", Map.of());
        assertEquals(List.of(Duration.ofSeconds(11)), sleeps);
        assertEquals(2, server.getRequestCount());
    }

    @Test
    @DisplayName("Remaining quota above zero never waits")
    void remainingAboveZero_noWait() throws Exception {
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse()
                    .setResponseCode(200)
                    .setHeader("X-RateLimit-Remaining", String.valueOf(3 - i))
                    .setHeader("X-RateLimit-Reset", resetIn(60))
                    .setBody("[]"));
        }

        for (int i = 0; i < 3; i++) {
            client.fetch("repos/octo/demo/commits", Map.of());
        }

        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("Secondary rate limit uses Retry-After and gives up after the retry ceiling")
    void secondaryRateLimit_exceedsCeiling() {
        for (int i = 0; i < GitHubApiClient.MAX_ATTEMPTS; i++) {
            server.enqueue(new MockResponse()
                    .setResponseCode(403)
                    .setHeader("Retry-After", "30")
                    .setBody("{\"message\": \"You have exceeded a secondary rate limit.\"}"));
        }

        RateLimitExceededException ex = assertThrows(RateLimitExceededException.class,
                () -> client.fetch("repos/octo/demo/commits", Map.of()));

        assertEquals(GitHubApiClient.MAX_ATTEMPTS, ex.getAttempts());
        assertEquals(GitHubApiClient.MAX_ATTEMPTS, server.getRequestCount());
        assertEquals(List.of(Duration.ofSeconds(30), Duration.ofSeconds(30)), sleeps);
    }

    @Test
    @DisplayName("Abuse detection response is treated as a rate limit")
    void abuseDetection_isRetried() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(403)
                .setHeader("Retry-After", "2")
                .setBody("{\"message\": \"You have triggered an abuse detection mechanism.\"}"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("[]"));

        client.fetch("repos/octo/demo/commits", Map.of());

        assertEquals(List.of(Duration.ofSeconds(2)), sleeps);
        assertEquals(2, server.getRequestCount());
    }

    @Test
    @DisplayName("429 without rate-limit headers falls back to the default wait")
    void tooManyRequests_withoutHeaders_usesDefaultWait() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("[]"));

        client.fetch("repos/octo/demo/commits", Map.of());

        assertEquals(List.of(GitHubApiClient.DEFAULT_RATE_LIMIT_WAIT), sleeps);
    }

    // =========================================================================
    // Error classification tests
    // =========================================================================

    @Test
    @DisplayName("404 fails immediately with status and body")
    void notFound_throwsHttpStatusException() {
        server.enqueue(new MockResponse()
                .setResponseCode(404)
                .setHeader("X-RateLimit-Remaining", "4000")
                .setBody("{\"message\": \"Not Found\"}"));

        HttpStatusException ex = assertThrows(HttpStatusException.class,
                () -> client.fetch("repos/octo/missing/commits", Map.of()));

        assertEquals(404, ex.getStatus());
        assertTrue(ex.getBody().contains("Not Found"));
        assertEquals(1, server.getRequestCount());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("403 without a rate-limit signal is not retried")
    void forbiddenWithoutSignal_throwsHttpStatusException() {
        server.enqueue(new MockResponse()
                .setResponseCode(403)
                .setHeader("X-RateLimit-Remaining", "4000")
                .setBody("{\"message\": \"Resource not accessible by integration\"}"));

        HttpStatusException ex = assertThrows(HttpStatusException.class,
                () -> client.fetch("repos/octo/private/commits", Map.of()));

        assertEquals(403, ex.getStatus());
        assertEquals(1, server.getRequestCount());
    }

    @Test
    @DisplayName("500 is reported as an HTTP error, not a rate limit")
    void serverError_throwsHttpStatusException() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        HttpStatusException ex = assertThrows(HttpStatusException.class,
                () -> client.fetch("repos/octo/demo/commits", Map.of()));

        assertEquals(500, ex.getStatus());
        assertEquals("boom", ex.getBody());
    }

    // =========================================================================
    // Endpoint tests
    // =========================================================================

    @Test
    @DisplayName("getRepository deserializes repository metadata")
    void getRepository_deserializes() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .setBody("""
                        {
                            "id": 12345,
                            "name": "demo",
                            "full_name": "octo/demo",
                            "description": "Demo repository",
                            "html_url": "https://github.com/octo/demo",
                            "created_at": "2020-01-15T10:30:00Z",
                            "extra_field": "ignored"
                        }"""));

        RepositoryInfo info = client.getRepository("octo/demo");

        assertEquals(12345, info.id());
        assertEquals("octo/demo", info.fullName());
        assertEquals("https://github.com/octo/demo", info.htmlUrl());
        assertEquals("/repos/octo/demo", server.takeRequest().getRequestUrl().encodedPath());
    }
}
