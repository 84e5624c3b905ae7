package com.commitpulse.pipeline.client;

import com.commitpulse.pipeline.model.RepositoryInfo;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * GitHub REST API client that honours the rate-limit headers of every response.
 *
 * <p>When the last response reported an exhausted quota, the next request waits
 * until the reported reset time before going out. Rate-limited responses
 * (primary quota, secondary limits, abuse detection) are retried after the
 * advertised wait, up to {@value #MAX_ATTEMPTS} attempts per call.</p>
 *
 * <p>Not thread-safe: the last-seen rate-limit window is mutable state shared
 * by consecutive calls. One pipeline run uses one client from a single thread.</p>
 */
public class GitHubApiClient {

    private static final Logger logger = LoggerFactory.getLogger(GitHubApiClient.class);

    public static final String DEFAULT_BASE_URL = "https://api.github.com/";
    static final int MAX_ATTEMPTS = 3;
    static final Duration DEFAULT_RATE_LIMIT_WAIT = Duration.ofSeconds(60);

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String token;
    private final HttpUrl baseUrl;
    private final Sleeper sleeper;
    private final Clock clock;

    private RateLimitWindow window;

    public GitHubApiClient(String token) {
        this(token, DEFAULT_BASE_URL, defaultHttpClient(), Sleeper.THREAD, Clock.systemUTC());
    }

    public GitHubApiClient(String token, String baseUrl, OkHttpClient httpClient,
                           Sleeper sleeper, Clock clock) {
        this.token = token;
        this.baseUrl = HttpUrl.get(baseUrl);
        this.httpClient = httpClient;
        this.sleeper = sleeper;
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private static OkHttpClient defaultHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .build();
    }

    // -------------------------------------------------------------------------
    // Endpoint methods
    // -------------------------------------------------------------------------

    /**
     * Fetches repository metadata.
     * Endpoint: GET /repos/{owner}/{repo}
     */
    public RepositoryInfo getRepository(String repoFullName) throws IOException, InterruptedException {
        JsonNode json = fetch("repos/" + repoFullName, Map.of());
        return objectMapper.treeToValue(json, RepositoryInfo.class);
    }

    // -------------------------------------------------------------------------
    // Core HTTP execution with rate-limit handling
    // -------------------------------------------------------------------------

    /**
     * Issues a GET request and returns the parsed JSON body.
     *
     * @param path   path relative to the API base URL, e.g. {@code repos/owner/name/commits}
     * @param params query parameters, appended in iteration order
     * @throws RateLimitExceededException if every attempt was rate limited
     * @throws HttpStatusException        on any other non-2xx response
     */
    public JsonNode fetch(String path, Map<String, String> params) throws IOException, InterruptedException {
        HttpUrl url = buildUrl(path, params);
        Request request = buildRequest(url);

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            awaitQuotaReset();

            try (Response response = httpClient.newCall(request).execute()) {
                int statusCode = response.code();
                logResponse(url, statusCode, response);
                window = RateLimitWindow.from(response);

                ResponseBody body = response.body();
                String bodyString = body != null ? body.string() : "";

                if (statusCode >= 200 && statusCode < 300) {
                    return objectMapper.readTree(bodyString);
                }

                if (!isRateLimited(statusCode, response, bodyString)) {
                    throw new HttpStatusException(url.toString(), statusCode, bodyString);
                }

                if (attempt == MAX_ATTEMPTS) {
                    break;
                }
                Duration wait = retryWait(response);
                logger.warn("Rate limited ({}) on {}. Waiting {}s before retry (attempt {}/{})",
                        statusCode, url, wait.toSeconds(), attempt, MAX_ATTEMPTS);
                sleeper.sleep(wait);
                window = null;
            }
        }

        throw new RateLimitExceededException(url.toString(), MAX_ATTEMPTS);
    }

    HttpUrl buildUrl(String path, Map<String, String> params) {
        String relative = path.startsWith("/") ? path.substring(1) : path;
        HttpUrl.Builder builder = baseUrl.newBuilder().addPathSegments(relative);
        params.forEach(builder::addQueryParameter);
        return builder.build();
    }

    /**
     * Builds a GET request with the GitHub media type, API version and, when a
     * token is configured, bearer authentication.
     */
    Request buildRequest(HttpUrl url) {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .header("Accept", "application/vnd.github+json")
                .header("X-GitHub-Api-Version", "2022-11-28");

        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }

        return builder.build();
    }

    // -------------------------------------------------------------------------
    // Rate limit handling
    // -------------------------------------------------------------------------

    /**
     * If the last response left no quota, sleep until the reported reset.
     */
    void awaitQuotaReset() throws InterruptedException {
        if (window == null || !window.exhausted()) {
            return;
        }
        Duration wait = window.untilReset(clock.instant());
        logger.warn("Rate limit exhausted. Pausing for {}s until reset.", wait.toSeconds());
        sleeper.sleep(wait);
        window = null;
    }

    static boolean isRateLimited(int statusCode, Response response, String body) {
        if (statusCode == 429) {
            return true;
        }
        if (statusCode != 403) {
            return false;
        }
        if ("0".equals(response.header("X-RateLimit-Remaining"))) {
            return true;
        }
        String lower = body == null ? "" : body.toLowerCase(Locale.ROOT);
        return lower.contains("rate limit") || lower.contains("abuse");
    }

    /**
     * Uses Retry-After when present, otherwise the quota reset time, otherwise
     * a fixed default.
     */
    Duration retryWait(Response response) {
        String retryAfter = response.header("Retry-After");
        if (retryAfter != null) {
            try {
                return Duration.ofSeconds(Math.max(Long.parseLong(retryAfter.trim()), 0));
            } catch (NumberFormatException e) {
                logger.debug("Ignoring non-numeric Retry-After header: {}", retryAfter);
            }
        }
        RateLimitWindow current = RateLimitWindow.from(response);
        if (current != null) {
            return current.untilReset(clock.instant());
        }
        return DEFAULT_RATE_LIMIT_WAIT;
    }

    // -------------------------------------------------------------------------
    // Logging
    // -------------------------------------------------------------------------

    private void logResponse(HttpUrl url, int statusCode, Response response) {
        String remaining = response.header("X-RateLimit-Remaining");
        logger.info("GitHub API {} {} | rate-limit-remaining: {}",
                statusCode, url, remaining != null ? remaining : "n/a");
    }

    // -------------------------------------------------------------------------
    // Rate limit window
    // -------------------------------------------------------------------------

    record RateLimitWindow(int remaining, long resetEpochSecond) {

        static RateLimitWindow from(Response response) {
            String remainingHeader = response.header("X-RateLimit-Remaining");
            String resetHeader = response.header("X-RateLimit-Reset");
            if (remainingHeader == null || resetHeader == null) {
                return null;
            }
            try {
                return new RateLimitWindow(Integer.parseInt(remainingHeader.trim()),
                        Long.parseLong(resetHeader.trim()));
            } catch (NumberFormatException e) {
                logger.debug("Unparseable rate-limit headers: remaining={}, reset={}",
                        remainingHeader, resetHeader);
                return null;
            }
        }

        boolean exhausted() {
            return remaining <= 0;
        }

        Duration untilReset(Instant now) {
            long seconds = resetEpochSecond - now.getEpochSecond() + 1;
            return Duration.ofSeconds(Math.max(seconds, 0));
        }
    }
}
