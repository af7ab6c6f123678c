package de.bsommerfeld.eventpulse.reddit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Singleton;
import de.bsommerfeld.eventpulse.core.config.WorkerConfig;
import de.bsommerfeld.eventpulse.core.result.CallResult;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * {@link SocialClient} backed by the Reddit OAuth API
 * ({@code oauth.reddit.com}) with an application-only token.
 *
 * <h3>Outcome mapping</h3>
 * <ul>
 * <li>{@code 200} → OK</li>
 * <li>{@code 404} and redirects (Reddit redirects unknown subreddits to its
 * search page) → NOT_FOUND</li>
 * <li>{@code 403} → FORBIDDEN (private, quarantined or banned)</li>
 * <li>{@code 429}, {@code 5xx}, I/O errors and timeouts → TRANSIENT_ERROR</li>
 * <li>{@code 401} → the token is refreshed and the request retried once</li>
 * </ul>
 *
 * <h3>Rate limiting</h3>
 * Reddit returns {@code x-ratelimit-remaining} and {@code x-ratelimit-reset}
 * headers on every response. When fewer than 2 requests remain in the
 * current window, the calling thread blocks for the reset window.
 */
@Singleton
public class RedditApiClient implements SocialClient {

    private static final Logger LOG = LoggerFactory.getLogger(RedditApiClient.class);

    private static final String TOKEN_URL = "https://www.reddit.com/api/v1/access_token";
    private static final String API_BASE = "https://oauth.reddit.com";

    /** Subreddit names: 2-21 letters, digits or underscores. */
    private static final Pattern SUBREDDIT_NAME = Pattern.compile("[A-Za-z0-9_]{2,21}");

    /** Pseudo-subreddits that have no {@code /about} page but can be searched. */
    private static final Set<String> AGGREGATE_TARGETS = Set.of("all", "popular");

    private final String apiBase;
    private final String userAgent;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final RedditTokenProvider tokenProvider;
    private final RedditListingParser parser;

    @Inject
    public RedditApiClient(WorkerConfig config) {
        this(URI.create(TOKEN_URL), API_BASE, config.getRedditClientId(), config.getRedditClientSecret(),
                config.getUserAgent(), config.getRequestTimeout(),
                HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_2)
                        .connectTimeout(config.getRequestTimeout())
                        .followRedirects(HttpClient.Redirect.NEVER)
                        .build(),
                Clock.systemUTC());
    }

    RedditApiClient(URI tokenUri, String apiBase, String clientId, String clientSecret, String userAgent,
            Duration timeout, HttpClient httpClient, Clock clock) {
        ObjectMapper mapper = new ObjectMapper();
        this.apiBase = apiBase;
        this.userAgent = userAgent;
        this.timeout = timeout;
        this.httpClient = httpClient;
        this.parser = new RedditListingParser(mapper);
        this.tokenProvider = new RedditTokenProvider(tokenUri, clientId, clientSecret, userAgent,
                timeout, httpClient, mapper, clock);
    }

    @Override
    public CallResult<TargetHandle> getTarget(String name) {
        if (name == null || !SUBREDDIT_NAME.matcher(name).matches()) {
            return CallResult.notFound("'" + name + "' is not a valid subreddit name");
        }
        if (AGGREGATE_TARGETS.contains(name.toLowerCase(Locale.ROOT))) {
            return CallResult.ok(new Subreddit(name));
        }

        CallResult<String> about = get("/r/" + name + "/about?raw_json=1");
        if (!about.isOk()) {
            return about.asFailure();
        }
        try {
            if (!parser.isSubreddit(about.value())) {
                return CallResult.notFound("r/" + name + " does not exist");
            }
        } catch (JsonProcessingException e) {
            return CallResult.transientError("Malformed about response for r/" + name);
        }
        return CallResult.ok(new Subreddit(name));
    }

    // =====================================================================
    // Target handle
    // =====================================================================

    private final class Subreddit implements TargetHandle {

        private final String name;

        Subreddit(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public CallResult<List<RedditPost>> search(String query, String sort, int limit) {
            String path = "/r/" + name + "/search?q=" + encode(query)
                    + "&restrict_sr=1&sort=" + encode(sort) + "&limit=" + limit + "&raw_json=1";
            return posts(get(path), "search of r/" + name);
        }

        @Override
        public CallResult<List<RedditPost>> hot(int limit) {
            return posts(get("/r/" + name + "/hot?limit=" + limit + "&raw_json=1"), "hot listing of r/" + name);
        }

        @Override
        public CallResult<List<RedditComment>> comments(RedditPost post, int limit) {
            CallResult<String> body = get("/comments/" + encode(post.id())
                    + "?limit=" + limit + "&depth=1&sort=top&raw_json=1");
            if (!body.isOk()) {
                return body.asFailure();
            }
            try {
                List<RedditComment> comments = parser.parseComments(body.value());
                return CallResult.ok(comments.size() > limit ? comments.subList(0, limit) : comments);
            } catch (JsonProcessingException e) {
                return CallResult.transientError("Malformed comments response for post " + post.id());
            }
        }

        private CallResult<List<RedditPost>> posts(CallResult<String> body, String what) {
            if (!body.isOk()) {
                return body.asFailure();
            }
            try {
                return CallResult.ok(parser.parsePosts(body.value()));
            } catch (JsonProcessingException e) {
                return CallResult.transientError("Malformed response for " + what);
            }
        }
    }

    // =====================================================================
    // HTTP
    // =====================================================================

    /**
     * Executes an authenticated GET. Every outgoing API call flows through
     * this method to ensure consistent headers, timeouts and backoff.
     */
    private CallResult<String> get(String pathAndQuery) {
        for (int attempt = 0; attempt < 2; attempt++) {
            CallResult<String> token = tokenProvider.get();
            if (!token.isOk()) {
                return token;
            }

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(apiBase + pathAndQuery))
                    .timeout(timeout)
                    .header("Authorization", "Bearer " + token.value())
                    .header("User-Agent", userAgent)
                    .GET()
                    .build();

            HttpResponse<String> response;
            try {
                response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            } catch (HttpTimeoutException e) {
                return CallResult.transientError("Timed out: " + pathAndQuery);
            } catch (IOException e) {
                return CallResult.transientError("I/O error on " + pathAndQuery + ": " + e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return CallResult.transientError("Interrupted: " + pathAndQuery);
            }
            checkRateLimit(response);

            if (response.statusCode() == 401 && attempt == 0) {
                LOG.debug("Reddit token rejected, refreshing");
                tokenProvider.invalidate();
                continue;
            }
            return classify(response.statusCode(), response.body(), pathAndQuery);
        }
        return CallResult.forbidden("Reddit rejected a freshly issued token for " + pathAndQuery);
    }

    static CallResult<String> classify(int status, String body, String what) {
        if (status == 200) {
            return CallResult.ok(body);
        }
        String detail = "HTTP " + status + " for " + what;
        if (status == 404 || (status >= 300 && status < 400)) {
            return CallResult.notFound(detail);
        }
        if (status == 403) {
            return CallResult.forbidden(detail);
        }
        return CallResult.transientError(detail);
    }

    /**
     * Inspects Reddit's rate-limit response headers. If fewer than 2
     * requests remain in the current window, the thread blocks for the
     * {@code x-ratelimit-reset} duration plus 1 second of safety margin.
     */
    private void checkRateLimit(HttpResponse<?> response) {
        response.headers().firstValue("x-ratelimit-remaining").ifPresent(remaining -> {
            try {
                double rem = Double.parseDouble(remaining);
                if (rem < 2.0) {
                    response.headers().firstValue("x-ratelimit-reset").ifPresent(reset -> {
                        int waitSecs = (int) Double.parseDouble(reset) + 1;
                        LOG.warn("Reddit rate limit near. Sleeping for {}s", waitSecs);
                        try {
                            Thread.sleep(waitSecs * 1000L);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                    });
                }
            } catch (NumberFormatException e) {
                LOG.debug("Ignoring malformed rate-limit header: {}", remaining);
            }
        });
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
