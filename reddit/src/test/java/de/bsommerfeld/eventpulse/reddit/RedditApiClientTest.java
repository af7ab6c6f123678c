package de.bsommerfeld.eventpulse.reddit;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import de.bsommerfeld.eventpulse.core.result.CallResult;
import de.bsommerfeld.eventpulse.core.result.CallStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the OAuth client against a local JDK HTTP server. Responses are
 * queued per path; unqueued paths answer 404.
 */
class RedditApiClientTest {

    private HttpServer server;
    private RedditApiClient client;

    private final Map<String, Deque<Reply>> replies = new ConcurrentHashMap<>();
    private final List<String> requests = new CopyOnWriteArrayList<>();
    private final List<String> authHeaders = new CopyOnWriteArrayList<>();

    private record Reply(int status, String body) {
    }

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();

        String base = "http://127.0.0.1:" + server.getAddress().getPort();
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
        client = new RedditApiClient(URI.create(base + "/api/v1/access_token"), base, "id", "secret",
                "campus-events-app/0.1", Duration.ofSeconds(5), httpClient, Clock.systemUTC());

        queue("/api/v1/access_token", 200, Fixtures.load("token.json"));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void queue(String path, int status, String body) {
        replies.computeIfAbsent(path, p -> new ArrayDeque<>()).add(new Reply(status, body));
    }

    private synchronized void handle(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        requests.add(path + (exchange.getRequestURI().getRawQuery() != null
                ? "?" + exchange.getRequestURI().getRawQuery() : ""));
        authHeaders.add(String.valueOf(exchange.getRequestHeaders().getFirst("Authorization")));
        exchange.getRequestBody().readAllBytes();

        Deque<Reply> queued = replies.get(path);
        Reply reply = queued == null || queued.isEmpty() ? new Reply(404, "{}")
                : (queued.size() > 1 ? queued.poll() : queued.peek());
        if (reply.status() == 302) {
            exchange.getResponseHeaders().add("Location", "/subreddits/search?q=x");
        }
        byte[] bytes = reply.body().getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(reply.status(), bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }

    private long count(String prefix) {
        return requests.stream().filter(r -> r.startsWith(prefix)).count();
    }

    // -- Target resolution --

    @Test
    void getTarget_shouldResolveExistingSubreddit() {
        queue("/r/programming/about", 200, Fixtures.load("about.json"));

        CallResult<TargetHandle> result = client.getTarget("programming");

        assertTrue(result.isOk());
        assertEquals("programming", result.value().name());
        assertTrue(authHeaders.contains("Bearer token-1"));
    }

    @Test
    void getTarget_shouldMapMissingSubredditToNotFound() {
        assertEquals(CallStatus.NOT_FOUND, client.getTarget("doesnotexist").status());
    }

    @Test
    void getTarget_shouldMapRedirectToNotFound() {
        queue("/r/renamed/about", 302, "");

        assertEquals(CallStatus.NOT_FOUND, client.getTarget("renamed").status());
    }

    @Test
    void getTarget_shouldMapForbidden() {
        queue("/r/secret/about", 403, "{\"reason\":\"private\"}");

        assertEquals(CallStatus.FORBIDDEN, client.getTarget("secret").status());
    }

    @Test
    void getTarget_shouldRejectInvalidNamesWithoutRequest() {
        assertEquals(CallStatus.NOT_FOUND, client.getTarget("ai OR hackathon").status());
        assertTrue(requests.isEmpty());
    }

    @Test
    void getTarget_shouldSkipAboutForAggregateTargets() {
        assertTrue(client.getTarget("all").isOk());
        assertEquals(0, count("/r/all/about"));
    }

    @Test
    void getTarget_shouldMapServerErrorToTransient() {
        queue("/r/flaky/about", 503, "");

        assertEquals(CallStatus.TRANSIENT_ERROR, client.getTarget("flaky").status());
    }

    // -- Listings --

    @Test
    void search_shouldSendQueryAndParsePosts() {
        queue("/r/programming/about", 200, Fixtures.load("about.json"));
        queue("/r/programming/search", 200, Fixtures.load("search-listing.json"));

        TargetHandle handle = client.getTarget("programming").value();
        CallResult<List<RedditPost>> posts = handle.search("hackathon OR ai", "new", 20);

        assertTrue(posts.isOk());
        assertEquals(2, posts.value().size());
        String search = requests.stream().filter(r -> r.startsWith("/r/programming/search")).findFirst().orElseThrow();
        assertTrue(search.contains("q=hackathon+OR+ai"), search);
        assertTrue(search.contains("sort=new"), search);
        assertTrue(search.contains("limit=20"), search);
        assertTrue(search.contains("restrict_sr=1"), search);
    }

    @Test
    void comments_shouldRespectLimit() {
        queue("/r/programming/about", 200, Fixtures.load("about.json"));
        queue("/comments/p1", 200, Fixtures.load("comments.json"));
        TargetHandle handle = client.getTarget("programming").value();
        RedditPost post = new RedditPost("p1", "programming", "t", "", null, null, null, null);

        CallResult<List<RedditComment>> comments = handle.comments(post, 1);

        assertTrue(comments.isOk());
        assertEquals(1, comments.value().size());
    }

    // -- Token handling --

    @Test
    void getTarget_shouldReuseCachedToken() {
        queue("/r/programming/about", 200, Fixtures.load("about.json"));

        client.getTarget("programming");
        client.getTarget("programming");

        assertEquals(1, count("/api/v1/access_token"));
    }

    @Test
    void getTarget_shouldRefreshTokenOnceAfter401() {
        queue("/r/programming/about", 401, "");
        queue("/r/programming/about", 200, Fixtures.load("about.json"));

        assertTrue(client.getTarget("programming").isOk());
        assertEquals(2, count("/api/v1/access_token"));
    }

    @Test
    void getTarget_shouldReportForbiddenWhenCredentialsAreRejected() {
        replies.get("/api/v1/access_token").clear();
        queue("/api/v1/access_token", 401, "{\"error\":\"invalid_grant\"}");

        assertEquals(CallStatus.FORBIDDEN, client.getTarget("programming").status());
    }

    // -- Classification --

    @Test
    void classify_shouldMapRateLimitToTransient() {
        assertEquals(CallStatus.TRANSIENT_ERROR, RedditApiClient.classify(429, "", "x").status());
        assertEquals(CallStatus.NOT_FOUND, RedditApiClient.classify(301, "", "x").status());
        assertTrue(RedditApiClient.classify(200, "{}", "x").isOk());
    }
}
