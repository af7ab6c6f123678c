package de.bsommerfeld.eventpulse.db;

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
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the PostgREST adapter against a local JDK HTTP server that records
 * the last request and answers with a canned response.
 */
class RestStorageGatewayTest {

    private HttpServer server;
    private RestStorageGateway gateway;

    private final AtomicReference<String> lastMethod = new AtomicReference<>();
    private final AtomicReference<String> lastQuery = new AtomicReference<>();
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final AtomicReference<String> lastApiKey = new AtomicReference<>();
    private volatile int responseStatus = 200;
    private volatile String responseBody = "[]";

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/rest/v1/", this::handle);
        server.start();
        String url = "http://127.0.0.1:" + server.getAddress().getPort();
        gateway = new RestStorageGateway(url, "service-key", Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        lastMethod.set(exchange.getRequestMethod());
        lastQuery.set(exchange.getRequestURI().getRawQuery());
        lastApiKey.set(exchange.getRequestHeaders().getFirst("apikey"));
        lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));

        byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(responseStatus, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }

    // -- URL building --

    @Test
    void normalizeBaseUrl_shouldAppendRestPathOnce() {
        assertEquals("https://x.supabase.co/rest/v1", RestStorageGateway.normalizeBaseUrl("https://x.supabase.co/"));
        assertEquals("https://x.supabase.co/rest/v1",
                RestStorageGateway.normalizeBaseUrl("https://x.supabase.co/rest/v1"));
    }

    @Test
    void selectUrl_shouldEncodeFiltersOrderAndLimit() {
        String url = gateway.selectUrl("event_submissions", Query.where()
                .gte("created_at", Instant.parse("2024-05-01T12:00:00Z"))
                .in("status", List.of("approved", "pending"))
                .orderBy("created_at", true)
                .limit(10));

        assertTrue(url.contains("created_at=gte.2024-05-01T12%3A00%3A00.000Z"), url);
        assertTrue(url.contains("status=in.%28%22approved%22%2C%22pending%22%29"), url);
        assertTrue(url.endsWith("&order=created_at.asc&limit=10"), url);
    }

    // -- Round trips --

    @Test
    void select_shouldParseRowsAndSendCredentials() {
        responseBody = "[{\"id\":\"E1\",\"tags\":[\"ai\"],\"created_at\":\"2024-05-01T12:00:00+00:00\"}]";

        List<Map<String, Object>> rows = gateway.select("event_submissions", Query.where().eq("id", "E1"));

        assertEquals(1, rows.size());
        assertEquals(List.of("ai"), rows.get(0).get("tags"));
        assertEquals("service-key", lastApiKey.get());
        assertEquals("select=*&id=eq.E1", lastQuery.get());
    }

    @Test
    void select_shouldThrowOnHttpError() {
        responseStatus = 500;
        responseBody = "{\"message\":\"boom\"}";

        StorageException e = assertThrows(StorageException.class,
                () -> gateway.select("event_submissions", Query.all()));
        assertTrue(e.getMessage().contains("500"));
    }

    @Test
    void insert_shouldPostJsonBody() {
        responseStatus = 201;
        responseBody = "";

        CallResult<Integer> result = gateway.insert("reddit_comments",
                Map.of("event_id", "E1", "created_utc", Instant.parse("2024-05-01T12:00:00Z")));

        assertTrue(result.isOk());
        assertEquals("POST", lastMethod.get());
        assertTrue(lastBody.get().contains("\"created_utc\":\"2024-05-01T12:00:00.000Z\""));
    }

    @Test
    void insert_shouldMapConflictToDuplicate() {
        responseStatus = 409;
        responseBody = "{\"code\":\"23505\",\"message\":\"duplicate key value violates unique constraint\"}";

        assertEquals(CallStatus.DUPLICATE, gateway.insert("reddit_comments", Map.of("event_id", "E1")).status());
    }

    @Test
    void update_shouldCountReturnedRepresentation() {
        responseBody = "[{\"id\":\"j1\"}]";

        CallResult<Integer> result = gateway.update("event_jobs", Map.of("attempts", 1),
                List.of(Query.Filter.eq("id", "j1"), Query.Filter.eq("attempts", 0)));

        assertEquals(1, result.value());
        assertEquals("PATCH", lastMethod.get());
        assertEquals("id=eq.j1&attempts=eq.0", lastQuery.get());
    }

    @Test
    void update_shouldReportZeroRowsForEmptyRepresentation() {
        responseBody = "[]";

        assertEquals(0, gateway.update("event_jobs", Map.of("attempts", 1),
                List.of(Query.Filter.eq("id", "j1"))).value());
    }

    // -- Status classification --

    @Test
    void classify_shouldMapStatusCodes() {
        assertEquals(CallStatus.NOT_FOUND, RestStorageGateway.classify(404, "").status());
        assertEquals(CallStatus.FORBIDDEN, RestStorageGateway.classify(401, "").status());
        assertEquals(CallStatus.TRANSIENT_ERROR, RestStorageGateway.classify(503, "").status());
        assertEquals(CallStatus.DUPLICATE, RestStorageGateway.classify(400, "{\"code\":\"23505\"}").status());
        assertEquals(CallStatus.DUPLICATE, RestStorageGateway.classify(409, "{\"code\":\"23505\"}").status());
    }

    @Test
    void classify_shouldTreatForeignKeyConflictAsTransient() {
        CallResult<Integer> result = RestStorageGateway.classify(409,
                "{\"code\":\"23503\",\"message\":\"insert or update violates foreign key constraint\"}");

        assertEquals(CallStatus.TRANSIENT_ERROR, result.status());
        assertTrue(result.detail().contains("23503"));
    }
}
