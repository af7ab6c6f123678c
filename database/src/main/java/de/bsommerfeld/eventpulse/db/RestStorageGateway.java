package de.bsommerfeld.eventpulse.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.eventpulse.core.result.CallResult;
import de.bsommerfeld.eventpulse.core.util.Timestamps;
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
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * {@link StorageGateway} speaking the PostgREST protocol, as exposed by
 * Supabase under {@code <project>/rest/v1}.
 *
 * <p>
 * Filters map to PostgREST query operators ({@code eq.}, {@code in.()},
 * {@code gte.}, ...). The service key is sent both as {@code apikey} and as
 * bearer token. Only a body carrying Postgres error code {@code 23505} is a
 * uniqueness violation; any other {@code 409} conflict, such as a foreign-key
 * violation, is a transient error.
 */
public class RestStorageGateway implements StorageGateway {

    private static final Logger LOG = LoggerFactory.getLogger(RestStorageGateway.class);
    private static final String REST_PATH = "/rest/v1";
    private static final int MAX_DETAIL_LENGTH = 300;
    private static final String UNIQUE_VIOLATION = "23505";

    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;

    public RestStorageGateway(String url, String apiKey, Duration timeout) {
        this(url, apiKey, timeout, HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .build());
    }

    RestStorageGateway(String url, String apiKey, Duration timeout, HttpClient httpClient) {
        this.baseUrl = normalizeBaseUrl(url);
        this.apiKey = apiKey;
        this.timeout = timeout;
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
    }

    static String normalizeBaseUrl(String url) {
        String base = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        return base.endsWith(REST_PATH) ? base : base + REST_PATH;
    }

    // =====================================================================
    // StorageGateway
    // =====================================================================

    @Override
    public List<Map<String, Object>> select(String table, Query query) {
        URI uri = URI.create(selectUrl(table, query));
        HttpRequest request = baseRequest(uri)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new StorageException("Select from " + table + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Select from " + table + " interrupted", e);
        }

        if (response.statusCode() != 200) {
            throw new StorageException("Select from " + table + " returned HTTP "
                    + response.statusCode() + ": " + abbreviate(response.body()));
        }
        try {
            return mapper.readValue(response.body(), new TypeReference<List<Map<String, Object>>>() {
            });
        } catch (JsonProcessingException e) {
            throw new StorageException("Select from " + table + " returned malformed JSON", e);
        }
    }

    @Override
    public CallResult<Integer> insert(String table, Map<String, Object> row) {
        String body = toJson(row);
        HttpRequest request = baseRequest(URI.create(baseUrl + "/" + Query.requireIdentifier(table)))
                .header("Content-Type", "application/json")
                .header("Prefer", "return=minimal")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        return execute("Insert into " + table, request, response -> 1);
    }

    @Override
    public CallResult<Integer> update(String table, Map<String, Object> patch, List<Query.Filter> filters) {
        StringJoiner params = new StringJoiner("&", "?", "").setEmptyValue("");
        for (Query.Filter filter : filters) {
            params.add(filterParam(filter));
        }
        URI uri = URI.create(baseUrl + "/" + Query.requireIdentifier(table) + params);
        HttpRequest request = baseRequest(uri)
                .header("Content-Type", "application/json")
                .header("Prefer", "return=representation")
                .method("PATCH", HttpRequest.BodyPublishers.ofString(toJson(patch)))
                .build();

        return execute("Update of " + table, request, this::countRows);
    }

    @Override
    public String describe() {
        return "PostgREST " + baseUrl;
    }

    // =====================================================================
    // Request building
    // =====================================================================

    private HttpRequest.Builder baseRequest(URI uri) {
        return HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("apikey", apiKey)
                .header("Authorization", "Bearer " + apiKey);
    }

    String selectUrl(String table, Query query) {
        StringBuilder url = new StringBuilder(baseUrl)
                .append('/').append(Query.requireIdentifier(table))
                .append("?select=*");
        for (Query.Filter filter : query.filters()) {
            url.append('&').append(filterParam(filter));
        }
        if (query.order() != null) {
            url.append("&order=").append(query.order().column())
                    .append(query.order().ascending() ? ".asc" : ".desc");
        }
        if (query.limit() != null) {
            url.append("&limit=").append(query.limit());
        }
        return url.toString();
    }

    private static String filterParam(Query.Filter filter) {
        String column = filter.column();
        switch (filter.operator()) {
            case EQ:
                return filter.value() == null
                        ? column + "=is.null"
                        : column + "=eq." + encode(literal(filter.value()));
            case IN:
                StringJoiner values = new StringJoiner(",", "(", ")");
                for (Object value : (Collection<?>) filter.value()) {
                    values.add("\"" + literal(value).replace("\"", "\\\"") + "\"");
                }
                return column + "=in." + encode(values.toString());
            case GT:
                return column + "=gt." + encode(literal(filter.value()));
            case GTE:
                return column + "=gte." + encode(literal(filter.value()));
            case LT:
                return column + "=lt." + encode(literal(filter.value()));
            case LTE:
                return column + "=lte." + encode(literal(filter.value()));
            default:
                throw new IllegalArgumentException("Unsupported operator " + filter.operator());
        }
    }

    private static String literal(Object value) {
        if (value instanceof Instant instant)
            return Timestamps.format(instant);
        return String.valueOf(value);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private String toJson(Map<String, Object> row) {
        Map<String, Object> body = new LinkedHashMap<>();
        row.forEach((column, value) -> body.put(Query.requireIdentifier(column),
                value instanceof Instant instant ? Timestamps.format(instant) : value));
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new StorageException("Row is not serializable to JSON", e);
        }
    }

    // =====================================================================
    // Response handling
    // =====================================================================

    @FunctionalInterface
    private interface RowCounter {
        int count(HttpResponse<String> response) throws JsonProcessingException;
    }

    private CallResult<Integer> execute(String operation, HttpRequest request, RowCounter counter) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            LOG.warn("{} timed out", operation);
            return CallResult.transientError(operation + " timed out");
        } catch (IOException e) {
            LOG.warn("{} failed: {}", operation, e.getMessage());
            return CallResult.transientError(operation + " failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CallResult.transientError(operation + " interrupted");
        }

        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            try {
                return CallResult.ok(counter.count(response));
            } catch (JsonProcessingException e) {
                return CallResult.transientError(operation + " returned malformed JSON");
            }
        }
        return classify(status, response.body());
    }

    private int countRows(HttpResponse<String> response) throws JsonProcessingException {
        String body = response.body();
        if (body == null || body.isBlank())
            return 0;
        JsonNode node = mapper.readTree(body);
        return node.isArray() ? node.size() : 1;
    }

    static <T> CallResult<T> classify(int status, String body) {
        String detail = "HTTP " + status + ": " + abbreviate(body);
        if (body != null && body.contains("\"" + UNIQUE_VIOLATION + "\"")) {
            return CallResult.duplicate(detail);
        }
        if (status == 404) {
            return CallResult.notFound(detail);
        }
        if (status == 401 || status == 403) {
            return CallResult.forbidden(detail);
        }
        return CallResult.transientError(detail);
    }

    private static String abbreviate(String body) {
        if (body == null)
            return "";
        return body.length() <= MAX_DETAIL_LENGTH ? body : body.substring(0, MAX_DETAIL_LENGTH) + "...";
    }
}
