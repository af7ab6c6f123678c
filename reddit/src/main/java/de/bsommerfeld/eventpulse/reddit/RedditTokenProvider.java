package de.bsommerfeld.eventpulse.reddit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.eventpulse.core.result.CallResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;

/**
 * Application-only OAuth token for the Reddit API (client credentials
 * grant). The token is cached until shortly before it expires; a 401 from
 * the API invalidates it early.
 */
class RedditTokenProvider {

    private static final Logger LOG = LoggerFactory.getLogger(RedditTokenProvider.class);

    /** Tokens are renewed this long before Reddit would expire them. */
    private static final Duration EXPIRY_MARGIN = Duration.ofSeconds(60);

    private final URI tokenUri;
    private final String basicAuth;
    private final String userAgent;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final Clock clock;

    private String token;
    private Instant expiresAt = Instant.EPOCH;

    RedditTokenProvider(URI tokenUri, String clientId, String clientSecret, String userAgent,
            Duration timeout, HttpClient httpClient, ObjectMapper mapper, Clock clock) {
        this.tokenUri = tokenUri;
        this.basicAuth = Base64.getEncoder()
                .encodeToString((clientId + ":" + clientSecret).getBytes(StandardCharsets.UTF_8));
        this.userAgent = userAgent;
        this.timeout = timeout;
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.clock = clock;
    }

    synchronized CallResult<String> get() {
        if (token != null && clock.instant().isBefore(expiresAt)) {
            return CallResult.ok(token);
        }
        return refresh();
    }

    synchronized void invalidate() {
        token = null;
        expiresAt = Instant.EPOCH;
    }

    private CallResult<String> refresh() {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(tokenUri)
                .timeout(timeout)
                .header("Authorization", "Basic " + basicAuth)
                .header("User-Agent", userAgent)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString("grant_type=client_credentials"))
                .build();

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() == 401 || response.statusCode() == 403) {
                return CallResult.forbidden("Reddit rejected the client credentials (HTTP "
                        + response.statusCode() + ")");
            }
            if (response.statusCode() != 200) {
                return CallResult.transientError("Token request failed with HTTP " + response.statusCode());
            }

            JsonNode root = mapper.readTree(response.body());
            String accessToken = root.path("access_token").asText(null);
            if (accessToken == null || accessToken.isEmpty()) {
                return CallResult.transientError("Token response without access_token: "
                        + root.path("error").asText("unknown error"));
            }
            long expiresIn = root.path("expires_in").asLong(3600);
            this.token = accessToken;
            this.expiresAt = clock.instant().plusSeconds(expiresIn).minus(EXPIRY_MARGIN);
            LOG.debug("Obtained Reddit access token, valid for {}s", expiresIn);
            return CallResult.ok(accessToken);
        } catch (IOException e) {
            return CallResult.transientError("Token request failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CallResult.transientError("Token request interrupted");
        }
    }
}
