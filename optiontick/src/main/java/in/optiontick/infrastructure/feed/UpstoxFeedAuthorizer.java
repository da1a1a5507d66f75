package in.optiontick.infrastructure.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Calls the Upstox feed authorize endpoint and extracts the authorized redirect URI.
 *
 * Expected response:
 * <pre>
 * {"status": "success", "data": {"authorized_redirect_uri": "wss://..."}}
 * </pre>
 * Any other outcome is a {@link FeedAuthenticationException}; the {@code errors}
 * payload, when present, is carried in its message. Never retried here.
 */
public final class UpstoxFeedAuthorizer implements FeedAuthorizer {
    private static final Logger log = LoggerFactory.getLogger(UpstoxFeedAuthorizer.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI authorizeUrl;
    private final Duration timeout;

    public UpstoxFeedAuthorizer(HttpClient httpClient, ObjectMapper objectMapper, URI authorizeUrl, Duration timeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.authorizeUrl = authorizeUrl;
        this.timeout = timeout;
    }

    @Override
    public URI authorize(String accessToken) {
        if (accessToken == null || accessToken.isBlank()) {
            throw new FeedAuthenticationException(-1, "Access token is missing");
        }

        HttpRequest request = HttpRequest.newBuilder()
            .uri(authorizeUrl)
            .header("Authorization", "Bearer " + accessToken)
            .header("Accept", "application/json")
            .timeout(timeout)
            .GET()
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.error("[UPSTOX] Authorize request failed: {}", e.getMessage());
            throw new FeedAuthenticationException(-1, "Authorize request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FeedAuthenticationException(-1, "Authorize request interrupted", e);
        }

        URI endpoint = parseRedirect(response.statusCode(), response.body());
        log.info("[UPSTOX] Feed authorized: {}://{}{}", endpoint.getScheme(), endpoint.getHost(), endpoint.getPath());
        return endpoint;
    }

    URI parseRedirect(int statusCode, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            log.error("[UPSTOX] Authorize HTTP {} returned non-JSON body", statusCode);
            throw new FeedAuthenticationException(statusCode, "Authorize response is not JSON", e);
        }

        String redirect = redirectUri(root);
        if (statusCode != 200 || redirect == null) {
            String errors = root != null && root.has("errors") ? root.get("errors").toString() : "none";
            log.error("[UPSTOX] Authorize HTTP {} without redirect URI, errors={}", statusCode, errors);
            throw new FeedAuthenticationException(statusCode,
                "No authorized_redirect_uri in response; errors=" + errors);
        }

        try {
            return URI.create(redirect);
        } catch (IllegalArgumentException e) {
            throw new FeedAuthenticationException(statusCode, "Invalid redirect URI: " + redirect, e);
        }
    }

    private static String redirectUri(JsonNode root) {
        if (root == null || !root.path("data").isObject()) {
            return null;
        }
        JsonNode data = root.get("data");
        for (String field : new String[]{"authorized_redirect_uri", "authorizedRedirectUri"}) {
            JsonNode node = data.get(field);
            if (node != null && node.isTextual() && !node.asText().isBlank()) {
                return node.asText();
            }
        }
        return null;
    }
}
