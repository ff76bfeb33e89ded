package com.flint.aggregator.connection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

/**
 * Turns a provider failure into a {@link ConnectionVerdict}. Pure and total: the same status and code
 * always give the same verdict and nothing here throws.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>408/429/503/504 or a temporary/timeout/rate-limit code: transient, retry.</li>
 *   <li>401/403 or an invalid-credentials/revoked/expired code: mark disconnected, no retry.</li>
 *   <li>404: treated as not-yet-synced, retry.</li>
 *   <li>anything else: retry, status untouched.</li>
 * </ol>
 */
@Component
public class ConnectionErrorClassifier {

    static final String AUTHORIZATION_EXPIRED = "AUTHORIZATION_EXPIRED";
    static final int DEFAULT_STATUS = 500;

    private static final Set<Integer> TRANSIENT_STATUSES = Set.of(408, 429, 503, 504);
    private static final Set<String> TRANSIENT_CODES = Set.of("TEMPORARY", "TEMPORARY_ERROR", "TIMEOUT", "RATE_LIMIT");
    private static final Set<Integer> AUTH_STATUSES = Set.of(401, 403);
    private static final Set<String> AUTH_CODES = Set.of("INVALID_CREDENTIALS", "ACCESS_REVOKED", AUTHORIZATION_EXPIRED);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public ConnectionVerdict classify(int status, String providerCode) {
        String code = normalizeCode(providerCode);
        if (TRANSIENT_STATUSES.contains(status) || isTransientCode(code)) {
            return new ConnectionVerdict(VerdictKind.TRANSIENT, status, code);
        }
        if (AUTH_STATUSES.contains(status) || (code != null && AUTH_CODES.contains(code))) {
            return new ConnectionVerdict(VerdictKind.AUTH_EXPIRED, status, code);
        }
        if (status == 404) {
            return new ConnectionVerdict(VerdictKind.TEMPORARILY_UNAVAILABLE, status, code);
        }
        return new ConnectionVerdict(VerdictKind.UNKNOWN, status, code);
    }

    public ConnectionVerdict classify(Throwable error) {
        Throwable cause = Exceptions.unwrap(error);
        if (cause instanceof ProviderException provider) {
            return classify(provider.getStatus(), provider.getProviderCode());
        }
        if (cause instanceof WebClientResponseException response) {
            return classify(response.getStatusCode().value(), codeFromBody(response.getResponseBodyAsString()));
        }
        if (isTimeout(cause)) {
            return classify(408, "TIMEOUT");
        }
        return classify(DEFAULT_STATUS, null);
    }

    private static boolean isTransientCode(String code) {
        return code != null && (TRANSIENT_CODES.contains(code) || code.endsWith("_TEMPORARY_ERROR"));
    }

    private static boolean isTimeout(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof TimeoutException) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    static String codeFromBody(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode root = MAPPER.readTree(body);
            if (root.hasNonNull("error_code")) {
                return root.get("error_code").asText();
            }
            if (root.hasNonNull("code")) {
                return root.get("code").asText();
            }
            JsonNode nested = root.path("error").path("code");
            return nested.isMissingNode() || nested.isNull() ? null : nested.asText();
        } catch (IOException e) {
            // not a JSON error body
            return null;
        }
    }

    private static String normalizeCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        return code.trim().toUpperCase(Locale.ROOT);
    }
}
