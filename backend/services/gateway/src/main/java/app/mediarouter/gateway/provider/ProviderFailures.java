package app.mediarouter.gateway.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.client.RestClientResponseException;

import java.util.function.Function;

/**
 * Turns exceptions raised around a provider call into failed outcomes.
 */
public final class ProviderFailures {

    private ProviderFailures() {
    }

    public static GenerationOutcome toOutcome(String remoteJobId,
                                              Exception ex,
                                              ObjectMapper objectMapper,
                                              Function<JsonNode, String> envelopeMessage) {
        if (ex instanceof RestClientResponseException responseEx) {
            int code = responseEx.getStatusCode().value();
            String body = responseEx.getResponseBodyAsString();
            String detail = readEnvelope(body, objectMapper, envelopeMessage);
            return GenerationOutcome.failed(remoteJobId, "HTTP " + code + ": " + detail, code, null);
        }
        return GenerationOutcome.failed(remoteJobId, message(ex), null, null);
    }

    static String readEnvelope(String body, ObjectMapper objectMapper, Function<JsonNode, String> envelopeMessage) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            String message = node == null ? null : envelopeMessage.apply(node);
            if (message != null && !message.isBlank()) {
                return message;
            }
        } catch (Exception ignored) {
            // not JSON, use the raw body
        }
        return body;
    }

    public static String message(Exception ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return message;
    }

    public static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        String value = node.isTextual() ? node.asText() : null;
        return value == null || value.isBlank() ? null : value;
    }
}
