package app.mediarouter.gateway.provider.openai;

import app.mediarouter.gateway.provider.GenerationOutcome;
import app.mediarouter.gateway.provider.GenerationRequest;
import app.mediarouter.gateway.provider.NormalizedStatus;
import app.mediarouter.gateway.provider.ProviderCapabilities;
import app.mediarouter.gateway.provider.ProviderFailures;
import app.mediarouter.gateway.provider.VideoProviderAdapter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * OpenAI Videos API: {@code POST /videos}, {@code GET /videos/{id}}, {@code GET /videos/{id}/content}.
 */
@Component
public class SoraAdapter implements VideoProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(SoraAdapter.class);

    public static final String PROVIDER = "openai";
    static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    private static final String DEFAULT_MODEL = "sora-2";
    private static final String DEFAULT_SIZE = "1280x720";

    private static final List<String> MODELS = List.of("sora-2", "sora-1");

    private static final Map<String, String> SIZES = Map.of(
            "9:16", "720x1280",
            "16:9", "1280x720",
            "1:1", "1024x1024"
    );

    private static final Map<String, NormalizedStatus> STATUSES = Map.of(
            "queued", NormalizedStatus.processing,
            "processing", NormalizedStatus.processing,
            "in_progress", NormalizedStatus.processing,
            "completed", NormalizedStatus.completed,
            "failed", NormalizedStatus.failed,
            "cancelled", NormalizedStatus.failed
    );

    private static final ProviderCapabilities FEATURES = new ProviderCapabilities(
            true,
            true,
            false,
            false,
            true,
            true,
            20,
            List.of("16:9", "9:16", "1:1")
    );

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String defaultModel;

    public SoraAdapter(RestClient.Builder restClientBuilder,
                       OpenAiProps props,
                       ObjectMapper objectMapper) {
        this.baseUrl = trimTrailingSlash(props == null || props.baseUrl() == null || props.baseUrl().isBlank()
                ? DEFAULT_BASE_URL
                : props.baseUrl());
        this.defaultModel = props == null || props.defaultModel() == null || props.defaultModel().isBlank()
                ? DEFAULT_MODEL
                : props.defaultModel();
        this.restClient = restClientBuilder
                .baseUrl(baseUrl)
                .build();
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return PROVIDER;
    }

    @Override
    public List<String> models() {
        return MODELS;
    }

    @Override
    public ProviderCapabilities supportedFeatures() {
        return FEATURES;
    }

    @Override
    public boolean validateKey(String apiKey) {
        try {
            restClient.get()
                    .uri("/models")
                    .header(HttpHeaders.AUTHORIZATION, bearer(apiKey))
                    .retrieve()
                    .toBodilessEntity();
            return true;
        } catch (Exception ex) {
            log.debug("OpenAI key validation failed error={}", ProviderFailures.message(ex));
            return false;
        }
    }

    @Override
    public GenerationOutcome generateVideo(String apiKey, GenerationRequest request) {
        try {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("prompt", request.prompt());
            payload.put("model", request.model() == null || request.model().isBlank() ? defaultModel : request.model());
            if (request.durationSeconds() != null && request.durationSeconds() > 0) {
                payload.put("seconds", request.durationSeconds().toString());
            }
            if (request.resolution() != null && !request.resolution().isBlank()) {
                payload.put("size", request.resolution());
            } else if (request.aspectRatio() != null && !request.aspectRatio().isBlank()) {
                payload.put("size", SIZES.getOrDefault(request.aspectRatio(), DEFAULT_SIZE));
            }

            JsonNode response = restClient.post()
                    .uri("/videos")
                    .header(HttpHeaders.AUTHORIZATION, bearer(apiKey))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);

            if (response == null) {
                throw new IllegalStateException("OpenAI video response is empty");
            }
            String videoId = ProviderFailures.text(response.path("id"));
            if (videoId == null) {
                throw new IllegalStateException("OpenAI video id is missing");
            }
            return GenerationOutcome.processing(videoId, response);
        } catch (Exception ex) {
            return ProviderFailures.toOutcome("", ex, objectMapper, SoraAdapter::errorMessage);
        }
    }

    @Override
    public GenerationOutcome checkStatus(String apiKey, String remoteJobId) {
        try {
            JsonNode response = restClient.get()
                    .uri("/videos/{videoId}", remoteJobId)
                    .header(HttpHeaders.AUTHORIZATION, bearer(apiKey))
                    .retrieve()
                    .body(JsonNode.class);

            if (response == null) {
                throw new IllegalStateException("OpenAI video status is empty");
            }
            String rawStatus = response.path("status").asText("processing").toLowerCase(Locale.ROOT);
            NormalizedStatus status = STATUSES.getOrDefault(rawStatus, NormalizedStatus.processing);
            return switch (status) {
                case completed -> GenerationOutcome.completed(remoteJobId, contentUrl(remoteJobId), response);
                case failed -> GenerationOutcome.failed(remoteJobId, failureReason(response, rawStatus), null, response);
                case processing -> GenerationOutcome.processing(remoteJobId, response);
            };
        } catch (Exception ex) {
            return ProviderFailures.toOutcome(remoteJobId, ex, objectMapper, SoraAdapter::errorMessage);
        }
    }

    /**
     * The content endpoint is authenticated with the same key that created the video.
     */
    @Override
    public Map<String, String> artifactHeaders(String apiKey) {
        return Map.of(HttpHeaders.AUTHORIZATION, bearer(apiKey));
    }

    String contentUrl(String videoId) {
        return baseUrl + "/videos/" + videoId + "/content";
    }

    static String errorMessage(JsonNode body) {
        return ProviderFailures.text(body.path("error").path("message"));
    }

    private String failureReason(JsonNode response, String rawStatus) {
        String message = errorMessage(response);
        return message == null ? "OpenAI video " + rawStatus : message;
    }

    private String bearer(String token) {
        return "Bearer " + token;
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
