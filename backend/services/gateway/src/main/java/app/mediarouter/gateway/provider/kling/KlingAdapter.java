package app.mediarouter.gateway.provider.kling;

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

@Component
public class KlingAdapter implements VideoProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(KlingAdapter.class);

    public static final String PROVIDER = "kling";
    static final String DEFAULT_BASE_URL = "https://api.klingai.com/v1";
    private static final String DEFAULT_REMOTE_MODEL = "kling-v1.5";

    private static final List<String> MODELS = List.of("kling-1.5", "kling-1.0");

    private static final Map<String, String> REMOTE_MODELS = Map.of(
            "kling-1.5", "kling-v1.5",
            "kling-1.0", "kling-v1"
    );

    private static final Map<String, NormalizedStatus> STATUSES = Map.of(
            "pending", NormalizedStatus.processing,
            "running", NormalizedStatus.processing,
            "success", NormalizedStatus.completed,
            "failed", NormalizedStatus.failed
    );

    private static final ProviderCapabilities FEATURES = new ProviderCapabilities(
            true,
            true,
            true,
            true,
            true,
            true,
            10,
            List.of("16:9", "9:16", "1:1")
    );

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public KlingAdapter(RestClient.Builder restClientBuilder,
                        KlingProps props,
                        ObjectMapper objectMapper) {
        String baseUrl = props == null || props.baseUrl() == null || props.baseUrl().isBlank()
                ? DEFAULT_BASE_URL
                : props.baseUrl();
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
                    .uri("/account")
                    .header(HttpHeaders.AUTHORIZATION, bearer(apiKey))
                    .retrieve()
                    .toBodilessEntity();
            return true;
        } catch (Exception ex) {
            log.debug("Kling key validation failed error={}", ProviderFailures.message(ex));
            return false;
        }
    }

    @Override
    public GenerationOutcome generateVideo(String apiKey, GenerationRequest request) {
        try {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("prompt", request.prompt());
            payload.put("model", REMOTE_MODELS.getOrDefault(request.model(), DEFAULT_REMOTE_MODEL));
            if (request.durationSeconds() != null && request.durationSeconds() > 0) {
                payload.put("duration", request.durationSeconds());
            }
            if (request.aspectRatio() != null && !request.aspectRatio().isBlank()) {
                payload.put("aspect_ratio", request.aspectRatio());
            }
            if (request.seed() != null) {
                payload.put("seed", request.seed());
            }
            if (request.fps() != null && request.fps() > 0) {
                payload.put("fps", request.fps());
            }

            JsonNode response = restClient.post()
                    .uri("/videos/generations")
                    .header(HttpHeaders.AUTHORIZATION, bearer(apiKey))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);

            if (response == null) {
                throw new IllegalStateException("Kling task response is empty");
            }
            JsonNode task = unwrap(response);
            String taskId = ProviderFailures.text(task.path("task_id"));
            if (taskId == null) {
                taskId = ProviderFailures.text(task.path("id"));
            }
            if (taskId == null) {
                throw new IllegalStateException("Kling task id is missing");
            }
            return GenerationOutcome.processing(taskId, response);
        } catch (Exception ex) {
            return ProviderFailures.toOutcome("", ex, objectMapper, KlingAdapter::errorMessage);
        }
    }

    @Override
    public GenerationOutcome checkStatus(String apiKey, String remoteJobId) {
        try {
            JsonNode response = restClient.get()
                    .uri("/videos/generations/{taskId}", remoteJobId)
                    .header(HttpHeaders.AUTHORIZATION, bearer(apiKey))
                    .retrieve()
                    .body(JsonNode.class);

            if (response == null) {
                throw new IllegalStateException("Kling task status is empty");
            }
            JsonNode task = unwrap(response);
            String rawStatus = task.path("task_status").asText("").toLowerCase(Locale.ROOT);
            NormalizedStatus status = STATUSES.getOrDefault(rawStatus, NormalizedStatus.processing);
            return switch (status) {
                case completed -> GenerationOutcome.completed(remoteJobId, videoUrl(task.path("task_result")), task);
                case failed -> GenerationOutcome.failed(remoteJobId, failureReason(task), null, task);
                case processing -> GenerationOutcome.processing(remoteJobId, task);
            };
        } catch (Exception ex) {
            return ProviderFailures.toOutcome(remoteJobId, ex, objectMapper, KlingAdapter::errorMessage);
        }
    }

    static String errorMessage(JsonNode body) {
        return ProviderFailures.text(body.path("message"));
    }

    /**
     * Task fields are either top level or wrapped in a {@code data} object.
     */
    private JsonNode unwrap(JsonNode response) {
        JsonNode data = response.path("data");
        return data.isObject() ? data : response;
    }

    private String videoUrl(JsonNode taskResult) {
        String direct = ProviderFailures.text(taskResult.path("video_url"));
        if (direct != null) {
            return direct;
        }
        JsonNode videos = taskResult.path("videos");
        if (videos.isArray() && !videos.isEmpty()) {
            return ProviderFailures.text(videos.get(0).path("url"));
        }
        return null;
    }

    private String failureReason(JsonNode task) {
        String message = ProviderFailures.text(task.path("task_status_msg"));
        return message == null ? "Kling task failed" : message;
    }

    private String bearer(String token) {
        return "Bearer " + token;
    }
}
