package app.mediarouter.gateway.provider.runway;

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
public class RunwayAdapter implements VideoProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(RunwayAdapter.class);

    public static final String PROVIDER = "runway";
    static final String DEFAULT_BASE_URL = "https://api.runwayml.com/v1";

    private static final List<String> MODELS = List.of("runway-gen3", "runway-gen4");

    private static final Map<String, String> REMOTE_MODELS = Map.of(
            "runway-gen3", "gen3",
            "runway-gen4", "gen4"
    );

    private static final Map<String, int[]> DIMENSIONS = Map.of(
            "16:9", new int[]{1920, 1080},
            "9:16", new int[]{1080, 1920},
            "1:1", new int[]{1080, 1080},
            "4:3", new int[]{1440, 1080},
            "21:9", new int[]{2560, 1080}
    );
    private static final int[] DEFAULT_DIMENSIONS = {1920, 1080};

    private static final Map<String, NormalizedStatus> STATUSES = Map.of(
            "pending", NormalizedStatus.processing,
            "processing", NormalizedStatus.processing,
            "succeeded", NormalizedStatus.completed,
            "failed", NormalizedStatus.failed
    );

    private static final ProviderCapabilities FEATURES = new ProviderCapabilities(
            true,
            true,
            true,
            false,
            true,
            false,
            10,
            List.of("16:9", "9:16", "1:1", "4:3")
    );

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public RunwayAdapter(RestClient.Builder restClientBuilder,
                         RunwayProps props,
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
                    .uri("/teams")
                    .header(HttpHeaders.AUTHORIZATION, bearer(apiKey))
                    .retrieve()
                    .toBodilessEntity();
            return true;
        } catch (Exception ex) {
            log.debug("Runway key validation failed error={}", ProviderFailures.message(ex));
            return false;
        }
    }

    @Override
    public GenerationOutcome generateVideo(String apiKey, GenerationRequest request) {
        try {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("prompt", request.prompt());
            payload.put("model", REMOTE_MODELS.getOrDefault(request.model(), "gen3"));
            if (request.durationSeconds() != null && request.durationSeconds() > 0) {
                payload.put("duration", request.durationSeconds());
            }
            int[] explicit = parseResolution(request.resolution());
            if (explicit != null) {
                payload.put("width", explicit[0]);
                payload.put("height", explicit[1]);
            } else if (request.aspectRatio() != null && !request.aspectRatio().isBlank()) {
                int[] dimensions = DIMENSIONS.getOrDefault(request.aspectRatio(), DEFAULT_DIMENSIONS);
                payload.put("width", dimensions[0]);
                payload.put("height", dimensions[1]);
            }
            if (request.seed() != null) {
                payload.put("seed", request.seed());
            }

            JsonNode response = restClient.post()
                    .uri("/generations")
                    .header(HttpHeaders.AUTHORIZATION, bearer(apiKey))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);

            if (response == null) {
                throw new IllegalStateException("Runway generation response is empty");
            }
            String generationId = ProviderFailures.text(response.path("id"));
            if (generationId == null) {
                throw new IllegalStateException("Runway generation id is missing");
            }
            return GenerationOutcome.processing(generationId, response);
        } catch (Exception ex) {
            return ProviderFailures.toOutcome("", ex, objectMapper, RunwayAdapter::errorMessage);
        }
    }

    @Override
    public GenerationOutcome checkStatus(String apiKey, String remoteJobId) {
        try {
            JsonNode response = restClient.get()
                    .uri("/generations/{generationId}", remoteJobId)
                    .header(HttpHeaders.AUTHORIZATION, bearer(apiKey))
                    .retrieve()
                    .body(JsonNode.class);

            if (response == null) {
                throw new IllegalStateException("Runway generation status is empty");
            }
            String rawStatus = response.path("status").asText("").toLowerCase(Locale.ROOT);
            NormalizedStatus status = STATUSES.getOrDefault(rawStatus, NormalizedStatus.processing);
            return switch (status) {
                case completed -> GenerationOutcome.completed(remoteJobId, outputUrl(response.path("output")), response);
                case failed -> GenerationOutcome.failed(remoteJobId, failureReason(response), null, response);
                case processing -> GenerationOutcome.processing(remoteJobId, response);
            };
        } catch (Exception ex) {
            return ProviderFailures.toOutcome(remoteJobId, ex, objectMapper, RunwayAdapter::errorMessage);
        }
    }

    static String errorMessage(JsonNode body) {
        JsonNode error = body.path("error");
        String text = ProviderFailures.text(error);
        if (text != null) {
            return text;
        }
        return ProviderFailures.text(error.path("message"));
    }

    private String outputUrl(JsonNode output) {
        if (output.isArray()) {
            return output.isEmpty() ? null : ProviderFailures.text(output.get(0));
        }
        return ProviderFailures.text(output.path("url"));
    }

    private String failureReason(JsonNode response) {
        String failure = ProviderFailures.text(response.path("failure"));
        if (failure != null) {
            return failure;
        }
        String error = errorMessage(response);
        return error == null ? "Runway generation failed" : error;
    }

    static int[] parseResolution(String resolution) {
        if (resolution == null || resolution.isBlank()) {
            return null;
        }
        String[] parts = resolution.trim().toLowerCase(Locale.ROOT).split("x");
        if (parts.length != 2) {
            return null;
        }
        try {
            int width = Integer.parseInt(parts[0]);
            int height = Integer.parseInt(parts[1]);
            return width > 0 && height > 0 ? new int[]{width, height} : null;
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private String bearer(String token) {
        return "Bearer " + token;
    }
}
