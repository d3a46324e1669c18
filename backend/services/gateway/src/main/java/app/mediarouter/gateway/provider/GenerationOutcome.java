package app.mediarouter.gateway.provider;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Provider-agnostic view of one submission or status call.
 *
 * @param httpStatus status code of the rejected call when the provider answered with an HTTP error
 */
public record GenerationOutcome(
        String remoteJobId,
        NormalizedStatus status,
        String videoUrl,
        String error,
        Integer httpStatus,
        JsonNode metadata
) {
    public static GenerationOutcome processing(String remoteJobId, JsonNode metadata) {
        return new GenerationOutcome(remoteJobId, NormalizedStatus.processing, null, null, null, metadata);
    }

    public static GenerationOutcome completed(String remoteJobId, String videoUrl, JsonNode metadata) {
        return new GenerationOutcome(remoteJobId, NormalizedStatus.completed, videoUrl, null, null, metadata);
    }

    public static GenerationOutcome failed(String remoteJobId, String error, Integer httpStatus, JsonNode metadata) {
        return new GenerationOutcome(remoteJobId, NormalizedStatus.failed, null, error, httpStatus, metadata);
    }

    public boolean isCompleted() {
        return status == NormalizedStatus.completed;
    }

    public boolean isFailed() {
        return status == NormalizedStatus.failed;
    }
}
