package app.mediarouter.gateway.provider;

import java.util.List;
import java.util.Map;

/**
 * One remote video-generation service behind the gateway's common contract.
 * <p>
 * Implementations are stateless and shared between jobs; the decrypted key is passed on every call.
 * {@link #validateKey}, {@link #generateVideo} and {@link #checkStatus} never throw: failures come back
 * as {@code false} or as a failed {@link GenerationOutcome}.
 */
public interface VideoProviderAdapter {

    String name();

    List<String> models();

    ProviderCapabilities supportedFeatures();

    boolean validateKey(String apiKey);

    GenerationOutcome generateVideo(String apiKey, GenerationRequest request);

    GenerationOutcome checkStatus(String apiKey, String remoteJobId);

    /**
     * Headers required to download a completed artifact.
     */
    default Map<String, String> artifactHeaders(String apiKey) {
        return Map.of();
    }
}
