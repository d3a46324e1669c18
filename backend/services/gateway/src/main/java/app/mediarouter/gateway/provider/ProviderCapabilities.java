package app.mediarouter.gateway.provider;

import java.util.List;

public record ProviderCapabilities(
        boolean supportsDuration,
        boolean supportsAspectRatio,
        boolean supportsSeed,
        boolean supportsFps,
        boolean supportsImageToVideo,
        boolean supportsVideoToVideo,
        int maxDurationSeconds,
        List<String> aspectRatios
) {
    public ProviderCapabilities {
        aspectRatios = aspectRatios == null ? List.of() : List.copyOf(aspectRatios);
    }
}
