package app.mediarouter.gateway.provider;

/**
 * @param resolution optional {@code WxH} override of the size derived from the aspect ratio
 */
public record GenerationRequest(
        String model,
        String prompt,
        Integer durationSeconds,
        String aspectRatio,
        Long seed,
        Integer fps,
        String resolution
) {
}
