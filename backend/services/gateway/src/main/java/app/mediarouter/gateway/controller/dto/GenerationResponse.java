package app.mediarouter.gateway.controller.dto;

import app.mediarouter.gateway.domain.type.GenerationStatus;

import java.math.BigDecimal;
import java.time.Instant;

public record GenerationResponse(
        String id,
        String object,
        String model,
        String provider,
        GenerationStatus status,
        String prompt,
        Video video,
        Usage usage,
        String error,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt
) {
    public static final String OBJECT = "video.generation";

    public record Video(
            String url,
            Double duration,
            Integer width,
            Integer height
    ) {
    }

    public record Usage(
            BigDecimal cost,
            Double timeSeconds
    ) {
    }
}
