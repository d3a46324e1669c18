package app.mediarouter.gateway.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

public record CostEstimateRequest(
        @NotBlank String model,
        String provider,
        @PositiveOrZero Double duration,
        String aspectRatio
) {
}
