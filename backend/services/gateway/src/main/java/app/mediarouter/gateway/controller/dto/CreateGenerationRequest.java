package app.mediarouter.gateway.controller.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record CreateGenerationRequest(
        @NotBlank String model,
        @NotBlank @Size(max = 4000) String prompt,
        String provider,
        @Min(1) @Max(60) Integer duration,
        String aspectRatio,
        Long seed,
        @Positive Integer fps,
        @Pattern(regexp = "^\\d+x\\d+$") String resolution
) {
}
