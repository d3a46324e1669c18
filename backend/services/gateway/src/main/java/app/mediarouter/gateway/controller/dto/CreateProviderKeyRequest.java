package app.mediarouter.gateway.controller.dto;

import jakarta.validation.constraints.NotBlank;

public record CreateProviderKeyRequest(
        @NotBlank String provider,
        @NotBlank String apiKey
) {
    @Override
    public String toString() {
        return "CreateProviderKeyRequest[provider=" + provider + "]";
    }
}
