package app.mediarouter.gateway.controller.dto;

import app.mediarouter.gateway.domain.type.CredentialStatus;

import java.time.Instant;
import java.util.UUID;

public record ProviderKeyResponse(
        UUID id,
        String provider,
        CredentialStatus status,
        String keyPreview,
        Instant lastValidatedAt,
        Instant createdAt
) {
}
