package app.mediarouter.gateway.controller.dto;

import app.mediarouter.gateway.domain.type.CredentialStatus;

public record KeyValidationResponse(
        boolean valid,
        CredentialStatus status
) {
}
