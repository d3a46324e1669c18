package app.mediarouter.gateway.controller.dto;

import app.mediarouter.gateway.domain.type.CredentialStatus;
import app.mediarouter.gateway.provider.ProviderCapabilities;

import java.util.List;

public record ProviderInfoResponse(
        String name,
        String displayName,
        List<String> models,
        ProviderCapabilities features,
        boolean hasKey,
        CredentialStatus keyStatus
) {
}
