package app.mediarouter.gateway.service;

import app.mediarouter.gateway.controller.dto.CreateProviderKeyRequest;
import app.mediarouter.gateway.controller.dto.KeyValidationResponse;
import app.mediarouter.gateway.controller.dto.ProviderKeyResponse;
import app.mediarouter.gateway.domain.entity.ProviderCredentialEntity;
import app.mediarouter.gateway.domain.type.CredentialStatus;
import app.mediarouter.gateway.provider.ProviderRegistry;
import app.mediarouter.gateway.provider.VideoProviderAdapter;
import app.mediarouter.gateway.vault.CredentialVault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
public class ProviderCredentialService {

    private static final Logger log = LoggerFactory.getLogger(ProviderCredentialService.class);

    private final CredentialVault credentialVault;
    private final ProviderRegistry providerRegistry;

    public ProviderCredentialService(CredentialVault credentialVault, ProviderRegistry providerRegistry) {
        this.credentialVault = credentialVault;
        this.providerRegistry = providerRegistry;
    }

    /**
     * Checks the key against the provider before storing it.
     */
    public ProviderKeyResponse addKey(CreateProviderKeyRequest request) {
        String provider = ProviderRegistry.normalizeProvider(request.provider());
        VideoProviderAdapter adapter = requireAdapter(provider);
        String secret = request.apiKey().trim();
        if (!adapter.validateKey(secret)) {
            log.info("Provider key rejected provider={}", provider);
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid API key");
        }
        ProviderCredentialEntity saved = credentialVault.addKey(provider, secret, Instant.now());
        return toResponse(saved);
    }

    public List<ProviderKeyResponse> listKeys() {
        return credentialVault.listKeys().stream()
                .map(this::toResponse)
                .toList();
    }

    /**
     * Re-checks a stored key and flips it between active and invalid. Revoked keys stay revoked.
     */
    public KeyValidationResponse validateKey(UUID id) {
        ProviderCredentialEntity credential = requireKey(id);
        if (credential.getStatus() == CredentialStatus.revoked) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Key is revoked");
        }
        VideoProviderAdapter adapter = requireAdapter(credential.getProvider());
        boolean valid = adapter.validateKey(credentialVault.decrypt(credential));
        CredentialStatus status = valid ? CredentialStatus.active : CredentialStatus.invalid;
        credentialVault.updateStatus(id, status);
        return new KeyValidationResponse(valid, status);
    }

    public void revokeKey(UUID id) {
        if (!credentialVault.revokeKey(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Key not found");
        }
        log.info("Provider key revoked id={}", id);
    }

    public void deleteKey(UUID id) {
        if (!credentialVault.deleteKey(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Key not found");
        }
        log.info("Provider key deleted id={}", id);
    }

    private ProviderCredentialEntity requireKey(UUID id) {
        return credentialVault.getKey(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Key not found"));
    }

    private VideoProviderAdapter requireAdapter(String provider) {
        return providerRegistry.find(provider)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown provider: " + provider));
    }

    private ProviderKeyResponse toResponse(ProviderCredentialEntity entity) {
        return new ProviderKeyResponse(
                entity.getId(),
                entity.getProvider(),
                entity.getStatus(),
                credentialVault.preview(entity),
                entity.getLastValidatedAt(),
                entity.getCreatedAt()
        );
    }
}
