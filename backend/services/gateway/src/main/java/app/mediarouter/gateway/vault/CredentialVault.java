package app.mediarouter.gateway.vault;

import app.mediarouter.gateway.domain.entity.ProviderCredentialEntity;
import app.mediarouter.gateway.domain.type.CredentialStatus;
import app.mediarouter.gateway.repository.ProviderCredentialRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
public class CredentialVault {

    private static final Logger log = LoggerFactory.getLogger(CredentialVault.class);
    private static final int PREVIEW_EDGE = 4;

    private final ProviderCredentialRepository credentialRepository;
    private final SecretVault secretVault;

    public CredentialVault(ProviderCredentialRepository credentialRepository, SecretVault secretVault) {
        this.credentialRepository = credentialRepository;
        this.secretVault = secretVault;
    }

    @Transactional
    public ProviderCredentialEntity addKey(String provider, String secret, Instant validatedAt) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("secret is required");
        }
        Instant now = Instant.now();
        ProviderCredentialEntity entity = new ProviderCredentialEntity();
        entity.setId(UUID.randomUUID());
        entity.setProvider(provider);
        entity.setEncryptedSecret(secretVault.encrypt(secret));
        entity.setStatus(CredentialStatus.active);
        entity.setLastValidatedAt(validatedAt);
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        ProviderCredentialEntity saved = credentialRepository.save(entity);
        log.info("Provider credential stored id={} provider={}", saved.getId(), provider);
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<ProviderCredentialEntity> getKey(UUID id) {
        return credentialRepository.findById(id);
    }

    /**
     * First ACTIVE credential of the provider, oldest first with the id as tie-breaker.
     */
    @Transactional(readOnly = true)
    public Optional<ProviderCredentialEntity> getActiveKeyForProvider(String provider) {
        return credentialRepository.findFirstByProviderAndStatusOrderByCreatedAtAscIdAsc(provider, CredentialStatus.active);
    }

    @Transactional(readOnly = true)
    public List<ProviderCredentialEntity> listKeys() {
        return credentialRepository.findByStatusNotOrderByCreatedAtAscIdAsc(CredentialStatus.revoked);
    }

    @Transactional
    public Optional<ProviderCredentialEntity> updateStatus(UUID id, CredentialStatus status) {
        return credentialRepository.findById(id).map(entity -> {
            Instant now = Instant.now();
            entity.setStatus(status);
            entity.setLastValidatedAt(now);
            entity.setUpdatedAt(now);
            log.info("Provider credential status changed id={} provider={} status={}", id, entity.getProvider(), status);
            return credentialRepository.save(entity);
        });
    }

    @Transactional
    public boolean revokeKey(UUID id) {
        return credentialRepository.findById(id).map(entity -> {
            entity.setStatus(CredentialStatus.revoked);
            entity.setUpdatedAt(Instant.now());
            credentialRepository.save(entity);
            return true;
        }).orElse(false);
    }

    @Transactional
    public boolean deleteKey(UUID id) {
        return credentialRepository.findById(id).map(entity -> {
            credentialRepository.delete(entity);
            return true;
        }).orElse(false);
    }

    public ResolvedCredential resolve(ProviderCredentialEntity entity) {
        return new ResolvedCredential(entity.getId(), entity.getProvider(), decrypt(entity));
    }

    public String decrypt(ProviderCredentialEntity entity) {
        return secretVault.decrypt(entity.getEncryptedSecret());
    }

    public String preview(ProviderCredentialEntity entity) {
        return mask(decrypt(entity));
    }

    static String mask(String secret) {
        if (secret == null || secret.length() <= PREVIEW_EDGE * 2) {
            return "****";
        }
        return secret.substring(0, PREVIEW_EDGE) + "..." + secret.substring(secret.length() - PREVIEW_EDGE);
    }
}
