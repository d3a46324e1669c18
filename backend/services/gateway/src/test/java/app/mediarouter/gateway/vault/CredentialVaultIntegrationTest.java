package app.mediarouter.gateway.vault;

import app.mediarouter.gateway.domain.entity.ProviderCredentialEntity;
import app.mediarouter.gateway.domain.type.CredentialStatus;
import app.mediarouter.gateway.repository.ProviderCredentialRepository;
import app.mediarouter.gateway.support.PostgresIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class CredentialVaultIntegrationTest extends PostgresIntegrationTest {

    @Autowired
    private CredentialVault credentialVault;

    @Autowired
    private ProviderCredentialRepository credentialRepository;

    @BeforeEach
    void cleanUp() {
        credentialRepository.deleteAll();
    }

    @Test
    void activeKeySelectionSkipsInvalidAndRevoked() {
        ProviderCredentialEntity invalid = credentialVault.addKey("runway", "rw-invalid-0001", Instant.now());
        ProviderCredentialEntity revoked = credentialVault.addKey("runway", "rw-revoked-0002", Instant.now());
        ProviderCredentialEntity active = credentialVault.addKey("runway", "rw-active-00003", Instant.now());
        credentialVault.updateStatus(invalid.getId(), CredentialStatus.invalid);
        credentialVault.revokeKey(revoked.getId());

        Optional<ProviderCredentialEntity> selected = credentialVault.getActiveKeyForProvider("runway");

        assertThat(selected).map(ProviderCredentialEntity::getId).contains(active.getId());
        assertThat(credentialVault.decrypt(selected.orElseThrow())).isEqualTo("rw-active-00003");
        assertThat(credentialVault.getActiveKeyForProvider("kling")).isEmpty();
    }

    @Test
    void oldestActiveKeyWins() throws InterruptedException {
        ProviderCredentialEntity first = credentialVault.addKey("openai", "sk-first-000001", Instant.now());
        Thread.sleep(5);
        credentialVault.addKey("openai", "sk-second-00002", Instant.now());

        assertThat(credentialVault.getActiveKeyForProvider("openai"))
                .map(ProviderCredentialEntity::getId)
                .contains(first.getId());
    }

    @Test
    void listingHidesRevokedKeys() {
        ProviderCredentialEntity kept = credentialVault.addKey("kling", "kl-kept-0000001", Instant.now());
        ProviderCredentialEntity revoked = credentialVault.addKey("kling", "kl-gone-0000002", Instant.now());
        credentialVault.revokeKey(revoked.getId());

        assertThat(credentialVault.listKeys()).extracting(ProviderCredentialEntity::getId).containsExactly(kept.getId());
        assertThat(credentialVault.deleteKey(kept.getId())).isTrue();
        assertThat(credentialVault.getKey(kept.getId())).isEmpty();
    }
}
