package app.mediarouter.gateway.repository;

import app.mediarouter.gateway.domain.entity.ProviderCredentialEntity;
import app.mediarouter.gateway.domain.type.CredentialStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ProviderCredentialRepository extends JpaRepository<ProviderCredentialEntity, UUID> {
    List<ProviderCredentialEntity> findByStatusNotOrderByCreatedAtAscIdAsc(CredentialStatus status);

    Optional<ProviderCredentialEntity> findFirstByProviderAndStatusOrderByCreatedAtAscIdAsc(
            String provider,
            CredentialStatus status
    );
}
