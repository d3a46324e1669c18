package app.mediarouter.gateway.repository;

import app.mediarouter.gateway.domain.entity.VideoGenerationEntity;
import app.mediarouter.gateway.domain.type.GenerationStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface VideoGenerationRepository extends JpaRepository<VideoGenerationEntity, String> {
    Page<VideoGenerationEntity> findByProvider(String provider, Pageable pageable);

    Page<VideoGenerationEntity> findByStatus(GenerationStatus status, Pageable pageable);

    Page<VideoGenerationEntity> findByProviderAndStatus(String provider, GenerationStatus status, Pageable pageable);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select g from VideoGenerationEntity g where g.id = :id")
    Optional<VideoGenerationEntity> findByIdForUpdate(@Param("id") String id);
}
