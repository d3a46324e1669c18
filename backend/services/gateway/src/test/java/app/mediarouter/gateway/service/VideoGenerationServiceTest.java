package app.mediarouter.gateway.service;

import app.mediarouter.gateway.controller.dto.CreateGenerationRequest;
import app.mediarouter.gateway.controller.dto.GenerationResponse;
import app.mediarouter.gateway.domain.entity.ProviderCredentialEntity;
import app.mediarouter.gateway.domain.entity.VideoGenerationEntity;
import app.mediarouter.gateway.domain.type.CredentialStatus;
import app.mediarouter.gateway.domain.type.GenerationStatus;
import app.mediarouter.gateway.provider.GenerationRequest;
import app.mediarouter.gateway.provider.ProviderCapabilities;
import app.mediarouter.gateway.provider.ProviderRegistry;
import app.mediarouter.gateway.provider.VideoProviderAdapter;
import app.mediarouter.gateway.repository.VideoGenerationRepository;
import app.mediarouter.gateway.storage.ArtifactDownloader;
import app.mediarouter.gateway.vault.CredentialVault;
import app.mediarouter.gateway.vault.ResolvedCredential;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class VideoGenerationServiceTest {

    private VideoGenerationRepository repository;
    private CredentialVault credentialVault;
    private GenerationOrchestrator orchestrator;
    private ArtifactDownloader storage;
    private VideoProviderAdapter runway;
    private VideoGenerationService service;

    @BeforeEach
    void setUp() {
        repository = mock(VideoGenerationRepository.class);
        when(repository.save(any(VideoGenerationEntity.class))).thenAnswer(inv -> inv.getArgument(0));
        credentialVault = mock(CredentialVault.class);
        orchestrator = mock(GenerationOrchestrator.class);
        storage = mock(ArtifactDownloader.class);

        runway = mock(VideoProviderAdapter.class);
        when(runway.name()).thenReturn("runway");
        when(runway.models()).thenReturn(List.of("runway-gen3", "runway-gen4"));
        when(runway.supportedFeatures()).thenReturn(
                new ProviderCapabilities(true, true, true, false, true, false, 10, List.of("16:9")));

        service = new VideoGenerationService(
                repository,
                new ProviderRegistry(List.of(runway)),
                credentialVault,
                orchestrator,
                storage,
                new ObjectMapper()
        );
    }

    @Test
    void createQueuesJobAndHandsItToOrchestrator() {
        ProviderCredentialEntity credential = credential();
        ResolvedCredential resolved = new ResolvedCredential(credential.getId(), "runway", "rw-key");
        when(credentialVault.getActiveKeyForProvider("runway")).thenReturn(Optional.of(credential));
        when(credentialVault.resolve(credential)).thenReturn(resolved);

        GenerationResponse response = service.create(
                new CreateGenerationRequest("runway-gen3", "waves at dusk", null, null, null, 7L, null, null));

        assertThat(response.id()).startsWith("gen_").hasSize(16);
        assertThat(response.status()).isEqualTo(GenerationStatus.queued);
        assertThat(response.provider()).isEqualTo("runway");

        ArgumentCaptor<GenerationRequest> captor = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(orchestrator).submitAndTrackJob(eq(response.id()), eq(runway), eq(resolved), captor.capture());
        assertThat(captor.getValue().durationSeconds()).isEqualTo(5);
        assertThat(captor.getValue().aspectRatio()).isEqualTo("16:9");
        assertThat(captor.getValue().seed()).isEqualTo(7L);
    }

    @Test
    void unknownProviderIsRejected() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> service.create(
                new CreateGenerationRequest("runway-gen3", "prompt", "acme", null, null, null, null, null)));

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(ex.getReason()).isEqualTo("Unknown provider: acme");
        verify(repository, never()).save(any());
    }

    @Test
    void explicitProviderMustOfferModel() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> service.create(
                new CreateGenerationRequest("sora-2", "prompt", "Runway", null, null, null, null, null)));

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        verify(orchestrator, never()).submitAndTrackJob(any(), any(), any(), any());
    }

    @Test
    void malformedAspectRatioIsRejected() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> service.create(
                new CreateGenerationRequest("runway-gen4", "prompt", null, 5, "wide", null, null, null)));

        assertThat(ex.getReason()).isEqualTo("Invalid aspect ratio: wide");
    }

    @Test
    void missingActiveKeyIsRejected() {
        when(credentialVault.getActiveKeyForProvider("runway")).thenReturn(Optional.empty());

        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> service.create(
                new CreateGenerationRequest("runway-gen4", "prompt", null, 5, "16:9", null, null, null)));

        assertThat(ex.getReason()).isEqualTo("No active API key found for provider: runway");
        verify(repository, never()).save(any());
    }

    @Test
    void cancelMovesPendingJobToCancelled() {
        VideoGenerationEntity job = job(GenerationStatus.processing);
        when(repository.findByIdForUpdate(job.getId())).thenReturn(Optional.of(job));

        GenerationResponse response = service.cancel(job.getId());

        assertThat(response.status()).isEqualTo(GenerationStatus.cancelled);
        assertThat(job.getCompletedAt()).isNotNull();
    }

    @Test
    void cancelRefusesTerminalJob() {
        VideoGenerationEntity job = job(GenerationStatus.completed);
        when(repository.findByIdForUpdate(job.getId())).thenReturn(Optional.of(job));

        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> service.cancel(job.getId()));

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    void deleteRemovesStoredVideo() {
        VideoGenerationEntity job = job(GenerationStatus.completed);
        job.setVideoPath("/videos/" + job.getId() + ".mp4");
        when(repository.findById(job.getId())).thenReturn(Optional.of(job));

        service.delete(job.getId());

        verify(storage).delete(job.getId() + ".mp4");
        verify(repository).delete(job);
    }

    @Test
    void getUnknownJobIsNotFound() {
        when(repository.findById("gen_missing")).thenReturn(Optional.empty());

        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> service.get("gen_missing"));

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    private ProviderCredentialEntity credential() {
        ProviderCredentialEntity entity = new ProviderCredentialEntity();
        entity.setId(UUID.randomUUID());
        entity.setProvider("runway");
        entity.setStatus(CredentialStatus.active);
        entity.setCreatedAt(Instant.now());
        return entity;
    }

    private VideoGenerationEntity job(GenerationStatus status) {
        VideoGenerationEntity job = new VideoGenerationEntity();
        job.setId("gen_aaaabbbbcccc");
        job.setProvider("runway");
        job.setModel("runway-gen3");
        job.setPrompt("prompt");
        job.setStatus(status);
        job.setCreatedAt(Instant.now());
        return job;
    }
}
