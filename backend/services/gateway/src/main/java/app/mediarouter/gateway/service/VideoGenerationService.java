package app.mediarouter.gateway.service;

import app.mediarouter.gateway.controller.dto.CreateGenerationRequest;
import app.mediarouter.gateway.controller.dto.GenerationResponse;
import app.mediarouter.gateway.domain.entity.ProviderCredentialEntity;
import app.mediarouter.gateway.domain.entity.VideoGenerationEntity;
import app.mediarouter.gateway.domain.type.GenerationStatus;
import app.mediarouter.gateway.provider.GenerationRequest;
import app.mediarouter.gateway.provider.ProviderRegistry;
import app.mediarouter.gateway.provider.VideoProviderAdapter;
import app.mediarouter.gateway.repository.OffsetLimitRequest;
import app.mediarouter.gateway.repository.VideoGenerationRepository;
import app.mediarouter.gateway.storage.ArtifactDownloader;
import app.mediarouter.gateway.storage.LocalVideoStorage;
import app.mediarouter.gateway.vault.CredentialVault;
import app.mediarouter.gateway.vault.ResolvedCredential;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

@Service
public class VideoGenerationService {

    private static final Logger log = LoggerFactory.getLogger(VideoGenerationService.class);

    static final int DEFAULT_DURATION_SECONDS = 5;
    static final String DEFAULT_ASPECT_RATIO = "16:9";
    private static final Pattern ASPECT_RATIO = Pattern.compile("^\\d+:\\d+$");
    private static final int MAX_LIMIT = 100;
    private static final String ID_PREFIX = "gen_";

    private final VideoGenerationRepository generationRepository;
    private final ProviderRegistry providerRegistry;
    private final CredentialVault credentialVault;
    private final GenerationOrchestrator orchestrator;
    private final ArtifactDownloader artifactStorage;
    private final ObjectMapper objectMapper;

    public VideoGenerationService(VideoGenerationRepository generationRepository,
                                  ProviderRegistry providerRegistry,
                                  CredentialVault credentialVault,
                                  GenerationOrchestrator orchestrator,
                                  ArtifactDownloader artifactStorage,
                                  ObjectMapper objectMapper) {
        this.generationRepository = generationRepository;
        this.providerRegistry = providerRegistry;
        this.credentialVault = credentialVault;
        this.orchestrator = orchestrator;
        this.artifactStorage = artifactStorage;
        this.objectMapper = objectMapper;
    }

    /**
     * Validates the request, persists a QUEUED job and hands it to the orchestrator.
     * Not transactional: the row must be committed before the worker picks it up.
     */
    public GenerationResponse create(CreateGenerationRequest request) {
        boolean explicitProvider = request.provider() != null && !request.provider().isBlank();
        String provider = explicitProvider
                ? ProviderRegistry.normalizeProvider(request.provider())
                : ProviderRegistry.providerForModel(request.model());
        VideoProviderAdapter adapter = providerRegistry.find(provider)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown provider: " + provider));
        if (explicitProvider && !adapter.models().contains(request.model())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Model " + request.model() + " is not offered by provider: " + provider);
        }

        int duration = request.duration() == null ? DEFAULT_DURATION_SECONDS : request.duration();
        int maxDuration = adapter.supportedFeatures().maxDurationSeconds();
        if (duration > maxDuration) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Duration exceeds provider maximum of " + maxDuration + " seconds");
        }
        String aspectRatio = request.aspectRatio() == null || request.aspectRatio().isBlank()
                ? DEFAULT_ASPECT_RATIO
                : request.aspectRatio().trim();
        if (!ASPECT_RATIO.matcher(aspectRatio).matches()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid aspect ratio: " + aspectRatio);
        }

        ProviderCredentialEntity credential = credentialVault.getActiveKeyForProvider(provider)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST,
                        "No active API key found for provider: " + provider));
        ResolvedCredential resolved = credentialVault.resolve(credential);

        ObjectNode params = objectMapper.createObjectNode();
        params.put("duration", duration);
        params.put("aspectRatio", aspectRatio);
        if (request.seed() != null) {
            params.put("seed", request.seed());
        }
        if (request.fps() != null) {
            params.put("fps", request.fps());
        }
        if (request.resolution() != null) {
            params.put("resolution", request.resolution());
        }

        Instant now = Instant.now();
        VideoGenerationEntity job = new VideoGenerationEntity();
        job.setId(newId());
        job.setProvider(provider);
        job.setModel(request.model());
        job.setPrompt(request.prompt());
        job.setParamsJson(params);
        job.setStatus(GenerationStatus.queued);
        job.setDurationSeconds((double) duration);
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        VideoGenerationEntity saved = generationRepository.save(job);

        GenerationRequest generationRequest = new GenerationRequest(
                request.model(),
                request.prompt(),
                duration,
                aspectRatio,
                request.seed(),
                request.fps(),
                request.resolution()
        );
        orchestrator.submitAndTrackJob(saved.getId(), adapter, resolved, generationRequest);
        log.info("Generation queued jobId={} provider={} model={} credentialId={}",
                saved.getId(), provider, request.model(), credential.getId());
        return toResponse(saved);
    }

    @Transactional(readOnly = true)
    public GenerationResponse get(String id) {
        return toResponse(requireGeneration(id));
    }

    @Transactional(readOnly = true)
    public List<GenerationResponse> list(String provider, String status, int skip, int limit) {
        int safeLimit = Math.min(Math.max(limit, 1), MAX_LIMIT);
        Pageable page = new OffsetLimitRequest(Math.max(skip, 0), safeLimit,
                Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id")));
        String providerFilter = provider == null || provider.isBlank() ? null : ProviderRegistry.normalizeProvider(provider);
        GenerationStatus statusFilter = parseStatus(status);

        if (providerFilter != null && statusFilter != null) {
            return toResponses(generationRepository.findByProviderAndStatus(providerFilter, statusFilter, page).getContent());
        }
        if (providerFilter != null) {
            return toResponses(generationRepository.findByProvider(providerFilter, page).getContent());
        }
        if (statusFilter != null) {
            return toResponses(generationRepository.findByStatus(statusFilter, page).getContent());
        }
        return toResponses(generationRepository.findAll(page).getContent());
    }

    @Transactional
    public void delete(String id) {
        VideoGenerationEntity job = requireGeneration(id);
        if (job.getVideoPath() != null) {
            artifactStorage.delete(LocalVideoStorage.fileNameOf(job.getVideoPath()));
        }
        generationRepository.delete(job);
        log.info("Generation deleted jobId={}", id);
    }

    /**
     * Moves a non-terminal job to CANCELLED. The worker notices before its next poll.
     */
    @Transactional
    public GenerationResponse cancel(String id) {
        VideoGenerationEntity job = generationRepository.findByIdForUpdate(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Generation not found"));
        if (job.isTerminal()) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Generation already " + job.getStatus());
        }
        Instant now = Instant.now();
        job.setStatus(GenerationStatus.cancelled);
        job.setCompletedAt(now);
        job.setUpdatedAt(now);
        log.info("Generation cancelled jobId={}", id);
        return toResponse(generationRepository.save(job));
    }

    private VideoGenerationEntity requireGeneration(String id) {
        return generationRepository.findById(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Generation not found"));
    }

    private GenerationStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return GenerationStatus.valueOf(status.trim().toLowerCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown status: " + status);
        }
    }

    private List<GenerationResponse> toResponses(List<VideoGenerationEntity> jobs) {
        return jobs.stream().map(this::toResponse).toList();
    }

    private GenerationResponse toResponse(VideoGenerationEntity job) {
        GenerationResponse.Video video = job.getStatus() == GenerationStatus.completed
                ? new GenerationResponse.Video(job.getVideoUrl(), job.getDurationSeconds(), job.getWidth(), job.getHeight())
                : null;
        GenerationResponse.Usage usage = job.getCost() == null && job.getGenerationTimeSeconds() == null
                ? null
                : new GenerationResponse.Usage(job.getCost(), job.getGenerationTimeSeconds());
        return new GenerationResponse(
                job.getId(),
                GenerationResponse.OBJECT,
                job.getModel(),
                job.getProvider(),
                job.getStatus(),
                job.getPrompt(),
                video,
                usage,
                job.getErrorMessage(),
                job.getCreatedAt(),
                job.getStartedAt(),
                job.getCompletedAt()
        );
    }

    private static String newId() {
        return ID_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
