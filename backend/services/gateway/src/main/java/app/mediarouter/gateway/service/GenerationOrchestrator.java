package app.mediarouter.gateway.service;

import app.mediarouter.gateway.domain.entity.VideoGenerationEntity;
import app.mediarouter.gateway.domain.type.CredentialStatus;
import app.mediarouter.gateway.domain.type.GenerationStatus;
import app.mediarouter.gateway.pricing.CostEstimator;
import app.mediarouter.gateway.provider.GenerationOutcome;
import app.mediarouter.gateway.provider.GenerationRequest;
import app.mediarouter.gateway.provider.VideoProviderAdapter;
import app.mediarouter.gateway.repository.VideoGenerationRepository;
import app.mediarouter.gateway.storage.ArtifactDownloader;
import app.mediarouter.gateway.vault.CredentialVault;
import app.mediarouter.gateway.vault.ResolvedCredential;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Drives one generation job from submission to a terminal state.
 * <p>
 * Submission and each status check run as separate tasks on a scheduled pool, so a job waiting between checks
 * holds no thread. The tasks of a job are the only writer of its row apart from an external cancel, and every
 * write re-reads the row under a lock and leaves terminal jobs untouched.
 */
@Service
public class GenerationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GenerationOrchestrator.class);

    static final String TIMEOUT_MESSAGE = "Generation timeout";
    static final String UNAVAILABLE_MESSAGE = "Generation worker unavailable";

    private final VideoGenerationRepository generationRepository;
    private final ArtifactDownloader artifactDownloader;
    private final CostEstimator costEstimator;
    private final CredentialVault credentialVault;
    private final TransactionTemplate transactionTemplate;
    private final int maxPollAttempts;
    private final long pollIntervalMs;
    private final boolean syncCredentialStatus;
    private final ScheduledExecutorService scheduler;

    public GenerationOrchestrator(VideoGenerationRepository generationRepository,
                                  ArtifactDownloader artifactDownloader,
                                  CostEstimator costEstimator,
                                  CredentialVault credentialVault,
                                  PlatformTransactionManager transactionManager,
                                  @Value("${app.gateway.generation.max-poll-attempts:60}") int maxPollAttempts,
                                  @Value("${app.gateway.generation.poll-interval-ms:5000}") long pollIntervalMs,
                                  @Value("${app.gateway.generation.worker-threads:4}") int workerThreads,
                                  @Value("${app.gateway.generation.sync-credential-status:true}") boolean syncCredentialStatus) {
        this.generationRepository = generationRepository;
        this.artifactDownloader = artifactDownloader;
        this.costEstimator = costEstimator;
        this.credentialVault = credentialVault;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.maxPollAttempts = Math.max(maxPollAttempts, 1);
        this.pollIntervalMs = Math.max(pollIntervalMs, 0);
        this.syncCredentialStatus = syncCredentialStatus;
        this.scheduler = Executors.newScheduledThreadPool(
                Math.max(workerThreads, 1),
                new CustomizableThreadFactory("video-generation-")
        );
    }

    /**
     * Schedules the job and returns immediately. Results are only visible through the job row.
     */
    public void submitAndTrackJob(String jobId,
                                  VideoProviderAdapter adapter,
                                  ResolvedCredential credential,
                                  GenerationRequest request) {
        try {
            scheduler.execute(() -> submit(jobId, adapter, credential, request));
        } catch (RejectedExecutionException ex) {
            log.warn("Generation executor rejected jobId={}", jobId);
            markFailed(jobId, UNAVAILABLE_MESSAGE);
        }
    }

    private void submit(String jobId, VideoProviderAdapter adapter, ResolvedCredential credential, GenerationRequest request) {
        Instant startedAt = Instant.now();
        try {
            boolean picked = updateJob(jobId, job -> {
                job.setStatus(GenerationStatus.processing);
                job.setStartedAt(startedAt);
            });
            if (!picked) {
                log.info("Generation skipped jobId={} reason=not_pending", jobId);
                return;
            }

            GenerationOutcome submitted = adapter.generateVideo(credential.secret(), request);
            if (submitted.isFailed()) {
                log.warn("Generation submit failed jobId={} provider={} httpStatus={} error={}",
                        jobId, adapter.name(), submitted.httpStatus(), trim(submitted.error()));
                markFailed(jobId, submitted.error());
                syncCredential(credential, submitted);
                return;
            }
            String remoteJobId = submitted.remoteJobId();
            if (!updateJob(jobId, job -> job.setProviderJobId(remoteJobId))) {
                log.info("Generation tracking stopped jobId={} attempt=0", jobId);
                return;
            }
            log.info("Generation submitted jobId={} provider={} remoteJobId={}", jobId, adapter.name(), remoteJobId);

            TrackedJob tracked = new TrackedJob(jobId, remoteJobId, adapter, credential, request, startedAt);
            if (submitted.isCompleted()) {
                markCompleted(tracked, submitted);
                return;
            }
            schedulePoll(tracked, 1);
        } catch (Exception ex) {
            fail(jobId, ex);
        }
    }

    private void schedulePoll(TrackedJob tracked, int attempt) {
        try {
            scheduler.schedule(() -> poll(tracked, attempt), pollIntervalMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException ex) {
            log.warn("Generation poll rejected jobId={} attempt={}", tracked.jobId(), attempt);
            markFailed(tracked.jobId(), UNAVAILABLE_MESSAGE);
        }
    }

    private void poll(TrackedJob tracked, int attempt) {
        String jobId = tracked.jobId();
        VideoProviderAdapter adapter = tracked.adapter();
        try {
            if (isStopped(jobId)) {
                log.info("Generation tracking stopped jobId={} attempt={}", jobId, attempt);
                return;
            }
            GenerationOutcome outcome = adapter.checkStatus(tracked.credential().secret(), tracked.remoteJobId());
            if (outcome.isCompleted()) {
                markCompleted(tracked, outcome);
                return;
            }
            if (outcome.isFailed()) {
                log.warn("Generation failed jobId={} provider={} attempt={} error={}",
                        jobId, adapter.name(), attempt, trim(outcome.error()));
                markFailed(jobId, outcome.error());
                syncCredential(tracked.credential(), outcome);
                return;
            }
            if (attempt >= maxPollAttempts) {
                log.warn("Generation timed out jobId={} provider={} attempts={}", jobId, adapter.name(), maxPollAttempts);
                markFailed(jobId, TIMEOUT_MESSAGE);
                return;
            }
            schedulePoll(tracked, attempt + 1);
        } catch (Exception ex) {
            fail(jobId, ex);
        }
    }

    private void fail(String jobId, Exception ex) {
        log.warn("Generation task failed jobId={} errorType={} message={}",
                jobId, ex.getClass().getSimpleName(), safeMessage(ex));
        markFailed(jobId, failureText(ex));
    }

    private void markCompleted(TrackedJob tracked, GenerationOutcome outcome) {
        String jobId = tracked.jobId();
        VideoProviderAdapter adapter = tracked.adapter();
        GenerationRequest request = tracked.request();
        String storedLocation = null;
        String publicUrl = null;
        if (outcome.videoUrl() != null && !outcome.videoUrl().isBlank()) {
            storedLocation = artifactDownloader.download(
                    outcome.videoUrl(),
                    jobId + ".mp4",
                    adapter.artifactHeaders(tracked.credential().secret())
            );
            publicUrl = artifactDownloader.publicUrl(storedLocation);
        } else {
            log.warn("Generation completed without artifact jobId={} provider={}", jobId, adapter.name());
        }

        double requestedDuration = request.durationSeconds() == null ? 0 : request.durationSeconds();
        GenerationMetadataReader.VideoDimensions dimensions =
                GenerationMetadataReader.read(outcome.metadata(), requestedDuration);
        BigDecimal cost = costEstimator.calculateCost(
                adapter.name(),
                request.model(),
                dimensions.durationSeconds(),
                dimensions.resolution()
        );
        Instant completedAt = Instant.now();
        double generationSeconds = Duration.between(tracked.startedAt(), completedAt).toMillis() / 1000.0;

        String location = storedLocation;
        String url = publicUrl;
        boolean written = updateJob(jobId, job -> {
            job.setStatus(GenerationStatus.completed);
            job.setVideoPath(location);
            job.setVideoUrl(url);
            job.setWidth(dimensions.width());
            job.setHeight(dimensions.height());
            job.setDurationSeconds(dimensions.durationSeconds());
            job.setCost(cost);
            job.setGenerationTimeSeconds(generationSeconds);
            job.setCompletedAt(completedAt);
            job.setErrorMessage(null);
        });
        if (written) {
            log.info("Generation completed jobId={} provider={} cost={} seconds={}",
                    jobId, adapter.name(), cost, generationSeconds);
        } else if (storedLocation != null) {
            artifactDownloader.delete(jobId + ".mp4");
        }
    }

    private void markFailed(String jobId, String error) {
        String message = error == null || error.isBlank() ? "Generation failed" : error;
        try {
            updateJob(jobId, job -> {
                job.setStatus(GenerationStatus.failed);
                job.setErrorMessage(message);
                job.setCompletedAt(Instant.now());
            });
        } catch (RuntimeException ex) {
            log.error("Generation failure could not be recorded jobId={} message={}", jobId, safeMessage(ex));
        }
    }

    /**
     * Applies {@code change} to the locked row unless the job is already terminal.
     *
     * @return whether the change was written
     */
    boolean updateJob(String jobId, Consumer<VideoGenerationEntity> change) {
        Boolean written = transactionTemplate.execute(status -> generationRepository.findByIdForUpdate(jobId)
                .filter(job -> !job.isTerminal())
                .map(job -> {
                    change.accept(job);
                    job.setUpdatedAt(Instant.now());
                    generationRepository.save(job);
                    return true;
                })
                .orElse(false));
        return Boolean.TRUE.equals(written);
    }

    private boolean isStopped(String jobId) {
        return generationRepository.findById(jobId)
                .map(VideoGenerationEntity::isTerminal)
                .orElse(true);
    }

    private void syncCredential(ResolvedCredential credential, GenerationOutcome outcome) {
        if (!syncCredentialStatus || outcome.httpStatus() == null || credential.credentialId() == null) {
            return;
        }
        CredentialStatus status = switch (outcome.httpStatus()) {
            case 401, 403 -> CredentialStatus.invalid;
            case 429 -> CredentialStatus.quota_exceeded;
            default -> null;
        };
        if (status != null) {
            credentialVault.updateStatus(credential.credentialId(), status);
        }
    }

    private static String failureText(Exception ex) {
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }

    private static String trim(String message) {
        if (message == null) {
            return "";
        }
        String trimmed = message.replaceAll("[\\r\\n]+", " ").trim();
        int max = 200;
        return trimmed.length() <= max ? trimmed : trimmed.substring(0, max) + "...";
    }

    private static String safeMessage(Exception ex) {
        return ex == null ? "" : trim(ex.getMessage());
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }

    private record TrackedJob(
            String jobId,
            String remoteJobId,
            VideoProviderAdapter adapter,
            ResolvedCredential credential,
            GenerationRequest request,
            Instant startedAt
    ) {
    }
}
