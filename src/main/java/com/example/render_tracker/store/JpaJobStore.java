package com.example.render_tracker.store;

import com.example.render_tracker.config.StoreProperties;
import com.example.render_tracker.model.BackendMetadata;
import com.example.render_tracker.model.RenderJob;
import com.example.render_tracker.repository.RenderJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * {@link JobStore} on top of JPA. Every call is retried on transient data-access failures.
 */
@Component
public class JpaJobStore implements JobStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(JpaJobStore.class);

    private final RenderJobRepository repository;
    private final StoreProperties properties;
    private final Clock clock;

    public JpaJobStore(RenderJobRepository repository, StoreProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public Optional<JobSnapshot> find(String jobId) {
        return withRetry("find", jobId, () -> repository.findById(jobId)).map(JpaJobStore::toSnapshot);
    }

    @Override
    public boolean markCompleted(String jobId, String outputRef) {
        if (!RenderJob.fitsOutputRef(outputRef)) {
            throw new IllegalArgumentException("Output reference exceeds " + RenderJob.MAX_OUTPUT_REF_LENGTH + " characters");
        }
        int updated = withRetry("markCompleted", jobId,
                () -> repository.markCompleted(jobId, outputRef, clock.instant()));
        LOGGER.debug("markCompleted jobId={} updated={}", jobId, updated);
        return updated > 0;
    }

    @Override
    public boolean markFailed(String jobId, String errorMessage) {
        String clipped = RenderJob.clipErrorMessage(errorMessage);
        int updated = withRetry("markFailed", jobId,
                () -> repository.markFailed(jobId, clipped, clock.instant()));
        LOGGER.debug("markFailed jobId={} updated={}", jobId, updated);
        return updated > 0;
    }

    static JobSnapshot toSnapshot(RenderJob job) {
        BackendMetadata metadata = BackendMetadata.fromStored(
                job.getId(),
                job.getBackend(),
                job.getCorrelationId(),
                job.getSubmittedAt(),
                job.getJobKind(),
                job.isAutoPublish());
        return new JobSnapshot(
                job.getId(),
                job.getStatus(),
                job.getProgress(),
                job.getOutputRef(),
                job.getErrorMessage(),
                metadata,
                job.getCreatedAt(),
                job.getUpdatedAt());
    }

    private <T> T withRetry(String operation, String jobId, Callable<T> action) {
        int maxAttempts = Math.max(1, properties.getMaxAttempts());
        Mono<T> call = Mono.fromCallable(action)
                .retryWhen(Retry.backoff(maxAttempts - 1, properties.getBackoff())
                        .filter(JpaJobStore::isRetryable)
                        .doBeforeRetry(signal -> LOGGER.warn(
                                "Store {} retry attempt={} jobId={} cause={}",
                                operation,
                                signal.totalRetriesInARow() + 2,
                                jobId,
                                signal.failure() == null ? "" : signal.failure().getMessage())));
        try {
            return call.block();
        } catch (RuntimeException ex) {
            if (Exceptions.isRetryExhausted(ex) && ex.getCause() instanceof DataAccessException cause) {
                LOGGER.error("Store {} failed jobId={} attempts={}", operation, jobId, maxAttempts, cause);
                throw cause;
            }
            throw ex;
        }
    }

    private static boolean isRetryable(Throwable throwable) {
        return throwable instanceof TransientDataAccessException
                || throwable instanceof RecoverableDataAccessException;
    }
}
