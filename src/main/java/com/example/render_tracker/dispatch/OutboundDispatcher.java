package com.example.render_tracker.dispatch;

import com.example.render_tracker.model.CompletionDispatch;
import com.example.render_tracker.repository.CompletionDispatchRepository;
import com.example.render_tracker.util.DispatchKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs downstream notifications off the request thread and records each attempt.
 * Nothing here ever throws back to the caller.
 */
@Component
public class OutboundDispatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(OutboundDispatcher.class);

    private final CompletionDispatchRepository repository;
    private final Executor executor;
    private final Clock clock;

    public OutboundDispatcher(CompletionDispatchRepository repository,
                              @Qualifier("dispatchTaskExecutor") Executor executor,
                              Clock clock) {
        this.repository = repository;
        this.executor = executor;
        this.clock = clock;
    }

    public void dispatch(String jobId, DispatchKind kind, Runnable call) {
        UUID dispatchId = record(jobId, kind);
        try {
            executor.execute(() -> run(dispatchId, jobId, kind, call));
        } catch (RejectedExecutionException ex) {
            LOGGER.warn("Dispatch rejected jobId={} kind={} reason={}", jobId, kind, ex.getMessage());
            complete(dispatchId, "rejected: " + ex.getMessage());
        }
    }

    public List<CompletionDispatch> history(String jobId) {
        return repository.findByJobIdOrderByCreatedAtAsc(jobId);
    }

    private void run(UUID dispatchId, String jobId, DispatchKind kind, Runnable call) {
        long start = System.currentTimeMillis();
        try {
            call.run();
            LOGGER.info("Dispatch succeeded jobId={} kind={} ({} ms)", jobId, kind, System.currentTimeMillis() - start);
            complete(dispatchId, null);
        } catch (RuntimeException ex) {
            LOGGER.warn("Dispatch failed jobId={} kind={} error={}", jobId, kind, ex.getMessage(), ex);
            complete(dispatchId, ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());
        }
    }

    private UUID record(String jobId, DispatchKind kind) {
        try {
            return repository.save(new CompletionDispatch(jobId, kind, clock.instant())).getId();
        } catch (RuntimeException ex) {
            LOGGER.error("Could not record dispatch jobId={} kind={}, sending unrecorded", jobId, kind, ex);
            return null;
        }
    }

    private void complete(UUID dispatchId, String error) {
        if (dispatchId == null) {
            return;
        }
        try {
            repository.findById(dispatchId).ifPresent(d -> {
                if (error == null) {
                    d.markSucceeded(clock.instant());
                } else {
                    d.markFailed(error, clock.instant());
                }
                repository.save(d);
            });
        } catch (RuntimeException ex) {
            LOGGER.error("Could not record dispatch outcome id={}", dispatchId, ex);
        }
    }
}
