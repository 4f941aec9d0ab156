package com.example.render_tracker.service;

import com.example.render_tracker.dispatch.AutoPublishClient;
import com.example.render_tracker.dispatch.OutboundDispatcher;
import com.example.render_tracker.dispatch.SessionStageClient;
import com.example.render_tracker.store.JobSnapshot;
import com.example.render_tracker.util.DispatchKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Side effects of a terminal transition. Callers must only invoke this from the path that
 * actually performed the transition; the store's conditional write guarantees there is one.
 */
@Service
public class CompletionTrigger {
    private static final Logger LOGGER = LoggerFactory.getLogger(CompletionTrigger.class);

    private final OutboundDispatcher dispatcher;
    private final AutoPublishClient autoPublishClient;
    private final SessionStageClient sessionStageClient;

    public CompletionTrigger(OutboundDispatcher dispatcher,
                             AutoPublishClient autoPublishClient,
                             SessionStageClient sessionStageClient) {
        this.dispatcher = dispatcher;
        this.autoPublishClient = autoPublishClient;
        this.sessionStageClient = sessionStageClient;
    }

    public void onCompleted(JobSnapshot job) {
        try {
            notifySession(job.id(), true);
            if (job.metadata().autoPublish()) {
                LOGGER.info("Auto-publish requested jobId={}", job.id());
                dispatcher.dispatch(job.id(), DispatchKind.AUTO_PUBLISH,
                        () -> autoPublishClient.requestAutoSchedule(job.id()));
            }
        } catch (RuntimeException ex) {
            LOGGER.error("Completion trigger failed jobId={}", job.id(), ex);
        }
    }

    public void onFailed(JobSnapshot job) {
        try {
            notifySession(job.id(), false);
        } catch (RuntimeException ex) {
            LOGGER.error("Failure trigger failed jobId={}", job.id(), ex);
        }
    }

    private void notifySession(String jobId, boolean success) {
        if (!sessionStageClient.isEnabled()) {
            return;
        }
        dispatcher.dispatch(jobId, DispatchKind.SESSION_STAGE,
                () -> sessionStageClient.renderFinished(jobId, success));
    }
}
