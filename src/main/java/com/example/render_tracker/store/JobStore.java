package com.example.render_tracker.store;

import com.example.render_tracker.exception.JobNotFoundException;

import java.util.Optional;

/**
 * Persistent record of render jobs. Writes are conditional on the job not being terminal;
 * there is no other locking.
 */
public interface JobStore {

    Optional<JobSnapshot> find(String jobId);

    default JobSnapshot get(String jobId) {
        return find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * Sets COMPLETED, progress 100 and the output reference if the job is not terminal yet.
     *
     * @return true only for the call that performed the transition
     */
    boolean markCompleted(String jobId, String outputRef);

    /**
     * Sets FAILED with the given reason if the job is not terminal yet.
     *
     * @return true only for the call that performed the transition
     */
    boolean markFailed(String jobId, String errorMessage);
}
