package com.example.render_tracker.repository;

import com.example.render_tracker.model.RenderJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

public interface RenderJobRepository extends JpaRepository<RenderJob, String> {
    /**
     * Moves a non-terminal job to COMPLETED.
     *
     * @return 1 when this statement performed the transition, 0 when the job was already terminal or absent
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        update RenderJob j
           set j.status = com.example.render_tracker.util.JobStatus.COMPLETED,
               j.progress = 100,
               j.outputRef = :outputRef,
               j.errorMessage = null,
               j.updatedAt = :now,
               j.version = j.version + 1
         where j.id = :id
           and j.status in (com.example.render_tracker.util.JobStatus.PENDING,
                            com.example.render_tracker.util.JobStatus.PROCESSING)
        """)
    int markCompleted(@Param("id") String id, @Param("outputRef") String outputRef, @Param("now") Instant now);

    /**
     * Moves a non-terminal job to FAILED.
     *
     * @return 1 when this statement performed the transition, 0 otherwise
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
        update RenderJob j
           set j.status = com.example.render_tracker.util.JobStatus.FAILED,
               j.progress = 0,
               j.outputRef = null,
               j.errorMessage = :errorMessage,
               j.updatedAt = :now,
               j.version = j.version + 1
         where j.id = :id
           and j.status in (com.example.render_tracker.util.JobStatus.PENDING,
                            com.example.render_tracker.util.JobStatus.PROCESSING)
        """)
    int markFailed(@Param("id") String id, @Param("errorMessage") String errorMessage, @Param("now") Instant now);
}
