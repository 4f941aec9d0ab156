package com.example.render_tracker.repository;

import com.example.render_tracker.model.CompletionDispatch;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface CompletionDispatchRepository extends JpaRepository<CompletionDispatch, UUID> {
    List<CompletionDispatch> findByJobIdOrderByCreatedAtAsc(String jobId);
}
