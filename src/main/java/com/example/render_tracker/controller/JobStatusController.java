package com.example.render_tracker.controller;

import com.example.render_tracker.dispatch.OutboundDispatcher;
import com.example.render_tracker.dto.DispatchResponse;
import com.example.render_tracker.dto.JobStatusResponse;
import com.example.render_tracker.service.StatusReconciler;
import com.example.render_tracker.store.JobStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1/jobs")
public class JobStatusController {
    private final StatusReconciler statusReconciler;
    private final JobStore jobStore;
    private final OutboundDispatcher dispatcher;

    public JobStatusController(StatusReconciler statusReconciler, JobStore jobStore, OutboundDispatcher dispatcher) {
        this.statusReconciler = statusReconciler;
        this.jobStore = jobStore;
        this.dispatcher = dispatcher;
    }

    @Operation(summary = "Current status of a render job, refreshed from its render backend while running")
    @ApiResponse(responseCode = "200", description = "Job status")
    @ApiResponse(responseCode = "401", description = "Missing or invalid bearer token")
    @ApiResponse(responseCode = "404", description = "Unknown job")
    @GetMapping("/{id}/status")
    public JobStatusResponse status(@PathVariable("id") String id) {
        return statusReconciler.reconcile(id);
    }

    @Operation(summary = "Downstream notifications sent for a render job")
    @ApiResponse(responseCode = "200", description = "Recorded dispatches, oldest first")
    @ApiResponse(responseCode = "404", description = "Unknown job")
    @GetMapping("/{id}/dispatches")
    public List<DispatchResponse> dispatches(@PathVariable("id") String id) {
        jobStore.get(id);
        return dispatcher.history(id).stream().map(DispatchResponse::from).toList();
    }
}
