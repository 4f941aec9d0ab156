package com.example.render_tracker.controller;

import com.example.render_tracker.dto.CallbackRequest;
import com.example.render_tracker.dto.CallbackResponse;
import com.example.render_tracker.service.CallbackIngestor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives completion notices from render backends. Authenticated by the shared secret in the body.
 */
@RestController
@RequestMapping("/v1/jobs")
public class RenderCallbackController {
    private final CallbackIngestor callbackIngestor;

    public RenderCallbackController(CallbackIngestor callbackIngestor) {
        this.callbackIngestor = callbackIngestor;
    }

    @Operation(summary = "Apply a render backend completion notice")
    @ApiResponse(responseCode = "200", description = "Applied, or skipped because the job already finished")
    @ApiResponse(responseCode = "400", description = "Missing or invalid job_id/status")
    @ApiResponse(responseCode = "401", description = "Invalid or missing callback secret, including an empty body")
    @ApiResponse(responseCode = "404", description = "Unknown job")
    @PostMapping("/callback")
    public CallbackResponse callback(@RequestBody(required = false) CallbackRequest request) {
        return callbackIngestor.ingest(request);
    }
}
