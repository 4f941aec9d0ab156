package com.example.render_tracker.backend;

import com.example.render_tracker.config.RenderBackendProperties;
import com.example.render_tracker.util.RenderBackend;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * GPU render server. Jobs pass through a provisioning phase before rendering starts.
 */
@Component
public class GpuRenderBackendClient extends AbstractRenderBackendClient {
    private static final Map<String, CanonicalStatus> VOCABULARY = Map.of(
            "queued", CanonicalStatus.QUEUED,
            "provisioning", CanonicalStatus.PROCESSING,
            "processing", CanonicalStatus.PROCESSING,
            "uploading", CanonicalStatus.PROCESSING,
            "completed", CanonicalStatus.COMPLETED,
            "failed", CanonicalStatus.FAILED,
            "error", CanonicalStatus.ERROR
    );

    @Autowired
    public GpuRenderBackendClient(@Qualifier("gpuWebClient") WebClient client,
                                  RenderBackendProperties props) {
        this(client, props.getGpu().getTimeout());
    }

    GpuRenderBackendClient(WebClient client, Duration timeout) {
        super(client, timeout);
    }

    @Override
    public RenderBackend backend() {
        return RenderBackend.GPU;
    }

    @Override
    protected String statusPath() {
        return "/api/v1/ai/job/{id}/status";
    }

    @Override
    protected BackendStatus parse(JsonNode body, String correlationId) {
        String jobId = text(body, "job_id");
        return BackendStatus.of(
                mapStatus(VOCABULARY, text(body, "status")),
                text(body, "output_url"),
                text(body, "error"),
                jobId == null ? correlationId : jobId);
    }
}
