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
 * Compose engine running next to the service, used in development.
 */
@Component
public class LocalRenderBackendClient extends AbstractRenderBackendClient {
    private static final Map<String, CanonicalStatus> VOCABULARY = Map.of(
            "queued", CanonicalStatus.QUEUED,
            "processing", CanonicalStatus.PROCESSING,
            "completed", CanonicalStatus.COMPLETED,
            "failed", CanonicalStatus.FAILED
    );

    @Autowired
    public LocalRenderBackendClient(@Qualifier("localWebClient") WebClient client,
                                    RenderBackendProperties props) {
        this(client, props.getLocal().getTimeout());
    }

    LocalRenderBackendClient(WebClient client, Duration timeout) {
        super(client, timeout);
    }

    @Override
    public RenderBackend backend() {
        return RenderBackend.LOCAL;
    }

    @Override
    protected String statusPath() {
        return "/job/{id}/status";
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
