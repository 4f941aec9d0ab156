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
 * Serverless function backend. Results are nested under {@code result}.
 */
@Component
public class ServerlessRenderBackendClient extends AbstractRenderBackendClient {
    private static final Map<String, CanonicalStatus> VOCABULARY = Map.of(
            "pending", CanonicalStatus.QUEUED,
            "queued", CanonicalStatus.QUEUED,
            "running", CanonicalStatus.PROCESSING,
            "processing", CanonicalStatus.PROCESSING,
            "success", CanonicalStatus.COMPLETED,
            "completed", CanonicalStatus.COMPLETED,
            "failed", CanonicalStatus.FAILED,
            "error", CanonicalStatus.ERROR,
            "expired", CanonicalStatus.ERROR,
            "cancelled", CanonicalStatus.ERROR
    );

    @Autowired
    public ServerlessRenderBackendClient(@Qualifier("serverlessWebClient") WebClient client,
                                         RenderBackendProperties props) {
        this(client, props.getServerless().getTimeout());
    }

    ServerlessRenderBackendClient(WebClient client, Duration timeout) {
        super(client, timeout);
    }

    @Override
    public RenderBackend backend() {
        return RenderBackend.SERVERLESS;
    }

    @Override
    protected String statusPath() {
        return "/calls/{id}";
    }

    @Override
    protected BackendStatus parse(JsonNode body, String correlationId) {
        JsonNode result = body.get("result");
        // result.error wins over the top-level error
        String error = text(result, "error");
        if (error == null) error = text(body, "error");
        String callId = text(body, "call_id");
        return BackendStatus.of(
                mapStatus(VOCABULARY, text(body, "status")),
                text(result, "output_url"),
                error,
                callId == null ? correlationId : callId);
    }
}
