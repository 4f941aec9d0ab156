package com.example.render_tracker.dispatch;

import com.example.render_tracker.config.DispatchProperties;
import com.example.render_tracker.exception.DispatchException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * Tells the creation-session workflow that a render finished, so it can move past the render stage.
 */
@Component
public class SessionStageClient {

    private final WebClient client;
    private final String baseUrl;
    private final Duration timeout;

    public SessionStageClient(@Qualifier("dispatchWebClient") WebClient client, DispatchProperties props) {
        this.client = client;
        this.baseUrl = props.getSessionBaseUrl() == null ? "" : props.getSessionBaseUrl().replaceAll("/+$", "");
        this.timeout = props.getTimeout();
    }

    public boolean isEnabled() {
        return !baseUrl.isBlank();
    }

    public void renderFinished(String jobId, boolean success) {
        try {
            client.post()
                    .uri(baseUrl + "/api/v1/sessions/render-result")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("generationId", jobId, "success", success))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class).defaultIfEmpty("")
                                    .map(body -> new DispatchException("Session update error " + resp.statusCode() + ": " + body)))
                    .toBodilessEntity()
                    .timeout(timeout)
                    .block();
        } catch (DispatchException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new DispatchException("Session update failed for job " + jobId, ex);
        }
    }
}
