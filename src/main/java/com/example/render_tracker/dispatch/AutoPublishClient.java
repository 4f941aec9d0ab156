package com.example.render_tracker.dispatch;

import com.example.render_tracker.config.DispatchProperties;
import com.example.render_tracker.exception.DispatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * Asks the publishing side to schedule a finished render for auto-publish.
 */
@Component
public class AutoPublishClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(AutoPublishClient.class);

    private final WebClient client;
    private final String baseUrl;
    private final Duration timeout;

    public AutoPublishClient(@Qualifier("dispatchWebClient") WebClient client, DispatchProperties props) {
        this.client = client;
        this.baseUrl = props.getPublishBaseUrl().replaceAll("/+$", "");
        this.timeout = props.getTimeout();
    }

    public void requestAutoSchedule(String jobId) {
        long start = System.currentTimeMillis();
        try {
            client.post()
                    .uri(baseUrl + "/api/v1/generations/{id}/auto-schedule", jobId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of())
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class).defaultIfEmpty("")
                                    .map(body -> new DispatchException("Auto-schedule error " + resp.statusCode() + ": " + body)))
                    .toBodilessEntity()
                    .timeout(timeout)
                    .block();
        } catch (DispatchException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new DispatchException("Auto-schedule request failed for job " + jobId, ex);
        }
        LOGGER.debug("Auto-schedule requested jobId={} in {} ms", jobId, System.currentTimeMillis() - start);
    }
}
