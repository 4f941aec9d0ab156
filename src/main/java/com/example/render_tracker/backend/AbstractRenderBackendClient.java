package com.example.render_tracker.backend;

import com.example.render_tracker.exception.BackendQueryException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Shared HTTP plumbing: GET a JSON status document, treat 404 as "unknown job",
 * turn every other failure into {@link BackendQueryException}.
 */
public abstract class AbstractRenderBackendClient implements RenderBackendClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractRenderBackendClient.class);

    private final WebClient client;
    private final Duration timeout;

    protected AbstractRenderBackendClient(WebClient client, Duration timeout) {
        this.client = client;
        this.timeout = timeout;
    }

    /** URI template with a single {id} variable. */
    protected abstract String statusPath();

    /** Maps the backend's JSON body onto the canonical form. */
    protected abstract BackendStatus parse(JsonNode body, String correlationId);

    @Override
    public BackendStatus query(String correlationId) {
        long start = System.currentTimeMillis();
        Optional<JsonNode> body;
        try {
            body = client.get()
                    .uri(statusPath(), correlationId)
                    .accept(MediaType.APPLICATION_JSON)
                    .<Optional<JsonNode>>exchangeToMono(resp -> {
                        if (resp.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                            return resp.releaseBody().thenReturn(Optional.<JsonNode>empty());
                        }
                        if (resp.statusCode().isError()) {
                            return resp.bodyToMono(String.class).defaultIfEmpty("")
                                    .flatMap(text -> Mono.<Optional<JsonNode>>error(new BackendQueryException(backend(),
                                            "%s status check failed: %s - %s".formatted(backend().label(), resp.statusCode(), truncate(text, 300)))));
                        }
                        return resp.bodyToMono(JsonNode.class).map(Optional::of);
                    })
                    .timeout(timeout)
                    .block();
        } catch (BackendQueryException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new BackendQueryException(backend(),
                    "%s status check failed: %s".formatted(backend().label(), ex.getMessage()), ex);
        }

        long elapsed = System.currentTimeMillis() - start;
        if (body == null) {
            throw new BackendQueryException(backend(), backend().label() + " status check returned an empty body");
        }
        if (body.isEmpty()) {
            LOGGER.info("Backend {} does not know correlationId={} ({} ms)", backend(), correlationId, elapsed);
            return BackendStatus.missing(correlationId);
        }

        BackendStatus status = parse(body.get(), correlationId);
        LOGGER.debug("Backend {} correlationId={} status={} hasOutput={} hasError={} ({} ms)",
                backend(), correlationId, status.status(), status.outputRef() != null, status.error() != null, elapsed);
        return status;
    }

    protected static CanonicalStatus mapStatus(Map<String, CanonicalStatus> vocabulary, String nativeStatus) {
        if (nativeStatus == null) {
            return CanonicalStatus.PROCESSING;
        }
        return vocabulary.getOrDefault(nativeStatus.trim().toLowerCase(Locale.ROOT), CanonicalStatus.PROCESSING);
    }

    protected static String text(JsonNode node, String field) {
        if (node == null) return null;
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        String s = v.asText();
        return s.isBlank() ? null : s;
    }

    private static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
