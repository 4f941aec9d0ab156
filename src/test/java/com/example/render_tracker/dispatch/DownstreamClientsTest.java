package com.example.render_tracker.dispatch;

import com.example.render_tracker.config.DispatchProperties;
import com.example.render_tracker.exception.DispatchException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.codec.HttpMessageWriter;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DownstreamClientsTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();
    private final AtomicReference<String> lastBody = new AtomicReference<>();

    private ExchangeFunction answering(HttpStatus status) {
        ExchangeStrategies strategies = ExchangeStrategies.withDefaults();
        return request -> {
            lastRequest.set(request);
            MockClientHttpRequest mockRequest = new MockClientHttpRequest(request.method(), request.url());
            request.body().insert(mockRequest, new BodyInserter.Context() {
                @Override
                public List<HttpMessageWriter<?>> messageWriters() {
                    return strategies.messageWriters();
                }

                @Override
                public Optional<ServerHttpRequest> serverRequest() {
                    return Optional.empty();
                }

                @Override
                public Map<String, Object> hints() {
                    return Map.of();
                }
            }).block();
            lastBody.set(mockRequest.getBodyAsString().block());
            return Mono.just(ClientResponse.create(status).body("").build());
        };
    }

    private static DispatchProperties props() {
        DispatchProperties props = new DispatchProperties();
        props.setPublishBaseUrl("http://app.test/");
        props.setSessionBaseUrl("http://sessions.test");
        return props;
    }

    @Test
    void autoScheduleIsPostedForTheGeneration() {
        var client = new AutoPublishClient(WebClient.builder().exchangeFunction(answering(HttpStatus.OK)).build(), props());

        client.requestAutoSchedule("j1");

        assertThat(lastRequest.get().method()).isEqualTo(HttpMethod.POST);
        assertThat(lastRequest.get().url().toString()).isEqualTo("http://app.test/api/v1/generations/j1/auto-schedule");
    }

    @Test
    void autoScheduleErrorStatusRaisesDispatchException() {
        var client = new AutoPublishClient(
                WebClient.builder().exchangeFunction(answering(HttpStatus.SERVICE_UNAVAILABLE)).build(), props());

        var ex = assertThrows(DispatchException.class, () -> client.requestAutoSchedule("j1"));

        assertThat(ex.getMessage()).contains("503");
    }

    @Test
    void sessionStageCarriesOutcome() {
        var client = new SessionStageClient(WebClient.builder().exchangeFunction(answering(HttpStatus.OK)).build(), props());

        client.renderFinished("j1", false);

        assertThat(client.isEnabled()).isTrue();
        assertThat(lastRequest.get().url().toString()).isEqualTo("http://sessions.test/api/v1/sessions/render-result");
        assertThat(lastBody.get()).contains("\"generationId\":\"j1\"").contains("\"success\":false");
    }

    @Test
    void sessionStageIsDisabledWithoutBaseUrl() {
        DispatchProperties props = props();
        props.setSessionBaseUrl("");

        assertThat(new SessionStageClient(WebClient.create(), props).isEnabled()).isFalse();
    }

    @Test
    void transportFailureRaisesDispatchException() {
        var client = new SessionStageClient(
                WebClient.builder().exchangeFunction(request -> Mono.error(new IllegalStateException("reset"))).build(), props());

        assertThrows(DispatchException.class, () -> client.renderFinished("j1", true));
    }
}
