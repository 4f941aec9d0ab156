package com.example.render_tracker.service;

import com.example.render_tracker.backend.GpuRenderBackendClient;
import com.example.render_tracker.backend.RenderBackendAdapter;
import com.example.render_tracker.config.ProgressProperties;
import com.example.render_tracker.config.RenderBackendProperties;
import com.example.render_tracker.config.StorageProperties;
import com.example.render_tracker.dto.CallbackRequest;
import com.example.render_tracker.dto.CallbackResponse;
import com.example.render_tracker.dto.JobStatusResponse;
import com.example.render_tracker.storage.HmacPresignedUrlResolver;
import com.example.render_tracker.store.InMemoryJobStore;
import com.example.render_tracker.util.JobKind;
import com.example.render_tracker.util.RenderBackend;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * A GPU image-to-video job from submission to a replayed completion callback.
 */
@ExtendWith(MockitoExtension.class)
class RenderJobLifecycleTest {

    private static final Instant NOW = Instant.parse("2026-04-10T08:30:00Z");

    @Mock
    private CompletionTrigger trigger;

    @Test
    void pollCallbackPollReplay() {
        List<String> queried = new CopyOnWriteArrayList<>();
        WebClient gpuWeb = WebClient.builder().exchangeFunction(request -> {
            queried.add(request.url().getPath());
            return Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body("{\"job_id\":\"j1\",\"status\":\"provisioning\"}")
                    .build());
        }).build();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

        StorageProperties storage = new StorageProperties();
        storage.setBucket("renders");
        storage.setPublicBaseUrl("https://cdn.example.test/out");
        storage.setSigningKey("k");
        RenderBackendProperties backends = new RenderBackendProperties();
        backends.getGpu().setCallbackSecret("ec2-secret");

        InMemoryJobStore store = new InMemoryJobStore();
        var adapter = new RenderBackendAdapter(List.of(new GpuRenderBackendClient(gpuWeb, backends)));
        var reconciler = new StatusReconciler(store, adapter, new ProgressEstimator(new ProgressProperties(), clock),
                trigger, new HmacPresignedUrlResolver(storage, clock));
        var ingestor = new CallbackIngestor(new CallbackSecretVerifier(backends), store, trigger);

        store.pending("j1", RenderBackend.GPU, JobKind.IMAGE_TO_VIDEO, null, NOW, false);

        JobStatusResponse first = reconciler.reconcile("j1");
        assertThat(first.status()).isEqualTo("processing");
        assertThat(first.progress()).isBetween(5, 35);
        assertThat(first.currentStep()).isEqualTo("Rendering on GPU");
        assertThat(queried).containsExactly("/api/v1/ai/job/j1/status");

        var callback = new CallbackRequest("j1", "completed", "s3://renders/ai/j1.mp4", null, "ec2-secret");
        assertThat(ingestor.ingest(callback)).isEqualTo(CallbackResponse.ok("j1", "COMPLETED"));

        JobStatusResponse second = reconciler.reconcile("j1");
        assertThat(second.status()).isEqualTo("completed");
        assertThat(second.progress()).isEqualTo(100);
        assertThat(second.outputUrl()).startsWith("https://cdn.example.test/out/ai/j1.mp4?expires=");
        assertThat(queried).hasSize(1);

        assertThat(ingestor.ingest(callback).status()).isEqualTo("skipped");
        verify(trigger, times(1)).onCompleted(any());
    }
}
