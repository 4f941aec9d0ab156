package com.example.render_tracker.model;

import com.example.render_tracker.exception.UnsupportedJobMetadataException;
import com.example.render_tracker.util.JobKind;
import com.example.render_tracker.util.RenderBackend;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BackendMetadataTest {

    @Test
    void storedTagsAreParsedCaseInsensitively() {
        BackendMetadata m = BackendMetadata.fromStored("j1", "gpu", " ", null, "image_to_video", true);

        assertThat(m.backend()).isEqualTo(RenderBackend.GPU);
        assertThat(m.jobKind()).isEqualTo(JobKind.IMAGE_TO_VIDEO);
        assertThat(m.correlationId()).isNull();
        assertThat(m.autoPublish()).isTrue();
    }

    @Test
    void unknownBackendTagFailsClosed() {
        var ex = assertThrows(UnsupportedJobMetadataException.class,
                () -> BackendMetadata.fromStored("j1", "lambda", null, null, "FAST_CUT", false));

        assertThat(ex.getMessage()).contains("lambda").contains("j1");
    }

    @Test
    void missingJobKindFailsClosed() {
        assertThrows(UnsupportedJobMetadataException.class,
                () -> BackendMetadata.fromStored("j1", "SERVERLESS", "fc-1", null, null, false));
    }

    @Test
    void persistedCorrelationIdWinsOverFallback() {
        var m = new BackendMetadata(RenderBackend.GPU, "ec2-77", null, JobKind.VIDEO_GENERATION, false);

        assertThat(m.resolveCorrelation("j1")).contains(new BackendMetadata.CorrelationRef("ec2-77", false));
    }

    @Test
    void fallbackOnlyForKindsThatAllowIt() {
        var ai = new BackendMetadata(RenderBackend.GPU, null, null, JobKind.VIDEO_GENERATION, false);
        var cut = new BackendMetadata(RenderBackend.SERVERLESS, null, null, JobKind.FAST_CUT, false);

        assertThat(ai.resolveCorrelation("j1")).contains(new BackendMetadata.CorrelationRef("j1", true));
        assertThat(cut.resolveCorrelation("j1")).isEmpty();
    }
}
