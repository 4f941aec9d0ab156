package com.example.render_tracker.storage;

import com.example.render_tracker.config.StorageProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HmacPresignedUrlResolverTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final long EXPIRES = NOW.getEpochSecond() + 3600;

    private StorageProperties props;
    private HmacPresignedUrlResolver resolver;

    @BeforeEach
    void setUp() {
        props = new StorageProperties();
        props.setBucket("renders");
        props.setPublicBaseUrl("https://cdn.example.test/out/");
        props.setSigningKey("secret-key");
        resolver = new HmacPresignedUrlResolver(props, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static String hmac(String message) throws Exception {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec("secret-key".getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        return HexFormat.of().formatHex(mac.doFinal(message.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void s3UrlInConfiguredBucketIsSigned() throws Exception {
        String url = resolver.resolve("s3://renders/fast-cut/j1.mp4");

        assertThat(url).isEqualTo("https://cdn.example.test/out/fast-cut/j1.mp4?expires=" + EXPIRES
                + "&signature=" + hmac("fast-cut/j1.mp4\n" + EXPIRES));
    }

    @Test
    void virtualHostedAndPathStyleUrlsAreSigned() {
        assertThat(resolver.resolve("https://renders.s3.us-east-1.amazonaws.com/ai/g-2.mp4"))
                .startsWith("https://cdn.example.test/out/ai/g-2.mp4?expires=" + EXPIRES + "&signature=");
        assertThat(resolver.resolve("https://s3.eu-west-1.amazonaws.com/renders/ai/g-3.mp4"))
                .startsWith("https://cdn.example.test/out/ai/g-3.mp4?expires=");
    }

    @Test
    void bareKeyIsSignedAndEncoded() {
        assertThat(resolver.resolve("/outputs/my clip.mp4"))
                .startsWith("https://cdn.example.test/out/outputs/my%20clip.mp4?expires=");
    }

    @Test
    void foreignLocationsAreReturnedUnchanged() {
        assertThat(resolver.resolve("https://videos.example.org/x.mp4")).isEqualTo("https://videos.example.org/x.mp4");
        assertThat(resolver.resolve("s3://other-bucket/x.mp4")).isEqualTo("s3://other-bucket/x.mp4");
    }

    @Test
    void otherSchemesAreNotTreatedAsKeys() {
        assertThat(resolver.resolve("gs://other/x.mp4")).isEqualTo("gs://other/x.mp4");
        assertThat(resolver.resolve("file:///tmp/x.mp4")).isEqualTo("file:///tmp/x.mp4");
        assertThat(resolver.objectKey("gs://other/x.mp4")).isEmpty();
    }

    @Test
    void missingReferenceResolvesToNull() {
        assertThat(resolver.resolve(null)).isNull();
        assertThat(resolver.resolve("  ")).isNull();
    }

    @Test
    void signingKeyIsRequired() {
        props.setSigningKey(" ");

        assertThrows(IllegalStateException.class, () -> new HmacPresignedUrlResolver(props, Clock.systemUTC()));
    }
}
