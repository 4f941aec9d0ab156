package com.example.render_tracker.storage;

import com.example.render_tracker.config.StorageProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Signs download links as {@code <publicBaseUrl>/<key>?expires=<epochSeconds>&signature=<hex HMAC-SHA256>}.
 * The signed message is {@code key + "\n" + expires}.
 */
@Component
public class HmacPresignedUrlResolver implements PresignedUrlResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(HmacPresignedUrlResolver.class);
    private static final String ALGORITHM = "HmacSHA256";
    private static final Pattern URI_SCHEME = Pattern.compile("^[A-Za-z][A-Za-z0-9+.-]*:");

    private final StorageProperties properties;
    private final Clock clock;
    private final SecretKeySpec key;

    public HmacPresignedUrlResolver(StorageProperties properties, Clock clock) {
        if (properties.getSigningKey() == null || properties.getSigningKey().isBlank()) {
            throw new IllegalStateException("render.storage.signing-key must be configured");
        }
        this.properties = properties;
        this.clock = clock;
        this.key = new SecretKeySpec(properties.getSigningKey().getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    @Override
    @Nullable
    public String resolve(@Nullable String outputRef) {
        if (outputRef == null || outputRef.isBlank()) {
            return null;
        }
        Optional<String> objectKey = objectKey(outputRef.trim());
        if (objectKey.isEmpty()) {
            LOGGER.debug("Output ref is outside managed storage, returning as-is: {}", outputRef);
            return outputRef;
        }
        long expires = clock.instant().plus(properties.getUrlTtl()).getEpochSecond();
        String k = objectKey.get();
        String base = properties.getPublicBaseUrl().replaceAll("/+$", "");
        return base + "/" + UriUtils.encodePath(k, StandardCharsets.UTF_8)
                + "?expires=" + expires
                + "&signature=" + sign(k, expires);
    }

    String sign(String objectKey, long expires) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            byte[] digest = mac.doFinal((objectKey + "\n" + expires).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot sign download URL", e);
        }
    }

    /**
     * Extracts the object key from {@code s3://bucket/key}, virtual-hosted or path-style
     * S3 URLs, or a bare key. Empty for URLs that point somewhere else and for any other scheme.
     */
    Optional<String> objectKey(String ref) {
        String bucket = properties.getBucket() == null ? "" : properties.getBucket().trim();
        if (ref.startsWith("s3://")) {
            String rest = ref.substring("s3://".length());
            int slash = rest.indexOf('/');
            if (slash <= 0 || slash == rest.length() - 1) {
                return Optional.empty();
            }
            String refBucket = rest.substring(0, slash);
            if (!bucket.isEmpty() && !bucket.equals(refBucket)) {
                return Optional.empty();
            }
            return Optional.of(rest.substring(slash + 1));
        }

        String lower = ref.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            if (URI_SCHEME.matcher(ref).find()) {
                return Optional.empty();
            }
            return Optional.of(ref.replaceAll("^/+", ""));
        }

        URI uri;
        try {
            uri = new URI(ref);
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
        String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
        String path = uri.getPath() == null ? "" : uri.getPath().replaceAll("^/+", "");
        if (bucket.isEmpty() || path.isEmpty() || !host.endsWith(".amazonaws.com")) {
            return Optional.empty();
        }
        // virtual-hosted style: <bucket>.s3.<region>.amazonaws.com/<key>
        if (host.startsWith(bucket.toLowerCase(Locale.ROOT) + ".s3")) {
            return Optional.of(path);
        }
        // path style: s3.<region>.amazonaws.com/<bucket>/<key>
        if (host.startsWith("s3") && path.startsWith(bucket + "/") && path.length() > bucket.length() + 1) {
            return Optional.of(path.substring(bucket.length() + 1));
        }
        return Optional.empty();
    }
}
