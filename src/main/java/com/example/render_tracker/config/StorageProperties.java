package com.example.render_tracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Where rendered artifacts live and how download links for them are signed.
 */
@ConfigurationProperties(prefix = "render.storage")
public class StorageProperties {
    private String bucket = "";
    private String publicBaseUrl = "http://localhost:8080/v1/files/out";
    private String signingKey = "";
    private Duration urlTtl = Duration.ofHours(1);

    public String getBucket() { return bucket; }
    public void setBucket(String bucket) { this.bucket = bucket; }

    public String getPublicBaseUrl() { return publicBaseUrl; }
    public void setPublicBaseUrl(String publicBaseUrl) { this.publicBaseUrl = publicBaseUrl; }

    public String getSigningKey() { return signingKey; }
    public void setSigningKey(String signingKey) { this.signingKey = signingKey; }

    public Duration getUrlTtl() { return urlTtl; }
    public void setUrlTtl(Duration urlTtl) { this.urlTtl = urlTtl; }
}
