package com.example.render_tracker.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties(RenderBackendProperties.class)
public class RenderBackendClientConfig {

    @Bean("serverlessWebClient")
    public WebClient serverlessWebClient(RenderBackendProperties props) {
        return build(props.getServerless());
    }

    @Bean("gpuWebClient")
    public WebClient gpuWebClient(RenderBackendProperties props) {
        return build(props.getGpu());
    }

    @Bean("localWebClient")
    public WebClient localWebClient(RenderBackendProperties props) {
        return build(props.getLocal());
    }

    static WebClient build(RenderBackendProperties.Backend backend) {
        Duration to = backend.getTimeout();
        int toSec = (int) Math.max(1, to.getSeconds());

        HttpClient http = HttpClient.create()
                .responseTimeout(to)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) backend.getConnectTimeout().toMillis())
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(toSec))
                        .addHandlerLast(new WriteTimeoutHandler(toSec)));

        return WebClient.builder()
                .baseUrl(backend.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(http))
                .build();
    }
}
