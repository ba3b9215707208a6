package com.example.shortsbot_backend.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * WebClients for the transcription, speech synthesis and stock footage collaborators.
 */
@Configuration
@EnableConfigurationProperties(FwProperties.class)
public class HttpClientConfig {

    @Bean("fwWebClient")
    public WebClient fwWebClient(FwProperties props) {
        return build(props.getBaseUrl(), Duration.ofSeconds(props.getTimeoutSeconds()), 32, false);
    }

    @Bean("narrationWebClient")
    public WebClient narrationWebClient(NarrationProperties props) {
        return build(props.getBaseUrl(), Duration.ofSeconds(props.getTimeoutSeconds()), 64, false);
    }

    @Bean
    @Qualifier("stockWebClient")
    public WebClient stockWebClient(BackgroundProperties props) {
        // base URL differs per provider; downloads follow CDN redirects
        return build(null, Duration.ofSeconds(props.getDownloadTimeoutSeconds()), 16, true);
    }

    private static WebClient build(String baseUrl, Duration timeout, int maxInMemoryMb, boolean followRedirects) {
        int toSec = (int) Math.max(1, timeout.getSeconds());

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(c -> c.defaultCodecs().maxInMemorySize(maxInMemoryMb * 1024 * 1024))
                .build();

        HttpClient http = HttpClient.create()
                .followRedirect(followRedirects)
                .responseTimeout(timeout)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 15_000)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(toSec))
                        .addHandlerLast(new WriteTimeoutHandler(toSec))
                );

        WebClient.Builder builder = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(http))
                .exchangeStrategies(strategies);
        if (baseUrl != null) {
            builder.baseUrl(baseUrl);
        }
        return builder.build();
    }
}
