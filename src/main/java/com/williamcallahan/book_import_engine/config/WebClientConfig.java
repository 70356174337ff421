/**
 * WebClient builder shared by the metadata providers
 * - Connect and per-request timeouts come from the enrichment settings
 * - Identifies the engine to Google Books and OpenLibrary through the User-Agent header
 * - Raises the codec limit for OpenLibrary search pages listing every edition's ISBNs
 */
package com.williamcallahan.book_import_engine.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    private static final int PROVIDER_CODEC_LIMIT_BYTES = 10 * 1024 * 1024;

    @Bean
    public WebClient.Builder webClientBuilder(ImportProperties properties,
                                              @Value("${spring.application.name:book-import-engine}") String applicationName) {
        Duration connectTimeout = properties.getEnrichment().getConnectTimeout();
        Duration requestTimeout = properties.getEnrichment().getRequestTimeout();

        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
            .doOnConnected(conn -> conn.addHandlerLast(new ReadTimeoutHandler(requestTimeout.toMillis(), TimeUnit.MILLISECONDS)))
            .responseTimeout(requestTimeout);

        return WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, applicationName)
            .exchangeStrategies(ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(PROVIDER_CODEC_LIMIT_BYTES))
                .build())
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
