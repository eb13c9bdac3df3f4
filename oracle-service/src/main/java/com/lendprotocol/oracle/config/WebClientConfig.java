package com.lendprotocol.oracle.config;

import com.lendprotocol.oracle.client.HttpPriceSourceResolver;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    @Value("${oracle.http.connect-timeout-ms:2000}")
    private int connectTimeoutMs;

    @Value("${oracle.http.read-timeout-seconds:5}")
    private int readTimeoutSeconds;

    // source address -> base URL of its price endpoint
    @Value("#{${oracle.source-endpoints:{:}}}")
    private Map<String, String> sourceEndpoints;

    @Bean
    public WebClient priceSourceWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(Duration.ofSeconds(readTimeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(readTimeoutSeconds, TimeUnit.SECONDS))
            );

        return builder
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(serverErrorFilter())
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public HttpPriceSourceResolver priceSourceResolver(WebClient priceSourceWebClient) {
        // one second of slack over the read timeout so the netty timeout fires first
        HttpPriceSourceResolver resolver = new HttpPriceSourceResolver(
            priceSourceWebClient, sourceEndpoints, Duration.ofSeconds(readTimeoutSeconds + 1L));
        log.info("PRICE_SOURCES_CONFIGURED count={} sources={}", resolver.endpointCount(), sourceEndpoints.keySet());
        return resolver;
    }

    private ExchangeFilterFunction serverErrorFilter() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return Mono.error(new IllegalStateException("Price source server error: " + clientResponse.statusCode()));
            }
            return Mono.just(clientResponse);
        });
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
