package com.lendprotocol.oracle.client;

import com.lendprotocol.common.capability.PriceSource;
import com.lendprotocol.common.capability.PriceSourceResolver;
import com.lendprotocol.common.exception.ProtocolException;
import com.lendprotocol.common.model.Address;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * Maps a source address to its HTTP endpoint using the {@code oracle.source-endpoints}
 * table. An address without an endpoint cannot be called.
 */
public class HttpPriceSourceResolver implements PriceSourceResolver {

    private final WebClient webClient;
    private final Map<String, String> endpoints;
    private final Duration timeout;

    public HttpPriceSourceResolver(WebClient webClient, Map<String, String> endpoints, Duration timeout) {
        this.webClient = webClient;
        this.endpoints = Map.copyOf(endpoints);
        this.timeout   = timeout;
    }

    @Override
    public PriceSource resolve(Address source) {
        String baseUrl = endpoints.get(source.value());
        if (baseUrl == null) {
            throw ProtocolException.externalCallFailed("no endpoint configured for price source " + source, null);
        }
        return new HttpPriceSource(webClient, source, baseUrl, timeout);
    }

    public int endpointCount() {
        return endpoints.size();
    }
}
