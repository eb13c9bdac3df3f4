package com.lendprotocol.oracle.client;

import com.lendprotocol.common.capability.PriceSource;
import com.lendprotocol.common.exception.ProtocolException;
import com.lendprotocol.common.model.Address;
import com.lendprotocol.oracle.client.dto.PriceQuote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigInteger;
import java.time.Duration;

/**
 * {@link PriceSource} reached over HTTP. The aggregator consumes prices synchronously inside
 * one invocation, so the reply is awaited here with a hard timeout; callers run on the
 * bounded-elastic scheduler.
 */
public class HttpPriceSource implements PriceSource {

    private static final Logger log = LoggerFactory.getLogger(HttpPriceSource.class);

    private final WebClient webClient;
    private final Address source;
    private final String baseUrl;
    private final Duration timeout;

    public HttpPriceSource(WebClient webClient, Address source, String baseUrl, Duration timeout) {
        this.webClient = webClient;
        this.source    = source;
        this.baseUrl   = baseUrl;
        this.timeout   = timeout;
    }

    @Override
    public BigInteger getPrice(Address asset) {
        PriceQuote quote;
        try {
            quote = webClient.get()
                .uri(baseUrl + "/api/v1/price/{asset}", asset.value())
                .retrieve()
                .bodyToMono(PriceQuote.class)
                .block(timeout);
        } catch (RuntimeException e) {
            throw ProtocolException.externalCallFailed(
                "price source " + source + " unreachable for asset " + asset + ": " + e.getMessage(), e);
        }
        if (quote == null || quote.price() == null) {
            throw ProtocolException.externalCallFailed(
                "price source " + source + " returned no price for asset " + asset, null);
        }
        log.debug("PRICE_QUOTED source={} asset={} price={}", source, asset, quote.price());
        return quote.price();
    }
}
