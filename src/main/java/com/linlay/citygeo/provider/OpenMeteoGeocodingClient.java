package com.linlay.citygeo.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.citygeo.config.OpenMeteoGeocodingProperties;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.List;

/**
 * Open-Meteo geocoding search ({@code /v1/search}). Single attempt, no retry.
 */
@Component
public class OpenMeteoGeocodingClient {

    private static final Logger log = LoggerFactory.getLogger(OpenMeteoGeocodingClient.class);

    private final ObjectMapper objectMapper;
    private final WebClient webClient;

    public OpenMeteoGeocodingClient(OpenMeteoGeocodingProperties properties, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.webClient = buildWebClient(properties);
    }

    public Mono<List<OpenMeteoGeoResult>> search(String name, int count, String language) {
        log.debug("open-meteo geocoding name={} count={} language={}", name, count, language);
        return webClient.get()
                .uri(uriBuilder -> uriBuilder.path("/v1/search")
                        .queryParam("name", "{name}")
                        .queryParam("count", "{count}")
                        .queryParam("language", "{language}")
                        .queryParam("format", "json")
                        .build(name, count, language))
                .accept(MediaType.APPLICATION_JSON)
                .exchangeToMono(this::handleResponse)
                .onErrorMap(WebClientRequestException.class, ex -> new GeoProviderException(
                        "open-meteo geocoding: " + ex.getMessage(), GeoProviderException.NO_STATUS, false, ex));
    }

    private Mono<List<OpenMeteoGeoResult>> handleResponse(ClientResponse response) {
        int status = response.statusCode().value();
        if (!response.statusCode().is2xxSuccessful()) {
            return ResponseBodies.readCapped(response)
                    .flatMap(body -> Mono.<List<OpenMeteoGeoResult>>error(new GeoProviderException(
                            "open-meteo geocoding: status=%d reason=%s".formatted(
                                    status, ResponseBodies.errorReason(objectMapper, status, body)),
                            status, false)));
        }
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(this::decode);
    }

    private List<OpenMeteoGeoResult> decode(String body) {
        try {
            SearchPayload payload = objectMapper.readValue(body, SearchPayload.class);
            if (payload == null || payload.results() == null) {
                return List.of();
            }
            return payload.results();
        } catch (JsonProcessingException ex) {
            throw new GeoProviderException(
                    "open-meteo geocoding: invalid response: " + ex.getOriginalMessage(),
                    GeoProviderException.NO_STATUS, false, ex);
        }
    }

    private WebClient buildWebClient(OpenMeteoGeocodingProperties config) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.max(100L, config.getConnectTimeoutMs()))
                .responseTimeout(Duration.ofMillis(Math.max(200L, config.getResponseTimeoutMs())));
        WebClient.Builder builder = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .baseUrl(config.getBaseUrl());
        if (StringUtils.hasText(config.getUserAgent())) {
            builder.defaultHeader(HttpHeaders.USER_AGENT, config.getUserAgent());
        }
        return builder.build();
    }

    // "results" is absent when nothing matches
    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchPayload(List<OpenMeteoGeoResult> results) {
    }
}
