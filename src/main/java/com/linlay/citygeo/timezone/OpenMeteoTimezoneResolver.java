package com.linlay.citygeo.timezone;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.citygeo.config.TimezoneProperties;
import com.linlay.citygeo.provider.ResponseBodies;
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

/**
 * Resolves the zone through Open-Meteo's forecast endpoint with {@code timezone=auto};
 * the forecast payload is kept minimal since only the resolved zone is read.
 */
@Component
public class OpenMeteoTimezoneResolver implements TimezoneResolver {

    private static final Logger log = LoggerFactory.getLogger(OpenMeteoTimezoneResolver.class);

    private final ObjectMapper objectMapper;
    private final WebClient webClient;

    public OpenMeteoTimezoneResolver(TimezoneProperties properties, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.webClient = buildWebClient(properties);
    }

    @Override
    public Mono<String> resolveTimezone(String latitude, String longitude) {
        if (!StringUtils.hasText(latitude) || !StringUtils.hasText(longitude)) {
            return Mono.error(new IllegalArgumentException("lat/lon required"));
        }
        log.debug("open-meteo timezone lookup lat={} lon={}", latitude, longitude);
        return webClient.get()
                .uri(uriBuilder -> uriBuilder.path("/v1/forecast")
                        .queryParam("latitude", "{lat}")
                        .queryParam("longitude", "{lon}")
                        .queryParam("current", "temperature_2m")
                        .queryParam("timezone", "auto")
                        .build(latitude.trim(), longitude.trim()))
                .accept(MediaType.APPLICATION_JSON)
                .exchangeToMono(this::handleResponse)
                .onErrorMap(WebClientRequestException.class,
                        ex -> new TimezoneLookupException("open-meteo forecast: " + ex.getMessage(), ex));
    }

    private Mono<String> handleResponse(ClientResponse response) {
        int status = response.statusCode().value();
        if (!response.statusCode().is2xxSuccessful()) {
            return ResponseBodies.readCapped(response)
                    .flatMap(body -> Mono.<String>error(new TimezoneLookupException(
                            "open-meteo forecast: status=%d reason=%s".formatted(
                                    status, ResponseBodies.errorReason(objectMapper, status, body)))));
        }
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(this::readTimezone);
    }

    private String readTimezone(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new TimezoneLookupException("open-meteo forecast: invalid response", ex);
        }
        String timezone = root == null ? "" : root.path("timezone").asText("").trim();
        if (timezone.isEmpty()) {
            throw new TimezoneLookupException("timezone not found");
        }
        return timezone;
    }

    private WebClient buildWebClient(TimezoneProperties config) {
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
}
