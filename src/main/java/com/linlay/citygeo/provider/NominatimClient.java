package com.linlay.citygeo.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.citygeo.config.NominatimProperties;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.netty.http.client.HttpClient;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Nominatim 搜索客户端：一次调用只负责拿到解码后的结果列表，或者一个明确的错误。
 * <p>
 * 最多 3 次尝试。429 与 5xx、网络异常会在等待 1×、2× backoff 后重试；其他非 2xx
 * 状态以及 JSON 解码失败直接失败。取消订阅会同时中断进行中的请求和等待中的 backoff。
 */
@Component
public class NominatimClient {

    private static final Logger log = LoggerFactory.getLogger(NominatimClient.class);

    static final int MAX_ATTEMPTS = 3;
    private static final TypeReference<List<NominatimPlace>> PLACE_LIST = new TypeReference<>() {
    };

    private final NominatimProperties properties;
    private final ObjectMapper objectMapper;
    private final Scheduler backoffScheduler;
    private final WebClient webClient;

    @Autowired
    public NominatimClient(NominatimProperties properties, ObjectMapper objectMapper) {
        this(properties, objectMapper, Schedulers.parallel());
    }

    NominatimClient(NominatimProperties properties, ObjectMapper objectMapper, Scheduler backoffScheduler) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.backoffScheduler = backoffScheduler;
        this.webClient = buildWebClient(properties);
    }

    public Mono<List<NominatimPlace>> search(String query, int limit, String acceptLanguage) {
        return attemptSearch(query, limit, acceptLanguage, 0, null)
                .doOnCancel(() -> log.info("nominatim search canceled q={}", query));
    }

    Duration backoffFor(int attempt) {
        return Duration.ofMillis(Math.max(0L, properties.getBackoffBaseMs()) * attempt);
    }

    private Mono<List<NominatimPlace>> attemptSearch(
            String query,
            int limit,
            String acceptLanguage,
            int attempt,
            GeoProviderException lastError
    ) {
        if (attempt >= MAX_ATTEMPTS) {
            if (lastError != null) {
                return Mono.error(lastError);
            }
            return Mono.error(new GeoProviderException(
                    "nominatim: max retries exceeded", GeoProviderException.NO_STATUS, false));
        }

        Mono<Long> wait = attempt == 0
                ? Mono.just(0L)
                : Mono.delay(backoffFor(attempt), backoffScheduler);

        return wait
                .then(Mono.defer(() -> exchange(query, limit, acceptLanguage, attempt)))
                .onErrorResume(
                        ex -> ex instanceof GeoProviderException providerError && providerError.isRetryable(),
                        ex -> {
                            log.warn("nominatim attempt {}/{} failed q={}: {}",
                                    attempt + 1, MAX_ATTEMPTS, query, ex.getMessage());
                            return attemptSearch(query, limit, acceptLanguage, attempt + 1, (GeoProviderException) ex);
                        }
                );
    }

    private Mono<List<NominatimPlace>> exchange(String query, int limit, String acceptLanguage, int attempt) {
        log.debug("nominatim search attempt={} q={} limit={} accept-language={}",
                attempt, query, limit, acceptLanguage);
        return webClient.get()
                .uri(uriBuilder -> searchUri(uriBuilder, query, limit, acceptLanguage))
                .accept(MediaType.APPLICATION_JSON)
                .exchangeToMono(this::handleResponse)
                .onErrorMap(WebClientRequestException.class, ex -> new GeoProviderException(
                        "nominatim: " + ex.getMessage(), GeoProviderException.NO_STATUS, true, ex));
    }

    private URI searchUri(UriBuilder uriBuilder, String query, int limit, String acceptLanguage) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("q", query);
        variables.put("limit", limit);
        uriBuilder.path("/search")
                .queryParam("q", "{q}")
                .queryParam("format", "json")
                .queryParam("addressdetails", "1")
                .queryParam("limit", "{limit}");
        if (StringUtils.hasText(acceptLanguage)) {
            uriBuilder.queryParam("accept-language", "{lang}");
            variables.put("lang", acceptLanguage);
        }
        return uriBuilder.build(variables);
    }

    private Mono<List<NominatimPlace>> handleResponse(ClientResponse response) {
        int status = response.statusCode().value();
        if (status == 429 || status >= 500) {
            return response.releaseBody()
                    .then(Mono.<List<NominatimPlace>>error(
                            new GeoProviderException("nominatim: status=" + status, status, true)));
        }
        if (!response.statusCode().is2xxSuccessful()) {
            return ResponseBodies.readCapped(response)
                    .flatMap(body -> Mono.<List<NominatimPlace>>error(new GeoProviderException(
                            "nominatim: status=%d body=%s".formatted(status, body), status, false)));
        }
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(this::decode);
    }

    private List<NominatimPlace> decode(String body) {
        try {
            List<NominatimPlace> places = objectMapper.readValue(body, PLACE_LIST);
            return places == null ? List.of() : places;
        } catch (JsonProcessingException ex) {
            throw new GeoProviderException(
                    "nominatim: invalid response: " + ex.getOriginalMessage(), GeoProviderException.NO_STATUS, false, ex);
        }
    }

    private WebClient buildWebClient(NominatimProperties config) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.max(100L, config.getConnectTimeoutMs()))
                .responseTimeout(Duration.ofMillis(Math.max(200L, config.getResponseTimeoutMs())));
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .baseUrl(config.getBaseUrl())
                .defaultHeader(HttpHeaders.USER_AGENT, config.getUserAgent())
                .build();
    }
}
