package com.linlay.citygeo.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Reads at most a fixed number of bytes of an upstream error body for diagnostics.
 */
public final class ResponseBodies {

    private static final Logger log = LoggerFactory.getLogger(ResponseBodies.class);

    public static final int MAX_ERROR_BODY_BYTES = 4096;

    private ResponseBodies() {
    }

    public static Mono<String> readCapped(ClientResponse response) {
        return readCapped(response, MAX_ERROR_BODY_BYTES);
    }

    public static Mono<String> readCapped(ClientResponse response, long maxBytes) {
        return DataBufferUtils.join(DataBufferUtils.takeUntilByteCount(response.bodyToFlux(DataBuffer.class), maxBytes))
                .map(buffer -> {
                    try {
                        return buffer.toString(StandardCharsets.UTF_8);
                    } finally {
                        DataBufferUtils.release(buffer);
                    }
                })
                .defaultIfEmpty("");
    }

    /**
     * Open-Meteo style error reason: the JSON {@code reason} field, else the trimmed body,
     * else "code ReasonPhrase".
     */
    public static String errorReason(ObjectMapper objectMapper, int status, String body) {
        String reason = "";
        try {
            JsonNode root = objectMapper.readTree(body == null ? "" : body);
            if (root != null) {
                reason = root.path("reason").asText("").trim();
            }
        } catch (JsonProcessingException ex) {
            log.debug("error body is not json: {}", ex.getOriginalMessage());
        }
        if (reason.isEmpty()) {
            reason = body == null ? "" : body.trim();
        }
        if (reason.isEmpty()) {
            HttpStatus httpStatus = HttpStatus.resolve(status);
            reason = httpStatus != null ? status + " " + httpStatus.getReasonPhrase() : String.valueOf(status);
        }
        return reason;
    }
}
