package com.linlay.citygeo.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.citygeo.config.OpenMeteoGeocodingProperties;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenMeteoGeocodingClientTest {

    private final BlockingQueue<String[]> requests = new ArrayBlockingQueue<>(8);
    private HttpServer server;
    private volatile int status = 200;
    private volatile String body = "";

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/search", this::handle);
        server.start();
    }

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void shouldSendSearchParametersAndDecodeResults() throws Exception {
        respond(200, """
                {"results":[
                  {"id":2643743,"name":"London","latitude":51.50853,"longitude":-0.12574,"elevation":25.0,
                   "feature_code":"PPLC","country_code":"GB","timezone":"Europe/London","population":8961989,
                   "country":"United Kingdom","admin1":"England"}
                ],"generationtime_ms":0.9}
                """);

        List<OpenMeteoGeoResult> results = newClient().search("London", 4, "en").block(Duration.ofSeconds(5));

        String[] request = requests.poll();
        assertThat(request).isNotNull();
        assertThat(request[0])
                .contains("name=London")
                .contains("count=4")
                .contains("language=en")
                .contains("format=json");
        assertThat(request[1]).isEqualTo("Hearth/0.1");
        assertThat(results).containsExactly(new OpenMeteoGeoResult(
                2643743L, "London", 51.50853, -0.12574, "Europe/London", "United Kingdom", "England", 8961989L));
    }

    @Test
    void missingResultsShouldDecodeAsEmptyList() {
        respond(200, "{\"generationtime_ms\":0.4}");

        assertThat(newClient().search("Qwxyz", 2, "en").block(Duration.ofSeconds(5))).isEmpty();
    }

    @Test
    void errorStatusShouldCarryReasonFromPayload() {
        respond(400, "{\"error\":true,\"reason\":\"Parameter count must be between 1 and 100.\"}");

        assertThatThrownBy(() -> newClient().search("Paris", 0, "en").block(Duration.ofSeconds(5)))
                .isInstanceOfSatisfying(GeoProviderException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(400);
                    assertThat(ex.isRetryable()).isFalse();
                })
                .hasMessage("open-meteo geocoding: status=400 reason=Parameter count must be between 1 and 100.");
    }

    @Test
    void errorWithoutBodyShouldFallBackToStatusText() {
        respond(503, "");

        assertThatThrownBy(() -> newClient().search("Paris", 2, "en").block(Duration.ofSeconds(5)))
                .isInstanceOf(GeoProviderException.class)
                .hasMessage("open-meteo geocoding: status=503 reason=503 Service Unavailable");
    }

    @Test
    void invalidJsonShouldFail() {
        respond(200, "<html>maintenance</html>");

        assertThatThrownBy(() -> newClient().search("Paris", 2, "en").block(Duration.ofSeconds(5)))
                .isInstanceOfSatisfying(GeoProviderException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(GeoProviderException.NO_STATUS))
                .hasMessageStartingWith("open-meteo geocoding: invalid response");
    }

    @Test
    void connectionFailureShouldBecomeProviderError() {
        OpenMeteoGeocodingClient client = newClient();
        server.stop(0);
        server = null;

        assertThatThrownBy(() -> client.search("Paris", 2, "en").block(Duration.ofSeconds(5)))
                .isInstanceOfSatisfying(GeoProviderException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(GeoProviderException.NO_STATUS))
                .hasMessageStartingWith("open-meteo geocoding: ");
    }

    private OpenMeteoGeocodingClient newClient() {
        OpenMeteoGeocodingProperties properties = new OpenMeteoGeocodingProperties();
        properties.setBaseUrl("http://127.0.0.1:" + server.getAddress().getPort());
        properties.setResponseTimeoutMs(3_000);
        return new OpenMeteoGeocodingClient(properties, new ObjectMapper());
    }

    private void respond(int status, String body) {
        this.status = status;
        this.body = body;
    }

    private void handle(HttpExchange exchange) throws IOException {
        requests.offer(new String[]{
                exchange.getRequestURI().getRawQuery(),
                exchange.getRequestHeaders().getFirst("User-Agent")
        });
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream output = exchange.getResponseBody()) {
                output.write(bytes);
            }
        }
        exchange.close();
    }
}
