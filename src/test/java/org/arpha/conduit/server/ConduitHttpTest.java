package org.arpha.conduit.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.arpha.conduit.ConduitRunner;
import org.arpha.conduit.container.DefaultContainer;
import org.arpha.conduit.core.ConduitServer;
import org.arpha.conduit.example.RequestIdMiddleware;
import org.arpha.conduit.example.StatusController;
import org.arpha.conduit.metadata.ControllerScanner;
import org.arpha.conduit.metadata.MetadataRegistry;
import org.arpha.conduit.server.dto.ServerProperties;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Conduit over a real socket")
class ConduitHttpTest {

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final HttpClient client = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(5))
            .build();

    private static ConduitHttp http;

    @BeforeAll
    static void startServer() throws InterruptedException {
        ServerProperties properties = ServerProperties.builder()
                .host("127.0.0.1")
                .port(0)
                .build();
        MetadataRegistry registry = new MetadataRegistry();
        ControllerScanner.register(registry, StatusController.class);
        DefaultContainer container = new DefaultContainer()
                .bindSingleton(RequestIdMiddleware.class, RequestIdMiddleware::new);

        http = new ConduitServer(container, registry, properties)
                .setErrorConfig(ConduitRunner::errorConfig)
                .serve()
                .bind();
    }

    @AfterAll
    static void stopServer() {
        http.close();
    }

    private static HttpResponse<String> get(String path, String requestId) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + http.port() + path))
                .timeout(Duration.ofSeconds(5))
                .GET();
        if (requestId != null) {
            builder.header(RequestIdMiddleware.HEADER, requestId);
        }
        return client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    @DisplayName("controller middleware runs before a synchronous action")
    void status_returnsJsonWithRequestId() throws Exception {
        HttpResponse<String> response = get("/status", "req-42");

        JsonNode body = objectMapper.readTree(response.body());
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("content-type")).hasValueSatisfying(
                value -> assertThat(value).startsWith("application/json"));
        assertThat(response.headers().firstValue(RequestIdMiddleware.HEADER)).contains("req-42");
        assertThat(body.get("status").asText()).isEqualTo("UP");
        assertThat(body.get("requestId").asText()).isEqualTo("req-42");
    }

    @Test
    @DisplayName("an asynchronous action result is sent once it resolves")
    void echo_sendsResolvedValue() throws Exception {
        HttpResponse<String> response = get("/status/echo/ab?times=2", null);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue(RequestIdMiddleware.HEADER)).isPresent();
        assertThat(objectMapper.readTree(response.body()).get("echo").asText()).isEqualTo("abab");
    }

    @Test
    @DisplayName("an asynchronous action failure reaches the error configuration")
    void echo_withInvalidCount_isHandledByErrorConfig() throws Exception {
        HttpResponse<String> response = get("/status/echo/ab?times=x", null);

        assertThat(response.statusCode()).isEqualTo(500);
        assertThat(objectMapper.readTree(response.body()).get("error").asText()).contains("\"x\"");
    }

    @Test
    @DisplayName("unknown paths fall through to 404")
    void unknownPath_yields404() throws Exception {
        HttpResponse<String> response = get("/nowhere", null);

        assertThat(response.statusCode()).isEqualTo(404);
        assertThat(response.body()).isEqualTo("Cannot GET /nowhere");
    }

}
