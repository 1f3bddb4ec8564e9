package de.htwsaar.streamrelay.cli.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sun.net.httpserver.HttpServer;
import de.htwsaar.streamrelay.cli.dto.HttpCallResult;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RelayProbeServiceTest {

    private HttpServer server;
    private URI base;
    private final RelayProbeService service = new RelayProbeService(HttpClient.newHttpClient(), Duration.ofSeconds(5));

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.setExecutor(Executors.newSingleThreadExecutor());
        server.start();
        base = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void relayAnswersBadRequestWithJson() {
        respond(400, "application/json", "{\"error\":\"Missing url parameter\"}");

        HttpCallResult result = service.probe(base);

        assertEquals(400, result.statusCode());
        assertTrue(RelayProbeService.looksLikeRelay(result));
    }

    @Test
    void htmlPageIsNotARelay() {
        respond(200, "text/html; charset=utf-8", "<html>static site</html>");

        assertFalse(RelayProbeService.looksLikeRelay(service.probe(base)));
    }

    @Test
    void classificationRules() {
        assertTrue(RelayProbeService.looksLikeRelay(HttpCallResult.http(200, "application/json", "{}")));
        assertFalse(RelayProbeService.looksLikeRelay(HttpCallResult.http(400, "text/plain", "bad")));
        assertFalse(RelayProbeService.looksLikeRelay(HttpCallResult.http(404, "application/json", "{}")));
        assertFalse(RelayProbeService.looksLikeRelay(HttpCallResult.ioError("refused")));
    }

    private void respond(int status, String contentType, String body) {
        server.createContext("/stream", exchange -> {
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", contentType);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
    }
}
