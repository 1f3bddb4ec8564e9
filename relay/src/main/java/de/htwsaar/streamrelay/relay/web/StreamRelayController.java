package de.htwsaar.streamrelay.relay.web;

import de.htwsaar.streamrelay.common.url.RelayUrls;
import de.htwsaar.streamrelay.relay.domain.RelayPayload;
import de.htwsaar.streamrelay.relay.domain.RelayRequest;
import de.htwsaar.streamrelay.relay.domain.ResourceKind;
import de.htwsaar.streamrelay.relay.domain.UpstreamResponse;
import de.htwsaar.streamrelay.relay.service.RelayInputException;
import de.htwsaar.streamrelay.relay.service.RelayService;
import de.htwsaar.streamrelay.relay.service.RelayTransportException;
import de.htwsaar.streamrelay.relay.service.RelayUpstreamException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP-Adapter des Relays: {@code GET /stream?url=...&h=...}.
 *
 * <p>Kein Fachcode hier – nur Parameter-Parsing, Header-Mapping und Fehlerbehandlung.
 * Segmente werden ungepuffert durchgereicht, Playlists umgeschrieben ausgeliefert.</p>
 */
@RestController
@Profile("relay")
public class StreamRelayController {

    private static final Logger log = LoggerFactory.getLogger(StreamRelayController.class);

    static final String PLAYLIST_CONTENT_TYPE = "application/vnd.apple.mpegurl";
    static final String SEGMENT_CACHE_CONTROL = "public, max-age=3600";
    private static final List<String> PASSTHROUGH_HEADERS =
            List.of(HttpHeaders.CONTENT_LENGTH, HttpHeaders.CONTENT_RANGE, HttpHeaders.ACCEPT_RANGES);

    private final RelayService relayService;
    private final String publicOrigin;

    /**
     * Constructor Injection.
     *
     * @param relayService fachlicher Relay-Service
     * @param publicOrigin fester öffentlicher Origin; leer = aus der Anfrage ableiten
     */
    public StreamRelayController(RelayService relayService, @Value("${relay.public-origin:}") String publicOrigin) {
        this.relayService = relayService;
        this.publicOrigin = publicOrigin == null ? "" : publicOrigin.trim();
    }

    /**
     * Holt die Ziel-Ressource und leitet sie weiter.
     *
     * @param url      Ziel-URL
     * @param hints    Base64-Header-Hinweise
     * @param range    Range-Header des Clients
     * @param request  Servlet-Request (für den Relay-Origin)
     * @param response Servlet-Response, in die direkt geschrieben wird
     * @throws IOException wenn der Client die Verbindung abbricht
     */
    @GetMapping(RelayUrls.STREAM_PATH)
    public void stream(
            @RequestParam(value = RelayUrls.URL_PARAM, required = false) String url,
            @RequestParam(value = RelayUrls.HINTS_PARAM, required = false) String hints,
            @RequestHeader(value = HttpHeaders.RANGE, required = false) String range,
            HttpServletRequest request,
            HttpServletResponse response)
            throws IOException {

        RelayRequest relayRequest = RelayRequestParser.parse(url, hints, range);
        try (RelayPayload payload = relayService.relay(relayRequest, relayOrigin(request))) {
            if (payload.kind() == ResourceKind.PLAYLIST) {
                writePlaylist(response, payload.playlist());
            } else {
                streamSegment(response, payload.stream());
            }
        }
    }

    @ExceptionHandler(RelayInputException.class)
    public ResponseEntity<Map<String, Object>> onInvalidInput(RelayInputException ex) {
        return ResponseEntity.badRequest().body(error(ex.getMessage()));
    }

    @ExceptionHandler(RelayUpstreamException.class)
    public ResponseEntity<Map<String, Object>> onUpstreamFailure(RelayUpstreamException ex) {
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode());
        String reason = status != null ? status.getReasonPhrase() : ex.getMessage();
        Map<String, Object> body = error("Upstream error: " + reason);
        body.put("status", ex.getStatusCode());
        return ResponseEntity.status(ex.getStatusCode()).body(body);
    }

    @ExceptionHandler(RelayTransportException.class)
    public ResponseEntity<Map<String, Object>> onTransportFailure(RelayTransportException ex) {
        Map<String, Object> body = error("Failed to fetch stream");
        body.put("details", ex.getMessage());
        return ResponseEntity.internalServerError().body(body);
    }

    private static void writePlaylist(HttpServletResponse response, String playlist) throws IOException {
        byte[] bytes = playlist.getBytes(StandardCharsets.UTF_8);
        response.setStatus(HttpServletResponse.SC_OK);
        response.setContentType(PLAYLIST_CONTENT_TYPE);
        response.setHeader(HttpHeaders.CACHE_CONTROL, "no-cache");
        response.setContentLength(bytes.length);
        response.getOutputStream().write(bytes);
    }

    private static void streamSegment(HttpServletResponse response, UpstreamResponse upstream) throws IOException {
        response.setStatus(upstream.statusCode());
        String ct = upstream.contentType();
        response.setContentType(ct != null && !ct.isBlank() ? ct : "application/octet-stream");
        for (String name : PASSTHROUGH_HEADERS) {
            upstream.firstHeader(name).ifPresent(value -> response.setHeader(name, value));
        }
        response.setHeader(HttpHeaders.CACHE_CONTROL, SEGMENT_CACHE_CONTROL);

        OutputStream out = response.getOutputStream();
        try (InputStream in = upstream.body()) {
            long copied = in.transferTo(out);
            log.debug("Streamed {} bytes", copied);
        }
        out.flush();
    }

    /** Öffentlicher Origin des Relays: konfiguriert oder aus Forwarded-/Host-Headern. */
    String relayOrigin(HttpServletRequest request) {
        if (!publicOrigin.isEmpty()) return RelayUrls.stripTrailingSlash(publicOrigin);

        String proto = request.getHeader("X-Forwarded-Proto");
        if (proto == null || proto.isBlank()) proto = request.getScheme();
        proto = proto.split(",")[0].trim();

        String host = request.getHeader(HttpHeaders.HOST);
        if (host == null || host.isBlank()) {
            int port = request.getServerPort();
            boolean defaultPort = port <= 0 || port == 80 || port == 443;
            host = request.getServerName() + (defaultPort ? "" : ":" + port);
        }
        return proto + "://" + host.trim();
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        return body;
    }
}
