package de.htwsaar.streamrelay.cli.service;

import de.htwsaar.streamrelay.cli.dto.HttpCallResult;
import de.htwsaar.streamrelay.common.url.RelayUrls;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Prüft, ob unter einer Basis-URL ein Relay antwortet.
 *
 * <p>Ein Aufruf von {@code /stream} ohne {@code url} muss mit 400 und JSON beantwortet werden.
 * Statische Hosts liefern dagegen meist eine HTML-Seite oder 404.</p>
 */
public final class RelayProbeService {

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public RelayProbeService(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    /**
     * @param relayBase Basis-URL des Relays
     * @return Antwort auf {@code GET <relayBase>/stream?probe=1}
     */
    public HttpCallResult probe(URI relayBase) {
        URI probeUri = URI.create(RelayUrls.stripTrailingSlash(relayBase.toString()) + RelayUrls.STREAM_PATH + "?probe=1");
        HttpRequest req = HttpRequest.newBuilder(probeUri)
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        try {
            HttpResponse<String> resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
            return HttpCallResult.http(
                    resp.statusCode(), resp.headers().firstValue("Content-Type").orElse(""), resp.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HttpCallResult.ioError("interrupted");
        } catch (IOException e) {
            return HttpCallResult.ioError(e.getMessage());
        }
    }

    /**
     * @param result Probe-Antwort
     * @return {@code true}, wenn die Antwort von einem Relay stammt
     */
    public static boolean looksLikeRelay(HttpCallResult result) {
        if (result.statusCode() == null) return false;
        String ct = Objects.toString(result.contentType(), "").toLowerCase(Locale.ROOT);
        if (result.statusCode() == 400) return ct.contains("json");
        return result.is2xx() && !ct.contains("html");
    }
}
