package de.htwsaar.streamrelay.relay.adapter.http;

import de.htwsaar.streamrelay.relay.domain.UpstreamClient;
import de.htwsaar.streamrelay.relay.domain.UpstreamResponse;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.zip.GZIPInputStream;
import java.util.zip.InflaterInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP-Adapter zum Upstream-CDN auf Basis von {@link HttpClient}.
 *
 * <p>Enthält alle HTTP-Details: Browser-Header, Header-Filter, Dekomprimierung.
 * Die Relay-Logik hängt ausschließlich am {@link UpstreamClient}-Port.</p>
 */
public final class HttpUpstreamClient implements UpstreamClient {

    private static final Logger log = LoggerFactory.getLogger(HttpUpstreamClient.class);

    static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/131.0.0.0 Safari/537.36";

    /** Header, die der Client setzt oder die {@link HttpClient} nicht erlaubt. */
    private static final Set<String> MANAGED_HEADERS = Set.of(
            "host", "connection", "content-length", "expect", "upgrade", "range", "referer", "accept-encoding");

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    /**
     * Erstellt den HTTP-Adapter.
     *
     * @param httpClient     HTTP-Client (darf nicht {@code null} sein)
     * @param requestTimeout Timeout pro Versuch bis zu den Antwort-Headern
     */
    public HttpUpstreamClient(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
    }

    @Override
    public UpstreamResponse fetch(URI target, String referer, Map<String, String> extraHeaders, String rangeHeader)
            throws IOException {

        HttpRequest.Builder builder =
                HttpRequest.newBuilder(target).timeout(requestTimeout).GET();
        try {
            browserHeaders(referer).forEach(builder::setHeader);
            if (rangeHeader != null && !rangeHeader.isBlank()) {
                builder.setHeader("Range", rangeHeader);
            }
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid request header for " + target.getHost() + ": " + e.getMessage(), e);
        }
        if (extraHeaders != null) {
            extraHeaders.forEach((name, value) -> applyHint(builder, name, value));
        }

        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while fetching from " + target.getHost());
        }
        return decode(response);
    }

    /**
     * Header, mit denen sich der Relay als Browser auf der Referer-Seite ausgibt.
     *
     * <p>Enthält weder {@code Origin} noch {@code Sec-Fetch-*}.</p>
     *
     * @param referer Referer des Versuchs
     * @return Header in Sende-Reihenfolge
     */
    static Map<String, String> browserHeaders(String referer) {
        Map<String, String> h = new LinkedHashMap<>();
        h.put("User-Agent", USER_AGENT);
        h.put("Accept", "*/*");
        h.put("Accept-Language", "en-US,en;q=0.9");
        h.put("Accept-Encoding", "gzip, deflate");
        h.put("Cache-Control", "no-cache");
        h.put("Pragma", "no-cache");
        h.put("Referer", referer);
        return h;
    }

    private static void applyHint(HttpRequest.Builder builder, String name, String value) {
        if (name == null || value == null || MANAGED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) return;
        try {
            builder.setHeader(name, value);
        } catch (IllegalArgumentException e) {
            log.debug("Skipping header hint {}: {}", name, e.getMessage());
        }
    }

    /** Entpackt gzip/deflate; Content-Length und Content-Encoding gelten danach nicht mehr. */
    private static UpstreamResponse decode(HttpResponse<InputStream> response) throws IOException {
        Map<String, List<String>> headers = new LinkedHashMap<>(response.headers().map());
        String contentType = response.headers().firstValue("Content-Type").orElse(null);
        String encoding = response.headers()
                .firstValue("Content-Encoding")
                .orElse("")
                .trim()
                .toLowerCase(Locale.ROOT);

        InputStream raw = response.body();
        InputStream body = raw;
        if (encoding.equals("gzip") || encoding.equals("deflate")) {
            headers.keySet().removeIf(n -> n.equalsIgnoreCase("Content-Length") || n.equalsIgnoreCase("Content-Encoding"));
            if (encoding.equals("gzip")) {
                try {
                    body = new GZIPInputStream(raw, 8192);
                } catch (EOFException e) {
                    // leerer Body trotz Content-Encoding
                    raw.close();
                    body = InputStream.nullInputStream();
                }
            } else {
                body = new InflaterInputStream(raw);
            }
        }
        return new UpstreamResponse(response.statusCode(), contentType, body, headers);
    }
}
