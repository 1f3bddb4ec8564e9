package de.htwsaar.streamrelay.relay.domain;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Transport-agnostische Antwort eines Upstream-Versuchs.
 *
 * <p>Gehört genau einem Versuch; wird geschlossen, sobald der Versuch verworfen oder
 * der Body vollständig weitergeleitet wurde.</p>
 *
 * @param statusCode  HTTP-Statuscode
 * @param contentType Content-Type Header (optional)
 * @param body        Body-Stream (nicht gepuffert)
 * @param headers     Antwort-Header, Namen ohne Beachtung der Groß-/Kleinschreibung
 */
public record UpstreamResponse(int statusCode, String contentType, InputStream body, Map<String, List<String>> headers)
        implements Closeable {

    public UpstreamResponse {
        Objects.requireNonNull(body, "body must not be null");
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, values) -> {
                if (name != null) copy.put(name, List.copyOf(values));
            });
        }
        headers = Collections.unmodifiableMap(copy);
    }

    /**
     * Erster Wert eines Headers.
     *
     * @param name Header-Name
     * @return Wert oder leer
     */
    public Optional<String> firstHeader(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.ofNullable(values.get(0));
    }

    @Override
    public void close() throws IOException {
        body.close();
    }
}
