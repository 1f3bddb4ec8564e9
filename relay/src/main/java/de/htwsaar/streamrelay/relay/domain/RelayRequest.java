package de.htwsaar.streamrelay.relay.domain;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * Eingehende Relay-Anfrage nach dem Parsen.
 *
 * @param targetUrl         absolute http(s)-Ziel-URL
 * @param clientHeaderHints dekodierte Header-Hinweise des Clients (ggf. leer)
 * @param rangeHeader       weiterzuleitender Range-Header oder {@code null}
 */
public record RelayRequest(URI targetUrl, Map<String, String> clientHeaderHints, String rangeHeader) {

    public RelayRequest {
        Objects.requireNonNull(targetUrl, "targetUrl must not be null");
        if (!targetUrl.isAbsolute() || targetUrl.getHost() == null) {
            throw new IllegalArgumentException("targetUrl must be absolute: " + targetUrl);
        }
        clientHeaderHints = clientHeaderHints == null ? Map.of() : Map.copyOf(clientHeaderHints);
    }

    /** @return {@code true}, wenn der Client einen Origin-Header vorgibt */
    public boolean hasOriginHint() {
        return clientHeaderHints.keySet().stream().anyMatch("Origin"::equalsIgnoreCase);
    }
}
