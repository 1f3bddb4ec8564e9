package de.htwsaar.streamrelay.relay.domain;

import java.io.IOException;
import java.net.URI;
import java.util.Map;

/**
 * Port zur Abstraktion der Transport-Schicht zum Upstream-CDN.
 * Ein Aufruf ist genau ein Versuch; Wiederholungen orchestriert der Relay-Service.
 */
public interface UpstreamClient {

    /**
     * Führt einen GET gegen die Ziel-URL aus.
     *
     * @param target       absolute Ziel-URL
     * @param referer      zu sendender Referer
     * @param extraHeaders zusätzliche Header aus den Client-Hinweisen
     * @param rangeHeader  weiterzuleitender Range-Header oder {@code null}
     * @return Antwort mit ungepuffertem Body; der Aufrufer muss sie schließen
     * @throws IOException bei Netzwerk-, DNS- oder Timeout-Fehlern
     */
    UpstreamResponse fetch(URI target, String referer, Map<String, String> extraHeaders, String rangeHeader)
            throws IOException;
}
