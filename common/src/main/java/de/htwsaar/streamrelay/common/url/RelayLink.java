package de.htwsaar.streamrelay.common.url;

import de.htwsaar.streamrelay.common.hints.HeaderHintCodec;
import java.util.Map;

/**
 * Aufgeschlüsselte Relay-URL.
 *
 * @param targetUrl    dekodierte Ziel-URL (Parameter {@code url}), ggf. {@code null}
 * @param encodedHints roher Base64-Wert des Parameters {@code h}, ggf. {@code null}
 */
public record RelayLink(String targetUrl, String encodedHints) {

    /** @return dekodierte Header-Hinweise (leer, wenn keine oder ungültig) */
    public Map<String, String> hints() {
        return HeaderHintCodec.decode(encodedHints);
    }
}
