package de.htwsaar.streamrelay.common.url;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Bau und Zerlegung von Relay-URLs der Form
 * {@code <relayOrigin>/stream?url=<percent-encoded URL>&h=<percent-encoded Base64>}.
 *
 * <p>Einzige Stelle, an der Relay-URLs zusammengesetzt werden: Relay (Playlist-Rewriting)
 * und CLI nutzen dieselbe Logik.</p>
 */
public final class RelayUrls {

    public static final String STREAM_PATH = "/stream";
    public static final String URL_PARAM = "url";
    public static final String HINTS_PARAM = "h";

    private RelayUrls() {
        // Utility-Klasse, keine Instanzen.
    }

    /**
     * Baut eine Relay-URL.
     *
     * @param relayOrigin  Schema + Host des Relays, z. B. {@code https://relay.example}
     * @param targetUrl    absolute Ziel-URL
     * @param encodedHints Base64-Header-Hinweise oder {@code null}
     * @return vollständige Relay-URL
     */
    public static String wrap(String relayOrigin, String targetUrl, String encodedHints) {
        StringBuilder sb = new StringBuilder(stripTrailingSlash(relayOrigin))
                .append(STREAM_PATH)
                .append('?')
                .append(URL_PARAM)
                .append('=')
                .append(encode(targetUrl));
        if (encodedHints != null && !encodedHints.isBlank()) {
            sb.append('&').append(HINTS_PARAM).append('=').append(encode(encodedHints));
        }
        return sb.toString();
    }

    /**
     * Zerlegt eine Relay-URL in Ziel-URL und Header-Hinweise.
     *
     * @param relayUrl Relay-URL (absolut oder nur Pfad + Query)
     * @return {@link RelayLink}; fehlende Parameter sind {@code null}
     */
    public static RelayLink unwrap(String relayUrl) {
        if (relayUrl == null) return new RelayLink(null, null);
        int q = relayUrl.indexOf('?');
        if (q < 0) return new RelayLink(null, null);

        String target = null;
        String hints = null;
        for (String pair : relayUrl.substring(q + 1).split("&")) {
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            if (URL_PARAM.equals(name) && target == null) {
                target = value;
            } else if (HINTS_PARAM.equals(name) && hints == null) {
                hints = value;
            }
        }
        return new RelayLink(target, hints);
    }

    /**
     * Entfernt abschließende Slashes, damit {@code origin + "/stream"} keinen doppelten Slash erzeugt.
     *
     * @param origin Origin, z. B. {@code http://localhost:8080/}
     * @return Origin ohne Slash am Ende; bei {@code null} ein leerer String
     */
    public static String stripTrailingSlash(String origin) {
        if (origin == null) return "";
        String o = origin.trim();
        while (o.endsWith("/")) o = o.substring(0, o.length() - 1);
        return o;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
