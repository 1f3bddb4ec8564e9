package de.htwsaar.streamrelay.relay.domain;

import java.net.URI;
import java.util.Objects;

/**
 * Kontext für das Umschreiben genau einer Playlist.
 *
 * @param baseUrl           Verzeichnis der Playlist inkl. abschließendem Slash
 * @param targetOrigin      Schema + Host (+ Port) der Playlist
 * @param relayOrigin       Schema + Host des Relays selbst
 * @param winningCredential Referer des erfolgreichen Versuchs
 */
public record RewriteContext(String baseUrl, String targetOrigin, String relayOrigin, String winningCredential) {

    public RewriteContext {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        Objects.requireNonNull(targetOrigin, "targetOrigin must not be null");
        Objects.requireNonNull(relayOrigin, "relayOrigin must not be null");
        Objects.requireNonNull(winningCredential, "winningCredential must not be null");
    }

    /**
     * Leitet Basis-URL und Origin aus der Playlist-URL ab.
     *
     * @param target            URL der Playlist
     * @param relayOrigin       Origin des Relays
     * @param winningCredential erfolgreicher Referer
     * @return neuer Kontext
     */
    public static RewriteContext of(URI target, String relayOrigin, String winningCredential) {
        String origin = originOf(target);
        String path = target.getRawPath();
        if (path == null || path.isEmpty()) path = "/";
        String directory = path.substring(0, path.lastIndexOf('/') + 1);
        return new RewriteContext(origin + directory, origin, relayOrigin, winningCredential);
    }

    /**
     * @param uri absolute URI
     * @return {@code scheme://host[:port]}
     */
    public static String originOf(URI uri) {
        return uri.getScheme() + "://" + uri.getHost() + (uri.getPort() >= 0 ? ":" + uri.getPort() : "");
    }

    /** @return Schema der Playlist-URL, für schema-relative Referenzen */
    public String scheme() {
        return targetOrigin.substring(0, targetOrigin.indexOf(':'));
    }
}
