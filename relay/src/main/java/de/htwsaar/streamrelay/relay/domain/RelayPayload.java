package de.htwsaar.streamrelay.relay.domain;

import java.io.Closeable;
import java.io.IOException;
import java.util.Objects;

/**
 * Fachliches Ergebnis einer Relay-Anfrage, ohne HTTP-Framework-Typen.
 *
 * @param kind           Ressourcenart
 * @param playlist       umgeschriebene Playlist (nur {@link ResourceKind#PLAYLIST})
 * @param stream         offene Upstream-Antwort zum Durchreichen (sonst)
 * @param winningReferer Referer des erfolgreichen Versuchs
 */
public record RelayPayload(ResourceKind kind, String playlist, UpstreamResponse stream, String winningReferer)
        implements Closeable {

    public RelayPayload {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(winningReferer, "winningReferer must not be null");
        if (kind == ResourceKind.PLAYLIST) {
            Objects.requireNonNull(playlist, "playlist must not be null");
        } else {
            Objects.requireNonNull(stream, "stream must not be null");
        }
    }

    public static RelayPayload playlist(String rewritten, String winningReferer) {
        return new RelayPayload(ResourceKind.PLAYLIST, rewritten, null, winningReferer);
    }

    public static RelayPayload stream(ResourceKind kind, UpstreamResponse response, String winningReferer) {
        return new RelayPayload(kind, null, response, winningReferer);
    }

    @Override
    public void close() throws IOException {
        if (stream != null) stream.close();
    }
}
