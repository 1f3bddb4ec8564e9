package de.htwsaar.streamrelay.relay.domain;

import java.io.IOException;
import java.util.Objects;

/**
 * Ergebnis eines einzelnen Upstream-Versuchs.
 *
 * <p>Nur akzeptierte Versuche tragen eine offene {@link UpstreamResponse} (Segmente) oder den
 * gepufferten Playlist-Text. Verworfene Versuche haben ihren Body bereits freigegeben.</p>
 *
 * @param spec           geplanter Versuch
 * @param statusCode     HTTP-Status; 0 bei Transportfehler
 * @param kind           Ressourcenart (UNKNOWN bei Transportfehler)
 * @param accepted       ob der Versuch verwendet werden kann
 * @param response       offene Antwort (nur akzeptierte Segment-/Unknown-Versuche)
 * @param playlistText   gepufferter Body (nur akzeptierte Playlists)
 * @param failureReason  Grund der Ablehnung
 * @param transportError Transportfehler oder {@code null}
 */
public record AttemptResult(
        AttemptSpec spec,
        int statusCode,
        ResourceKind kind,
        boolean accepted,
        UpstreamResponse response,
        String playlistText,
        String failureReason,
        IOException transportError) {

    public AttemptResult {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public static AttemptResult streamable(AttemptSpec spec, ResourceKind kind, UpstreamResponse response) {
        return new AttemptResult(spec, response.statusCode(), kind, true, response, null, null, null);
    }

    public static AttemptResult playlist(AttemptSpec spec, int statusCode, String text) {
        return new AttemptResult(spec, statusCode, ResourceKind.PLAYLIST, true, null, text, null, null);
    }

    public static AttemptResult rejected(AttemptSpec spec, int statusCode, ResourceKind kind, String reason) {
        return new AttemptResult(spec, statusCode, kind, false, null, null, reason, null);
    }

    public static AttemptResult transportFailure(AttemptSpec spec, IOException error) {
        return new AttemptResult(
                spec, 0, ResourceKind.UNKNOWN, false, null, null, String.valueOf(error.getMessage()), error);
    }

    /** @return {@code true}, wenn der Upstream überhaupt mit einem Status geantwortet hat */
    public boolean hasStatus() {
        return transportError == null;
    }
}
