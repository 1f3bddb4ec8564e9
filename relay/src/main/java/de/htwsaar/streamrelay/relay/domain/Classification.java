package de.htwsaar.streamrelay.relay.domain;

import java.util.Objects;

/**
 * Ergebnis der Antwort-Klassifizierung.
 *
 * @param ok             Status im 2xx-Bereich
 * @param kind           Ressourcenart
 * @param disguisedError Erfolgsstatus, aber HTML-Fehlerseite statt Segment
 */
public record Classification(boolean ok, ResourceKind kind, boolean disguisedError) {

    public Classification {
        Objects.requireNonNull(kind, "kind must not be null");
    }

    /** @return {@code true}, wenn die Antwort (vorbehaltlich Playlist-Marker) verwendbar ist */
    public boolean acceptable() {
        return ok && !disguisedError;
    }
}
