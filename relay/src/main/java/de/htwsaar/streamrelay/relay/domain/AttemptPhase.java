package de.htwsaar.streamrelay.relay.domain;

/**
 * Durchgang, zu dem ein Upstream-Versuch gehört.
 */
public enum AttemptPhase {
    /** erster Versuch mit dem aufgelösten oder vom Client vorgegebenen Referer */
    INITIAL,
    /** feste Fallback-Liste */
    FALLBACK,
    /** nur Playlists: Fallback-Liste erneut, ohne Origin-Header */
    ORIGINLESS
}
