package de.htwsaar.streamrelay.relay.domain;

/**
 * Art der angefragten Ressource; steuert, ob gestreamt oder umgeschrieben wird.
 */
public enum ResourceKind {
    PLAYLIST,
    SEGMENT,
    UNKNOWN
}
