package de.htwsaar.streamrelay.relay.service;

/**
 * Ungültige Client-Anfrage (fehlende oder unbrauchbare Parameter).
 * Wird im Web-Layer auf HTTP 400 gemappt.
 */
public class RelayInputException extends RuntimeException {

    public RelayInputException(String message) {
        super(message);
    }
}
