package de.htwsaar.streamrelay.relay.service;

/**
 * Jeder Versuch scheiterte auf Transportebene (DNS, Verbindung, Timeout).
 * Wird im Web-Layer auf HTTP 500 gemappt.
 */
public class RelayTransportException extends RuntimeException {

    public RelayTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
