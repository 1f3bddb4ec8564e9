package de.htwsaar.streamrelay.relay.service;

/**
 * Fachliche Exception, wenn kein Versuch eine verwendbare Antwort lieferte,
 * der Upstream aber zumindest geantwortet hat.
 * Wird im Web-Layer in HTTP-Statuscodes gemappt.
 */
public class RelayUpstreamException extends RuntimeException {

    private final int statusCode;

    /**
     * Erstellt eine neue Upstream-Exception.
     *
     * @param message    Fehlerbeschreibung
     * @param statusCode an den Client zu meldender Statuscode
     */
    public RelayUpstreamException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * Gibt den zugehörigen HTTP-Statuscode zurück.
     *
     * @return HTTP-Statuscode
     */
    public int getStatusCode() {
        return statusCode;
    }
}
