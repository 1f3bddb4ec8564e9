package de.htwsaar.streamrelay.cli.dto;

/**
 * Ergebnis eines HTTP-Aufrufs gegen den Relay.
 *
 * @param statusCode  HTTP-Status (nur bei HTTP-Antwort)
 * @param contentType Content-Type der Antwort
 * @param body        Antwort-Body
 * @param error       Fehlertext bei IO-Problemen
 */
public record HttpCallResult(Integer statusCode, String contentType, String body, String error) {

    public static HttpCallResult http(int statusCode, String contentType, String body) {
        return new HttpCallResult(statusCode, contentType, body, null);
    }

    public static HttpCallResult ioError(String message) {
        return new HttpCallResult(null, null, null, message == null ? "io error" : message);
    }

    public boolean is2xx() {
        return statusCode != null && statusCode >= 200 && statusCode < 300;
    }
}
