package de.htwsaar.streamrelay.cli.di;

import java.io.PrintWriter;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;

/**
 * Gemeinsamer Laufzeit-Kontext für CLI-Commands.
 *
 * <p>Hier gehören nur generische Abhängigkeiten hinein (I/O, HTTP, Timeouts),
 * keine fachlichen Services.</p>
 */
public final class CliContext {
    private final PrintWriter out;
    private final PrintWriter err;
    private final HttpClient httpClient;
    private final Duration defaultRequestTimeout;

    /**
     * Erzeugt einen neuen CLI-Kontext.
     *
     * @param out Writer für normale Ausgaben
     * @param err Writer für Fehlermeldungen
     * @param httpClient gemeinsamer HTTP-Client für Relay-Aufrufe
     * @param defaultRequestTimeout Standard-Timeout für HTTP-Requests
     */
    public CliContext(PrintWriter out, PrintWriter err, HttpClient httpClient, Duration defaultRequestTimeout) {
        this.out = Objects.requireNonNull(out);
        this.err = Objects.requireNonNull(err);
        this.httpClient = Objects.requireNonNull(httpClient);
        this.defaultRequestTimeout = Objects.requireNonNull(defaultRequestTimeout);
    }

    public PrintWriter out() {
        return out;
    }

    public PrintWriter err() {
        return err;
    }

    public HttpClient httpClient() {
        return httpClient;
    }

    public Duration defaultRequestTimeout() {
        return defaultRequestTimeout;
    }
}
