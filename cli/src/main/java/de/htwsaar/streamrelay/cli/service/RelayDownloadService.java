package de.htwsaar.streamrelay.cli.service;

import de.htwsaar.streamrelay.cli.dto.DownloadResult;
import de.htwsaar.streamrelay.common.url.RelayUrls;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Objects;

/**
 * Lädt eine Ziel-URL über den Relay herunter.
 *
 * <p>Schreibt erfolgreiche Downloads atomar: erst in eine .part-Datei, dann Move auf Zielpfad.</p>
 */
public final class RelayDownloadService {

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public RelayDownloadService(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    /**
     * @param relayBase    Basis-URL des Relays
     * @param targetUrl    absolute Ziel-URL
     * @param encodedHints Base64-Header-Hinweise oder {@code null}
     * @param out          Ziel-Dateipfad
     * @param overwrite    ob bestehende Dateien ersetzt werden sollen
     * @return Ergebnis inkl. StatusCode/Bytes oder Error
     */
    public DownloadResult download(URI relayBase, String targetUrl, String encodedHints, Path out, boolean overwrite) {
        Objects.requireNonNull(relayBase, "relayBase");
        Objects.requireNonNull(targetUrl, "targetUrl");
        Objects.requireNonNull(out, "out");

        URI relayUri = URI.create(RelayUrls.wrap(relayBase.toString(), targetUrl, encodedHints));
        HttpRequest req = HttpRequest.newBuilder(relayUri).timeout(requestTimeout).GET().build();

        HttpResponse<InputStream> resp;
        try {
            resp = httpClient.send(req, HttpResponse.BodyHandlers.ofInputStream());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DownloadResult.ioError("interrupted");
        } catch (IOException e) {
            return DownloadResult.ioError(e.getMessage());
        }

        int sc = resp.statusCode();
        try (InputStream body = resp.body()) {
            if (sc >= 200 && sc < 300) {
                writeAtomically(body, out, overwrite);
                return DownloadResult.ok(sc, Files.size(out));
            }
            // Fehler-Body verwerfen
            body.transferTo(OutputStream.nullOutputStream());
            return DownloadResult.httpError(sc);
        } catch (IOException e) {
            return DownloadResult.ioError(e.getMessage());
        }
    }

    private static void writeAtomically(InputStream in, Path out, boolean overwrite) throws IOException {
        Path parent = out.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        if (Files.exists(out) && !overwrite) {
            throw new IOException("output file exists");
        }

        String baseName = out.getFileName() == null ? "download" : out.getFileName().toString();
        Path tmp = Files.createTempFile(parent != null ? parent : Path.of("."), baseName, ".part");

        try {
            Files.copy(in, tmp, StandardCopyOption.REPLACE_EXISTING);
            if (overwrite) {
                Files.move(tmp, out, StandardCopyOption.REPLACE_EXISTING);
            } else {
                Files.move(tmp, out);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
