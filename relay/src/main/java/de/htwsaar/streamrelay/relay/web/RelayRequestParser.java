package de.htwsaar.streamrelay.relay.web;

import de.htwsaar.streamrelay.common.hints.HeaderHintCodec;
import de.htwsaar.streamrelay.relay.domain.RelayRequest;
import de.htwsaar.streamrelay.relay.service.RelayInputException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Übersetzt die Query-Parameter von {@code /stream} in eine {@link RelayRequest}.
 */
final class RelayRequestParser {

    static final String MISSING_URL = "Missing url parameter";
    static final String INVALID_URL = "Invalid url parameter";

    /** Zeichen, die CDNs gern unkodiert ausliefern, {@link URI} aber ablehnt. */
    private static final String LENIENT_CHARS = " \"<>\\^`{|}";

    private RelayRequestParser() {}

    /**
     * @param url          Ziel-URL (bereits url-dekodiert)
     * @param encodedHints {@code h}-Parameter oder {@code null}
     * @param range        Range-Header oder {@code null}
     * @return geparste Anfrage
     * @throws RelayInputException bei fehlender oder ungültiger Ziel-URL
     */
    static RelayRequest parse(String url, String encodedHints, String range) {
        if (url == null || url.isBlank()) {
            throw new RelayInputException(MISSING_URL);
        }
        URI target;
        try {
            target = new URI(escapeLenient(url.trim()));
        } catch (URISyntaxException e) {
            throw new RelayInputException(INVALID_URL);
        }
        String scheme = target.getScheme() == null ? "" : target.getScheme().toLowerCase(Locale.ROOT);
        if (!(scheme.equals("http") || scheme.equals("https")) || target.getHost() == null) {
            throw new RelayInputException(INVALID_URL);
        }
        return new RelayRequest(target, HeaderHintCodec.decode(encodedHints), range == null || range.isBlank() ? null : range);
    }

    private static String escapeLenient(String url) {
        StringBuilder sb = new StringBuilder(url.length());
        for (char c : url.toCharArray()) {
            if (LENIENT_CHARS.indexOf(c) >= 0) {
                sb.append('%').append(String.format("%02X", (int) c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
