package de.htwsaar.streamrelay.cli.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Optional;

/**
 * URI helpers for CLI input validation.
 */
public final class UriUtils {
    private UriUtils() {}

    /**
     * @param raw user input
     * @return absolute http(s) URI with host, or empty
     */
    public static Optional<URI> parseHttpUri(String raw) {
        if (raw == null) return Optional.empty();
        String trimmed = raw.trim();
        try {
            URI u = new URI(trimmed);
            String scheme = u.getScheme();
            if (scheme == null || u.getHost() == null) return Optional.empty();
            if (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https")) return Optional.empty();
            return Optional.of(u);
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }
}
