package de.htwsaar.streamrelay.relay.config;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Zuordnung einer CDN-Familie zu dem Referer, den ihre Hosts erwarten.
 *
 * @param name      Name der Familie (nur für Logs)
 * @param fragments Host-Fragmente; ein Treffer genügt
 * @param referer   zu sendender Referer
 */
public record RefererRule(String name, List<String> fragments, String referer) {

    public RefererRule {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(referer, "referer must not be null");
        fragments = fragments.stream().map(f -> f.toLowerCase(Locale.ROOT)).toList();
    }

    /**
     * @param hostname Hostname in Kleinbuchstaben
     * @return {@code true}, wenn der Hostname eines der Fragmente enthält
     */
    public boolean matches(String hostname) {
        for (String fragment : fragments) {
            if (hostname.contains(fragment)) return true;
        }
        return false;
    }
}
