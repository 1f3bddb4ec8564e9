package de.htwsaar.streamrelay.relay.config;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Unveränderliche Tabelle Host-Fragment → Referer.
 *
 * <p>Regeln werden in Tabellenreihenfolge geprüft; die erste passende gewinnt.</p>
 *
 * @param rules          geordnete Regeln
 * @param defaultReferer Referer für unbekannte Hosts
 */
public record RefererTable(List<RefererRule> rules, String defaultReferer) {

    public static final String MEGACLOUD_REFERER = "https://megacloud.blog/";

    public RefererTable {
        rules = List.copyOf(rules);
        Objects.requireNonNull(defaultReferer, "defaultReferer must not be null");
    }

    /**
     * Tabelle mit den bekannten CDN-Familien.
     *
     * @return Standard-Tabelle
     */
    public static RefererTable defaults() {
        return new RefererTable(
                List.of(
                        new RefererRule(
                                "megacloud",
                                List.of(
                                        "megacloud", "haildrop", "rapid-cloud", "megaup", "lightningspark",
                                        "sunshinerays", "surfparadise", "moonjump", "skydrop", "wetransfer",
                                        "bicdn", "bcdn", "b-cdn", "bunny", "mcloud", "fogtwist", "statics",
                                        "mgstatics", "lasercloud", "cloudrax", "stormshade", "thunderwave",
                                        "raincloud", "snowfall", "rainveil", "thunderstrike", "sunburst",
                                        "clearskyline"),
                                MEGACLOUD_REFERER),
                        new RefererRule("vidcloud", List.of("vidcloud", "vidstreaming"), "https://vidcloud.blog/"),
                        new RefererRule("hianime", List.of("hianime", "aniwatch"), "https://hianime.to/"),
                        new RefererRule("gogoanime", List.of("gogoanime", "gogocdn"), "https://gogoanime.cl/"),
                        new RefererRule("animepahe", List.of("kwik", "animepahe"), "https://animepahe.ru/")),
                MEGACLOUD_REFERER);
    }

    /**
     * @param referer neuer Standard-Referer
     * @return Kopie mit ausgetauschtem Standard
     */
    public RefererTable withDefaultReferer(String referer) {
        return new RefererTable(rules, referer);
    }

    /**
     * Sucht die erste Regel, deren Fragment im Hostnamen vorkommt.
     *
     * @param hostname Hostname (Groß-/Kleinschreibung egal)
     * @return passende Regel oder leer
     */
    public Optional<RefererRule> lookup(String hostname) {
        if (hostname == null) return Optional.empty();
        String host = hostname.toLowerCase(Locale.ROOT);
        return rules.stream().filter(r -> r.matches(host)).findFirst();
    }
}
