package de.htwsaar.streamrelay.relay.service;

import de.htwsaar.streamrelay.relay.domain.AttemptPhase;
import de.htwsaar.streamrelay.relay.domain.AttemptSpec;
import de.htwsaar.streamrelay.relay.domain.CredentialCandidate;
import de.htwsaar.streamrelay.relay.domain.RewriteContext;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reine Planung der Upstream-Versuche; führt selbst nichts aus.
 *
 * <ol>
 *   <li>erster Versuch mit dem aufgelösten Referer</li>
 *   <li>Fallback-Liste plus Origin der Ziel-URL, ohne bereits probierte Werte</li>
 *   <li>nur Playlists mit Origin-Hinweis: dieselbe Liste ohne Origin-Header</li>
 * </ol>
 */
public final class RetryPolicy {

    public static final List<String> DEFAULT_FALLBACKS = List.of(
            "https://megacloud.blog/", "https://megacloud.tv/", "https://hianime.to/", "https://aniwatch.to/");

    private final List<String> fallbackReferers;

    public RetryPolicy(List<String> fallbackReferers) {
        this.fallbackReferers = fallbackReferers.stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_FALLBACKS);
    }

    /**
     * Erster Versuch plus Fallback-Durchgang.
     *
     * @param target  Ziel-URL
     * @param initial Referer des ersten Versuchs
     * @return geordnete Versuche, jeder Referer höchstens einmal
     */
    public List<AttemptSpec> initialAndFallbacks(URI target, CredentialCandidate initial) {
        List<AttemptSpec> plan = new ArrayList<>();
        plan.add(new AttemptSpec(AttemptPhase.INITIAL, initial, false));
        for (String referer : candidates(target)) {
            if (!referer.equals(initial.referer())) {
                plan.add(new AttemptSpec(AttemptPhase.FALLBACK, new CredentialCandidate(referer), false));
            }
        }
        return plan;
    }

    /**
     * Zusätzlicher Durchgang ohne Origin-Header.
     *
     * @param target     Ziel-URL
     * @param playlist   ob die Ressource eine Playlist ist
     * @param originHint ob der Client einen Origin-Header vorgegeben hat
     * @return Versuche oder leere Liste
     */
    public List<AttemptSpec> originlessPass(URI target, boolean playlist, boolean originHint) {
        if (!playlist || !originHint) return List.of();
        List<AttemptSpec> plan = new ArrayList<>();
        for (String referer : candidates(target)) {
            plan.add(new AttemptSpec(AttemptPhase.ORIGINLESS, new CredentialCandidate(referer), true));
        }
        return plan;
    }

    /** @return Origin der Ziel-URL mit abschließendem Slash */
    static String targetOriginReferer(URI target) {
        return RewriteContext.originOf(target) + "/";
    }

    private List<String> candidates(URI target) {
        Set<String> unique = new LinkedHashSet<>(fallbackReferers);
        unique.add(targetOriginReferer(target));
        return List.copyOf(unique);
    }
}
