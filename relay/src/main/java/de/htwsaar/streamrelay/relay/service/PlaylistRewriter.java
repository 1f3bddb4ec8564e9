package de.htwsaar.streamrelay.relay.service;

import de.htwsaar.streamrelay.common.hints.HeaderHintCodec;
import de.htwsaar.streamrelay.common.url.RelayUrls;
import de.htwsaar.streamrelay.relay.domain.RewriteContext;
import java.net.URI;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Schreibt jede Referenz einer HLS-Playlist auf das Relay um.
 *
 * <p>Zeilenweise: Tag-Zeilen behalten alles außer {@code URI="..."}-Attributen,
 * Referenz-Zeilen werden komplett ersetzt, Leerzeilen und Zeilenenden bleiben erhalten.
 * Jede umgeschriebene URL trägt den erfolgreichen Referer als {@code h}-Parameter.</p>
 */
@Service
public class PlaylistRewriter {

    private static final Logger log = LoggerFactory.getLogger(PlaylistRewriter.class);

    private static final Pattern URI_ATTRIBUTE = Pattern.compile("URI=\"([^\"]*)\"");
    private static final Pattern HAS_SCHEME = Pattern.compile("^[A-Za-z][A-Za-z0-9+.-]*:");

    /**
     * @param playlist Playlist-Text des Upstreams
     * @param ctx      Kontext der Playlist
     * @return umgeschriebene Playlist, gleiche Zeilenanzahl
     */
    public String rewrite(String playlist, RewriteContext ctx) {
        String hints = HeaderHintCodec.encodeReferer(ctx.winningCredential());
        String[] lines = playlist.split("\n", -1);
        StringBuilder out = new StringBuilder(playlist.length() + lines.length * 64);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) out.append('\n');
            out.append(rewriteLine(lines[i], ctx, hints));
        }
        return out.toString();
    }

    private String rewriteLine(String line, RewriteContext ctx, String hints) {
        boolean cr = line.endsWith("\r");
        String content = cr ? line.substring(0, line.length() - 1) : line;
        String trimmed = content.trim();
        if (trimmed.isEmpty()) return line;

        String rewritten;
        if (trimmed.startsWith("#")) {
            if (!content.contains("URI=\"")) return line;
            rewritten = rewriteUriAttributes(content, ctx, hints);
        } else {
            Optional<String> absolute = resolve(trimmed, ctx);
            if (absolute.isEmpty()) return line;
            rewritten = RelayUrls.wrap(ctx.relayOrigin(), absolute.get(), hints);
        }
        return cr ? rewritten + "\r" : rewritten;
    }

    private String rewriteUriAttributes(String tagLine, RewriteContext ctx, String hints) {
        Matcher m = URI_ATTRIBUTE.matcher(tagLine);
        StringBuilder sb = new StringBuilder(tagLine.length() + 64);
        while (m.find()) {
            String replacement = resolve(m.group(1), ctx)
                    .map(abs -> "URI=\"" + RelayUrls.wrap(ctx.relayOrigin(), abs, hints) + "\"")
                    .orElse(m.group());
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * Löst eine Referenz gegen die Playlist auf.
     *
     * @param reference Referenz aus der Playlist
     * @param ctx       Kontext
     * @return absolute URL oder leer, wenn sie sich nicht auflösen lässt
     */
    Optional<String> resolve(String reference, RewriteContext ctx) {
        String ref = reference.trim();
        if (ref.isEmpty()) return Optional.empty();
        if (HAS_SCHEME.matcher(ref).lookingAt()) return Optional.of(ref);
        try {
            URI resolved;
            if (ref.startsWith("//")) {
                resolved = URI.create(ctx.scheme() + ":" + ref);
            } else if (ref.startsWith("/")) {
                resolved = URI.create(ctx.targetOrigin() + ref);
            } else {
                resolved = URI.create(ctx.baseUrl()).resolve(ref);
            }
            if (resolved.getHost() == null) return Optional.empty();
            return Optional.of(resolved.toString());
        } catch (IllegalArgumentException e) {
            log.debug("Leaving unresolvable playlist reference untouched: {}", ref);
            return Optional.empty();
        }
    }
}
