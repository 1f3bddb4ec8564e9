package de.htwsaar.streamrelay.relay.service;

import de.htwsaar.streamrelay.common.hints.HeaderHintCodec;
import de.htwsaar.streamrelay.relay.domain.AttemptResult;
import de.htwsaar.streamrelay.relay.domain.AttemptSelection;
import de.htwsaar.streamrelay.relay.domain.AttemptSpec;
import de.htwsaar.streamrelay.relay.domain.Classification;
import de.htwsaar.streamrelay.relay.domain.CredentialCandidate;
import de.htwsaar.streamrelay.relay.domain.RelayPayload;
import de.htwsaar.streamrelay.relay.domain.RelayRequest;
import de.htwsaar.streamrelay.relay.domain.ResourceKind;
import de.htwsaar.streamrelay.relay.domain.RewriteContext;
import de.htwsaar.streamrelay.relay.domain.UpstreamClient;
import de.htwsaar.streamrelay.relay.domain.UpstreamResponse;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fachlicher Relay-Service: Referer auflösen, Versuche ausführen, Playlist umschreiben.
 *
 * <p><b>Kein</b> Spring-Web-Typ hier – der Upstream wird ausschließlich über den
 * {@link UpstreamClient}-Port angesprochen. Versuche laufen streng nacheinander;
 * nach dem ersten akzeptierten Versuch wird keiner mehr gestartet.</p>
 */
public class RelayService {

    private static final Logger log = LoggerFactory.getLogger(RelayService.class);

    private static final int LOG_URL_LENGTH = 80;

    private final UpstreamClient upstreamClient;
    private final CredentialResolver credentialResolver;
    private final ResponseClassifier classifier;
    private final RetryPolicy retryPolicy;
    private final PlaylistRewriter rewriter;
    private final Clock clock;
    private final Duration totalDeadline;

    /**
     * Erstellt den Service mit Constructor Injection.
     *
     * @param upstreamClient     Port zum Upstream
     * @param credentialResolver Referer-Auflösung
     * @param classifier         Antwort-Klassifizierung
     * @param retryPolicy        Versuchsplanung
     * @param rewriter           Playlist-Umschreibung
     * @param clock              Zeitquelle
     * @param totalDeadline      Obergrenze für alle Versuche einer Anfrage
     */
    public RelayService(
            UpstreamClient upstreamClient,
            CredentialResolver credentialResolver,
            ResponseClassifier classifier,
            RetryPolicy retryPolicy,
            PlaylistRewriter rewriter,
            Clock clock,
            Duration totalDeadline) {

        this.upstreamClient = Objects.requireNonNull(upstreamClient, "upstreamClient must not be null");
        this.credentialResolver = Objects.requireNonNull(credentialResolver, "credentialResolver must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.rewriter = Objects.requireNonNull(rewriter, "rewriter must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.totalDeadline = Objects.requireNonNull(totalDeadline, "totalDeadline must not be null");
    }

    /**
     * Holt die Ziel-Ressource und bereitet sie für den Client auf.
     *
     * @param request     geparste Anfrage
     * @param relayOrigin öffentlicher Origin des Relays für umgeschriebene URLs
     * @return Playlist-Text oder offener Segment-Stream; der Aufrufer muss schließen
     * @throws RelayUpstreamException  wenn der Upstream nur unbrauchbare Antworten lieferte
     * @throws RelayTransportException wenn jeder Versuch am Transport scheiterte
     */
    public RelayPayload relay(RelayRequest request, String relayOrigin) {
        URI target = request.targetUrl();
        CredentialCandidate initial = credentialResolver.resolve(
                target.getHost(), HeaderHintCodec.referer(request.clientHeaderHints()).orElse(null));

        AttemptSelection selection = AttemptSelector.select(attempts(request, initial));
        if (!selection.succeeded()) {
            throw failure(target, selection);
        }

        AttemptResult winner = selection.winner();
        String referer = winner.spec().credential().referer();
        log.info(
                "Relaying {} {} via Referer={} after {} attempt(s)",
                winner.kind(), abbreviate(target), referer, selection.attempts());

        if (winner.kind() == ResourceKind.PLAYLIST) {
            String rewritten = rewriter.rewrite(winner.playlistText(), RewriteContext.of(target, relayOrigin, referer));
            return RelayPayload.playlist(rewritten, referer);
        }
        return RelayPayload.stream(winner.kind(), winner.response(), referer);
    }

    /**
     * Führt genau einen Versuch aus. Verworfene Antworten werden sofort geschlossen.
     *
     * @param request Anfrage
     * @param spec    geplanter Versuch
     * @return Ergebnis des Versuchs
     */
    AttemptResult attempt(RelayRequest request, AttemptSpec spec) {
        URI target = request.targetUrl();
        UpstreamResponse response;
        try {
            response = upstreamClient.fetch(
                    target,
                    spec.credential().referer(),
                    attemptHeaders(request.clientHeaderHints(), spec.stripOrigin()),
                    request.rangeHeader());
        } catch (IOException e) {
            log.warn("{} attempt for {} with Referer={} failed: {}",
                    spec.phase(), abbreviate(target), spec.credential().referer(), e.toString());
            return AttemptResult.transportFailure(spec, e);
        }

        Classification c = classifier.classify(response.statusCode(), response.contentType(), target.getPath());
        if (!c.acceptable()) {
            discard(response);
            String reason = c.disguisedError() ? "HTML error page instead of media" : "HTTP " + response.statusCode();
            log.warn("{} attempt for {} with Referer={} rejected (status {}): {}",
                    spec.phase(), abbreviate(target), spec.credential().referer(), response.statusCode(), reason);
            return AttemptResult.rejected(spec, response.statusCode(), c.kind(), reason);
        }

        if (c.kind() != ResourceKind.PLAYLIST) {
            return AttemptResult.streamable(spec, c.kind(), response);
        }

        String text;
        try (UpstreamResponse r = response) {
            text = new String(r.body().readAllBytes(), charsetOf(r.contentType()));
        } catch (IOException e) {
            log.warn("Reading playlist with Referer={} failed: {}", spec.credential().referer(), e.toString());
            return AttemptResult.transportFailure(spec, e);
        }
        if (!classifier.hasPlaylistMarker(text)) {
            log.warn("{} attempt for {} with Referer={} rejected (status {}): missing #EXTM3U",
                    spec.phase(), abbreviate(target), spec.credential().referer(), response.statusCode());
            return AttemptResult.rejected(spec, response.statusCode(), ResourceKind.PLAYLIST, "missing #EXTM3U marker");
        }
        return AttemptResult.playlist(spec, response.statusCode(), text);
    }

    /**
     * Lazy Folge aller Versuche; jeder Schritt führt genau einen Upstream-Aufruf aus.
     */
    private Iterable<AttemptResult> attempts(RelayRequest request, CredentialCandidate initial) {
        long deadline = clock.millis() + totalDeadline.toMillis();
        return () -> new Iterator<>() {
            private final Deque<AttemptSpec> pending =
                    new ArrayDeque<>(retryPolicy.initialAndFallbacks(request.targetUrl(), initial));
            private boolean playlist =
                    classifier.kindOf(null, request.targetUrl().getPath()) == ResourceKind.PLAYLIST;
            private boolean originlessPlanned;
            private boolean expired;
            private int executed;

            @Override
            public boolean hasNext() {
                if (expired) return false;
                if (pending.isEmpty() && !originlessPlanned) {
                    originlessPlanned = true;
                    pending.addAll(retryPolicy.originlessPass(request.targetUrl(), playlist, request.hasOriginHint()));
                }
                if (pending.isEmpty()) return false;
                if (executed > 0 && clock.millis() >= deadline) {
                    log.warn("Deadline of {} ms reached after {} attempt(s)", totalDeadline.toMillis(), executed);
                    expired = true;
                    return false;
                }
                return true;
            }

            @Override
            public AttemptResult next() {
                if (!hasNext()) throw new NoSuchElementException();
                executed++;
                AttemptResult result = attempt(request, pending.poll());
                if (result.kind() == ResourceKind.PLAYLIST) playlist = true;
                return result;
            }
        };
    }

    private RuntimeException failure(URI target, AttemptSelection selection) {
        Integer status = selection.lastObservedStatus();
        if (status == null) {
            IOException cause = selection.lastAttempt() != null ? selection.lastAttempt().transportError() : null;
            String details = cause != null ? String.valueOf(cause.getMessage()) : "no attempt was made";
            log.error("All {} attempt(s) for {} failed in transport: {}", selection.attempts(), abbreviate(target), details);
            return new RelayTransportException(details, cause);
        }
        int reported = status >= 200 && status < 300 ? 502 : status;
        String reason = selection.lastAttempt() != null ? selection.lastAttempt().failureReason() : null;
        log.error(
                "All {} attempt(s) for {} failed, last upstream status {}",
                selection.attempts(), abbreviate(target), status);
        return new RelayUpstreamException(reason != null ? reason : "HTTP " + status, reported);
    }

    /** Client-Hinweise ohne Referer (wird pro Versuch gesetzt) und ggf. ohne Origin. */
    static Map<String, String> attemptHeaders(Map<String, String> hints, boolean stripOrigin) {
        Map<String, String> headers = new LinkedHashMap<>();
        hints.forEach((name, value) -> {
            if (HeaderHintCodec.REFERER.equalsIgnoreCase(name)) return;
            if (stripOrigin && "Origin".equalsIgnoreCase(name)) return;
            headers.put(name, value);
        });
        return headers;
    }

    static Charset charsetOf(String contentType) {
        if (contentType != null) {
            for (String param : contentType.split(";")) {
                String p = param.trim();
                if (p.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                    try {
                        return Charset.forName(p.substring("charset=".length()).replace("\"", "").trim());
                    } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                        log.debug("Unknown playlist charset {}, falling back to UTF-8", p);
                    }
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    private static void discard(UpstreamResponse response) {
        try {
            response.close();
        } catch (IOException e) {
            log.debug("Closing rejected upstream body failed: {}", e.toString());
        }
    }

    private static String abbreviate(URI target) {
        String s = target.toString();
        return s.length() <= LOG_URL_LENGTH ? s : s.substring(0, LOG_URL_LENGTH) + "...";
    }
}
