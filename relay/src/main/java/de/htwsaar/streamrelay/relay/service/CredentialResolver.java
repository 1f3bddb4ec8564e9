package de.htwsaar.streamrelay.relay.service;

import de.htwsaar.streamrelay.common.hints.HeaderHintCodec;
import de.htwsaar.streamrelay.relay.config.RefererTable;
import de.htwsaar.streamrelay.relay.domain.CredentialCandidate;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Bestimmt den Referer des ersten Versuchs.
 *
 * <p>Ein vom Client vorgegebener Referer hat immer Vorrang; sonst entscheidet die
 * {@link RefererTable} anhand des Hostnamens.</p>
 */
@Service
public class CredentialResolver {

    private static final Logger log = LoggerFactory.getLogger(CredentialResolver.class);

    private final RefererTable table;

    public CredentialResolver(RefererTable table) {
        this.table = Objects.requireNonNull(table, "table must not be null");
    }

    /**
     * @param hostname     Host der Ziel-URL
     * @param explicitHint Referer aus den Client-Hinweisen oder {@code null}; Werte mit
     *                     Steuerzeichen werden ignoriert
     * @return Referer für den ersten Versuch
     */
    public CredentialCandidate resolve(String hostname, String explicitHint) {
        if (explicitHint != null && !explicitHint.isBlank() && HeaderHintCodec.isHeaderSafe(explicitHint)) {
            return new CredentialCandidate(explicitHint.trim());
        }
        return table.lookup(hostname)
                .map(rule -> {
                    log.debug("Host {} matched referer rule {}", hostname, rule.name());
                    return new CredentialCandidate(rule.referer());
                })
                .orElseGet(() -> new CredentialCandidate(table.defaultReferer()));
    }
}
