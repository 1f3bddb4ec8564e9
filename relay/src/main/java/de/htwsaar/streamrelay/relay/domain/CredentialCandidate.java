package de.htwsaar.streamrelay.relay.domain;

import java.util.Objects;

/**
 * Ein Referer-Wert, mit dem ein Upstream-Versuch unternommen wird.
 *
 * @param referer Referer-Header, z. B. {@code https://megacloud.blog/}
 */
public record CredentialCandidate(String referer) {

    public CredentialCandidate {
        Objects.requireNonNull(referer, "referer must not be null");
    }
}
