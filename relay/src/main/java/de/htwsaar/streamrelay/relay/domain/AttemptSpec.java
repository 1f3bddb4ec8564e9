package de.htwsaar.streamrelay.relay.domain;

import java.util.Objects;

/**
 * Plan für genau einen Upstream-Versuch.
 *
 * @param phase       Durchgang
 * @param credential  zu sendender Referer
 * @param stripOrigin {@code true}, wenn ein vom Client vorgegebener Origin-Header entfernt wird
 */
public record AttemptSpec(AttemptPhase phase, CredentialCandidate credential, boolean stripOrigin) {

    public AttemptSpec {
        Objects.requireNonNull(phase, "phase must not be null");
        Objects.requireNonNull(credential, "credential must not be null");
    }
}
