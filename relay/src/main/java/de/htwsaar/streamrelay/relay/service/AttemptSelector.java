package de.htwsaar.streamrelay.relay.service;

import de.htwsaar.streamrelay.relay.domain.AttemptResult;
import de.htwsaar.streamrelay.relay.domain.AttemptSelection;

/**
 * Wählt den ersten akzeptierten Versuch aus einer (lazy) Folge von Versuchen.
 * Nach einem Treffer wird die Folge nicht weiter konsumiert.
 */
public final class AttemptSelector {

    private AttemptSelector() {}

    /**
     * @param attempts Versuche in Ausführungsreihenfolge
     * @return Auswahl inkl. letztem beobachteten Status
     */
    public static AttemptSelection select(Iterable<AttemptResult> attempts) {
        AttemptResult last = null;
        Integer lastStatus = null;
        int count = 0;
        for (AttemptResult attempt : attempts) {
            count++;
            if (attempt.accepted()) {
                return new AttemptSelection(attempt, attempt, attempt.statusCode(), count);
            }
            last = attempt;
            if (attempt.hasStatus()) lastStatus = attempt.statusCode();
        }
        return new AttemptSelection(null, last, lastStatus, count);
    }
}
