package de.htwsaar.streamrelay.relay.domain;

/**
 * Ergebnis der Auswahl über alle Versuche einer Anfrage.
 *
 * @param winner             erster akzeptierter Versuch oder {@code null}
 * @param lastAttempt        letzter ausgeführter Versuch oder {@code null}
 * @param lastObservedStatus letzter vom Upstream gelieferte Status oder {@code null},
 *                           wenn jeder Versuch am Transport scheiterte
 * @param attempts           Anzahl ausgeführter Versuche
 */
public record AttemptSelection(
        AttemptResult winner, AttemptResult lastAttempt, Integer lastObservedStatus, int attempts) {

    public boolean succeeded() {
        return winner != null;
    }
}
