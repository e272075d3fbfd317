package org.evalux.blackjack.dto;

/** Résultat d'une commande : acceptée, ou refusée sans changement d'état. */
public record CommandResult(boolean accepted, Reason reason) {

    public enum Reason {
        WRONG_PHASE, INVALID_BET, INSUFFICIENT_BANKROLL, NOT_SPLITTABLE,
        WRONG_HAND, SHOE_EXHAUSTED, UNKNOWN_ACTION
    }

    private static final CommandResult OK = new CommandResult(true, null);

    public static CommandResult ok() { return OK; }

    public static CommandResult rejected(Reason reason) {
        return new CommandResult(false, reason);
    }
}
