package org.evalux.blackjack.model.rules;

import org.evalux.blackjack.model.Hand;
import org.evalux.blackjack.model.HandOutcome;

import java.util.Optional;

public final class PayoutRules {
    private PayoutRules(){}

    /** credit = montant rendu au joueur, mise comprise. */
    public record Outcome(HandOutcome outcome, long credit) {}

    /** Blackjack naturel : mise + 3:2. */
    public static long blackjackCredit(long bet) {
        return bet + (bet * 3) / 2;
    }

    /** Règlement immédiat après la donne si un blackjack naturel est présent. */
    public static Optional<Outcome> naturals(Hand player, Hand dealer) {
        long bet = player.getBet();
        boolean pBJ = player.isNaturalBlackjack(), dBJ = dealer.isNaturalBlackjack();
        if (pBJ && dBJ) return Optional.of(new Outcome(HandOutcome.PUSH, bet));
        if (pBJ) return Optional.of(new Outcome(HandOutcome.BLACKJACK, blackjackCredit(bet)));
        if (dBJ) return Optional.of(new Outcome(HandOutcome.LOSS, 0));
        return Optional.empty();
    }

    /** Comparaison de fin de main contre le croupier (paiement 1:1). */
    public static Outcome compare(Hand player, Hand dealer) {
        long bet = player.getBet();
        if (player.isBusted()) return new Outcome(HandOutcome.LOSS, 0);
        if (dealer.isBusted()) return new Outcome(HandOutcome.WIN, bet * 2);
        int pt = player.bestValue(), dt = dealer.bestValue();
        if (pt > dt) return new Outcome(HandOutcome.WIN, bet * 2);
        if (pt == dt) return new Outcome(HandOutcome.PUSH, bet);
        return new Outcome(HandOutcome.LOSS, 0);
    }
}
