package org.evalux.blackjack.model.rules;

import org.evalux.blackjack.model.Player;
import org.evalux.blackjack.model.Shoe;

import java.util.List;

public final class DealingRules {
    private DealingRules(){}

    public static final int INITIAL_CARDS = 2;

    /**
     * Donne initiale : chaque joueur puis le croupier, deux tours.
     * Le sabot doit avoir été vérifié (Shoe#ensureCardsForPlayers) avant l'appel.
     */
    public static void dealInitial(Shoe shoe, List<Player> players, Player dealer) {
        for (int i = 0; i < INITIAL_CARDS; i++) {
            for (Player p : players) {
                shoe.draw().ifPresent(c -> p.addCardToHand(c, 0));
            }
            shoe.draw().ifPresent(c -> dealer.addCardToHand(c, 0));
        }
    }
}
