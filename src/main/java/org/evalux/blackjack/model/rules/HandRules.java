package org.evalux.blackjack.model.rules;

import org.evalux.blackjack.model.Card;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

public final class HandRules {
    private HandRules(){}

    public static final int BLACKJACK = 21;

    /**
     * Tous les totaux atteignables, triés et sans doublon.
     * Chaque As vaut 1 ou 11 indépendamment : deux As donnent {2, 12, 22}.
     */
    public static SortedSet<Integer> possibleValues(Iterable<Card> cards) {
        int base = 0, aces = 0;
        for (Card c : cards) {
            if (c.getRank().isAce()) aces++;
            else base += c.value();
        }
        SortedSet<Integer> totals = new TreeSet<>();
        totals.add(base);
        for (int i = 0; i < aces; i++) {
            SortedSet<Integer> next = new TreeSet<>();
            for (int t : totals) {
                for (int p : Card.Rank.ACE.points()) next.add(t + p);
            }
            totals = next;
        }
        return Collections.unmodifiableSortedSet(totals);
    }

    /** Plus grand total <= 21, sinon le plus petit (main bust, affichage seulement). */
    public static int bestValue(Iterable<Card> cards) {
        SortedSet<Integer> values = possibleValues(cards);
        SortedSet<Integer> safe = values.headSet(BLACKJACK + 1);
        return safe.isEmpty() ? values.first() : safe.last();
    }

    public static boolean isBusted(Iterable<Card> cards) {
        return possibleValues(cards).first() > BLACKJACK;
    }
}
