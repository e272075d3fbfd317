package org.evalux.blackjack.model;

import lombok.Getter;
import lombok.Setter;
import org.evalux.blackjack.model.rules.HandRules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;

@Getter
public class Hand {
    private final List<Card> cards = new ArrayList<>();
    @Setter
    private long bet = 0;
    private HandOutcome outcome;

    public Hand() {}

    public static Hand withBet(long bet) {
        Hand h = new Hand();
        h.bet = bet;
        return h;
    }

    public static Hand withCard(Card card) {
        return withCardAndBet(card, 0);
    }

    /** Main issue d'un split : une carte et la même mise que la main d'origine. */
    public static Hand withCardAndBet(Card card, long bet) {
        Hand h = withBet(bet);
        h.cards.add(card);
        return h;
    }

    public List<Card> getCards() {
        return Collections.unmodifiableList(cards);
    }

    public void add(Card c) {
        cards.add(c);
    }

    public void doubleBet() {
        bet = bet * 2;
    }

    /** Retire la seconde carte d'une paire pour ouvrir une nouvelle main. */
    public Card splitOff() {
        if (!canSplit()) throw new IllegalStateException("Main non splittable: " + this);
        return cards.remove(1);
    }

    /** L'issue n'est écrite qu'une fois (règlement ou bust en cours de main). */
    public void settle(HandOutcome o) {
        if (outcome != null) throw new IllegalStateException("Issue déjà fixée: " + outcome);
        outcome = o;
    }

    public boolean isSettled() {
        return outcome != null;
    }

    public SortedSet<Integer> possibleValues() {
        return HandRules.possibleValues(cards);
    }

    public int bestValue() {
        return HandRules.bestValue(cards);
    }

    public boolean isNaturalBlackjack() {
        return cards.size() == 2 && bestValue() == HandRules.BLACKJACK;
    }

    /** 21 quel que soit le nombre de cartes (ex: 21 à trois cartes après split). */
    public boolean isBlackjack() {
        return bestValue() == HandRules.BLACKJACK;
    }

    public boolean isBusted() {
        return HandRules.isBusted(cards);
    }

    public boolean canSplit() {
        return cards.size() == 2 && cards.get(0).getRank() == cards.get(1).getRank();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Card c : cards) sb.append(c).append(' ');
        return sb.toString().trim();
    }
}
