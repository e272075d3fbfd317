package org.evalux.blackjack.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Un participant : le joueur humain (avec bankroll) ou le croupier (une seule main).
 * La liste de mains grandit au split et revient à une main vide au reset.
 */
@Getter
public class Player {
    public static final long DEFAULT_BANKROLL = 10_000L;

    private final String name;
    private final List<Hand> hands = new ArrayList<>();
    private long bankroll;

    public Player(String name, long bankroll) {
        this.name = name;
        this.bankroll = bankroll;
        hands.add(new Hand());
    }

    public static Player withBankroll(String name, long bankroll) {
        return new Player(name, bankroll);
    }

    public static Player dealer() {
        return new Player("Dealer", 0L);
    }

    public List<Hand> getHands() {
        return Collections.unmodifiableList(hands);
    }

    public Hand hand(int index) {
        return hands.get(index);
    }

    public Hand firstHand() {
        return hands.get(0);
    }

    public boolean hasHand(int index) {
        return index >= 0 && index < hands.size();
    }

    /** Index invalide : la carte est ignorée. */
    public void addCardToHand(Card card, int index) {
        if (hasHand(index)) hands.get(index).add(card);
    }

    public void insertHand(int index, Hand hand) {
        hands.add(index, hand);
    }

    public void debit(long amount) { bankroll -= amount; }

    public void credit(long amount) { bankroll += amount; }

    public void resetHands() {
        hands.clear();
        hands.add(new Hand());
    }
}
