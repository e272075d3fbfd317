package org.evalux.blackjack.model;

import lombok.Value;

import java.util.List;

@Value
public class Card {
    Rank rank;
    Suit suit;

    /** Valeur "dure" de la carte : l'As compte 1 ici, le 11 est géré par HandRules. */
    public int value() {
        return rank.points().get(0);
    }

    @Override
    public String toString() {
        return rank.label() + suit.symbol();
    }

    public enum Suit {
        CLUBS("♣"), DIAMONDS("♦"), HEARTS("♥"), SPADES("♠");

        private final String symbol;

        Suit(String symbol) { this.symbol = symbol; }

        public String symbol() { return symbol; }
    }

    public enum Rank {
        TWO("2", 2), THREE("3", 3), FOUR("4", 4), FIVE("5", 5), SIX("6", 6),
        SEVEN("7", 7), EIGHT("8", 8), NINE("9", 9), TEN("10", 10),
        JACK("J", 10), QUEEN("Q", 10), KING("K", 10),
        ACE("A", 1, 11);

        private final String label;
        private final List<Integer> points;

        Rank(String label, Integer... points) {
            this.label = label;
            this.points = List.of(points);
        }

        public String label() { return label; }

        /** 1 ou 2 valeurs possibles, croissantes. */
        public List<Integer> points() { return points; }

        public boolean isAce() { return this == ACE; }
    }
}
