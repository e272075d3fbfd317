package org.evalux.blackjack.model;

import lombok.Value;

@Value
public class GameSettings {
    public static final int DEFAULT_DECK_COUNT = 6;
    public static final int MIN_DECKS = 1, MAX_DECKS = 8;

    String playerName;
    int deckCount;
    long startingBankroll;

    public static GameSettings of(String playerName, int deckCount) {
        return new GameSettings(playerName, deckCount, Player.DEFAULT_BANKROLL);
    }

    /** Configuration casino standard : 6 jeux, bankroll par défaut. */
    public static GameSettings defaultSinglePlayer(String playerName) {
        return of(playerName, DEFAULT_DECK_COUNT);
    }

    /**
     * @return this, pour chaîner
     * @throws IllegalArgumentException à la première valeur invalide
     */
    public GameSettings validate() {
        if (playerName == null || playerName.trim().isEmpty())
            throw new IllegalArgumentException("Player name cannot be empty");
        if (deckCount < MIN_DECKS || deckCount > MAX_DECKS)
            throw new IllegalArgumentException("Deck count must be between 1 and 8");
        if (startingBankroll < 0)
            throw new IllegalArgumentException("Starting bankroll cannot be negative");
        return this;
    }
}
