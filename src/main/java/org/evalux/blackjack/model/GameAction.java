package org.evalux.blackjack.model;

import java.util.Locale;
import java.util.Optional;

public enum GameAction {
    HIT("h", "hit"),
    STAND("s", "stand"),
    DOUBLE("d", "double"),
    SPLIT("p", "split");

    private final String shortToken;
    private final String token;

    GameAction(String shortToken, String token) {
        this.shortToken = shortToken;
        this.token = token;
    }

    /** Insensible à la casse et aux espaces ; vide si l'action n'est pas reconnue. */
    public static Optional<GameAction> parse(String value) {
        if (value == null) return Optional.empty();
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (GameAction a : values()) {
            if (a.shortToken.equals(v) || a.token.equals(v)) return Optional.of(a);
        }
        return Optional.empty();
    }

    public String label() {
        return name();
    }
}
