package org.evalux.blackjack.model;

import lombok.extern.slf4j.Slf4j;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.*;

/**
 * Sabot de plusieurs jeux de 52 cartes. Les cartes tirées vont dans la défausse ;
 * disponibles + défausse = deckCount jeux complets jusqu'au prochain changement de sabot.
 */
@Slf4j
public class Shoe {
    private final int deckCount;
    private final Random rnd;
    private final Duration changePause;
    private final List<Card> available = new ArrayList<>();
    private final List<Card> discarded = new ArrayList<>();

    public Shoe(int deckCount) {
        this(deckCount, new SecureRandom(), Duration.ZERO);
    }

    public Shoe(int deckCount, Random rnd, Duration changePause) {
        this.deckCount = deckCount;
        this.rnd = rnd;
        this.changePause = changePause == null ? Duration.ZERO : changePause;
        available.addAll(freshCards(deckCount));
    }

    /** Ordre déterministe : rang puis couleur, répété pour chaque jeu. */
    static List<Card> freshCards(int decks) {
        List<Card> tmp = new ArrayList<>(52 * decks);
        for (int d = 0; d < decks; d++) {
            for (Card.Rank r : Card.Rank.values()) {
                for (Card.Suit s : Card.Suit.values()) tmp.add(new Card(r, s));
            }
        }
        return tmp;
    }

    public static int minimumCardsFor(int numPlayers) {
        // (joueurs + croupier) * 2 cartes initiales * 2 de marge pour hits/splits
        return (numPlayers + 1) * 2 * 2;
    }

    /** Mélange les cartes disponibles uniquement. */
    public void shuffle() {
        Collections.shuffle(available, rnd);
    }

    /** Tire la carte du dessus (fin de liste) ; vide si le sabot est épuisé. */
    public Optional<Card> draw() {
        if (available.isEmpty()) return Optional.empty();
        Card c = available.remove(available.size() - 1);
        discarded.add(c);
        return Optional.of(c);
    }

    /**
     * Remplace le sabot (neuf, mélangé) s'il reste moins de cartes que le minimum
     * pour une donne. À appeler avant chaque donne initiale.
     *
     * @return true si le sabot a été changé
     */
    public boolean ensureCardsForPlayers(int numPlayers) {
        int min = minimumCardsFor(numPlayers);
        if (available.size() >= min) return false;

        log.info("Changement de sabot: {} cartes restantes (< {}), nouveau sabot de {} jeux",
                available.size(), min, deckCount);
        available.clear();
        discarded.clear();
        available.addAll(freshCards(deckCount));
        shuffle();
        pause();
        return true;
    }

    private void pause() {
        if (changePause.isZero() || changePause.isNegative()) return;
        try {
            Thread.sleep(changePause.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Pause de changement de sabot interrompue");
        }
    }

    public int deckCount() { return deckCount; }

    public int remaining() { return available.size(); }

    public int discardedCount() { return discarded.size(); }

    public boolean isEmpty() { return available.isEmpty(); }

    public List<Card> availableCards() { return Collections.unmodifiableList(available); }

    public List<Card> discardedCards() { return Collections.unmodifiableList(discarded); }
}
