package org.evalux.blackjack.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CardTest {

    @Test
    void points_asADeuxValeurs() {
        assertThat(Card.Rank.ACE.points()).containsExactly(1, 11);
        assertThat(Card.Rank.ACE.isAce()).isTrue();
    }

    @Test
    void points_figuresValent10() {
        assertThat(Card.Rank.TEN.points()).containsExactly(10);
        assertThat(Card.Rank.JACK.points()).containsExactly(10);
        assertThat(Card.Rank.QUEEN.points()).containsExactly(10);
        assertThat(Card.Rank.KING.points()).containsExactly(10);
    }

    @Test
    void points_cartesBassesValentLeurNumero() {
        int expected = 2;
        for (Card.Rank r : new Card.Rank[]{Card.Rank.TWO, Card.Rank.THREE, Card.Rank.FOUR, Card.Rank.FIVE,
                Card.Rank.SIX, Card.Rank.SEVEN, Card.Rank.EIGHT, Card.Rank.NINE}) {
            assertThat(r.points()).containsExactly(expected++);
        }
    }

    @Test
    void toString_rangPuisCouleur() {
        assertThat(new Card(Card.Rank.ACE, Card.Suit.CLUBS)).hasToString("A♣");
        assertThat(new Card(Card.Rank.TEN, Card.Suit.HEARTS)).hasToString("10♥");
        assertThat(new Card(Card.Rank.KING, Card.Suit.DIAMONDS)).hasToString("K♦");
    }

    @Test
    void egalite_parValeur() {
        assertThat(new Card(Card.Rank.NINE, Card.Suit.SPADES)).isEqualTo(new Card(Card.Rank.NINE, Card.Suit.SPADES));
        assertThat(new Card(Card.Rank.NINE, Card.Suit.SPADES)).isNotEqualTo(new Card(Card.Rank.NINE, Card.Suit.HEARTS));
    }
}
