package org.evalux.blackjack.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PlayerTest {

    @Test
    void nouveauJoueur_uneMainVide() {
        Player p = Player.withBankroll("Alice", 5_000);

        assertThat(p.getHands()).hasSize(1);
        assertThat(p.firstHand().getCards()).isEmpty();
        assertThat(p.getBankroll()).isEqualTo(5_000);
    }

    @Test
    void addCardToHand_indexInvalideIgnore() {
        Player p = Player.withBankroll("Alice", 0);

        p.addCardToHand(new Card(Card.Rank.ACE, Card.Suit.SPADES), 999);
        p.addCardToHand(new Card(Card.Rank.ACE, Card.Suit.SPADES), -1);

        assertThat(p.firstHand().getCards()).isEmpty();
    }

    @Test
    void insertHand_puisReset() {
        Player p = Player.withBankroll("Alice", 0);
        p.addCardToHand(new Card(Card.Rank.TWO, Card.Suit.SPADES), 0);
        p.insertHand(1, Hand.withBet(10));

        assertThat(p.getHands()).hasSize(2);
        assertThat(p.hasHand(1)).isTrue();

        p.resetHands();

        assertThat(p.getHands()).hasSize(1);
        assertThat(p.firstHand().getCards()).isEmpty();
        assertThat(p.firstHand().getBet()).isZero();
    }

    @Test
    void debitCredit_soldeSigne() {
        Player p = Player.withBankroll("Alice", 100);
        p.debit(150);
        assertThat(p.getBankroll()).isEqualTo(-50);
        p.credit(300);
        assertThat(p.getBankroll()).isEqualTo(250);
    }

    @Test
    void dealer_sansBankroll() {
        Player d = Player.dealer();
        assertThat(d.getBankroll()).isZero();
        assertThat(d.getHands()).hasSize(1);
    }
}
