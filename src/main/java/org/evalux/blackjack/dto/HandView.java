package org.evalux.blackjack.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import org.evalux.blackjack.model.Card;
import org.evalux.blackjack.model.Hand;
import org.evalux.blackjack.model.HandOutcome;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HandView {
    List<Card> cards;
    long bet;
    HandOutcome outcome;
    List<Integer> possibleValues;
    int total;
    boolean busted;
    boolean blackjack;

    public static HandView of(Hand h) {
        return HandView.builder()
                .cards(List.copyOf(h.getCards()))
                .bet(h.getBet())
                .outcome(h.getOutcome())
                .possibleValues(List.copyOf(h.possibleValues()))
                .total(h.bestValue())
                .busted(h.isBusted())
                .blackjack(h.isNaturalBlackjack())
                .build();
    }
}
