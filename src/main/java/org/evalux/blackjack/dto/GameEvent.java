package org.evalux.blackjack.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class GameEvent {
    public enum Type {
        BET_ACCEPTED, CARDS_DEALT, PLAYER_ACTION, DEALER_CARD,
        ROUND_COMPLETE, NEW_ROUND, SHOE_REPLACED, COMMAND_REJECTED
    }

    Type type;
    Object payload;
}
