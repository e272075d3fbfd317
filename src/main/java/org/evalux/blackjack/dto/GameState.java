package org.evalux.blackjack.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Value;
import org.evalux.blackjack.model.GamePhase;

import java.util.List;

/**
 * Photo immuable de la manche. Seuls les champs valides pour la phase sont remplis,
 * les autres restent null (et absents du JSON).
 */
@Value
@Builder(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GameState {
    GamePhase phase;
    long bankroll;
    Long bet;
    HandView dealerHand;
    List<HandView> playerHands;
    Integer activeHandIndex;

    public static GameState waitingForBet(long bankroll) {
        return GameState.builder().phase(GamePhase.WAITING_FOR_BET).bankroll(bankroll).build();
    }

    public static GameState waitingToDeal(long bet, long bankroll) {
        return GameState.builder().phase(GamePhase.WAITING_TO_DEAL).bet(bet).bankroll(bankroll).build();
    }

    public static GameState playerTurn(HandView dealer, List<HandView> hands, long bankroll, int activeHandIndex) {
        return table(GamePhase.PLAYER_TURN, dealer, hands, bankroll).activeHandIndex(activeHandIndex).build();
    }

    public static GameState dealerTurn(HandView dealer, List<HandView> hands, long bankroll) {
        return table(GamePhase.DEALER_TURN, dealer, hands, bankroll).build();
    }

    public static GameState roundComplete(HandView dealer, List<HandView> hands, long bankroll) {
        return table(GamePhase.ROUND_COMPLETE, dealer, hands, bankroll).build();
    }

    private static GameStateBuilder table(GamePhase phase, HandView dealer, List<HandView> hands, long bankroll) {
        List<HandView> copy = List.copyOf(hands);
        return GameState.builder()
                .phase(phase)
                .bankroll(bankroll)
                .bet(copy.isEmpty() ? null : copy.get(0).getBet())
                .dealerHand(dealer)
                .playerHands(copy);
    }
}
