package org.evalux.blackjack.service;

import lombok.RequiredArgsConstructor;
import org.evalux.blackjack.config.BlackjackProperties;
import org.evalux.blackjack.dto.CommandResult;
import org.evalux.blackjack.dto.GameState;
import org.evalux.blackjack.dto.RoundSummary;
import org.evalux.blackjack.events.SpringGameEventBridge;
import org.evalux.blackjack.model.GameAction;
import org.evalux.blackjack.model.GameSettings;
import org.evalux.blackjack.model.Shoe;
import org.evalux.blackjack.service.engine.BlackjackGame;
import org.evalux.blackjack.service.registry.GameRegistry;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.List;
import java.util.function.Function;

/**
 * Point d'entrée par session. Les appels d'une même session sont sérialisés sur sa partie ;
 * un id inconnu lève IllegalArgumentException, une action illégale renvoie un CommandResult refusé.
 */
@Service
@RequiredArgsConstructor
public class GameSessionService {

    private final GameRegistry registry;
    private final SpringGameEventBridge events;
    private final RoundHistoryService history;
    private final BlackjackProperties properties;

    public String createSession(String playerName) {
        return createSession(playerName, properties.getDefaultDeckCount());
    }

    public String createSession(String playerName, int deckCount) {
        GameSettings settings = new GameSettings(playerName, deckCount, properties.getStartingBankroll()).validate();
        return registry.create(id -> {
            Shoe shoe = new Shoe(deckCount, new SecureRandom(), properties.getShoeChangePause());
            BlackjackGame game = new BlackjackGame(settings, shoe, events.forSession(id));
            game.shuffleShoe();
            return game;
        });
    }

    public GameState state(String sessionId) {
        return withGame(sessionId, BlackjackGame::getState);
    }

    public CommandResult bet(String sessionId, long amount) {
        return withGame(sessionId, g -> g.acceptBet(amount));
    }

    public CommandResult deal(String sessionId) {
        return withGame(sessionId, BlackjackGame::dealInitialCards);
    }

    public CommandResult act(String sessionId, GameAction action, int handIndex) {
        return withGame(sessionId, g -> g.processPlayerAction(action, handIndex));
    }

    /** Jeton texte (h/hit, s/stand, d/double, p/split) ; inconnu = UNKNOWN_ACTION. */
    public CommandResult act(String sessionId, String actionToken, int handIndex) {
        return GameAction.parse(actionToken)
                .map(a -> act(sessionId, a, handIndex))
                .orElseGet(() -> CommandResult.rejected(CommandResult.Reason.UNKNOWN_ACTION));
    }

    public CommandResult dealerStep(String sessionId) {
        return withGame(sessionId, BlackjackGame::nextDealerTurn);
    }

    public CommandResult playDealer(String sessionId) {
        return withGame(sessionId, BlackjackGame::playDealer);
    }

    public CommandResult nextRound(String sessionId) {
        return withGame(sessionId, BlackjackGame::nextRound);
    }

    public List<RoundSummary> history(String sessionId) {
        registry.get(sessionId);
        return history.history(sessionId);
    }

    public boolean close(String sessionId) {
        boolean removed = registry.remove(sessionId);
        history.forget(sessionId);
        return removed;
    }

    private <T> T withGame(String sessionId, Function<BlackjackGame, T> call) {
        BlackjackGame game = registry.get(sessionId);
        synchronized (game) {
            return call.apply(game);
        }
    }
}
