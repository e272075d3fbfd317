package org.evalux.blackjack.service.engine;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.evalux.blackjack.dto.CommandResult;
import org.evalux.blackjack.dto.GameEvent;
import org.evalux.blackjack.dto.GameState;
import org.evalux.blackjack.dto.HandView;
import org.evalux.blackjack.dto.RoundSummary;
import org.evalux.blackjack.events.GameEventListener;
import org.evalux.blackjack.model.*;
import org.evalux.blackjack.model.rules.DealingRules;
import org.evalux.blackjack.model.rules.PayoutRules;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Une partie : un joueur, le croupier et un sabot, pilotés phase par phase
 * (mise, donne, tour du joueur, tour du croupier, règlement).
 * <p>
 * Chaque commande s'exécute entièrement ou est refusée ({@link CommandResult#rejected})
 * sans toucher à l'état. Aucune exception ne sort d'une commande.
 * Non thread-safe : l'appelant sérialise les accès.
 */
@Slf4j
public class BlackjackGame {

    /** Le croupier tire jusqu'à 16 et reste à partir de 17. */
    public static final int DEALER_STANDS_ON = 17;
    private static final int PLAYERS = 1;

    @Getter
    private final GameSettings settings;
    private final Shoe shoe;
    private final Player player;
    private final Player dealer;
    private final GameEventListener listener;

    @Getter
    private GameState state;
    private int activeHandIndex = 0;
    @Getter
    private int roundNumber = 0;

    /** Sabot non mélangé : appeler {@link #shuffleShoe()} avant de jouer. */
    public BlackjackGame(GameSettings settings) {
        this(settings, new Shoe(settings.validate().getDeckCount()), GameEventListener.NOOP);
    }

    public BlackjackGame(GameSettings settings, Shoe shoe, GameEventListener listener) {
        this.settings = settings.validate();
        this.shoe = shoe;
        this.listener = listener;
        this.player = Player.withBankroll(settings.getPlayerName().trim(), settings.getStartingBankroll());
        this.dealer = Player.dealer();
        this.state = GameState.waitingForBet(player.getBankroll());
    }

    public GamePhase phase() {
        return state.getPhase();
    }

    public String playerName() {
        return player.getName();
    }

    public void shuffleShoe() {
        shoe.shuffle();
    }

    // ---------- mise ----------

    public CommandResult acceptBet(long bet) {
        if (phase() != GamePhase.WAITING_FOR_BET) return reject("BET", CommandResult.Reason.WRONG_PHASE);
        if (bet < 0) return reject("BET", CommandResult.Reason.INVALID_BET);
        if (bet > player.getBankroll()) return reject("BET", CommandResult.Reason.INSUFFICIENT_BANKROLL);

        player.debit(bet);
        player.firstHand().setBet(bet);
        state = GameState.waitingToDeal(bet, player.getBankroll());
        emit(GameEvent.Type.BET_ACCEPTED, Map.of("bet", bet, "bankroll", player.getBankroll()));
        return CommandResult.ok();
    }

    // ---------- donne ----------

    public CommandResult dealInitialCards() {
        if (phase() != GamePhase.WAITING_TO_DEAL) return reject("DEAL", CommandResult.Reason.WRONG_PHASE);

        if (shoe.ensureCardsForPlayers(PLAYERS)) {
            emit(GameEvent.Type.SHOE_REPLACED, Map.of("cards", shoe.remaining(), "decks", settings.getDeckCount()));
        }
        DealingRules.dealInitial(shoe, List.of(player), dealer);
        roundNumber++;
        activeHandIndex = 0;

        Hand hand = player.firstHand();
        Hand dealerHand = dealer.firstHand();
        emit(GameEvent.Type.CARDS_DEALT, Map.of(
                "round", roundNumber,
                "player", HandView.of(hand),
                "dealerUp", dealerHand.getCards().isEmpty() ? "" : dealerHand.getCards().get(0)
        ));

        Optional<PayoutRules.Outcome> natural = PayoutRules.naturals(hand, dealerHand);
        if (natural.isPresent()) {
            settle(hand, natural.get());
            completeRound();
            return CommandResult.ok();
        }

        state = playerTurnState();
        return CommandResult.ok();
    }

    // ---------- tour du joueur ----------

    public CommandResult processPlayerAction(GameAction action, int handIndex) {
        if (action == null) return reject("ACTION", CommandResult.Reason.UNKNOWN_ACTION);
        String name = action.label();
        if (phase() != GamePhase.PLAYER_TURN) return reject(name, CommandResult.Reason.WRONG_PHASE);
        if (handIndex != activeHandIndex) return reject(name, CommandResult.Reason.WRONG_HAND);

        Hand hand = player.hand(handIndex);
        CommandResult result = switch (action) {
            case HIT -> hit(hand, handIndex);
            case STAND -> stand(handIndex);
            case DOUBLE -> doubleDown(hand, handIndex);
            case SPLIT -> split(hand, handIndex);
        };
        if (result.accepted()) {
            emit(GameEvent.Type.PLAYER_ACTION, Map.of(
                    "action", name,
                    "handIndex", handIndex,
                    "hand", HandView.of(hand),
                    "phase", phase()
            ));
        }
        return result;
    }

    private CommandResult hit(Hand hand, int index) {
        Optional<Card> card = shoe.draw();
        if (card.isEmpty()) return reject(GameAction.HIT.label(), CommandResult.Reason.SHOE_EXHAUSTED);

        hand.add(card.get());
        if (hand.isBusted()) {
            hand.settle(HandOutcome.LOSS);
            log.debug("Main {} bust à {}", index, hand.bestValue());
            finishHand(index, true);
        } else if (hand.isBlackjack()) {
            // 21 ne s'améliore pas : stand automatique
            finishHand(index, false);
        } else {
            state = playerTurnState();
        }
        return CommandResult.ok();
    }

    private CommandResult stand(int index) {
        finishHand(index, false);
        return CommandResult.ok();
    }

    /** Une seule carte, mise doublée, puis la main est terminée quoi qu'il arrive. */
    private CommandResult doubleDown(Hand hand, int index) {
        Optional<Card> card = shoe.draw();
        if (card.isEmpty()) return reject(GameAction.DOUBLE.label(), CommandResult.Reason.SHOE_EXHAUSTED);

        hand.add(card.get());
        player.debit(hand.getBet());
        hand.doubleBet();
        finishHand(index, false);
        return CommandResult.ok();
    }

    /**
     * La seconde carte ouvre une main en index+1 avec la même mise ; la main
     * d'origine reçoit tout de suite une carte et reste la main active.
     */
    private CommandResult split(Hand hand, int index) {
        if (!hand.canSplit()) return reject(GameAction.SPLIT.label(), CommandResult.Reason.NOT_SPLITTABLE);
        if (shoe.isEmpty()) return reject(GameAction.SPLIT.label(), CommandResult.Reason.SHOE_EXHAUSTED);

        Card splitCard = hand.splitOff();
        long bet = hand.getBet();
        player.debit(bet);
        player.insertHand(index + 1, Hand.withCardAndBet(splitCard, bet));
        shoe.draw().ifPresent(hand::add);
        state = playerTurnState();
        return CommandResult.ok();
    }

    /**
     * Passe à la main splittée suivante (qui reçoit sa deuxième carte), sinon au croupier.
     * Après un bust, si plus aucune main n'est vivante, la manche se termine sans le croupier.
     */
    private void finishHand(int index, boolean afterBust) {
        int next = index + 1;
        if (player.hasHand(next)) {
            Hand nextHand = player.hand(next);
            shoe.draw().ifPresentOrElse(nextHand::add,
                    () -> log.warn("Sabot vide: la main {} reste sans carte complémentaire", next));
            activeHandIndex = next;
            state = playerTurnState();
            return;
        }
        if (afterBust && player.getHands().stream().allMatch(Hand::isBusted)) {
            determineWinnerAndCompleteRound();
            return;
        }
        state = GameState.dealerTurn(HandView.of(dealer.firstHand()), playerViews(), player.getBankroll());
    }

    // ---------- tour du croupier ----------

    /**
     * Une étape du croupier : tire une carte à 16 ou moins, sinon règle la manche.
     * Entre deux cartes l'état reste DEALER_TURN pour que l'affichage puisse suivre.
     */
    public CommandResult nextDealerTurn() {
        if (phase() != GamePhase.DEALER_TURN) return reject("DEALER", CommandResult.Reason.WRONG_PHASE);

        Hand hand = dealer.firstHand();
        if (hand.bestValue() >= DEALER_STANDS_ON) {
            determineWinnerAndCompleteRound();
            return CommandResult.ok();
        }

        Optional<Card> card = shoe.draw();
        if (card.isEmpty()) return reject("DEALER", CommandResult.Reason.SHOE_EXHAUSTED);

        hand.add(card.get());
        emit(GameEvent.Type.DEALER_CARD, Map.of("card", card.get(), "dealer", HandView.of(hand)));
        if (hand.isBusted()) {
            determineWinnerAndCompleteRound();
        } else {
            state = GameState.dealerTurn(HandView.of(hand), playerViews(), player.getBankroll());
        }
        return CommandResult.ok();
    }

    /** Joue tout le tour du croupier en un appel (un DEALER_CARD par carte tirée). */
    public CommandResult playDealer() {
        if (phase() != GamePhase.DEALER_TURN) return reject("DEALER", CommandResult.Reason.WRONG_PHASE);
        CommandResult result = CommandResult.ok();
        while (result.accepted() && phase() == GamePhase.DEALER_TURN) {
            result = nextDealerTurn();
        }
        return result;
    }

    // ---------- règlement ----------

    /** Règle chaque main pas encore réglée contre la main du croupier. */
    private void determineWinnerAndCompleteRound() {
        Hand dealerHand = dealer.firstHand();
        for (Hand hand : player.getHands()) {
            if (hand.isSettled()) continue;
            settle(hand, PayoutRules.compare(hand, dealerHand));
        }
        completeRound();
    }

    private void settle(Hand hand, PayoutRules.Outcome o) {
        hand.settle(o.outcome());
        player.credit(o.credit());
        log.debug("Main réglée: total={}, mise={}, issue={}, crédit={}",
                hand.bestValue(), hand.getBet(), o.outcome(), o.credit());
    }

    private void completeRound() {
        Hand dealerHand = dealer.firstHand();
        state = GameState.roundComplete(HandView.of(dealerHand), playerViews(), player.getBankroll());
        RoundSummary summary = new RoundSummary(
                roundNumber,
                player.getHands().stream().mapToLong(Hand::getBet).sum(),
                dealerHand.bestValue(),
                player.getHands().stream().map(Hand::getOutcome).toList(),
                player.getBankroll());
        log.debug("Manche {} de {} terminée: {}", roundNumber, player.getName(), summary.outcomes());
        emit(GameEvent.Type.ROUND_COMPLETE, summary);
    }

    // ---------- manche suivante ----------

    public CommandResult nextRound() {
        if (phase() != GamePhase.ROUND_COMPLETE) return reject("NEXT_ROUND", CommandResult.Reason.WRONG_PHASE);
        player.resetHands();
        dealer.resetHands();
        activeHandIndex = 0;
        state = GameState.waitingForBet(player.getBankroll());
        emit(GameEvent.Type.NEW_ROUND, Map.of("bankroll", player.getBankroll()));
        return CommandResult.ok();
    }

    // ---------- helpers ----------

    private GameState playerTurnState() {
        return GameState.playerTurn(HandView.of(dealer.firstHand()), playerViews(), player.getBankroll(), activeHandIndex);
    }

    private List<HandView> playerViews() {
        return player.getHands().stream().map(HandView::of).toList();
    }

    private CommandResult reject(String command, CommandResult.Reason reason) {
        log.debug("Commande {} refusée en phase {}: {}", command, phase(), reason);
        emit(GameEvent.Type.COMMAND_REJECTED, Map.of("command", command, "phase", phase(), "reason", reason));
        return CommandResult.rejected(reason);
    }

    private void emit(GameEvent.Type type, Object payload) {
        listener.onEvent(GameEvent.builder().type(type).payload(payload).build());
    }
}
