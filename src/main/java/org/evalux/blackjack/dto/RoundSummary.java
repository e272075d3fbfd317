package org.evalux.blackjack.dto;

import org.evalux.blackjack.model.HandOutcome;

import java.util.List;

/** Entrée d'historique, une par manche terminée. */
public record RoundSummary(int round, long totalBet, int dealerTotal, List<HandOutcome> outcomes, long bankrollAfter) {}
