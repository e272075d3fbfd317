package org.evalux.blackjack.model;

public enum GamePhase { WAITING_FOR_BET, WAITING_TO_DEAL, PLAYER_TURN, DEALER_TURN, ROUND_COMPLETE }
