package org.evalux.blackjack.model;

public enum HandOutcome { WIN, LOSS, PUSH, BLACKJACK }
