package org.evalux.blackjack.events;

import org.evalux.blackjack.dto.GameEvent;

/** Événement Spring : un GameEvent rattaché à sa session. */
public record SessionGameEvent(String sessionId, GameEvent event) {}
