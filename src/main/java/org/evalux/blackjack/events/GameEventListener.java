package org.evalux.blackjack.events;

import org.evalux.blackjack.dto.GameEvent;

/** Reçoit les notifications du moteur (affichage, journal, historique...). */
@FunctionalInterface
public interface GameEventListener {
    GameEventListener NOOP = e -> {};

    void onEvent(GameEvent event);
}
