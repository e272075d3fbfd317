package org.evalux.blackjack.events;

import lombok.RequiredArgsConstructor;
import org.evalux.blackjack.dto.GameEvent;
import org.evalux.blackjack.dto.RoundSummary;
import org.evalux.blackjack.service.RoundHistoryService;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RoundHistoryListener {

    private final RoundHistoryService history;

    @EventListener
    public void onGameEvent(SessionGameEvent e) {
        GameEvent event = e.event();
        if (event.getType() == GameEvent.Type.ROUND_COMPLETE && event.getPayload() instanceof RoundSummary) {
            history.record(e.sessionId(), (RoundSummary) event.getPayload());
        }
    }
}
