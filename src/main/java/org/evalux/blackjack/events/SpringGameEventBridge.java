package org.evalux.blackjack.events;

import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SpringGameEventBridge {

    private final ApplicationEventPublisher publisher;

    public GameEventListener forSession(String sessionId) {
        return event -> publisher.publishEvent(new SessionGameEvent(sessionId, event));
    }
}
