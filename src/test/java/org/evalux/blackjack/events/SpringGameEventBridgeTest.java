package org.evalux.blackjack.events;

import org.evalux.blackjack.dto.GameEvent;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SpringGameEventBridgeTest {

    @Test
    void forSession_publieAvecLIdDeSession() {
        ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
        SpringGameEventBridge bridge = new SpringGameEventBridge(publisher);
        GameEvent event = GameEvent.builder().type(GameEvent.Type.NEW_ROUND).build();

        bridge.forSession("s1").onEvent(event);

        verify(publisher).publishEvent(new SessionGameEvent("s1", event));
    }
}
