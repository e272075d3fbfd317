package org.evalux.blackjack.service.registry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.evalux.blackjack.config.BlackjackProperties;
import org.evalux.blackjack.service.engine.BlackjackGame;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/** Une partie par session : aucun sabot ni bankroll partagé entre sessions. */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameRegistry {
    private final BlackjackProperties properties;
    private final Map<String, BlackjackGame> games = new ConcurrentHashMap<>();

    /** La factory reçoit l'id de session (pour brancher ses listeners). */
    public synchronized String create(Function<String, BlackjackGame> factory) {
        if (games.size() >= properties.getMaxSessions())
            throw new IllegalStateException("Too many sessions (" + properties.getMaxSessions() + ")");
        String id = UUID.randomUUID().toString();
        games.put(id, factory.apply(id));
        log.info("Session {} créée ({} actives)", id, games.size());
        return id;
    }

    public BlackjackGame get(String id) {
        BlackjackGame g = id == null ? null : games.get(id);
        if (g == null) throw new IllegalArgumentException("Unknown session: " + id);
        return g;
    }

    public boolean remove(String id) {
        boolean removed = id != null && games.remove(id) != null;
        if (removed) log.info("Session {} fermée", id);
        return removed;
    }

    public int size() { return games.size(); }
}
