package org.evalux.blackjack.service;

import org.evalux.blackjack.dto.RoundSummary;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class RoundHistoryService {

    public static final int MAX_ENTRIES = 50;

    // sessionId -> dernières manches, la plus ancienne en tête
    private final Map<String, Deque<RoundSummary>> cache = new ConcurrentHashMap<>();

    public void record(String sessionId, RoundSummary summary) {
        Deque<RoundSummary> entries = cache.computeIfAbsent(sessionId, k -> new ArrayDeque<>());
        synchronized (entries) {
            entries.addLast(summary);
            while (entries.size() > MAX_ENTRIES) entries.pollFirst();
        }
    }

    public List<RoundSummary> history(String sessionId) {
        Deque<RoundSummary> entries = cache.get(sessionId);
        if (entries == null) return List.of();
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    public void forget(String sessionId) {
        cache.remove(sessionId);
    }
}
