package com.mathide.core.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link SessionStore} over a concurrent map. Nothing survives a restart.
 */
@Component
public class InMemorySessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    @Override
    public Session create(String userId) {
        Session session = new Session(userId);
        Session previous = sessions.put(userId, session);
        log.info("[Sessions] Created session for {}{}", userId, previous != null ? " (replaced existing)" : "");
        return session;
    }

    @Override
    public Optional<Session> get(String userId) {
        return Optional.ofNullable(sessions.get(userId));
    }

    @Override
    public Optional<Session> reset(String userId) {
        Session previous = sessions.put(userId, new Session(userId));
        log.info("[Sessions] Reset session for {}", userId);
        return Optional.ofNullable(previous);
    }

    @Override
    public Optional<Session> evict(String userId) {
        Session removed = sessions.remove(userId);
        if (removed != null) {
            log.info("[Sessions] Evicted session for {}", userId);
        }
        return Optional.ofNullable(removed);
    }

    @Override
    public List<Session> evictIdle(Duration maxIdle) {
        Instant cutoff = Instant.now().minus(maxIdle);
        List<Session> evicted = new ArrayList<>();

        for (Map.Entry<String, Session> entry : sessions.entrySet()) {
            Session session = entry.getValue();
            if (session.getLastActivity().isBefore(cutoff)
                    && !session.lock().isLocked()
                    && sessions.remove(entry.getKey(), session)) {
                evicted.add(session);
            }
        }

        if (!evicted.isEmpty()) {
            log.info("[Sessions] Evicted {} idle session(s) (idle > {})", evicted.size(), maxIdle);
        }
        return evicted;
    }

    @Override
    public int size() {
        return sessions.size();
    }
}
