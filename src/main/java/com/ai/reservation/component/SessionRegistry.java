package com.ai.reservation.component;

import com.ai.reservation.conversation.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * In-memory per-call session state. Turns for one session run one at a time;
 * different sessions never block each other.
 */
@Component
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, SessionState> sessions = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration idleTimeout;

    public SessionRegistry(Clock clock,
                           @Value("${reservation.session.idle-timeout:30m}") Duration idleTimeout) {
        this.clock = clock;
        this.idleTimeout = idleTimeout;
    }

    /**
     * Runs one turn against the session's state, creating the session on first use.
     * A state that was ended or evicted while this turn waited for its lock is
     * never used; the turn starts over on the registered one.
     */
    public <T> T withSession(String sessionId, Function<SessionState, T> turn) {
        while (true) {
            SessionState state = sessions.computeIfAbsent(sessionId, id -> {
                log.info("[{}] New session", id);
                return new SessionState(id, Instant.now(clock));
            });
            synchronized (state) {
                if (sessions.get(sessionId) != state) {
                    log.debug("[{}] Session replaced while waiting, retrying turn", sessionId);
                    continue;
                }
                state.setLastActivity(Instant.now(clock));
                try {
                    return turn.apply(state);
                } finally {
                    state.setLastActivity(Instant.now(clock));
                }
            }
        }
    }

    public Optional<SessionState> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * Discards the session's state and draft. Committed reservations are untouched.
     */
    public boolean end(String sessionId) {
        SessionState removed = sessions.remove(sessionId);
        if (removed != null) {
            log.info("[{}] Session ended in {}.{}", sessionId,
                    removed.getContext().getWireName(), removed.getStep().getWireName());
        }
        return removed != null;
    }

    /**
     * Removes sessions idle past the timeout. A session whose turn is running is
     * checked only after that turn finishes.
     */
    @Scheduled(fixedDelayString = "${reservation.session.sweep-interval-ms:60000}")
    public void evictIdleSessions() {
        Instant cutoff = Instant.now(clock).minus(idleTimeout);
        int evicted = 0;
        for (SessionState state : sessions.values()) {
            synchronized (state) {
                if (state.getLastActivity().isBefore(cutoff) && sessions.remove(state.getSessionId(), state)) {
                    evicted++;
                }
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} idle sessions", evicted);
        }
    }

    public int size() {
        return sessions.size();
    }
}
