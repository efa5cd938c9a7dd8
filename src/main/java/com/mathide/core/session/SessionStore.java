package com.mathide.core.session;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Lookup of live sessions keyed by user id.
 *
 * LIFECYCLE:
 * - create: on the first task of a user; replaces any previous session
 * - reset:  on cancel; the user keeps a fresh session awaiting a task
 * - evict:  on explicit discard
 * - evictIdle: sessions untouched for longer than the given duration
 *
 * Implementations must support concurrent use across different user ids.
 */
public interface SessionStore {

    Session create(String userId);

    Optional<Session> get(String userId);

    /** @return the discarded session, if there was one */
    Optional<Session> reset(String userId);

    Optional<Session> evict(String userId);

    List<Session> evictIdle(Duration maxIdle);

    int size();
}
