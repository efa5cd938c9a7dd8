package com.mathide.core.candidate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * CandidateRegistry - process-wide map of short opaque ids to generated candidates.
 *
 * Ids fit in size-constrained UI callback payloads. Each id is the process epoch plus a
 * base-36 sequence number, so ids are never reused within a process and ids from a
 * previous process never resolve.
 *
 * Nothing is persisted. Unknown or forgotten ids resolve to empty, the same as ids that
 * were never issued.
 *
 * Shared by all sessions: backed by concurrent maps, no cross-key ordering.
 */
@Component
public class CandidateRegistry {

    private static final Logger log = LoggerFactory.getLogger(CandidateRegistry.class);

    private final String     epoch;
    private final AtomicLong sequence = new AtomicLong();

    private final Map<String, Candidate>    candidatesById = new ConcurrentHashMap<>();
    private final Map<String, List<String>> idsByStep      = new ConcurrentHashMap<>();

    // Every id ever issued for a step, including replaced generations
    private final Map<String, List<String>> issuedByStep   = new ConcurrentHashMap<>();

    public CandidateRegistry() {
        this.epoch = Long.toString(new SecureRandom().nextInt(36 * 36 * 36), 36);
    }

    /**
     * Allocate one fresh id per candidate, in input order, and associate them with the
     * step. A previous association for the same step is replaced; its ids stay resolvable.
     */
    public List<String> register(String stepId, List<Candidate> candidates) {
        List<String> ids = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            String id = epoch + "." + Long.toString(sequence.incrementAndGet(), 36);
            candidatesById.put(id, candidate);
            ids.add(id);
        }
        idsByStep.put(stepId, Collections.unmodifiableList(ids));
        issuedByStep.merge(stepId, new ArrayList<>(ids), (old, added) -> {
            List<String> all = new ArrayList<>(old);
            all.addAll(added);
            return all;
        });
        log.debug("[Registry] Registered {} candidate(s) for step {}", ids.size(), stepId);
        return ids;
    }

    public Optional<Candidate> resolve(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(candidatesById.get(id));
    }

    /** Candidates last registered for the step, in registration order; empty if unknown. */
    public List<Candidate> candidatesForStep(String stepId) {
        List<String> ids = idsByStep.getOrDefault(stepId, List.of());
        List<Candidate> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            Candidate c = candidatesById.get(id);
            if (c != null) result.add(c);
        }
        return result;
    }

    public List<String> idsForStep(String stepId) {
        return idsByStep.getOrDefault(stepId, List.of());
    }

    /** Drop every candidate ever registered for the given steps. */
    public void forgetSteps(Collection<String> stepIds) {
        int dropped = 0;
        for (String stepId : stepIds) {
            idsByStep.remove(stepId);
            List<String> ids = issuedByStep.remove(stepId);
            if (ids == null) continue;
            ids.forEach(candidatesById::remove);
            dropped += ids.size();
        }
        if (dropped > 0) {
            log.debug("[Registry] Forgot {} candidate(s) from {} step(s)", dropped, stepIds.size());
        }
    }

    public int size() {
        return candidatesById.size();
    }
}
