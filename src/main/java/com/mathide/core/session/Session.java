package com.mathide.core.session;

import com.mathide.core.candidate.Candidate;
import com.mathide.core.history.StepHistory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable per-user solving session.
 *
 * Every read or write of the mutable fields happens while {@link #lock()} is held;
 * the orchestrator takes it around each operation.
 */
public class Session {

    private final String        userId;
    private final Instant       createdAt;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile Instant lastActivity;

    private SessionState state = SessionState.AWAITING_TASK;
    private StepHistory  history;

    // Candidate ids offered by the latest generation for the current step
    private final List<String> offeredCandidateIds = new ArrayList<>();

    // Selection in progress: the chosen candidate, possibly still missing parameters
    private String    selectedCandidateId;
    private Candidate selectedCandidate;
    private final Map<String, String> suppliedParameters = new LinkedHashMap<>();

    public Session(String userId) {
        this.userId       = userId;
        this.createdAt    = Instant.now();
        this.lastActivity = createdAt;
    }

    public ReentrantLock lock() {
        return lock;
    }

    public void touch() {
        lastActivity = Instant.now();
    }

    // =========================================================================
    // Selection
    // =========================================================================

    public void select(String candidateId, Candidate candidate) {
        this.selectedCandidateId = candidateId;
        this.selectedCandidate   = candidate;
        this.suppliedParameters.clear();
    }

    /** Replace the selected candidate with its concrete form; the id stays. */
    public void concretizeSelection(Candidate concrete) {
        this.selectedCandidate = concrete;
        this.suppliedParameters.clear();
    }

    public void clearSelection() {
        this.selectedCandidateId = null;
        this.selectedCandidate   = null;
        this.suppliedParameters.clear();
    }

    public void offer(List<String> candidateIds) {
        offeredCandidateIds.clear();
        offeredCandidateIds.addAll(candidateIds);
    }

    public void clearOffer() {
        offeredCandidateIds.clear();
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public String getUserId()                  { return userId; }
    public Instant getCreatedAt()              { return createdAt; }
    public Instant getLastActivity()           { return lastActivity; }
    public SessionState getState()             { return state; }
    public void setState(SessionState state)   { this.state = state; }
    public StepHistory getHistory()            { return history; }
    public void setHistory(StepHistory history) { this.history = history; }
    public List<String> getOfferedCandidateIds() { return List.copyOf(offeredCandidateIds); }
    public String getSelectedCandidateId()     { return selectedCandidateId; }
    public Candidate getSelectedCandidate()    { return selectedCandidate; }
    public Map<String, String> getSuppliedParameters() { return suppliedParameters; }

    public boolean hasTask() {
        return history != null;
    }

    @Override
    public String toString() {
        return "Session{" + userId + ", state=" + state
                + ", steps=" + (history != null ? history.size() : 0) + "}";
    }
}
