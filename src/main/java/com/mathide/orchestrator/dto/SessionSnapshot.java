package com.mathide.orchestrator.dto;

import com.mathide.core.session.Session;
import com.mathide.core.session.SessionState;

import java.util.List;

/**
 * Read-only view of a session, taken under its lock.
 */
public class SessionSnapshot {

    private final String       userId;
    private final SessionState state;
    private final String       originalTask;
    private final String       currentExpression;
    private final int          stepCount;
    private final boolean      canRollback;
    private final List<String> offeredCandidateIds;
    private final String       selectedCandidateId;

    private SessionSnapshot(Session session) {
        this.userId              = session.getUserId();
        this.state               = session.getState();
        this.originalTask        = session.hasTask() ? session.getHistory().getOriginalTask() : null;
        this.currentExpression   = session.hasTask() ? session.getHistory().currentExpression() : "";
        this.stepCount           = session.hasTask() ? session.getHistory().size() : 0;
        this.canRollback         = session.hasTask() && session.getHistory().canRollback();
        this.offeredCandidateIds = session.getOfferedCandidateIds();
        this.selectedCandidateId = session.getSelectedCandidateId();
    }

    public static SessionSnapshot of(Session session) {
        return new SessionSnapshot(session);
    }

    public String getUserId()                  { return userId; }
    public SessionState getState()             { return state; }
    public String getOriginalTask()            { return originalTask; }
    public String getCurrentExpression()       { return currentExpression; }
    public int getStepCount()                  { return stepCount; }
    public boolean isCanRollback()             { return canRollback; }
    public List<String> getOfferedCandidateIds() { return offeredCandidateIds; }
    public String getSelectedCandidateId()     { return selectedCandidateId; }
}
