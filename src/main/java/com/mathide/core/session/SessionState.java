package com.mathide.core.session;

/**
 * Where a session stands in the generate, select, apply, check loop.
 */
public enum SessionState {
    AWAITING_TASK,
    GENERATING_CANDIDATES,
    AWAITING_SELECTION,
    AWAITING_PARAMETER_INPUT,
    APPLYING,
    SOLVED
}
