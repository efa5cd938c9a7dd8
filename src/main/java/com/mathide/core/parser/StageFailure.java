package com.mathide.core.parser;

/**
 * Why one decode stage rejected its input.
 */
public final class StageFailure {

    private final DecodeStage stage;
    private final String      reason;

    public StageFailure(DecodeStage stage, String reason) {
        this.stage  = stage;
        this.reason = reason != null ? reason : "";
    }

    public DecodeStage getStage() { return stage; }
    public String      getReason() { return reason; }

    @Override
    public String toString() {
        return stage + ": " + reason;
    }
}
