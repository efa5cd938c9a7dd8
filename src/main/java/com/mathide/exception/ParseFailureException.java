package com.mathide.exception;

import com.mathide.core.parser.StageFailure;

import java.util.List;
import java.util.Map;

/**
 * Every decode stage failed. Carries the per-stage reasons and the text that was decoded.
 */
public class ParseFailureException extends MathIdeException {

    private final List<StageFailure> stageFailures;
    private final String             originalText;

    public ParseFailureException(String message, List<StageFailure> stageFailures, String originalText) {
        super(MathIdeErrorCode.PARSE_FAILURE, message, Map.of("stages", stageFailures.size()));
        this.stageFailures = List.copyOf(stageFailures);
        this.originalText  = originalText;
    }

    public List<StageFailure> getStageFailures() {
        return stageFailures;
    }

    public String getOriginalText() {
        return originalText;
    }
}
