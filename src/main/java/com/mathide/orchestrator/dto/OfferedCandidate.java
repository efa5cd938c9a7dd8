package com.mathide.orchestrator.dto;

import com.mathide.core.candidate.Candidate;
import com.mathide.core.candidate.ParameterDefinition;

import java.util.List;

/**
 * A generated candidate as presented to the user, keyed by its registry id.
 */
public class OfferedCandidate {

    private final String                    id;
    private final String                    description;
    private final String                    expression;
    private final String                    kind;
    private final String                    usefulness;
    private final boolean                   requiresUserInput;
    private final List<ParameterDefinition> parameterDefinitions;
    private final String                    previewResult;

    public OfferedCandidate(String id, Candidate candidate) {
        this.id                   = id;
        this.description          = candidate.getDescription();
        this.expression           = candidate.getExpression();
        this.kind                 = candidate.getKind();
        this.usefulness           = candidate.usefulness();
        this.requiresUserInput    = candidate.needsParameters();
        this.parameterDefinitions = candidate.getParameterDefinitions();
        this.previewResult        = candidate.getPreviewResult();
    }

    public String getId()                                     { return id; }
    public String getDescription()                            { return description; }
    public String getExpression()                             { return expression; }
    public String getKind()                                   { return kind; }
    public String getUsefulness()                             { return usefulness; }
    public boolean isRequiresUserInput()                      { return requiresUserInput; }
    public List<ParameterDefinition> getParameterDefinitions() { return parameterDefinitions; }
    public String getPreviewResult()                          { return previewResult; }
}
