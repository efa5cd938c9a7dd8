package com.mathide.orchestrator;

import com.mathide.core.candidate.ParameterDefinition;

import java.util.Optional;

/**
 * Supplies a value for a candidate parameter, typically by asking the user.
 *
 * An empty result or a thrown exception makes the orchestrator fall back to the
 * definition's default value.
 */
@FunctionalInterface
public interface ParameterValueProvider {

    Optional<String> valueFor(ParameterDefinition definition);
}
