package com.mathide.llm;

/**
 * Which model-backed operation a completion serves.
 *
 * Canonical sampling temperatures live here so the engines never hardcode them.
 *
 * GENERATOR         0.7 - varied candidate proposals
 * APPLIER           0.3
 * CHECKER           0.2
 * PROGRESS_ANALYST  0.3
 * VERIFIER          0.1 - near-deterministic re-derivation
 * BRANCH_ANALYST    0.3
 */
public enum ModelRole {
    GENERATOR(0.7),
    APPLIER(0.3),
    CHECKER(0.2),
    PROGRESS_ANALYST(0.3),
    VERIFIER(0.1),
    BRANCH_ANALYST(0.3);

    private final double temperature;

    ModelRole(double temperature) {
        this.temperature = temperature;
    }

    public double temperature() {
        return temperature;
    }
}
