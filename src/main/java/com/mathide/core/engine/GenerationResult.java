package com.mathide.core.engine;

import com.mathide.core.candidate.Candidate;

import java.util.List;

/**
 * Candidates ready for presentation, plus how many decoded elements were unusable.
 */
public final class GenerationResult {

    private final List<Candidate> candidates;
    private final int             decodedCount;
    private final int             droppedCount;

    public GenerationResult(List<Candidate> candidates, int decodedCount, int droppedCount) {
        this.candidates   = List.copyOf(candidates);
        this.decodedCount = decodedCount;
        this.droppedCount = droppedCount;
    }

    public List<Candidate> getCandidates() { return candidates; }
    public int getDecodedCount()           { return decodedCount; }
    public int getDroppedCount()           { return droppedCount; }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }
}
