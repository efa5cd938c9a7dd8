package com.mathide.core.candidate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Orders candidates by usefulness and picks the presented subset.
 *
 * Rank: "good" first, then "neutral", then every other tag. The sort is stable, so equal
 * ranks keep the model's order. The retained top-N is shuffled afterwards to avoid
 * positional bias in the UI.
 */
public final class CandidateRanker {

    private static final Comparator<Candidate> BY_USEFULNESS =
            Comparator.comparingInt(CandidateRanker::rankOf);

    private CandidateRanker() {}

    static int rankOf(Candidate candidate) {
        String tag = candidate.usefulness();
        if ("good".equals(tag))    return 0;
        if ("neutral".equals(tag)) return 1;
        return 2;
    }

    /** Stable sort by rank, then truncate to {@code limit}. */
    public static List<Candidate> topRanked(List<Candidate> candidates, int limit) {
        List<Candidate> sorted = new ArrayList<>(candidates);
        sorted.sort(BY_USEFULNESS);
        return new ArrayList<>(sorted.subList(0, Math.min(limit, sorted.size())));
    }

    /** {@link #topRanked(List, int)} followed by a uniform shuffle. */
    public static List<Candidate> select(List<Candidate> candidates, int limit, Random random) {
        List<Candidate> top = topRanked(candidates, limit);
        if (top.size() > 1) {
            Collections.shuffle(top, random);
        }
        return top;
    }
}
