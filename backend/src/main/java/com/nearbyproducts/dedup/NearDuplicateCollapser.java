package com.nearbyproducts.dedup;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drops hits whose base identity was already kept and, when a {@link TitleSimilarity}
 * is configured, hits whose title resembles the title of any hit kept before them.
 *
 * <p>The title check compares each hit against the whole accumulator, so it is O(n²)
 * in the number of hits. The first kept hit in accumulator order wins.
 */
public class NearDuplicateCollapser {

    private final TitleSimilarity titleSimilarity;

    public NearDuplicateCollapser() {
        this(null);
    }

    public NearDuplicateCollapser(TitleSimilarity titleSimilarity) {
        this.titleSimilarity = titleSimilarity;
    }

    public List<CandidateHit> collapse(List<CandidateHit> hits) {
        List<CandidateHit> kept = new ArrayList<>();
        if (hits == null) {
            return kept;
        }
        Set<String> seenIdentities = new HashSet<>();
        for (CandidateHit candidate : hits) {
            if (candidate == null || seenIdentities.contains(candidate.getBaseIdentity())) {
                continue;
            }
            if (titleSimilarity != null && resemblesKept(candidate, kept)) {
                continue;
            }
            seenIdentities.add(candidate.getBaseIdentity());
            kept.add(candidate);
        }
        return kept;
    }

    private boolean resemblesKept(CandidateHit candidate, List<CandidateHit> kept) {
        for (CandidateHit previous : kept) {
            if (titleSimilarity.isSimilar(previous.getTitle(), candidate.getTitle())) {
                return true;
            }
        }
        return false;
    }
}
