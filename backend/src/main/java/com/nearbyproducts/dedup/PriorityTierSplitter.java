package com.nearbyproducts.dedup;

import java.util.ArrayList;
import java.util.List;

/**
 * Partitions hits into featured and regular tiers, keeping input order in both.
 */
public class PriorityTierSplitter {

    public static final class TierSplit {
        private final List<CandidateHit> featured;
        private final List<CandidateHit> regular;

        private TierSplit(List<CandidateHit> featured, List<CandidateHit> regular) {
            this.featured = featured;
            this.regular = regular;
        }

        public List<CandidateHit> getFeatured() {
            return featured;
        }

        public List<CandidateHit> getRegular() {
            return regular;
        }
    }

    public TierSplit split(List<CandidateHit> hits) {
        List<CandidateHit> featured = new ArrayList<>();
        List<CandidateHit> regular = new ArrayList<>();
        if (hits != null) {
            for (CandidateHit candidate : hits) {
                if (candidate.isFeatured()) {
                    featured.add(candidate);
                } else {
                    regular.add(candidate);
                }
            }
        }
        return new TierSplit(featured, regular);
    }
}
