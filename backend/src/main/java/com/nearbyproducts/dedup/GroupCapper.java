package com.nearbyproducts.dedup;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps at most {@code maxPerGroup} hits per location group. Groups come back in
 * first-seen order, followed by every singleton hit, which is never capped.
 */
public class GroupCapper {

    public List<CandidateHit> cap(List<CandidateHit> hits, int maxPerGroup) {
        List<CandidateHit> capped = new ArrayList<>();
        if (hits == null || hits.isEmpty()) {
            return capped;
        }
        int limit = Math.max(0, maxPerGroup);
        Map<String, List<CandidateHit>> groups = new LinkedHashMap<>();
        List<CandidateHit> singletons = new ArrayList<>();

        for (CandidateHit candidate : hits) {
            if (candidate.isSingleton()) {
                singletons.add(candidate);
                continue;
            }
            List<CandidateHit> group = groups.computeIfAbsent(candidate.getLocationKey(), k -> new ArrayList<>());
            if (group.size() < limit) {
                group.add(candidate);
            }
        }

        groups.values().forEach(capped::addAll);
        capped.addAll(singletons);
        return capped;
    }
}
