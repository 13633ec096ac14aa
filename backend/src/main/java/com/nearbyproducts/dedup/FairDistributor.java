package com.nearbyproducts.dedup;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Interleaves hits from different location groups into one bounded sequence.
 *
 * <p>Each placement scans the active groups round-robin, starting one position further
 * than the previous placement did. The first group whose next hit does not repeat the
 * location of the last placed hit is preferred. If that hit also repeats the last style,
 * one more scan looks for a group whose next hit repeats neither; failing that the
 * preferred hit is placed anyway. When the only remaining group shares the last location
 * its hit is placed rather than stalling.
 *
 * <p>Every group is an immutable list with a cursor, so the input is never modified and
 * each call is independent of any other.
 */
public class FairDistributor {

    private static final class Group {
        private final List<CandidateHit> items;
        private int cursor;

        private Group(List<CandidateHit> items) {
            this.items = items;
        }

        private CandidateHit peek() {
            return items.get(cursor);
        }

        private CandidateHit take() {
            return items.get(cursor++);
        }

        private boolean isExhausted() {
            return cursor >= items.size();
        }
    }

    public List<CandidateHit> distribute(List<CandidateHit> hits, int targetCount) {
        if (hits == null || hits.isEmpty() || targetCount <= 0) {
            return new ArrayList<>();
        }
        int limit = Math.min(targetCount, hits.size());
        List<Group> active = buildGroups(hits);
        List<CandidateHit> output = new ArrayList<>(limit);
        int start = 0;

        while (output.size() < limit && !active.isEmpty()) {
            CandidateHit last = output.isEmpty() ? null : output.get(output.size() - 1);
            int chosen = chooseGroup(active, start, last);
            Group group = active.get(chosen);
            output.add(group.take());

            start++;
            if (group.isExhausted()) {
                active.remove(chosen);
                if (chosen < start) {
                    start--;
                }
            }
            start = active.isEmpty() ? 0 : start % active.size();
        }
        return output;
    }

    private int chooseGroup(List<Group> active, int start, CandidateHit last) {
        if (last == null) {
            return start;
        }
        int size = active.size();
        int preferred = -1;
        for (int step = 0; step < size; step++) {
            int idx = (start + step) % size;
            if (!active.get(idx).peek().sharesLocationWith(last)) {
                preferred = idx;
                break;
            }
        }
        if (preferred < 0) {
            // only the last placed group is left
            return start;
        }
        if (!active.get(preferred).peek().sharesStyleWith(last)) {
            return preferred;
        }
        for (int step = 0; step < size; step++) {
            int idx = (start + step) % size;
            if (idx == preferred) {
                continue;
            }
            CandidateHit alternative = active.get(idx).peek();
            if (!alternative.sharesLocationWith(last) && !alternative.sharesStyleWith(last)) {
                return idx;
            }
        }
        return preferred;
    }

    private List<Group> buildGroups(List<CandidateHit> hits) {
        Map<String, List<CandidateHit>> byKey = new LinkedHashMap<>();
        int singletonSeq = 0;
        for (CandidateHit candidate : hits) {
            if (candidate == null) {
                continue;
            }
            // singletons never share a group, even when their fallback keys collide
            String key = candidate.isSingleton()
                ? "#" + (singletonSeq++)
                : candidate.getLocationKey();
            byKey.computeIfAbsent(key, k -> new ArrayList<>()).add(candidate);
        }
        List<Group> groups = new ArrayList<>(byKey.size());
        byKey.values().forEach(items -> groups.add(new Group(List.copyOf(items))));
        return groups;
    }
}
