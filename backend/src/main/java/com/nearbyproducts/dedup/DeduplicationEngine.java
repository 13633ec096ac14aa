package com.nearbyproducts.dedup;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.nearbyproducts.model.Hit;

/**
 * Turns an over-fetched batch of search hits into a short, visually varied sequence.
 *
 * <p>Pipeline: annotate keys, collapse near duplicates, optionally split into featured and
 * regular tiers, cap each location group, then interleave groups up to the target count.
 * The engine holds no state between calls and never throws for any input.
 */
@Component
public class DeduplicationEngine {

    private static final Logger log = LoggerFactory.getLogger(DeduplicationEngine.class);

    private final GroupCapper capper = new GroupCapper();
    private final FairDistributor distributor = new FairDistributor();
    private final PriorityTierSplitter splitter = new PriorityTierSplitter();

    public List<Hit> select(List<Hit> hits, DedupOptions options) {
        DedupOptions opts = options == null ? DedupOptions.defaults() : options;
        if (hits == null || hits.isEmpty() || opts.getTargetCount() <= 0) {
            return new ArrayList<>();
        }

        List<CandidateHit> annotated = new GroupingKeyExtractor(opts.getLocationPolicy()).annotate(hits);
        List<CandidateHit> unique = collapserFor(opts).collapse(annotated);

        List<CandidateHit> selected = opts.isFeaturedFirst()
            ? selectFeaturedFirst(unique, opts)
            : distributor.distribute(capper.cap(unique, opts.getMaxPerGroup()), opts.getTargetCount());

        log.debug("Deduplicated {} hits: {} unique, {} selected ({})",
            hits.size(), unique.size(), selected.size(), opts);

        return selected.stream().map(CandidateHit::getHit).collect(Collectors.toList());
    }

    private List<CandidateHit> selectFeaturedFirst(List<CandidateHit> unique, DedupOptions opts) {
        List<CandidateHit> grouped = new ArrayList<>();
        List<CandidateHit> ungrouped = new ArrayList<>();
        for (CandidateHit candidate : unique) {
            (candidate.isSingleton() ? ungrouped : grouped).add(candidate);
        }

        PriorityTierSplitter.TierSplit tiers = splitter.split(grouped);
        int target = opts.getTargetCount();
        List<CandidateHit> output = new ArrayList<>(
            distributor.distribute(capper.cap(tiers.getFeatured(), opts.getMaxPerGroup()), target));

        int remaining = target - output.size();
        if (remaining > 0) {
            output.addAll(distributor.distribute(capper.cap(tiers.getRegular(), opts.getMaxPerGroup()), remaining));
        }

        remaining = target - output.size();
        if (remaining > 0) {
            output.addAll(ungrouped.subList(0, Math.min(remaining, ungrouped.size())));
        }
        return output;
    }

    private NearDuplicateCollapser collapserFor(DedupOptions opts) {
        if (!opts.isTitleSimilarity()) {
            return new NearDuplicateCollapser();
        }
        return new NearDuplicateCollapser(new TitleSimilarity(opts.getSimilarityThreshold(), opts.getMinTokenLength()));
    }
}
