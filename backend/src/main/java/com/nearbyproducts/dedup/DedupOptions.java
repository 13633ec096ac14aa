package com.nearbyproducts.dedup;

/**
 * Immutable settings for one {@link DeduplicationEngine#select} call.
 */
public final class DedupOptions {

    public static final int DEFAULT_MAX_PER_GROUP = 2;
    public static final int DEFAULT_TARGET_COUNT = 24;

    private final int maxPerGroup;
    private final int targetCount;
    private final LocationGroupPolicy locationPolicy;
    private final boolean featuredFirst;
    private final boolean titleSimilarity;
    private final double similarityThreshold;
    private final int minTokenLength;

    public DedupOptions(int maxPerGroup, int targetCount, LocationGroupPolicy locationPolicy, boolean featuredFirst,
                        boolean titleSimilarity, double similarityThreshold, int minTokenLength) {
        this.maxPerGroup = maxPerGroup;
        this.targetCount = targetCount;
        this.locationPolicy = locationPolicy == null ? LocationGroupPolicy.LOCATION_PHOTO : locationPolicy;
        this.featuredFirst = featuredFirst;
        this.titleSimilarity = titleSimilarity;
        this.similarityThreshold = similarityThreshold;
        this.minTokenLength = minTokenLength;
    }

    public static DedupOptions defaults() {
        return new DedupOptions(DEFAULT_MAX_PER_GROUP, DEFAULT_TARGET_COUNT, LocationGroupPolicy.LOCATION_PHOTO,
            false, false, TitleSimilarity.DEFAULT_THRESHOLD, TitleSimilarity.DEFAULT_MIN_TOKEN_LENGTH);
    }

    public DedupOptions withMaxPerGroup(int value) {
        return new DedupOptions(value, targetCount, locationPolicy, featuredFirst, titleSimilarity,
            similarityThreshold, minTokenLength);
    }

    public DedupOptions withTargetCount(int value) {
        return new DedupOptions(maxPerGroup, value, locationPolicy, featuredFirst, titleSimilarity,
            similarityThreshold, minTokenLength);
    }

    public DedupOptions withLocationPolicy(LocationGroupPolicy value) {
        return new DedupOptions(maxPerGroup, targetCount, value, featuredFirst, titleSimilarity,
            similarityThreshold, minTokenLength);
    }

    public DedupOptions withFeaturedFirst(boolean value) {
        return new DedupOptions(maxPerGroup, targetCount, locationPolicy, value, titleSimilarity,
            similarityThreshold, minTokenLength);
    }

    public DedupOptions withTitleSimilarity(boolean value) {
        return new DedupOptions(maxPerGroup, targetCount, locationPolicy, featuredFirst, value,
            similarityThreshold, minTokenLength);
    }

    public int getMaxPerGroup() { return maxPerGroup; }
    public int getTargetCount() { return targetCount; }
    public LocationGroupPolicy getLocationPolicy() { return locationPolicy; }
    public boolean isFeaturedFirst() { return featuredFirst; }
    public boolean isTitleSimilarity() { return titleSimilarity; }
    public double getSimilarityThreshold() { return similarityThreshold; }
    public int getMinTokenLength() { return minTokenLength; }

    @Override
    public String toString() {
        return "DedupOptions{maxPerGroup=" + maxPerGroup + ", targetCount=" + targetCount
            + ", policy=" + locationPolicy + ", featuredFirst=" + featuredFirst
            + ", titleSimilarity=" + titleSimilarity + "}";
    }
}
