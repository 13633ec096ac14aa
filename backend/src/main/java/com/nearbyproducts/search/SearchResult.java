package com.nearbyproducts.search;

import java.util.List;

import com.nearbyproducts.model.Hit;

public class SearchResult {

    private final List<Hit> hits;
    private final long totalHits;
    private final long processingTimeMs;

    public SearchResult(List<Hit> hits, long totalHits, long processingTimeMs) {
        this.hits = hits;
        this.totalHits = totalHits;
        this.processingTimeMs = processingTimeMs;
    }

    public List<Hit> getHits() {
        return hits;
    }

    public long getTotalHits() {
        return totalHits;
    }

    public long getProcessingTimeMs() {
        return processingTimeMs;
    }
}
