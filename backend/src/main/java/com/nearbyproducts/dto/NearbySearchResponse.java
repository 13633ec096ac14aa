package com.nearbyproducts.dto;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.nearbyproducts.model.Hit;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class NearbySearchResponse {
    private List<Hit> hits = new ArrayList<>();
    private long totalHits;
    private boolean cached;
    private long searchTime;
    private String cacheAge;

    public NearbySearchResponse() {
    }

    public NearbySearchResponse(List<Hit> hits, long totalHits, long searchTime) {
        this.hits = new ArrayList<>(hits);
        this.totalHits = totalHits;
        this.searchTime = searchTime;
    }

    /**
     * Copy of this response marked as served from cache.
     */
    public NearbySearchResponse fromCache(String age) {
        NearbySearchResponse copy = new NearbySearchResponse(hits, totalHits, searchTime);
        copy.cached = true;
        copy.cacheAge = age;
        return copy;
    }

    public List<Hit> getHits() {
        return hits;
    }

    public void setHits(List<Hit> hits) {
        this.hits = hits;
    }

    public long getTotalHits() {
        return totalHits;
    }

    public void setTotalHits(long totalHits) {
        this.totalHits = totalHits;
    }

    public boolean isCached() {
        return cached;
    }

    public void setCached(boolean cached) {
        this.cached = cached;
    }

    public long getSearchTime() {
        return searchTime;
    }

    public void setSearchTime(long searchTime) {
        this.searchTime = searchTime;
    }

    public String getCacheAge() {
        return cacheAge;
    }

    public void setCacheAge(String cacheAge) {
        this.cacheAge = cacheAge;
    }
}
