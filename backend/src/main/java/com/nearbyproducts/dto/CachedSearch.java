package com.nearbyproducts.dto;

/**
 * Cache entry for a nearby search, stamped with the time it was stored.
 */
public class CachedSearch {
    private NearbySearchResponse response;
    private long timestamp;

    public CachedSearch() {
    }

    public CachedSearch(NearbySearchResponse response, long timestamp) {
        this.response = response;
        this.timestamp = timestamp;
    }

    public NearbySearchResponse getResponse() {
        return response;
    }

    public void setResponse(NearbySearchResponse response) {
        this.response = response;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }
}
