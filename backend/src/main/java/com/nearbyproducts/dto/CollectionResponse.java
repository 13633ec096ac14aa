package com.nearbyproducts.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class CollectionResponse {
    private String html;
    private boolean cached;
    private String cacheAge;
    private String generated;
    private Stats stats;

    public static CollectionResponse fresh(String html, String generated, Stats stats) {
        CollectionResponse resp = new CollectionResponse();
        resp.html = html;
        resp.generated = generated;
        resp.stats = stats;
        return resp;
    }

    public static CollectionResponse cached(String html, String generated, String cacheAge) {
        CollectionResponse resp = new CollectionResponse();
        resp.html = html;
        resp.cached = true;
        resp.generated = generated;
        resp.cacheAge = cacheAge;
        return resp;
    }

    public String getHtml() {
        return html;
    }

    public boolean isCached() {
        return cached;
    }

    public String getCacheAge() {
        return cacheAge;
    }

    public String getGenerated() {
        return generated;
    }

    public Stats getStats() {
        return stats;
    }

    public static class Stats {
        private final int products;
        private final long totalHits;
        private final String city;
        private final long searchTime;

        public Stats(int products, long totalHits, String city, long searchTime) {
            this.products = products;
            this.totalHits = totalHits;
            this.city = city;
            this.searchTime = searchTime;
        }

        public int getProducts() { return products; }
        public long getTotalHits() { return totalHits; }
        public String getCity() { return city; }
        public long getSearchTime() { return searchTime; }
    }
}
