package com.nearbyproducts.dto;

/**
 * Cache entry for a pre-generated collection page.
 */
public class CachedCollection {
    private String html;
    private long timestamp;
    private String generated;
    private int products;
    private long totalHits;

    public CachedCollection() {
    }

    public CachedCollection(String html, long timestamp, String generated, int products, long totalHits) {
        this.html = html;
        this.timestamp = timestamp;
        this.generated = generated;
        this.products = products;
        this.totalHits = totalHits;
    }

    public String getHtml() {
        return html;
    }

    public void setHtml(String html) {
        this.html = html;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(long timestamp) {
        this.timestamp = timestamp;
    }

    public String getGenerated() {
        return generated;
    }

    public void setGenerated(String generated) {
        this.generated = generated;
    }

    public int getProducts() {
        return products;
    }

    public void setProducts(int products) {
        this.products = products;
    }

    public long getTotalHits() {
        return totalHits;
    }

    public void setTotalHits(long totalHits) {
        this.totalHits = totalHits;
    }
}
