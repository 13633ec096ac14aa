package com.nearbyproducts.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;

public class NearbySearchRequest {
    private Double lat;
    private Double lng;

    @Positive
    private double radiusKm = 30;

    @Min(1)
    @Max(100)
    private int hitsPerPage = 24;

    private String currentHandle;

    @Min(1)
    private int maxPerLocationPhoto = 2;

    private boolean fallback;

    public Double getLat() {
        return lat;
    }

    public void setLat(Double lat) {
        this.lat = lat;
    }

    public Double getLng() {
        return lng;
    }

    public void setLng(Double lng) {
        this.lng = lng;
    }

    public double getRadiusKm() {
        return radiusKm;
    }

    public void setRadiusKm(double radiusKm) {
        this.radiusKm = radiusKm;
    }

    public int getHitsPerPage() {
        return hitsPerPage;
    }

    public void setHitsPerPage(int hitsPerPage) {
        this.hitsPerPage = hitsPerPage;
    }

    public String getCurrentHandle() {
        return currentHandle;
    }

    public void setCurrentHandle(String currentHandle) {
        this.currentHandle = currentHandle;
    }

    public int getMaxPerLocationPhoto() {
        return maxPerLocationPhoto;
    }

    public void setMaxPerLocationPhoto(int maxPerLocationPhoto) {
        this.maxPerLocationPhoto = maxPerLocationPhoto;
    }

    public boolean isFallback() {
        return fallback;
    }

    public void setFallback(boolean fallback) {
        this.fallback = fallback;
    }
}
