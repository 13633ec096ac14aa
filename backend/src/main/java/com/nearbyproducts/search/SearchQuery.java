package com.nearbyproducts.search;

import java.util.List;

/**
 * Parameters of one search index query. Geo filtering applies only when both
 * coordinates are set.
 */
public class SearchQuery {

    public static final List<String> DEFAULT_ATTRIBUTES = List.of(
        "title", "handle", "product_image", "image", "price",
        "vendor", "_geoloc", "meta.location.details", "featured"
    );

    private final Double latitude;
    private final Double longitude;
    private final double radiusKm;
    private final int hitsPerPage;
    private final String excludeHandle;

    private SearchQuery(Double latitude, Double longitude, double radiusKm, int hitsPerPage, String excludeHandle) {
        this.latitude = latitude;
        this.longitude = longitude;
        this.radiusKm = radiusKm;
        this.hitsPerPage = hitsPerPage;
        this.excludeHandle = excludeHandle;
    }

    public static SearchQuery around(double latitude, double longitude, double radiusKm, int hitsPerPage) {
        return new SearchQuery(latitude, longitude, radiusKm, hitsPerPage, null);
    }

    public static SearchQuery unbounded(int hitsPerPage) {
        return new SearchQuery(null, null, 0, hitsPerPage, null);
    }

    public SearchQuery excluding(String handle) {
        return new SearchQuery(latitude, longitude, radiusKm, hitsPerPage, handle);
    }

    public boolean hasGeoFilter() {
        return latitude != null && longitude != null;
    }

    public Double getLatitude() {
        return latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public double getRadiusKm() {
        return radiusKm;
    }

    public int getRadiusMeters() {
        return (int) Math.round(radiusKm * 1000);
    }

    public int getHitsPerPage() {
        return hitsPerPage;
    }

    public String getExcludeHandle() {
        return excludeHandle;
    }
}
