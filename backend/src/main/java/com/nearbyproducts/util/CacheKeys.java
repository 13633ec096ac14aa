package com.nearbyproducts.util;

import java.math.BigDecimal;

/**
 * Builds cache keys from request parameters. Numbers print without a trailing {@code .0}
 * so {@code 30} and {@code 30.0} produce the same key.
 */
public final class CacheKeys {

    public static final String NEARBY_PREFIX = "nearby:";
    public static final String COLLECTION_PREFIX = "static-collection:";

    private CacheKeys() {
    }

    public static String nearby(Double lat, Double lng, double radiusKm, int hitsPerPage, int maxPerGroup) {
        return NEARBY_PREFIX + orFallback(lat) + ":" + orFallback(lng) + ":" + number(radiusKm)
            + ":" + hitsPerPage + ":" + maxPerGroup;
    }

    public static String collection(String cityName, double lat, double lng, double radiusKm, int hitsPerPage) {
        return COLLECTION_PREFIX + cityName + ":" + number(lat) + ":" + number(lng) + ":" + number(radiusKm)
            + ":" + hitsPerPage;
    }

    static String number(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static String orFallback(Double value) {
        return value == null ? "fallback" : number(value);
    }
}
