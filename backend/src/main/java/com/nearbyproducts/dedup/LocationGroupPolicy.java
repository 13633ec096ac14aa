package com.nearbyproducts.dedup;

/**
 * Which location attributes decide that two products were captured at the same place.
 */
public enum LocationGroupPolicy {
    /**
     * Rounded lat/lng, then Google place id, then formatted address, then location photo.
     */
    COORDINATES,
    /**
     * Only the explicit location photo identifier.
     */
    LOCATION_PHOTO
}
