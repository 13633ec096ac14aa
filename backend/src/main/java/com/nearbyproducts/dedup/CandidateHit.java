package com.nearbyproducts.dedup;

import com.nearbyproducts.model.Hit;

/**
 * A search hit annotated with the keys the engine groups and compares on.
 * Instances are immutable; the wrapped {@link Hit} is never modified by the engine.
 */
public final class CandidateHit {

    private final Hit hit;
    private final String baseIdentity;
    private final String locationKey;
    private final boolean singleton;
    private final String styleKey;

    public CandidateHit(Hit hit, String baseIdentity, String locationKey, boolean singleton, String styleKey) {
        this.hit = hit;
        this.baseIdentity = baseIdentity;
        this.locationKey = locationKey;
        this.singleton = singleton;
        this.styleKey = styleKey;
    }

    public Hit getHit() {
        return hit;
    }

    public String getBaseIdentity() {
        return baseIdentity;
    }

    public String getLocationKey() {
        return locationKey;
    }

    /**
     * True when no location attribute was usable and the hit forms a group of its own.
     */
    public boolean isSingleton() {
        return singleton;
    }

    public String getStyleKey() {
        return styleKey;
    }

    public boolean isFeatured() {
        return hit != null && hit.isFeatured();
    }

    public String getTitle() {
        return hit == null ? null : hit.getTitle();
    }

    boolean sharesLocationWith(CandidateHit other) {
        return other != null && !singleton && !other.singleton && locationKey.equals(other.locationKey);
    }

    boolean sharesStyleWith(CandidateHit other) {
        return other != null && styleKey != null && styleKey.equals(other.styleKey);
    }

    @Override
    public String toString() {
        return "CandidateHit{" + baseIdentity + " @ " + locationKey + (styleKey != null ? " / " + styleKey : "") + "}";
    }
}
