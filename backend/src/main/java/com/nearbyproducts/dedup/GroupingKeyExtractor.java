package com.nearbyproducts.dedup;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.nearbyproducts.model.Hit;
import com.nearbyproducts.model.LocationDetails;
import com.nearbyproducts.util.GeoValidator;

/**
 * Derives the location group and style group of a hit under one {@link LocationGroupPolicy}.
 */
public class GroupingKeyExtractor {

    static final String COORDINATE_PREFIX = "geo:";
    static final String PLACE_PREFIX = "place:";
    static final String ADDRESS_PREFIX = "address:";
    static final String PHOTO_PREFIX = "photo:";
    static final String SINGLETON_PREFIX = "item:";

    private final LocationGroupPolicy policy;

    public GroupingKeyExtractor(LocationGroupPolicy policy) {
        this.policy = policy == null ? LocationGroupPolicy.LOCATION_PHOTO : policy;
    }

    public LocationGroupPolicy getPolicy() {
        return policy;
    }

    /**
     * Returns the grouping key of a hit, never empty. Hits without any usable location
     * attribute fall back to a key derived from their own identity.
     */
    public String locationKey(Hit hit) {
        String key = sharedLocationKey(hit);
        return key != null ? key : SINGLETON_PREFIX + ProductIdentityNormalizer.baseIdentity(hit);
    }

    public String styleKey(Hit hit) {
        LocationDetails details = hit == null ? null : hit.getLocationDetails();
        return details == null ? null : trimToNull(details.getStyleName());
    }

    /**
     * Annotates hits in input order. Null entries are skipped.
     */
    public List<CandidateHit> annotate(List<Hit> hits) {
        List<CandidateHit> annotated = new ArrayList<>();
        if (hits == null) {
            return annotated;
        }
        for (Hit hit : hits) {
            if (hit == null) {
                continue;
            }
            String baseIdentity = ProductIdentityNormalizer.baseIdentity(hit);
            String shared = sharedLocationKey(hit);
            boolean singleton = shared == null;
            String locationKey = singleton ? SINGLETON_PREFIX + baseIdentity : shared;
            annotated.add(new CandidateHit(hit, baseIdentity, locationKey, singleton, styleKey(hit)));
        }
        return annotated;
    }

    private String sharedLocationKey(Hit hit) {
        LocationDetails details = hit == null ? null : hit.getLocationDetails();
        if (details == null) {
            return null;
        }
        if (policy == LocationGroupPolicy.COORDINATES) {
            if (GeoValidator.isValidCoordinate(details.getLatitude(), details.getLongitude())) {
                return COORDINATE_PREFIX + String.format(Locale.ROOT, "%.6f,%.6f",
                    details.getLatitude(), details.getLongitude());
            }
            String placeId = trimToNull(details.getGooglePlaceId());
            if (placeId != null) {
                return PLACE_PREFIX + placeId;
            }
            String address = trimToNull(details.getFormattedAddress());
            if (address != null) {
                return ADDRESS_PREFIX + address;
            }
        }
        String photoId = trimToNull(details.getLocationPhotoId());
        return photoId != null ? PHOTO_PREFIX + photoId : null;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
