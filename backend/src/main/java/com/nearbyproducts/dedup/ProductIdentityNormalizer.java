package com.nearbyproducts.dedup;

import java.util.List;
import java.util.regex.Pattern;

import com.nearbyproducts.model.Hit;

/**
 * Derives the base identity of a product handle so that size, format and medium
 * variants of the same artwork share one key.
 *
 * <p>Stripping is best-effort: unknown suffixes are left untouched. Trailing size and
 * medium markers are removed repeatedly until none is left, which keeps
 * {@link #normalize(String)} idempotent for handles such as {@code art-40x60-print}.
 */
public final class ProductIdentityNormalizer {

    private static final String VARIANT_MARKER = "-variant-";
    private static final String SHORT_VARIANT_MARKER = "-v-";
    private static final Pattern SIZE_SUFFIX = Pattern.compile("-\\d+x\\d+$");
    private static final List<String> MEDIUM_SUFFIXES = List.of(
        "-original-painting",
        "-print",
        "-canvas",
        "-paper"
    );

    private ProductIdentityNormalizer() {
    }

    public static String baseIdentity(Hit hit) {
        return hit == null ? "" : normalize(hit.getHandle());
    }

    public static String normalize(String handle) {
        if (handle == null) {
            return "";
        }
        String base = prefixBefore(handle, VARIANT_MARKER);
        base = prefixBefore(base, SHORT_VARIANT_MARKER);

        String previous;
        do {
            previous = base;
            base = SIZE_SUFFIX.matcher(base).replaceFirst("");
            for (String suffix : MEDIUM_SUFFIXES) {
                if (base.endsWith(suffix)) {
                    base = base.substring(0, base.length() - suffix.length());
                }
            }
        } while (!base.equals(previous));
        return base;
    }

    private static String prefixBefore(String value, String marker) {
        int idx = value.indexOf(marker);
        return idx >= 0 ? value.substring(0, idx) : value;
    }
}
