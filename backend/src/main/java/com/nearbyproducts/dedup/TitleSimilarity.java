package com.nearbyproducts.dedup;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Token-overlap comparison of product titles.
 *
 * <p>Titles are lowercased, trimmed and split on whitespace; only tokens of at least
 * {@code minTokenLength} characters count. The score is
 * {@code 2 * common / (tokens1 + tokens2)}. Identical normalized titles are always similar,
 * empty titles never are.
 */
public class TitleSimilarity {

    public static final double DEFAULT_THRESHOLD = 0.8;
    public static final int DEFAULT_MIN_TOKEN_LENGTH = 3;

    private final double threshold;
    private final int minTokenLength;

    public TitleSimilarity() {
        this(DEFAULT_THRESHOLD, DEFAULT_MIN_TOKEN_LENGTH);
    }

    public TitleSimilarity(double threshold, int minTokenLength) {
        this.threshold = threshold;
        this.minTokenLength = minTokenLength;
    }

    public boolean isSimilar(String first, String second) {
        String a = normalize(first);
        String b = normalize(second);
        if (a.isEmpty() || b.isEmpty()) {
            return false;
        }
        if (a.equals(b)) {
            return true;
        }
        return score(tokens(a), tokens(b)) >= threshold;
    }

    double score(String first, String second) {
        return score(tokens(normalize(first)), tokens(normalize(second)));
    }

    private double score(List<String> first, List<String> second) {
        if (first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }
        Set<String> lookup = new HashSet<>(second);
        int common = 0;
        for (String token : first) {
            if (lookup.contains(token)) {
                common++;
            }
        }
        return (2.0 * common) / (first.size() + second.size());
    }

    private List<String> tokens(String normalized) {
        List<String> tokens = new ArrayList<>();
        for (String token : normalized.split("\\s+")) {
            if (token.length() >= minTokenLength) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static String normalize(String title) {
        return title == null ? "" : title.toLowerCase(Locale.ROOT).trim();
    }
}
