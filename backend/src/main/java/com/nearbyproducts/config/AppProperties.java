package com.nearbyproducts.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import com.nearbyproducts.dedup.DedupOptions;
import com.nearbyproducts.dedup.LocationGroupPolicy;
import com.nearbyproducts.dedup.TitleSimilarity;

@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private final Cache cache = new Cache();
    private final Search search = new Search();
    private final Dedup dedup = new Dedup();
    private final RateLimit rateLimit = new RateLimit();
    private final Cors cors = new Cors();

    public Cache getCache() {
        return cache;
    }

    public Search getSearch() {
        return search;
    }

    public Dedup getDedup() {
        return dedup;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public Cors getCors() {
        return cors;
    }

    public static class Cache {
        private int ttlHours = 24;

        public int getTtlHours() {
            return ttlHours;
        }

        public void setTtlHours(int ttlHours) {
            this.ttlHours = ttlHours;
        }
    }

    public static class Search {
        private String appId;
        private String apiKey;
        private String indexName;
        private int overfetchFactor = 3;
        private int collectionHits = 100;
        private int connectTimeoutMs = 3000;
        private int readTimeoutMs = 10000;

        public String getAppId() {
            return appId;
        }

        public void setAppId(String appId) {
            this.appId = appId;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getIndexName() {
            return indexName;
        }

        public void setIndexName(String indexName) {
            this.indexName = indexName;
        }

        public int getOverfetchFactor() {
            return overfetchFactor;
        }

        public void setOverfetchFactor(int overfetchFactor) {
            this.overfetchFactor = overfetchFactor;
        }

        public int getCollectionHits() {
            return collectionHits;
        }

        public void setCollectionHits(int collectionHits) {
            this.collectionHits = collectionHits;
        }

        public int getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public int getReadTimeoutMs() {
            return readTimeoutMs;
        }

        public void setReadTimeoutMs(int readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
        }
    }

    public static class Dedup {
        private int maxPerGroup = DedupOptions.DEFAULT_MAX_PER_GROUP;
        private int targetCount = DedupOptions.DEFAULT_TARGET_COUNT;
        private LocationGroupPolicy locationPolicy = LocationGroupPolicy.LOCATION_PHOTO;
        private boolean featuredFirst = false;
        private boolean titleSimilarity = false;
        private double similarityThreshold = TitleSimilarity.DEFAULT_THRESHOLD;
        private int minTokenLength = TitleSimilarity.DEFAULT_MIN_TOKEN_LENGTH;

        public DedupOptions toOptions() {
            return new DedupOptions(maxPerGroup, targetCount, locationPolicy, featuredFirst, titleSimilarity,
                similarityThreshold, minTokenLength);
        }

        public int getMaxPerGroup() {
            return maxPerGroup;
        }

        public void setMaxPerGroup(int maxPerGroup) {
            this.maxPerGroup = maxPerGroup;
        }

        public int getTargetCount() {
            return targetCount;
        }

        public void setTargetCount(int targetCount) {
            this.targetCount = targetCount;
        }

        public LocationGroupPolicy getLocationPolicy() {
            return locationPolicy;
        }

        public void setLocationPolicy(LocationGroupPolicy locationPolicy) {
            this.locationPolicy = locationPolicy;
        }

        public boolean isFeaturedFirst() {
            return featuredFirst;
        }

        public void setFeaturedFirst(boolean featuredFirst) {
            this.featuredFirst = featuredFirst;
        }

        public boolean isTitleSimilarity() {
            return titleSimilarity;
        }

        public void setTitleSimilarity(boolean titleSimilarity) {
            this.titleSimilarity = titleSimilarity;
        }

        public double getSimilarityThreshold() {
            return similarityThreshold;
        }

        public void setSimilarityThreshold(double similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
        }

        public int getMinTokenLength() {
            return minTokenLength;
        }

        public void setMinTokenLength(int minTokenLength) {
            this.minTokenLength = minTokenLength;
        }
    }

    public static class RateLimit {
        private long windowMs = 60_000;
        private int maxRequests = 120;

        public long getWindowMs() {
            return windowMs;
        }

        public void setWindowMs(long windowMs) {
            this.windowMs = windowMs;
        }

        public int getMaxRequests() {
            return maxRequests;
        }

        public void setMaxRequests(int maxRequests) {
            this.maxRequests = maxRequests;
        }
    }

    public static class Cors {
        private String allowedOrigins = "*";

        public String getAllowedOrigins() {
            return allowedOrigins;
        }

        public void setAllowedOrigins(String allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
        }
    }
}
