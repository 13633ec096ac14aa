package com.nearbyproducts.service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.nearbyproducts.config.AppProperties;
import com.nearbyproducts.dedup.DedupOptions;
import com.nearbyproducts.dedup.DeduplicationEngine;
import com.nearbyproducts.dto.CachedSearch;
import com.nearbyproducts.dto.NearbySearchRequest;
import com.nearbyproducts.dto.NearbySearchResponse;
import com.nearbyproducts.model.Hit;
import com.nearbyproducts.search.ProductSearchClient;
import com.nearbyproducts.search.SearchQuery;
import com.nearbyproducts.search.SearchResult;
import com.nearbyproducts.util.CacheKeys;
import com.nearbyproducts.util.GeoValidator;

@Service
public class NearbySearchService {

    private static final Logger log = LoggerFactory.getLogger(NearbySearchService.class);

    private final ProductSearchClient searchClient;
    private final DeduplicationEngine engine;
    private final CacheService cacheService;
    private final AppProperties appProperties;
    private final Clock clock;

    public NearbySearchService(
        ProductSearchClient searchClient,
        DeduplicationEngine engine,
        CacheService cacheService,
        AppProperties appProperties,
        Clock clock
    ) {
        this.searchClient = searchClient;
        this.engine = engine;
        this.cacheService = cacheService;
        this.appProperties = appProperties;
        this.clock = clock;
    }

    public NearbySearchResponse search(NearbySearchRequest request) {
        Double lat = request.getLat();
        Double lng = request.getLng();
        boolean hasCoordinates = lat != null && lng != null;
        if (!request.isFallback() && !hasCoordinates) {
            throw new IllegalArgumentException("Missing required parameters: lat, lng (or set fallback: true)");
        }
        if (hasCoordinates && !GeoValidator.isValidCoordinate(lat, lng)) {
            throw new IllegalArgumentException("lat must be between -90 and 90, lng between -180 and 180");
        }

        log.info("Nearby search location={} radius={}km page={}",
            hasCoordinates ? lat + ", " + lng : "fallback", request.getRadiusKm(), request.getHitsPerPage());

        String cacheKey = CacheKeys.nearby(lat, lng, request.getRadiusKm(), request.getHitsPerPage(),
            request.getMaxPerLocationPhoto());
        long now = clock.millis();
        Duration ttl = Duration.ofHours(appProperties.getCache().getTtlHours());

        Optional<CachedSearch> cached = cacheService.get(cacheKey, CachedSearch.class);
        if (cached.isPresent() && cached.get().getResponse() != null && now - cached.get().getTimestamp() < ttl.toMillis()) {
            long ageMinutes = Duration.ofMillis(now - cached.get().getTimestamp()).toMinutes();
            log.info("Cache HIT {} age={}m", cacheKey, ageMinutes);
            return cached.get().getResponse().fromCache(ageMinutes + "m");
        }
        log.info("Cache MISS {}, querying search index", cacheKey);

        int fetchSize = request.getHitsPerPage() * Math.max(1, appProperties.getSearch().getOverfetchFactor());
        SearchQuery query = !request.isFallback() && hasCoordinates
            ? SearchQuery.around(lat, lng, request.getRadiusKm(), fetchSize)
            : SearchQuery.unbounded(fetchSize);
        SearchResult result = searchClient.search(query.excluding(request.getCurrentHandle()));

        DedupOptions options = appProperties.getDedup().toOptions()
            .withMaxPerGroup(request.getMaxPerLocationPhoto())
            .withTargetCount(request.getHitsPerPage());
        List<Hit> hits = engine.select(result.getHits(), options);

        NearbySearchResponse response = new NearbySearchResponse(hits, result.getTotalHits(), result.getProcessingTimeMs());
        cacheService.set(cacheKey, new CachedSearch(response, now), ttl);
        return response;
    }
}
