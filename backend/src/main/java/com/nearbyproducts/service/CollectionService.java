package com.nearbyproducts.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import com.nearbyproducts.config.AppProperties;
import com.nearbyproducts.dedup.DedupOptions;
import com.nearbyproducts.dedup.DeduplicationEngine;
import com.nearbyproducts.dto.CachedCollection;
import com.nearbyproducts.dto.CollectionRequest;
import com.nearbyproducts.dto.CollectionResponse;
import com.nearbyproducts.model.Hit;
import com.nearbyproducts.render.CollectionHtmlRenderer;
import com.nearbyproducts.search.ProductSearchClient;
import com.nearbyproducts.search.SearchQuery;
import com.nearbyproducts.search.SearchResult;
import com.nearbyproducts.util.CacheKeys;
import com.nearbyproducts.util.GeoValidator;

/**
 * Builds and caches the static product grid of a city collection page.
 */
@Service
public class CollectionService {

    private static final Logger log = LoggerFactory.getLogger(CollectionService.class);

    private final ProductSearchClient searchClient;
    private final DeduplicationEngine engine;
    private final CollectionHtmlRenderer renderer;
    private final CacheService cacheService;
    private final AppProperties appProperties;
    private final Clock clock;

    public CollectionService(
        ProductSearchClient searchClient,
        DeduplicationEngine engine,
        CollectionHtmlRenderer renderer,
        CacheService cacheService,
        AppProperties appProperties,
        Clock clock
    ) {
        this.searchClient = searchClient;
        this.engine = engine;
        this.renderer = renderer;
        this.cacheService = cacheService;
        this.appProperties = appProperties;
        this.clock = clock;
    }

    public CollectionResponse generate(CollectionRequest request) {
        if (request.getLat() == null || request.getLng() == null || !StringUtils.hasText(request.getCityName())) {
            throw new IllegalArgumentException("Missing required parameters: lat, lng, cityName");
        }
        if (!GeoValidator.isValidCoordinate(request.getLat(), request.getLng())) {
            throw new IllegalArgumentException("lat must be between -90 and 90, lng between -180 and 180");
        }

        String city = request.getCityName();
        log.info("Pre-generating collection city={} location={}, {} radius={}km handle={}",
            city, request.getLat(), request.getLng(), request.getRadiusKm(), request.getCollectionHandle());

        String cacheKey = CacheKeys.collection(city, request.getLat(), request.getLng(), request.getRadiusKm(),
            request.getHitsPerPage());
        Instant now = clock.instant();
        Duration ttl = Duration.ofHours(appProperties.getCache().getTtlHours());

        if (!request.isForceRegenerate()) {
            Optional<CachedCollection> cached = cacheService.get(cacheKey, CachedCollection.class);
            if (cached.isPresent() && now.toEpochMilli() - cached.get().getTimestamp() < ttl.toMillis()) {
                long ageHours = Duration.ofMillis(now.toEpochMilli() - cached.get().getTimestamp()).toHours();
                log.info("Returning cached static HTML for {} age={}h", city, ageHours);
                return CollectionResponse.cached(cached.get().getHtml(), cached.get().getGenerated(), ageHours + "h");
            }
        }

        SearchResult result = searchClient.search(SearchQuery.around(request.getLat(), request.getLng(),
            request.getRadiusKm(), appProperties.getSearch().getCollectionHits()));
        DedupOptions options = appProperties.getDedup().toOptions().withTargetCount(request.getHitsPerPage());
        List<Hit> products = engine.select(result.getHits(), options);

        String html = renderer.render(products, city, result.getTotalHits(), now);
        String generated = now.toString();
        cacheService.set(cacheKey,
            new CachedCollection(html, now.toEpochMilli(), generated, products.size(), result.getTotalHits()), ttl);

        log.info("Static HTML generated for {}: products={} size={}KB searchTime={}ms",
            city, products.size(), Math.round(html.length() / 1024.0), result.getProcessingTimeMs());

        return CollectionResponse.fresh(html, generated,
            new CollectionResponse.Stats(products.size(), result.getTotalHits(), city, result.getProcessingTimeMs()));
    }
}
