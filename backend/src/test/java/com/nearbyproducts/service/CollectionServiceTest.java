package com.nearbyproducts.service;

import static com.nearbyproducts.HitFixtures.atPhoto;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.nearbyproducts.config.AppProperties;
import com.nearbyproducts.dedup.DeduplicationEngine;
import com.nearbyproducts.dto.CachedCollection;
import com.nearbyproducts.dto.CollectionRequest;
import com.nearbyproducts.dto.CollectionResponse;
import com.nearbyproducts.model.Hit;
import com.nearbyproducts.render.CollectionHtmlRenderer;
import com.nearbyproducts.search.ProductSearchClient;
import com.nearbyproducts.search.SearchQuery;
import com.nearbyproducts.search.SearchResult;

@ExtendWith(MockitoExtension.class)
class CollectionServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String BERLIN_KEY = "static-collection:Berlin:52.52:13.405:30:4";

    @Mock
    private ProductSearchClient searchClient;

    @Mock
    private CacheService cacheService;

    private CollectionService service;

    @BeforeEach
    void setUp() {
        service = new CollectionService(searchClient, new DeduplicationEngine(), new CollectionHtmlRenderer(),
            cacheService, new AppProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static CollectionRequest berlin() {
        CollectionRequest request = new CollectionRequest();
        request.setLat(52.52);
        request.setLng(13.405);
        request.setCityName("Berlin");
        request.setHitsPerPage(4);
        return request;
    }

    @Test
    void shouldRequireCityAndCoordinates() {
        CollectionRequest request = berlin();
        request.setCityName(" ");

        assertThatThrownBy(() -> service.generate(request))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Missing required parameters: lat, lng, cityName");
        verifyNoInteractions(searchClient, cacheService);
    }

    @Test
    void shouldRenderAndCacheFreshCollection() {
        // Given
        List<Hit> hits = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            hits.add(atPhoto("berlin-" + i, i < 3 ? "tor" : "dom"));
        }
        when(searchClient.search(any(SearchQuery.class))).thenReturn(new SearchResult(hits, 40, 9));

        // When
        CollectionResponse response = service.generate(berlin());

        // Then
        ArgumentCaptor<SearchQuery> query = ArgumentCaptor.forClass(SearchQuery.class);
        verify(searchClient).search(query.capture());
        assertThat(query.getValue().getHitsPerPage()).isEqualTo(100);
        assertThat(query.getValue().hasGeoFilter()).isTrue();

        assertThat(response.isCached()).isFalse();
        assertThat(response.getGenerated()).isEqualTo("2026-03-01T12:00:00Z");
        assertThat(response.getStats().getProducts()).isEqualTo(4);
        assertThat(response.getStats().getTotalHits()).isEqualTo(40);
        assertThat(response.getStats().getCity()).isEqualTo("Berlin");
        assertThat(response.getStats().getSearchTime()).isEqualTo(9);
        assertThat(response.getHtml())
            .contains("Showing 4 artworks from Berlin and nearby areas (36 more available)")
            .contains("/products/berlin-0", "/products/berlin-3", "/products/berlin-1", "/products/berlin-4")
            .doesNotContain("/products/berlin-2");

        ArgumentCaptor<CachedCollection> stored = ArgumentCaptor.forClass(CachedCollection.class);
        verify(cacheService).set(eq(BERLIN_KEY), stored.capture(), eq(Duration.ofHours(24)));
        assertThat(stored.getValue().getHtml()).isEqualTo(response.getHtml());
        assertThat(stored.getValue().getProducts()).isEqualTo(4);
        assertThat(stored.getValue().getTimestamp()).isEqualTo(NOW.toEpochMilli());
    }

    @Test
    void shouldReturnCachedHtmlWithAgeInHours() {
        CachedCollection cached = new CachedCollection("<div>cached</div>",
            NOW.minus(Duration.ofHours(3)).toEpochMilli(), "2026-03-01T09:00:00Z", 4, 40);
        when(cacheService.get(BERLIN_KEY, CachedCollection.class)).thenReturn(Optional.of(cached));

        CollectionResponse response = service.generate(berlin());

        assertThat(response.isCached()).isTrue();
        assertThat(response.getCacheAge()).isEqualTo("3h");
        assertThat(response.getHtml()).isEqualTo("<div>cached</div>");
        assertThat(response.getGenerated()).isEqualTo("2026-03-01T09:00:00Z");
        assertThat(response.getStats()).isNull();
        verifyNoInteractions(searchClient);
    }

    @Test
    void shouldBypassCacheWhenRegenerationForced() {
        CollectionRequest request = berlin();
        request.setForceRegenerate(true);
        when(searchClient.search(any(SearchQuery.class))).thenReturn(new SearchResult(List.of(), 0, 1));

        CollectionResponse response = service.generate(request);

        assertThat(response.isCached()).isFalse();
        assertThat(response.getHtml()).contains("Showing 0 artworks from Berlin");
        verify(cacheService).set(eq(BERLIN_KEY), any(CachedCollection.class), any(Duration.class));
    }
}
