package com.nearbyproducts.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.math.BigDecimal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import com.nearbyproducts.config.AppProperties;
import com.nearbyproducts.model.Hit;

class AlgoliaSearchClientTest {

    private static final String QUERY_URL = "https://testapp-dsn.algolia.net/1/indexes/products/query";

    private static final String RESPONSE = """
        {
          "hits": [
            {
              "objectID": "1",
              "handle": "isar-sunset-40x60",
              "title": "Isar Sunset",
              "product_image": "https://cdn.example.com/isar.jpg",
              "price": 120.5,
              "vendor": "Studio Nord",
              "featured": true,
              "_geoloc": {"lat": 48.13, "lng": 11.58},
              "meta": {"location": {"details": {"location_photo": "photo-7", "style_name": "oil"}}},
              "_rankingInfo": {"geoDistance": 120}
            }
          ],
          "nbHits": 42,
          "processingTimeMS": 3,
          "page": 0
        }
        """;

    private MockRestServiceServer server;
    private AlgoliaSearchClient client;
    private AppProperties properties;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        properties = new AppProperties();
        properties.getSearch().setAppId("TestApp");
        properties.getSearch().setApiKey("search-key");
        properties.getSearch().setIndexName("products");
        client = new AlgoliaSearchClient(restTemplate, properties);
    }

    @Nested
    class Search {

        @Test
        void shouldPostGeoQueryAndMapHits() {
            // Given
            server.expect(requestTo(QUERY_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("X-Algolia-Application-Id", "TestApp"))
                .andExpect(header("X-Algolia-API-Key", "search-key"))
                .andExpect(jsonPath("$.params", containsString("aroundLatLng=48.13%2C11.58")))
                .andExpect(jsonPath("$.params", containsString("aroundRadius=30000")))
                .andExpect(jsonPath("$.params", containsString("filters=NOT+handle%3Aviewed")))
                .andRespond(withSuccess(RESPONSE, MediaType.APPLICATION_JSON));

            // When
            SearchResult result = client.search(SearchQuery.around(48.13, 11.58, 30, 72).excluding("viewed"));

            // Then
            server.verify();
            assertThat(result.getTotalHits()).isEqualTo(42);
            assertThat(result.getProcessingTimeMs()).isEqualTo(3);
            assertThat(result.getHits()).hasSize(1);
            Hit hit = result.getHits().get(0);
            assertThat(hit.getHandle()).isEqualTo("isar-sunset-40x60");
            assertThat(hit.getPrice()).isEqualByComparingTo(new BigDecimal("120.5"));
            assertThat(hit.isFeatured()).isTrue();
            assertThat(hit.getImageUrl()).isEqualTo("https://cdn.example.com/isar.jpg");
            assertThat(hit.getLocationDetails().getLocationPhotoId()).isEqualTo("photo-7");
            assertThat(hit.getLocationDetails().getStyleName()).isEqualTo("oil");
        }

        @Test
        void shouldOmitGeoParametersForUnboundedQuery() {
            server.expect(requestTo(QUERY_URL))
                .andExpect(jsonPath("$.params", not(containsString("aroundLatLng"))))
                .andExpect(jsonPath("$.params", not(containsString("filters="))))
                .andRespond(withSuccess("{\"hits\": [], \"nbHits\": 0}", MediaType.APPLICATION_JSON));

            SearchResult result = client.search(SearchQuery.unbounded(24));

            server.verify();
            assertThat(result.getHits()).isEmpty();
        }

        @Test
        void shouldWrapServerErrors() {
            server.expect(requestTo(QUERY_URL)).andRespond(withServerError());

            assertThatThrownBy(() -> client.search(SearchQuery.unbounded(24)))
                .isInstanceOf(SearchClientException.class)
                .hasMessageStartingWith("Search index request failed");
        }
    }

    @Nested
    class Credentials {

        @Test
        void shouldFailWithoutApplicationId() {
            properties.getSearch().setAppId(null);

            assertThatThrownBy(() -> client.search(SearchQuery.unbounded(24)))
                .isInstanceOf(SearchClientException.class)
                .hasMessageContaining("ALGOLIA_APP_ID");
            server.verify();
        }

        @Test
        void shouldFallBackToDefaultIndexName() {
            properties.getSearch().setIndexName(null);
            server.expect(requestTo("https://testapp-dsn.algolia.net/1/indexes/shopify_products/query"))
                .andRespond(withSuccess("{\"hits\": [], \"nbHits\": 0}", MediaType.APPLICATION_JSON));

            client.search(SearchQuery.unbounded(24));

            server.verify();
        }
    }

    @Test
    void shouldBuildEncodedParamString() {
        String params = AlgoliaSearchClient.buildParams(SearchQuery.around(48.137, 11.575, 25, 60).excluding("art-x"));

        assertThat(params).isEqualTo("query=&hitsPerPage=60"
            + "&attributesToRetrieve=title%2Chandle%2Cproduct_image%2Cimage%2Cprice%2Cvendor%2C_geoloc%2Cmeta.location.details%2Cfeatured"
            + "&getRankingInfo=true&aroundLatLng=48.137%2C11.575&aroundRadius=25000&filters=NOT+handle%3Aart-x");
    }

    @Test
    void shouldLowercaseApplicationIdInHost() {
        assertThat(AlgoliaSearchClient.queryUrl("ABC123", "shopify_products"))
            .isEqualTo("https://abc123-dsn.algolia.net/1/indexes/shopify_products/query");
    }
}
