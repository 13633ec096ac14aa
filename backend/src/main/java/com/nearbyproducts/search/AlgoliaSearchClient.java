package com.nearbyproducts.search;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.nearbyproducts.config.AppProperties;
import com.nearbyproducts.model.Hit;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Queries an Algolia index over its REST API.
 */
@Service
public class AlgoliaSearchClient implements ProductSearchClient {

    private static final Logger log = LoggerFactory.getLogger(AlgoliaSearchClient.class);

    private static final String DEFAULT_INDEX_NAME = "shopify_products";

    private final RestTemplate restTemplate;
    private final AppProperties appProperties;

    private final Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();

    public AlgoliaSearchClient(RestTemplate restTemplate, AppProperties appProperties) {
        this.restTemplate = restTemplate;
        this.appProperties = appProperties;
    }

    @Override
    public SearchResult search(SearchQuery query) {
        AppProperties.Search config = appProperties.getSearch();
        String appId = resolveValue(config.getAppId(), "ALGOLIA_APP_ID");
        String apiKey = resolveValue(config.getApiKey(), "ALGOLIA_SEARCH_API_KEY");
        if (!StringUtils.hasText(appId) || !StringUtils.hasText(apiKey)) {
            throw new SearchClientException("ALGOLIA_APP_ID and ALGOLIA_SEARCH_API_KEY must be set");
        }
        String indexName = resolveValue(config.getIndexName(), "ALGOLIA_INDEX_NAME");
        if (!StringUtils.hasText(indexName)) {
            indexName = DEFAULT_INDEX_NAME;
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("X-Algolia-Application-Id", appId);
        headers.set("X-Algolia-API-Key", apiKey);
        HttpEntity<Map<String, String>> request = new HttpEntity<>(Map.of("params", buildParams(query)), headers);

        AlgoliaResponse response;
        try {
            response = restTemplate.postForObject(queryUrl(appId, indexName), request, AlgoliaResponse.class);
        } catch (RestClientException e) {
            throw new SearchClientException("Search index request failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new SearchClientException("Search index returned an empty body");
        }

        List<Hit> hits = response.getHits() != null ? new ArrayList<>(response.getHits()) : new ArrayList<>();
        log.debug("Index {} returned {} of {} hits in {}ms", indexName, hits.size(), response.getNbHits(),
            response.getProcessingTimeMs());
        return new SearchResult(hits, response.getNbHits(), response.getProcessingTimeMs());
    }

    static String queryUrl(String appId, String indexName) {
        return "https://" + appId.toLowerCase(Locale.ROOT) + "-dsn.algolia.net/1/indexes/"
            + URLEncoder.encode(indexName, StandardCharsets.UTF_8) + "/query";
    }

    static String buildParams(SearchQuery query) {
        StringBuilder params = new StringBuilder("query=");
        params.append("&hitsPerPage=").append(query.getHitsPerPage());
        params.append("&attributesToRetrieve=").append(encode(String.join(",", SearchQuery.DEFAULT_ATTRIBUTES)));
        params.append("&getRankingInfo=true");
        if (query.hasGeoFilter()) {
            params.append("&aroundLatLng=").append(encode(query.getLatitude() + "," + query.getLongitude()));
            params.append("&aroundRadius=").append(query.getRadiusMeters());
        }
        if (StringUtils.hasText(query.getExcludeHandle())) {
            params.append("&filters=").append(encode("NOT handle:" + query.getExcludeHandle()));
        }
        return params.toString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private String resolveValue(String propertyValue, String key) {
        if (StringUtils.hasText(propertyValue)) {
            return propertyValue;
        }
        String systemValue = System.getenv(key);
        if (StringUtils.hasText(systemValue)) {
            return systemValue;
        }
        String dotenvValue = dotenv.get(key);
        return StringUtils.hasText(dotenvValue) ? dotenvValue : null;
    }
}
