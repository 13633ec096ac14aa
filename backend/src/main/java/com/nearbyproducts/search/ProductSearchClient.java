package com.nearbyproducts.search;

/**
 * Read access to the product search index.
 */
public interface ProductSearchClient {

    /**
     * Runs a query and returns the raw hits in index ranking order.
     *
     * @throws SearchClientException when the index cannot be reached or its answer cannot be read
     */
    SearchResult search(SearchQuery query);
}
