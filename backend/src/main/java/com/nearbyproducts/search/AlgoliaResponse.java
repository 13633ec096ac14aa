package com.nearbyproducts.search;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nearbyproducts.model.Hit;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AlgoliaResponse {
    private List<Hit> hits = new ArrayList<>();
    private long nbHits;

    @JsonProperty("processingTimeMS")
    private long processingTimeMs;

    public List<Hit> getHits() {
        return hits;
    }

    public void setHits(List<Hit> hits) {
        this.hits = hits;
    }

    public long getNbHits() {
        return nbHits;
    }

    public void setNbHits(long nbHits) {
        this.nbHits = nbHits;
    }

    public long getProcessingTimeMs() {
        return processingTimeMs;
    }

    public void setProcessingTimeMs(long processingTimeMs) {
        this.processingTimeMs = processingTimeMs;
    }
}
