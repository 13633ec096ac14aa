package com.nearbyproducts.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.nearbyproducts.dto.ApiResponse;
import com.nearbyproducts.dto.CollectionRequest;
import com.nearbyproducts.dto.CollectionResponse;
import com.nearbyproducts.dto.NearbySearchRequest;
import com.nearbyproducts.dto.NearbySearchResponse;
import com.nearbyproducts.service.CollectionService;
import com.nearbyproducts.service.NearbySearchService;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api")
@Validated
public class NearbyController {

    private final NearbySearchService nearbySearchService;
    private final CollectionService collectionService;

    public NearbyController(NearbySearchService nearbySearchService, CollectionService collectionService) {
        this.nearbySearchService = nearbySearchService;
        this.collectionService = collectionService;
    }

    @PostMapping("/nearby-search")
    public ResponseEntity<?> nearbySearch(@RequestBody @Valid NearbySearchRequest request) {
        NearbySearchResponse response = nearbySearchService.search(request);
        return ResponseEntity.ok(ApiResponse.ok(response, response.getHits().size()));
    }

    @PostMapping("/pre-generate-collection")
    public ResponseEntity<?> preGenerateCollection(@RequestBody @Valid CollectionRequest request) {
        CollectionResponse response = collectionService.generate(request);
        return ResponseEntity.ok(ApiResponse.ok(response));
    }
}
