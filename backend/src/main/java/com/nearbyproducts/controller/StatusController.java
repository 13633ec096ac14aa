package com.nearbyproducts.controller;

import java.lang.management.ManagementFactory;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import com.nearbyproducts.dto.ApiResponse;
import com.nearbyproducts.service.CacheService;
import com.nearbyproducts.util.CacheKeys;

@RestController
public class StatusController {

    static final String SERVICE_NAME = "nearby-products";

    private final CacheService cacheService;

    public StatusController(CacheService cacheService) {
        this.cacheService = cacheService;
    }

    @GetMapping("/")
    public ResponseEntity<?> health() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "ok");
        status.put("service", SERVICE_NAME);
        status.put("cacheSize", cachedKeys().size());
        status.put("uptime", uptimeSeconds() + "s");
        return ResponseEntity.ok(ApiResponse.ok(status));
    }

    @GetMapping("/cache-stats")
    public ResponseEntity<?> cacheStats() {
        Set<String> keys = cachedKeys();
        Runtime runtime = Runtime.getRuntime();
        Map<String, Object> memory = new LinkedHashMap<>();
        memory.put("totalBytes", runtime.totalMemory());
        memory.put("freeBytes", runtime.freeMemory());
        memory.put("maxBytes", runtime.maxMemory());

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("size", keys.size());
        stats.put("keys", keys);
        stats.put("memory", memory);
        stats.put("uptime", uptimeSeconds());
        return ResponseEntity.ok(ApiResponse.ok(stats));
    }

    private Set<String> cachedKeys() {
        Set<String> keys = new TreeSet<>(cacheService.keys(CacheKeys.NEARBY_PREFIX + "*"));
        keys.addAll(cacheService.keys(CacheKeys.COLLECTION_PREFIX + "*"));
        return keys;
    }

    private static long uptimeSeconds() {
        return ManagementFactory.getRuntimeMXBean().getUptime() / 1000;
    }
}
