package com.nearbyproducts.controller;

import static com.nearbyproducts.HitFixtures.atPhoto;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.nearbyproducts.dto.CollectionRequest;
import com.nearbyproducts.dto.CollectionResponse;
import com.nearbyproducts.dto.NearbySearchRequest;
import com.nearbyproducts.dto.NearbySearchResponse;
import com.nearbyproducts.exception.ApiExceptionHandler;
import com.nearbyproducts.search.SearchClientException;
import com.nearbyproducts.service.CollectionService;
import com.nearbyproducts.service.NearbySearchService;

@ExtendWith(MockitoExtension.class)
class NearbyControllerTest {

    @Mock
    private NearbySearchService nearbySearchService;

    @Mock
    private CollectionService collectionService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new NearbyController(nearbySearchService, collectionService))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Nested
    class NearbySearch {

        @Test
        void shouldReturnDeduplicatedHits() throws Exception {
            when(nearbySearchService.search(any(NearbySearchRequest.class)))
                .thenReturn(new NearbySearchResponse(List.of(atPhoto("harbour-view", "p1")), 17, 4));

            mockMvc.perform(post("/api/nearby-search")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"lat\": 53.55, \"lng\": 9.99, \"hitsPerPage\": 12}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.data.hits[0].handle").value("harbour-view"))
                .andExpect(jsonPath("$.data.totalHits").value(17))
                .andExpect(jsonPath("$.data.cached").value(false));
        }

        @Test
        void shouldMapMissingParametersToBadRequest() throws Exception {
            when(nearbySearchService.search(any(NearbySearchRequest.class)))
                .thenThrow(new IllegalArgumentException("Missing required parameters: lat, lng (or set fallback: true)"));

            mockMvc.perform(post("/api/nearby-search").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Invalid request"))
                .andExpect(jsonPath("$.message").value(containsString("fallback: true")));
        }

        @Test
        void shouldRejectInvalidPageSizeBeforeSearching() throws Exception {
            mockMvc.perform(post("/api/nearby-search")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"lat\": 53.55, \"lng\": 9.99, \"hitsPerPage\": 0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(containsString("hitsPerPage")));

            verifyNoInteractions(nearbySearchService);
        }

        @Test
        void shouldRejectMalformedBody() throws Exception {
            mockMvc.perform(post("/api/nearby-search").contentType(MediaType.APPLICATION_JSON).content("{\"lat\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed JSON body"));
        }

        @Test
        void shouldReportSearchFailureAsServerError() throws Exception {
            when(nearbySearchService.search(any(NearbySearchRequest.class)))
                .thenThrow(new SearchClientException("Search index request failed: 503"));

            mockMvc.perform(post("/api/nearby-search")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"fallback\": true}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Search failed"));
        }
    }

    @Test
    void shouldReturnGeneratedCollection() throws Exception {
        when(collectionService.generate(any(CollectionRequest.class)))
            .thenReturn(CollectionResponse.cached("<div>grid</div>", "2026-03-01T09:00:00Z", "3h"));

        mockMvc.perform(post("/api/pre-generate-collection")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"lat\": 52.52, \"lng\": 13.405, \"cityName\": \"Berlin\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.data.html").value("<div>grid</div>"))
            .andExpect(jsonPath("$.data.cached").value(true))
            .andExpect(jsonPath("$.data.cacheAge").value("3h"));
    }
}
