package org.knowhub.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.knowhub.DTO.SearchFilters;
import org.knowhub.DTO.SearchResult;
import org.knowhub.config.RagProperties;
import org.knowhub.exception.GlobalExceptionHandler;
import org.knowhub.exception.RetrievalException;
import org.knowhub.service.HybridSearchService;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class SearchControllerTest {

    private final HybridSearchService searchService = mock(HybridSearchService.class);
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        SearchController controller = new SearchController();
        ReflectionTestUtils.setField(controller, "hybridSearchService", searchService);
        ReflectionTestUtils.setField(controller, "ragProperties", new RagProperties());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void returnsRankedResults() throws Exception {
        SearchResult hit = SearchResult.builder()
                .chunkId("ops:0").documentId("ops").version(1).sequenceIndex(0)
                .textContent("Deploy via `terraform apply`").score(0.9)
                .build();
        when(searchService.search(eq("how do I deploy"), eq(3), any(SearchFilters.class))).thenReturn(List.of(hit));

        mockMvc.perform(post("/api/v1/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"how do I deploy\",\"topK\":3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data[0].chunkId").value("ops:0"));
    }

    @Test
    void backendOutageIsReportedAsUnavailable() throws Exception {
        when(searchService.search(any(), anyInt(), any(SearchFilters.class)))
                .thenThrow(new RetrievalException("es down"));

        mockMvc.perform(post("/api/v1/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"deploy\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.message").value(GlobalExceptionHandler.UNAVAILABLE_MESSAGE));
    }

    @Test
    void invalidTopKIsBadRequest() throws Exception {
        when(searchService.search(any(), eq(0), any(SearchFilters.class)))
                .thenThrow(new IllegalArgumentException("topK 必须大于 0"));

        mockMvc.perform(post("/api/v1/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"deploy\",\"topK\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }
}
