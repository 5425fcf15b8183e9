package org.knowhub.controller;

import org.knowhub.DTO.SearchFilters;
import org.knowhub.DTO.SearchRequest;
import org.knowhub.DTO.SearchResult;
import org.knowhub.annotation.LogAction;
import org.knowhub.config.RagProperties;
import org.knowhub.service.HybridSearchService;
import org.knowhub.utils.LogUtils;
import org.knowhub.utils.Result;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

// 提供混合检索接口
@RestController
@RequestMapping("/api/v1/search")
public class SearchController {

    @Autowired
    private HybridSearchService hybridSearchService;

    @Autowired
    private RagProperties ragProperties;

    /**
     * 混合检索
     *
     * 示例请求体: {"query": "how do I deploy", "topK": 5, "tags": ["CODE"]}
     */
    @PostMapping
    @LogAction(value = "SearchController", action = "hybridSearch")
    public ResponseEntity<?> search(@RequestBody SearchRequest request) {
        int topK = request.getTopK() != null ? request.getTopK() : ragProperties.getRetrieval().getDefaultTopK();
        SearchFilters filters = new SearchFilters(request.getDocumentIds(), request.getTags());
        List<SearchResult> results = hybridSearchService.search(request.getQuery(), topK, filters);
        LogUtils.logBusiness("HYBRID_SEARCH", "-", "混合检索完成: 返回结果数量=%d", results.size());
        return ResponseEntity.ok(Result.success("success", results));
    }
}
