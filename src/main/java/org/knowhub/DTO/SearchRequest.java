package org.knowhub.DTO;

import lombok.Data;

import java.util.Set;

@Data
public class SearchRequest {
    private String query;
    private Integer topK;
    private Set<String> documentIds;
    private Set<StructuralTag> tags;
}
