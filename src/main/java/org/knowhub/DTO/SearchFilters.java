package org.knowhub.DTO;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.Set;

/**
 * 检索过滤条件，字段为空表示不限制。
 * <p>
 * activeVersions 由检索服务在读锁内填入，后端只召回这些 (文档, 版本) 的记录。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SearchFilters {
    private Set<String> documentIds;
    private Set<StructuralTag> tags;
    private Map<String, Long> activeVersions;

    public SearchFilters(Set<String> documentIds, Set<StructuralTag> tags) {
        this(documentIds, tags, null);
    }

    public static SearchFilters none() {
        return new SearchFilters();
    }

    public SearchFilters withActiveVersions(Map<String, Long> versions) {
        return toBuilder().activeVersions(versions).build();
    }

    public boolean hasDocumentIds() {
        return documentIds != null && !documentIds.isEmpty();
    }

    public boolean hasTags() {
        return tags != null && !tags.isEmpty();
    }

    public boolean matches(IndexRecord record) {
        if (hasDocumentIds() && !documentIds.contains(record.getDocumentId())) {
            return false;
        }
        if (activeVersions != null) {
            Long version = activeVersions.get(record.getDocumentId());
            if (version == null || version != record.getVersion()) {
                return false;
            }
        }
        return !hasTags() || (record.getTag() != null && tags.contains(StructuralTag.valueOf(record.getTag())));
    }
}
