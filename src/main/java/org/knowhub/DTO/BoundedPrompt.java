package org.knowhub.DTO;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * 已按字符预算裁剪的 Prompt。references 为标签 [n] 到分块的映射，只包含真正放进 Prompt 的分块。
 */
@Getter
@AllArgsConstructor
public class BoundedPrompt {
    private final List<Message> messages;
    private final Map<Integer, SearchResult> references;
    private final int contextChars;
    private final int droppedCount;

    public boolean hasReferences() {
        return !references.isEmpty();
    }
}
