package org.knowhub.service;

import org.knowhub.DTO.BoundedPrompt;
import org.knowhub.DTO.Message;
import org.knowhub.DTO.RankedChunk;
import org.knowhub.DTO.SearchResult;
import org.knowhub.config.AiProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 组装带编号参考资料的 Prompt。
 * 参考资料按排名依次放入，超出字符预算时从排名最低的开始整块丢弃，不截断分块。
 */
@Component
public class PromptBuilder {

    private final AiProperties aiProperties;

    public PromptBuilder(AiProperties aiProperties) {
        this.aiProperties = aiProperties;
    }

    public BoundedPrompt build(String question, List<RankedChunk> chunks, List<Message> history, int maxContextChars) {
        List<RankedChunk> ordered = new ArrayList<>(chunks);
        ordered.sort(Comparator.comparingInt(RankedChunk::getRank));

        StringBuilder context = new StringBuilder();
        Map<Integer, SearchResult> references = new LinkedHashMap<>();
        int used = 0;
        int dropped = 0;
        int label = 1;
        boolean full = false;
        for (RankedChunk chunk : ordered) {
            String block = formatBlock(label, chunk.getResult());
            // 一旦放不下，后面排名更低的都不再放
            if (full || used + block.length() > maxContextChars) {
                full = true;
                dropped++;
                continue;
            }
            context.append(block);
            references.put(label, chunk.getResult());
            used += block.length();
            label++;
        }

        AiProperties.Prompt promptCfg = aiProperties.getPrompt();
        StringBuilder system = new StringBuilder();
        if (promptCfg.getRules() != null) {
            system.append(promptCfg.getRules()).append("\n\n");
        }
        system.append(promptCfg.getRefStart()).append("\n")
                .append(context)
                .append(promptCfg.getRefEnd());

        List<Message> messages = new ArrayList<>();
        messages.add(new Message("system", system.toString()));
        if (history != null) {
            messages.addAll(history);
        }
        messages.add(new Message("user", question));
        return new BoundedPrompt(messages, references, used, dropped);
    }

    private String formatBlock(int label, SearchResult result) {
        String source = result.getFileName() != null ? result.getFileName() : result.getDocumentId();
        return "[" + label + "] (source: " + source + "#" + result.getSequenceIndex() + ")\n"
                + result.getTextContent().strip() + "\n\n";
    }
}
