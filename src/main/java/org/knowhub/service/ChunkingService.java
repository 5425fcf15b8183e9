package org.knowhub.service;

import com.hankcs.hanlp.seg.common.Term;
import com.hankcs.hanlp.tokenizer.StandardTokenizer;
import org.knowhub.DTO.Chunk;
import org.knowhub.DTO.StructuralTag;
import org.knowhub.config.RagProperties;
import org.knowhub.entity.SourceType;
import org.knowhub.exception.DocumentParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 结构感知的文档切分。
 * <p>
 * 先按段落、标题、代码块、表格切成块，再把块贪心合并到字符预算内。
 * 超长块依次按句子、HanLP 分词、固定窗口（带重叠）拆分。
 * 每个分块的文本都是原文的一个连续子串，按 startOffset 排序后拼接（去掉重叠部分）即为原文。
 * 纯空白的片段并入相邻分块，不单独成块，因此分块长度可能超出预算若干个空白字符。
 */
@Service
public class ChunkingService {

    private static final Logger logger = LoggerFactory.getLogger(ChunkingService.class);

    private static final Pattern HEADING = Pattern.compile("^ {0,3}#{1,6}(\\s.*)?$");
    private static final Pattern TABLE_ROW = Pattern.compile("^\\s*\\|.*$");
    private static final Pattern FENCE = Pattern.compile("^\\s*(```|~~~).*$");
    // 句末标点及其后的引号、括号和空白都归到前一句
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?;。！？；]+[\"'”’)）\\]]*\\s*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final RagProperties ragProperties;

    public ChunkingService(RagProperties ragProperties) {
        this.ragProperties = ragProperties;
    }

    /**
     * 切分文档。相同输入总是得到相同结果，每次调用返回新的列表。
     *
     * @throws DocumentParseException 文本为空或缺少类型
     */
    public List<Chunk> chunk(String documentId, String text, SourceType sourceType) {
        if (sourceType == null) {
            throw new DocumentParseException("缺少文档类型: " + documentId);
        }
        if (text == null || text.isBlank()) {
            throw new DocumentParseException("文档内容为空: " + documentId);
        }
        int maxChars = ragProperties.getChunking().getMaxChars();
        int overlap = ragProperties.getChunking().getOverlap();
        if (maxChars <= 0 || overlap < 0 || overlap >= maxChars) {
            throw new IllegalArgumentException("切分配置非法: max-chars=" + maxChars + ", overlap=" + overlap);
        }

        List<Span> blocks = splitBlocks(text, sourceType == SourceType.MARKDOWN);
        List<Span> spans = absorbBlank(text, pack(text, blocks, maxChars, overlap));

        List<Chunk> chunks = new ArrayList<>(spans.size());
        for (int i = 0; i < spans.size(); i++) {
            Span span = spans.get(i);
            chunks.add(Chunk.builder()
                    .documentId(documentId)
                    .sequenceIndex(i)
                    .text(text.substring(span.start, span.end))
                    .startOffset(span.start)
                    .endOffset(span.end)
                    .tag(span.tag)
                    .build());
        }
        logger.info("文档切分完成，documentId: {}, 类型: {}, 字符数: {}, 块数: {}, 分块数: {}",
                documentId, sourceType, text.length(), blocks.size(), chunks.size());
        return chunks;
    }

    /**
     * 按行扫描切块。空行归入前一块，第一块从 0 开始，块与块首尾相接。
     */
    private List<Span> splitBlocks(String text, boolean markdown) {
        List<Span> blocks = new ArrayList<>();
        Span current = null;
        boolean inFence = false;
        boolean previousBlank = false;
        int pos = 0;
        int length = text.length();

        while (pos < length) {
            int lineEnd = text.indexOf('\n', pos);
            int next = lineEnd < 0 ? length : lineEnd + 1;
            String line = text.substring(pos, lineEnd < 0 ? length : lineEnd);

            if (inFence) {
                // 代码块内部（包括空行）不拆
                current.end = next;
                if (FENCE.matcher(line).matches()) {
                    inFence = false;
                }
                previousBlank = false;
                pos = next;
                continue;
            }
            if (line.isBlank()) {
                if (current != null) {
                    current.end = next;
                }
                previousBlank = true;
                pos = next;
                continue;
            }

            StructuralTag kind = markdown ? classify(line) : StructuralTag.BODY;
            boolean startsNew = current == null || previousBlank || kind != current.tag
                    || kind == StructuralTag.HEADING || kind == StructuralTag.CODE;
            if (startsNew) {
                if (current != null) {
                    blocks.add(current);
                }
                current = new Span(current == null ? 0 : pos, next, kind);
            } else {
                current.end = next;
            }
            if (kind == StructuralTag.CODE) {
                inFence = true;
            }
            previousBlank = false;
            pos = next;
        }
        if (current != null) {
            current.end = length;
            blocks.add(current);
        }
        return blocks;
    }

    private StructuralTag classify(String line) {
        if (FENCE.matcher(line).matches()) {
            return StructuralTag.CODE;
        }
        if (HEADING.matcher(line).matches()) {
            return StructuralTag.HEADING;
        }
        if (TABLE_ROW.matcher(line).matches()) {
            return StructuralTag.TABLE;
        }
        return StructuralTag.BODY;
    }

    /**
     * 把块贪心合并到预算内。标题总是开启新分块。
     */
    private List<Span> pack(String text, List<Span> blocks, int maxChars, int overlap) {
        List<Span> chunks = new ArrayList<>();
        Span current = null;
        for (Span block : blocks) {
            if (block.length() > maxChars) {
                if (current != null) {
                    chunks.add(current);
                    current = null;
                }
                chunks.addAll(splitBySentences(text, block, maxChars, overlap));
                continue;
            }
            if (current != null && (block.tag == StructuralTag.HEADING || current.length() + block.length() > maxChars)) {
                chunks.add(current);
                current = null;
            }
            if (current == null) {
                current = new Span(block.start, block.end, block.tag);
            } else {
                current.end = block.end;
                // 标题后面跟正文时，按正文的类型标记
                if (current.tag == StructuralTag.HEADING) {
                    current.tag = block.tag;
                }
            }
        }
        if (current != null) {
            chunks.add(current);
        }
        return chunks;
    }

    /**
     * 空白片段并入前一个分块，位于开头时并入后一个
     */
    private List<Span> absorbBlank(String text, List<Span> spans) {
        List<Span> result = new ArrayList<>(spans.size());
        int pendingStart = -1;
        for (Span span : spans) {
            if (text.substring(span.start, span.end).isBlank()) {
                if (!result.isEmpty()) {
                    Span previous = result.get(result.size() - 1);
                    previous.end = Math.max(previous.end, span.end);
                } else if (pendingStart < 0) {
                    pendingStart = span.start;
                }
                continue;
            }
            if (pendingStart >= 0) {
                result.add(new Span(Math.min(pendingStart, span.start), span.end, span.tag));
                pendingStart = -1;
            } else {
                result.add(span);
            }
        }
        return result;
    }

    private List<Span> splitBySentences(String text, Span block, int maxChars, int overlap) {
        List<Integer> cuts = new ArrayList<>();
        Matcher matcher = SENTENCE_END.matcher(text).region(block.start, block.end);
        while (matcher.find()) {
            int cut = matcher.end();
            if (cut > block.start && cut < block.end) {
                cuts.add(cut);
            }
        }
        List<Span> pieces = new ArrayList<>();
        Span current = null;
        for (Span unit : units(block, cuts)) {
            if (unit.length() > maxChars) {
                if (current != null) {
                    pieces.add(current);
                    current = null;
                }
                pieces.addAll(splitByWords(text, unit, maxChars, overlap));
                continue;
            }
            current = append(pieces, current, unit, maxChars);
        }
        if (current != null) {
            pieces.add(current);
        }
        return pieces;
    }

    /**
     * 超长句子按词边界拆分，中文依赖 HanLP 分词
     */
    private List<Span> splitByWords(String text, Span sentence, int maxChars, int overlap) {
        List<Span> pieces = new ArrayList<>();
        Span current = null;
        for (Span word : units(sentence, wordCuts(text, sentence))) {
            if (word.length() > maxChars) {
                if (current != null) {
                    pieces.add(current);
                    current = null;
                }
                pieces.addAll(slidingWindow(text, word, maxChars, overlap));
                continue;
            }
            current = append(pieces, current, word, maxChars);
        }
        if (current != null) {
            pieces.add(current);
        }
        return pieces;
    }

    private List<Integer> wordCuts(String text, Span sentence) {
        String segment = text.substring(sentence.start, sentence.end);
        List<Integer> cuts = new ArrayList<>();
        try {
            List<Term> terms = StandardTokenizer.segment(segment);
            int cursor = 0;
            for (Term term : terms) {
                if (term.word == null || term.word.isEmpty()) {
                    continue;
                }
                // 通过 indexOf 定位，保证偏移量落在原文上
                int idx = segment.indexOf(term.word, cursor);
                if (idx < 0) {
                    continue;
                }
                if (idx > 0) {
                    cuts.add(sentence.start + idx);
                }
                cursor = idx + term.word.length();
            }
        } catch (Exception e) {
            logger.warn("HanLP分词异常: {}, 使用空白切分作为备用方案", e.getMessage());
            cuts.clear();
            Matcher matcher = WHITESPACE.matcher(segment);
            while (matcher.find()) {
                if (matcher.end() < segment.length()) {
                    cuts.add(sentence.start + matcher.end());
                }
            }
        }
        return cuts;
    }

    /**
     * 兜底：固定窗口切分，相邻窗口重叠 overlap 个字符
     */
    private List<Span> slidingWindow(String text, Span span, int maxChars, int overlap) {
        List<Span> pieces = new ArrayList<>();
        int start = span.start;
        while (true) {
            int end = Math.min(start + maxChars, span.end);
            // 不拆开代理对
            if (end < span.end && end - 1 > start && Character.isHighSurrogate(text.charAt(end - 1))) {
                end--;
            }
            pieces.add(new Span(start, end, span.tag));
            if (end >= span.end) {
                break;
            }
            start = Math.max(end - overlap, start + 1);
        }
        return pieces;
    }

    private Span append(List<Span> out, Span current, Span unit, int maxChars) {
        if (current != null && current.length() + unit.length() > maxChars) {
            out.add(current);
            current = null;
        }
        if (current == null) {
            return new Span(unit.start, unit.end, unit.tag);
        }
        current.end = unit.end;
        return current;
    }

    private List<Span> units(Span span, List<Integer> cuts) {
        List<Span> units = new ArrayList<>();
        int start = span.start;
        for (int cut : cuts) {
            if (cut > start && cut < span.end) {
                units.add(new Span(start, cut, span.tag));
                start = cut;
            }
        }
        units.add(new Span(start, span.end, span.tag));
        return units;
    }

    private static final class Span {
        private final int start;
        private int end;
        private StructuralTag tag;

        private Span(int start, int end, StructuralTag tag) {
            this.start = start;
            this.end = end;
            this.tag = tag;
        }

        private int length() {
            return end - start;
        }
    }
}
