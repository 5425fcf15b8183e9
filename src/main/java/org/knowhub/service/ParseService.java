package org.knowhub.service;

import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.knowhub.entity.SourceType;
import org.knowhub.exception.DocumentParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.xml.sax.SAXException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

// 负责把原始文档字节转换为纯文本，切分交给 ChunkingService
@Service
public class ParseService {

    private static final Logger logger = LoggerFactory.getLogger(ParseService.class);

    /**
     * 提取文档文本。文本类直接按 UTF-8 严格解码，pdf/docx 交给 Tika。
     *
     * @throws DocumentParseException 内容为空、编码损坏或 Tika 解析失败
     */
    public String extractText(byte[] content, SourceType sourceType) {
        if (content == null || content.length == 0) {
            throw new DocumentParseException("文档内容为空");
        }
        if (sourceType == null) {
            throw new DocumentParseException("缺少文档类型");
        }
        String text;
        switch (sourceType) {
            case TEXT:
            case MARKDOWN:
                text = decodeUtf8(content);
                break;
            case PDF:
            case DOCX:
                text = parseWithTika(content, sourceType);
                break;
            default:
                throw new DocumentParseException("不支持的文档类型: " + sourceType);
        }
        if (text.isBlank()) {
            throw new DocumentParseException("未能从文档中提取到文本");
        }
        logger.info("文档解析完成，类型: {}, 字节数: {}, 字符数: {}", sourceType, content.length, text.length());
        return text;
    }

    private String decodeUtf8(byte[] content) {
        try {
            String text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
            // 去掉 BOM
            if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
                text = text.substring(1);
            }
            if (text.indexOf('\u0000') >= 0) {
                throw new DocumentParseException("文本中包含二进制内容，文档可能已损坏");
            }
            return text;
        } catch (CharacterCodingException e) {
            throw new DocumentParseException("文档不是合法的 UTF-8 文本", e);
        }
    }

    private String parseWithTika(byte[] content, SourceType sourceType) {
        AutoDetectParser parser = new AutoDetectParser();
        BodyContentHandler handler = new BodyContentHandler(-1); // 不限制输出长度
        Metadata metadata = new Metadata();
        try (InputStream stream = new ByteArrayInputStream(content)) {
            parser.parse(stream, handler, metadata, new ParseContext());
        } catch (SAXException | TikaException | IOException e) {
            logger.error("Tika 解析失败，类型: {}, 错误: {}", sourceType, e.getMessage());
            throw new DocumentParseException("文件解析失败: " + e.getMessage(), e);
        }
        return handler.toString();
    }
}
