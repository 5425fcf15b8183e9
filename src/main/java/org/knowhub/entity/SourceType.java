package org.knowhub.entity;

import org.knowhub.exception.DocumentParseException;

import java.util.Locale;

/**
 * 支持入库的文档来源类型。
 */
public enum SourceType {
    TEXT,
    MARKDOWN,
    PDF,
    DOCX;

    /**
     * 根据文件扩展名判断类型，扩展名缺失时参考 Content-Type。
     */
    public static SourceType detect(String fileName, String contentType) {
        String name = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
        if (name.endsWith(".md") || name.endsWith(".markdown")) {
            return MARKDOWN;
        }
        if (name.endsWith(".txt")) {
            return TEXT;
        }
        if (name.endsWith(".pdf")) {
            return PDF;
        }
        if (name.endsWith(".docx")) {
            return DOCX;
        }
        if (contentType != null) {
            String type = contentType.toLowerCase(Locale.ROOT);
            if (type.startsWith("text/markdown")) return MARKDOWN;
            if (type.startsWith("text/plain")) return TEXT;
            if (type.startsWith("application/pdf")) return PDF;
            if (type.startsWith("application/vnd.openxmlformats-officedocument.wordprocessingml.document")) return DOCX;
        }
        throw new DocumentParseException("不支持的文档类型: " + fileName + " (" + contentType + ")");
    }
}
