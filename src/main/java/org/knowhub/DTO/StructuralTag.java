package org.knowhub.DTO;

// 分块的结构标记
public enum StructuralTag {
    HEADING,
    BODY,
    TABLE,
    CODE
}
