package org.knowhub.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Citation {
    private int label;          // 回答中的 [n]
    private String chunkId;
    private String documentId;
    private int sequenceIndex;
    private String fileName;
}
