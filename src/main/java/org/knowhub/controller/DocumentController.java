package org.knowhub.controller;

import org.knowhub.annotation.LogAction;
import org.knowhub.entity.KnowledgeDocument;
import org.knowhub.service.DocumentService;
import org.knowhub.utils.Result;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * 文档控制器：上传、重新入库、解除挂起、删除、查询
 */
@RestController
@RequestMapping("/api/v1/documents")
public class DocumentController {

    @Autowired
    private DocumentService documentService;

    /**
     * 上传文档，入库在后台进行，返回 202
     *
     * @param file       文档文件（txt / md / pdf / docx）
     * @param documentId 已有文档ID时作为新版本上传
     */
    @PostMapping
    @LogAction(value = "DocumentController", action = "uploadDocument", logArgs = false)
    public ResponseEntity<?> upload(@RequestParam("file") MultipartFile file,
                                    @RequestParam(value = "documentId", required = false) String documentId) {
        KnowledgeDocument document = documentService.upload(documentId, file);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Result.accepted("文档已接收，正在入库", document));
    }

    @PostMapping("/{documentId}/reindex")
    @LogAction(value = "DocumentController", action = "reindexDocument")
    public ResponseEntity<?> reindex(@PathVariable String documentId) {
        KnowledgeDocument document = documentService.reindex(documentId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Result.accepted("已提交重新入库", document));
    }

    // 索引一致性问题人工处理完之后调用
    @PostMapping("/{documentId}/resolve")
    @LogAction(value = "DocumentController", action = "resolveHalt")
    public ResponseEntity<?> resolveHalt(@PathVariable String documentId) {
        KnowledgeDocument document = documentService.resolveHalt(documentId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Result.accepted("已解除挂起并重新入库", document));
    }

    @DeleteMapping("/{documentId}")
    @LogAction(value = "DocumentController", action = "deleteDocument")
    public ResponseEntity<?> delete(@PathVariable String documentId) {
        documentService.delete(documentId);
        return ResponseEntity.ok(Result.success("文档删除成功", null));
    }

    @GetMapping("/{documentId}")
    public ResponseEntity<?> get(@PathVariable String documentId) {
        return ResponseEntity.ok(Result.success(documentService.get(documentId)));
    }

    @GetMapping
    public ResponseEntity<?> list() {
        List<KnowledgeDocument> documents = documentService.list();
        return ResponseEntity.ok(Result.success("获取文档列表成功", documents));
    }
}
