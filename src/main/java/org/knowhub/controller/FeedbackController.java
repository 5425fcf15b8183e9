package org.knowhub.controller;

import org.knowhub.DTO.FeedbackRequest;
import org.knowhub.DTO.ReactionEvent;
import org.knowhub.DTO.StatsGroupBy;
import org.knowhub.annotation.LogAction;
import org.knowhub.entity.FeedbackRecord;
import org.knowhub.handler.ReactionEventAdapter;
import org.knowhub.service.FeedbackService;
import org.knowhub.utils.Result;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/feedback")
public class FeedbackController {

    @Autowired
    private FeedbackService feedbackService;

    @Autowired
    private ReactionEventAdapter reactionEventAdapter;

    @PostMapping
    @LogAction(value = "FeedbackController", action = "recordFeedback")
    public ResponseEntity<?> record(@RequestBody FeedbackRequest request) {
        FeedbackRecord record = feedbackService.record(request.getTurnRef(), request.getAuthor(), request.getKind(),
                request.getComment(), null, request.getConversationId());
        return ResponseEntity.ok(Result.success("反馈已记录", record));
    }

    /**
     * 聊天平台的表情回应回调，无法识别的表情返回成功但不记录
     */
    @PostMapping("/reactions")
    @LogAction(value = "FeedbackController", action = "reaction")
    public ResponseEntity<?> reaction(@RequestBody ReactionEvent event) {
        Optional<FeedbackRecord> record = reactionEventAdapter.handle(event);
        return ResponseEntity.ok(record.isPresent()
                ? Result.success("反馈已记录", record.get())
                : Result.success("事件已忽略", null));
    }

    /**
     * 统计窗口 [from, to)，默认最近 7 天
     */
    @GetMapping("/stats")
    public ResponseEntity<?> stats(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
            @RequestParam(defaultValue = "NONE") StatsGroupBy groupBy) {
        return ResponseEntity.ok(Result.success(feedbackService.stats(from, to, groupBy)));
    }

    @GetMapping("/export")
    @LogAction(value = "FeedbackController", action = "exportFeedback")
    public ResponseEntity<String> export(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
            @RequestParam(defaultValue = "json") String format) {
        String body = feedbackService.export(from, to, format);
        boolean csv = "csv".equalsIgnoreCase(format);
        return ResponseEntity.ok()
                .contentType(csv ? new MediaType("text", "csv") : MediaType.APPLICATION_JSON)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=feedback." + (csv ? "csv" : "json"))
                .body(body);
    }
}
