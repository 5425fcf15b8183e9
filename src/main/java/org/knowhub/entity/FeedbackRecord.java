package org.knowhub.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 用户对某轮回答的反馈。同一 (turnRef, author) 只有一条 active 记录，旧记录标记为 superseded 保留。
 */
@Data
@Entity
@Table(name = "feedback_record", indexes = {
        @Index(name = "idx_feedback_turn_author", columnList = "turn_ref, author"),
        @Index(name = "idx_feedback_created_at", columnList = "created_at")
})
public class FeedbackRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "turn_ref", length = 64, nullable = false)
    private String turnRef;

    @Column(length = 128, nullable = false)
    private String author;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private FeedbackKind kind;

    @Column(columnDefinition = "TEXT")
    private String comment;

    // 原始表情名称，如 thumbsup
    @Column(length = 64)
    private String reaction;

    @Column(name = "conversation_id", length = 64)
    private String conversationId;

    @Column(nullable = false)
    private boolean active = true;

    private LocalDateTime supersededAt;

    // 由服务端时钟赋值，统计窗口按它过滤
    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
