package org.knowhub.handler;

import org.knowhub.DTO.ReactionEvent;
import org.knowhub.entity.FeedbackKind;
import org.knowhub.entity.FeedbackRecord;
import org.knowhub.service.FeedbackService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 把聊天平台的表情回应转换成 (turnRef, author, kind) 反馈。
 * 不认识的表情直接忽略。
 */
@Component
public class ReactionEventAdapter {

    private static final Logger logger = LoggerFactory.getLogger(ReactionEventAdapter.class);

    static final String REACTION_ADDED = "reaction_added";
    static final String REACTION_REMOVED = "reaction_removed";

    private static final Set<String> POSITIVE = Set.of("thumbsup", "+1", "thumbs_up", "clap", "raised_hands", "heart");
    private static final Set<String> NEGATIVE = Set.of("thumbsdown", "-1", "thumbs_down", "x", "no_entry");

    private final FeedbackService feedbackService;

    public ReactionEventAdapter(FeedbackService feedbackService) {
        this.feedbackService = feedbackService;
    }

    /**
     * 解析事件对应的反馈类型，无法识别时返回 empty。
     * 撤回不认识的表情同样忽略。
     */
    public Optional<FeedbackKind> classify(ReactionEvent event) {
        if (event == null || event.getType() == null) {
            return Optional.empty();
        }
        String type = event.getType().toLowerCase(Locale.ROOT);
        if (REACTION_REMOVED.equals(type)) {
            return reactionKind(event.getReaction()).map(kind -> FeedbackKind.REMOVED);
        }
        if (!REACTION_ADDED.equals(type)) {
            return Optional.empty();
        }
        return reactionKind(event.getReaction());
    }

    /**
     * 同步记录；事件被忽略时返回 empty
     */
    public Optional<FeedbackRecord> handle(ReactionEvent event) {
        Optional<FeedbackKind> kind = classify(event);
        if (kind.isEmpty()) {
            logger.debug("忽略表情事件: {}", event);
            return Optional.empty();
        }
        if (kind.get() == FeedbackKind.REMOVED) {
            FeedbackKind retracted = reactionKind(event.getReaction()).orElseThrow();
            return Optional.of(feedbackService.retract(event.getTurnRef(), event.getUser(), retracted,
                    event.getReaction(), event.getConversationId()));
        }
        return Optional.of(feedbackService.record(event.getTurnRef(), event.getUser(), kind.get(), null,
                event.getReaction(), event.getConversationId()));
    }

    static Optional<FeedbackKind> reactionKind(String reaction) {
        if (reaction == null) {
            return Optional.empty();
        }
        String normalized = normalize(reaction);
        if (POSITIVE.contains(normalized)) {
            return Optional.of(FeedbackKind.POSITIVE);
        }
        if (NEGATIVE.contains(normalized)) {
            return Optional.of(FeedbackKind.NEGATIVE);
        }
        return Optional.empty();
    }

    // ":thumbsup:" 与 "ThumbsUp" 视为同一个表情
    private static String normalize(String reaction) {
        String r = reaction.trim().toLowerCase(Locale.ROOT);
        if (r.length() > 1 && r.startsWith(":") && r.endsWith(":")) {
            r = r.substring(1, r.length() - 1);
        }
        return r;
    }
}
