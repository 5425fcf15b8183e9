package org.knowhub.service;

import org.knowhub.DTO.Conversation;
import org.knowhub.DTO.ConversationState;
import org.knowhub.DTO.Message;
import org.knowhub.DTO.Turn;
import org.knowhub.config.RagProperties;
import org.knowhub.exception.CustomException;
import org.knowhub.repository.ConversationStore;
import org.knowhub.utils.TextAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 多轮会话上下文：生命周期（空 / 活跃 / 过期）、追问改写、追加轮次。
 * <p>
 * 同一会话的读改写必须在 {@link #withConversation} 或 {@link #acquire} 持有的许可内进行。
 */
@Service
public class ConversationService {

    private static final Logger logger = LoggerFactory.getLogger(ConversationService.class);

    private static final List<String> FOLLOWUP_PREFIXES = List.of(
            "what about", "how about", "and ", "what else", "also ", "then ", "same for", "and what", "and how");
    private static final Set<String> REFERENTIAL_WORDS = Set.of(
            "it", "its", "they", "them", "their", "this", "that", "these", "those");
    private static final Pattern ORDINAL = Pattern.compile(
            "\\b(?:the\\s+)?(first|second|third|fourth|fifth|sixth|seventh|eighth|ninth|tenth|last|1st|2nd|3rd|4th|5th)"
                    + "(?:\\s+(?:one|item|option|step|point))?\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern LIST_ITEM = Pattern.compile("^\\s*(?:\\d+[.)]|[-*•])\\s+(.+?)\\s*$", Pattern.MULTILINE);
    private static final Pattern CONTEXT_SUFFIX = Pattern.compile("\\s*\\(context: [^)]*\\)\\s*$");
    private static final Map<String, Integer> ORDINALS = Map.ofEntries(
            Map.entry("first", 1), Map.entry("1st", 1),
            Map.entry("second", 2), Map.entry("2nd", 2),
            Map.entry("third", 3), Map.entry("3rd", 3),
            Map.entry("fourth", 4), Map.entry("4th", 4),
            Map.entry("fifth", 5), Map.entry("5th", 5),
            Map.entry("sixth", 6), Map.entry("seventh", 7), Map.entry("eighth", 8),
            Map.entry("ninth", 9), Map.entry("tenth", 10));
    private static final int SHORT_QUESTION_TERMS = 2;
    private static final int MAX_TOPIC_TERMS = 5;
    private static final long LOCK_TIMEOUT_SECONDS = 60;

    private final ConversationStore conversationStore;
    private final RagProperties ragProperties;
    private final Clock clock;
    // 只保留有人持有或等待的会话，计数归零时移除
    private final Map<String, PermitEntry> permits = new ConcurrentHashMap<>();

    public ConversationService(ConversationStore conversationStore, RagProperties ragProperties, Clock clock) {
        this.conversationStore = conversationStore;
        this.ragProperties = ragProperties;
        this.clock = clock;
    }

    /**
     * 读取会话，不存在时返回一个空会话（尚未持久化）
     */
    public Conversation load(String conversationId) {
        return conversationStore.load(conversationId).orElseGet(() -> Conversation.builder()
                .id(conversationId)
                .turns(new ArrayList<>())
                .createdAt(clock.instant())
                .lastActivityAt(clock.instant())
                .build());
    }

    public ConversationState state(Conversation conversation) {
        if (conversation == null || !conversation.hasTurns()) {
            return ConversationState.EMPTY;
        }
        Instant last = conversation.getLastActivityAt();
        Duration window = ragProperties.getConversation().getInactivityWindow();
        if (last == null || Duration.between(last, clock.instant()).compareTo(window) > 0) {
            return ConversationState.EXPIRED;
        }
        return ConversationState.ACTIVE;
    }

    public boolean isLive(Conversation conversation) {
        return state(conversation) == ConversationState.ACTIVE;
    }

    /**
     * 刷新最后活跃时间。过期会话不会因此复活。
     */
    public Conversation touch(Conversation conversation) {
        if (state(conversation) == ConversationState.EXPIRED) {
            return conversation;
        }
        conversation.setLastActivityAt(clock.instant());
        conversationStore.save(conversation);
        return conversation;
    }

    /**
     * 把依赖上文的追问改写成可独立检索的问题。
     * 空会话、过期会话或独立问题原样返回。
     */
    public String resolveFollowup(String rawQuestion, Conversation conversation) {
        if (rawQuestion == null || state(conversation) != ConversationState.ACTIVE) {
            return rawQuestion;
        }
        String question = rawQuestion.trim();
        if (!isFollowup(question)) {
            return rawQuestion;
        }
        Turn last = conversation.lastTurn();
        String resolved = substituteOrdinal(question, last.getAnswer());

        String previous = last.getResolvedQuestion() != null ? last.getResolvedQuestion() : last.getQuestion();
        String topic = topicOf(previous, resolved);
        if (!topic.isEmpty()) {
            resolved = resolved + " (context: " + topic + ")";
        }
        logger.debug("追问改写: [{}] -> [{}]", rawQuestion, resolved);
        return resolved;
    }

    /**
     * 追加一轮。已有轮次不做任何修改；会话已过期时先归档，再以这一轮开始新的历史。
     */
    public Conversation appendTurn(Conversation conversation, Turn turn) {
        Instant now = clock.instant();
        List<Turn> turns;
        Instant createdAt = conversation.getCreatedAt() != null ? conversation.getCreatedAt() : now;
        if (state(conversation) == ConversationState.EXPIRED) {
            conversationStore.archive(conversation);
            logger.info("会话 {} 已过期，归档 {} 轮历史后重新开始", conversation.getId(), conversation.getTurns().size());
            turns = new ArrayList<>();
            createdAt = now;
        } else {
            turns = new ArrayList<>(conversation.getTurns() != null ? conversation.getTurns() : List.of());
        }
        turns.add(turn);
        Conversation updated = Conversation.builder()
                .id(conversation.getId())
                .turns(turns)
                .createdAt(createdAt)
                .lastActivityAt(now)
                .build();
        conversationStore.save(updated);
        return updated;
    }

    /**
     * 最近若干轮转成对话模型的历史消息
     */
    public List<Message> history(Conversation conversation, int maxTurns) {
        List<Message> messages = new ArrayList<>();
        if (!isLive(conversation) || maxTurns <= 0) {
            return messages;
        }
        List<Turn> turns = conversation.getTurns();
        for (Turn turn : turns.subList(Math.max(0, turns.size() - maxTurns), turns.size())) {
            messages.add(new Message("user", turn.getResolvedQuestion() != null ? turn.getResolvedQuestion() : turn.getQuestion()));
            messages.add(new Message("assistant", turn.getAnswer()));
        }
        return messages;
    }

    /**
     * 在会话许可内执行 fn，同一会话的调用依次执行
     */
    public <T> T withConversation(String conversationId, Function<Conversation, T> fn) {
        ConversationPermit permit = acquire(conversationId);
        try {
            return fn.apply(load(conversationId));
        } finally {
            permit.release();
        }
    }

    /**
     * 获取会话许可。流式回答在结束（完成、出错或取消）时释放，可以跨线程释放。
     */
    public ConversationPermit acquire(String conversationId) {
        PermitEntry entry = permits.compute(conversationId, (id, existing) -> {
            PermitEntry e = existing != null ? existing : new PermitEntry();
            e.users++;
            return e;
        });
        boolean acquired = false;
        try {
            acquired = entry.semaphore.tryAcquire(LOCK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CustomException("等待会话许可时被中断", HttpStatus.SERVICE_UNAVAILABLE, e);
        } finally {
            if (!acquired) {
                leave(conversationId);
            }
        }
        if (!acquired) {
            throw new CustomException("会话 " + conversationId + " 正忙，请稍后重试", HttpStatus.TOO_MANY_REQUESTS);
        }
        return new ConversationPermit(this, conversationId, entry.semaphore);
    }

    /**
     * 当前登记的会话许可数量
     */
    int trackedPermits() {
        return permits.size();
    }

    private void leave(String conversationId) {
        permits.computeIfPresent(conversationId, (id, e) -> --e.users == 0 ? null : e);
    }

    private boolean isFollowup(String question) {
        String lower = question.toLowerCase(Locale.ROOT);
        for (String prefix : FOLLOWUP_PREFIXES) {
            if (lower.startsWith(prefix)) {
                return true;
            }
        }
        if (ORDINAL.matcher(question).find()) {
            return true;
        }
        List<String> tokens = TextAnalyzer.tokenize(question);
        for (String token : tokens) {
            if (REFERENTIAL_WORDS.contains(token)) {
                return true;
            }
        }
        return TextAnalyzer.contentTerms(question).size() <= SHORT_QUESTION_TERMS;
    }

    /**
     * "the second one" 之类替换成上一轮回答中对应的列表项
     */
    private String substituteOrdinal(String question, String lastAnswer) {
        if (lastAnswer == null) {
            return question;
        }
        List<String> items = new ArrayList<>();
        Matcher itemMatcher = LIST_ITEM.matcher(lastAnswer);
        while (itemMatcher.find()) {
            items.add(itemMatcher.group(1));
        }
        if (items.isEmpty()) {
            return question;
        }
        Matcher ordinal = ORDINAL.matcher(question);
        if (!ordinal.find()) {
            return question;
        }
        String word = ordinal.group(1).toLowerCase(Locale.ROOT);
        int position = "last".equals(word) ? items.size() : ORDINALS.getOrDefault(word, -1);
        if (position < 1 || position > items.size()) {
            return question;
        }
        return question.substring(0, ordinal.start()) + "\"" + items.get(position - 1) + "\"" + question.substring(ordinal.end());
    }

    /**
     * 上一轮问题的内容词，去掉当前问题里已经出现的
     */
    private String topicOf(String previousQuestion, String currentQuestion) {
        if (previousQuestion == null) {
            return "";
        }
        String base = CONTEXT_SUFFIX.matcher(previousQuestion).replaceAll("");
        Matcher suffix = CONTEXT_SUFFIX.matcher(previousQuestion);
        // 上一轮本身是追问时，把它继承的主题也带上
        String inherited = suffix.find() ? previousQuestion.substring(suffix.start()).replaceAll("[()]|context:", " ") : "";
        List<String> current = TextAnalyzer.contentTerms(currentQuestion);
        List<String> topic = new ArrayList<>();
        for (String term : TextAnalyzer.distinctContentTerms(base + " " + inherited)) {
            if (!current.contains(term) && topic.size() < MAX_TOPIC_TERMS) {
                topic.add(term);
            }
        }
        return String.join(" ", topic);
    }

    /**
     * 会话许可，release 可重复调用
     */
    public static final class ConversationPermit {
        private final ConversationService owner;
        private final String conversationId;
        private final Semaphore semaphore;
        private boolean released;

        private ConversationPermit(ConversationService owner, String conversationId, Semaphore semaphore) {
            this.owner = owner;
            this.conversationId = conversationId;
            this.semaphore = semaphore;
        }

        public synchronized void release() {
            if (!released) {
                released = true;
                semaphore.release();
                owner.leave(conversationId);
            }
        }
    }

    // users 只在 permits.compute 内修改
    private static final class PermitEntry {
        private final Semaphore semaphore = new Semaphore(1);
        private int users;
    }
}
