package org.knowhub.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.knowhub.DTO.FeedbackGroupStats;
import org.knowhub.DTO.FeedbackStats;
import org.knowhub.DTO.StatsGroupBy;
import org.knowhub.entity.FeedbackKind;
import org.knowhub.entity.FeedbackRecord;
import org.knowhub.exception.CustomException;
import org.knowhub.repository.FeedbackRepository;
import org.knowhub.utils.LogUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * 反馈记录与统计。
 * 同一作者对同一轮回答的新反馈会覆盖旧反馈，统计只计 active 记录。
 */
@Service
public class FeedbackService {

    private static final Logger logger = LoggerFactory.getLogger(FeedbackService.class);

    private static final String CSV_HEADER = "id,turnRef,author,kind,reaction,conversationId,active,createdAt,supersededAt,comment";
    private static final DateTimeFormatter DAY = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final int LOCK_STRIPES = 64;

    private final FeedbackRepository feedbackRepository;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    // 按 (turnRef, author) 取模分段加锁，锁的数量固定
    private final ReentrantLock[] keyLocks = new ReentrantLock[LOCK_STRIPES];

    public FeedbackService(FeedbackRepository feedbackRepository,
                           PlatformTransactionManager transactionManager,
                           ObjectMapper objectMapper,
                           Clock clock) {
        this.feedbackRepository = feedbackRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.objectMapper = objectMapper;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            keyLocks[i] = new ReentrantLock();
        }
    }

    public FeedbackRecord record(String turnRef, String author, FeedbackKind kind, String comment) {
        return record(turnRef, author, kind, comment, null, null);
    }

    /**
     * 记录一条反馈，并让同一 (turnRef, author) 之前的有效反馈失效
     */
    public FeedbackRecord record(String turnRef, String author, FeedbackKind kind, String comment,
                                 String reaction, String conversationId) {
        validate(turnRef, author, kind);

        ReentrantLock lock = lockFor(turnRef, author);
        lock.lock();
        try {
            FeedbackRecord saved = transactionTemplate.execute(status -> {
                LocalDateTime now = LocalDateTime.now(clock);
                feedbackRepository.findFirstByTurnRefAndAuthorAndActiveTrueOrderByIdDesc(turnRef, author)
                        .ifPresent(previous -> {
                            previous.setActive(false);
                            previous.setSupersededAt(now);
                            feedbackRepository.save(previous);
                        });

                return feedbackRepository.save(newRecord(turnRef, author, kind, comment, reaction, conversationId, true, now));
            });
            LogUtils.logFeedback(turnRef, author, kind.name(), "SUCCESS");
            return saved;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 撤回一个表情。只有当前有效反馈正是该表情对应的类型时才失效并记为 REMOVED，
     * 否则只留一条不生效的 REMOVED 历史，当前反馈保持不变。
     */
    public FeedbackRecord retract(String turnRef, String author, FeedbackKind retractedKind,
                                  String reaction, String conversationId) {
        validate(turnRef, author, retractedKind);
        if (retractedKind != FeedbackKind.POSITIVE && retractedKind != FeedbackKind.NEGATIVE) {
            throw new IllegalArgumentException("只能撤回 POSITIVE 或 NEGATIVE 反馈: " + retractedKind);
        }

        ReentrantLock lock = lockFor(turnRef, author);
        lock.lock();
        try {
            FeedbackRecord saved = transactionTemplate.execute(status -> {
                LocalDateTime now = LocalDateTime.now(clock);
                FeedbackRecord current = feedbackRepository
                        .findFirstByTurnRefAndAuthorAndActiveTrueOrderByIdDesc(turnRef, author)
                        .orElse(null);
                boolean matches = current != null && current.getKind() == retractedKind;
                if (matches) {
                    current.setActive(false);
                    current.setSupersededAt(now);
                    feedbackRepository.save(current);
                }
                FeedbackRecord record = newRecord(turnRef, author, FeedbackKind.REMOVED, null, reaction,
                        conversationId, matches, now);
                if (!matches) {
                    record.setSupersededAt(now);
                }
                return feedbackRepository.save(record);
            });
            LogUtils.logFeedback(turnRef, author, FeedbackKind.REMOVED.name(), saved.isActive() ? "SUCCESS" : "IGNORED");
            return saved;
        } finally {
            lock.unlock();
        }
    }

    private static void validate(String turnRef, String author, FeedbackKind kind) {
        if (turnRef == null || turnRef.isBlank()) {
            throw new IllegalArgumentException("turnRef 不能为空");
        }
        if (author == null || author.isBlank()) {
            throw new IllegalArgumentException("author 不能为空");
        }
        if (kind == null) {
            throw new IllegalArgumentException("反馈类型不能为空");
        }
    }

    private ReentrantLock lockFor(String turnRef, String author) {
        return keyLocks[Math.floorMod((turnRef + "|" + author).hashCode(), LOCK_STRIPES)];
    }

    private static FeedbackRecord newRecord(String turnRef, String author, FeedbackKind kind, String comment,
                                            String reaction, String conversationId, boolean active,
                                            LocalDateTime now) {
        FeedbackRecord record = new FeedbackRecord();
        record.setTurnRef(turnRef);
        record.setAuthor(author);
        record.setKind(kind);
        record.setComment(comment);
        record.setReaction(reaction);
        record.setConversationId(conversationId);
        record.setActive(active);
        record.setCreatedAt(now);
        return record;
    }

    /**
     * 回答发出之后异步记录，失败只记日志
     */
    @Async
    public void recordAsync(String turnRef, String author, FeedbackKind kind, String comment,
                            String reaction, String conversationId) {
        try {
            record(turnRef, author, kind, comment, reaction, conversationId);
        } catch (Exception e) {
            LogUtils.logFeedback(turnRef, author, kind != null ? kind.name() : "null", "FAILED");
            logger.error("异步记录反馈失败, turnRef: {}, author: {}", turnRef, author, e);
        }
    }

    public List<FeedbackRecord> history(String turnRef, String author) {
        return feedbackRepository.findByTurnRefAndAuthorOrderByIdAsc(turnRef, author);
    }

    /**
     * 统计 [from, to) 内的有效反馈。没有数据时返回全零，不报错。
     */
    public FeedbackStats stats(LocalDateTime from, LocalDateTime to, StatsGroupBy groupBy) {
        LocalDateTime end = to != null ? to : LocalDateTime.now(clock);
        LocalDateTime start = from != null ? from : end.minusDays(7);
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("统计窗口起点必须早于终点");
        }
        StatsGroupBy grouping = groupBy != null ? groupBy : StatsGroupBy.NONE;

        List<FeedbackRecord> records =
                feedbackRepository.findByActiveTrueAndCreatedAtGreaterThanEqualAndCreatedAtLessThan(start, end);

        List<FeedbackGroupStats> groups = new ArrayList<>();
        if (grouping != StatsGroupBy.NONE) {
            Function<FeedbackRecord, String> keyOf = groupKey(grouping);
            Map<String, List<FeedbackRecord>> grouped = new TreeMap<>();
            for (FeedbackRecord record : records) {
                grouped.computeIfAbsent(keyOf.apply(record), k -> new ArrayList<>()).add(record);
            }
            grouped.forEach((key, items) -> groups.add(aggregate(key, items)));
        }

        return FeedbackStats.builder()
                .from(start)
                .to(end)
                .groupBy(grouping)
                .overall(aggregate("overall", records))
                .groups(groups)
                .build();
    }

    /**
     * 导出窗口内的全部反馈（包括已被覆盖的），格式为 json 或 csv
     */
    public String export(LocalDateTime from, LocalDateTime to, String format) {
        LocalDateTime end = to != null ? to : LocalDateTime.now(clock);
        LocalDateTime start = from != null ? from : end.minusDays(7);
        List<FeedbackRecord> records =
                feedbackRepository.findByCreatedAtGreaterThanEqualAndCreatedAtLessThanOrderByIdAsc(start, end);

        String fmt = format == null ? "json" : format.toLowerCase();
        switch (fmt) {
            case "json":
                try {
                    return objectMapper.writeValueAsString(records);
                } catch (JsonProcessingException e) {
                    throw new CustomException("反馈导出失败: " + e.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR, e);
                }
            case "csv":
                StringBuilder csv = new StringBuilder(CSV_HEADER).append('\n');
                for (FeedbackRecord r : records) {
                    csv.append(r.getId()).append(',')
                            .append(csvField(r.getTurnRef())).append(',')
                            .append(csvField(r.getAuthor())).append(',')
                            .append(r.getKind()).append(',')
                            .append(csvField(r.getReaction())).append(',')
                            .append(csvField(r.getConversationId())).append(',')
                            .append(r.isActive()).append(',')
                            .append(r.getCreatedAt()).append(',')
                            .append(r.getSupersededAt() != null ? r.getSupersededAt() : "").append(',')
                            .append(csvField(r.getComment()))
                            .append('\n');
                }
                return csv.toString();
            default:
                throw new IllegalArgumentException("不支持的导出格式: " + format);
        }
    }

    private FeedbackGroupStats aggregate(String key, List<FeedbackRecord> records) {
        long positive = 0;
        long negative = 0;
        long neutral = 0;
        long removed = 0;
        for (FeedbackRecord record : records) {
            switch (record.getKind()) {
                case POSITIVE:
                    positive++;
                    break;
                case NEGATIVE:
                    negative++;
                    break;
                case NEUTRAL:
                    neutral++;
                    break;
                case REMOVED:
                    removed++;
                    break;
                default:
                    break;
            }
        }
        long total = positive + negative + neutral;
        double percentage = total == 0 ? 0.0 : Math.round(positive * 10000.0 / total) / 100.0;
        return FeedbackGroupStats.builder()
                .key(key)
                .positive(positive)
                .negative(negative)
                .neutral(neutral)
                .removed(removed)
                .total(total)
                .positivePercentage(percentage)
                .build();
    }

    private Function<FeedbackRecord, String> groupKey(StatsGroupBy groupBy) {
        switch (groupBy) {
            case DAY:
                return r -> r.getCreatedAt().toLocalDate().format(DAY);
            case AUTHOR:
                return FeedbackRecord::getAuthor;
            case CONVERSATION:
                return r -> r.getConversationId() != null ? r.getConversationId() : "unknown";
            default:
                return r -> "overall";
        }
    }

    private static String csvField(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
