package org.knowhub.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * 日志工具类
 * 提供统一的业务日志、性能日志格式
 */
public class LogUtils {

    private static final Logger BUSINESS_LOGGER = LoggerFactory.getLogger("org.knowhub.business");

    private static final Logger PERFORMANCE_LOGGER = LoggerFactory.getLogger("org.knowhub.performance");

    // MDC键名常量
    public static final String USER_ID = "userId";
    public static final String REQUEST_ID = "requestId";
    public static final String CONVERSATION_ID = "conversationId";
    public static final String DOCUMENT_ID = "documentId";
    public static final String OPERATION = "operation";

    /**
     * 记录业务日志
     */
    public static void logBusiness(String operation, String userId, String message, Object... args) {
        try {
            MDC.put(OPERATION, operation);
            MDC.put(USER_ID, userId);
            BUSINESS_LOGGER.info("[{}] [用户:{}] {}", operation, userId, formatMessage(message, args));
        } finally {
            MDC.remove(OPERATION);
            MDC.remove(USER_ID);
        }
    }

    /**
     * 记录业务错误日志
     */
    public static void logBusinessError(String operation, String userId, String message, Throwable throwable, Object... args) {
        try {
            MDC.put(OPERATION, operation);
            MDC.put(USER_ID, userId);
            BUSINESS_LOGGER.error("[{}] [用户:{}] {}", operation, userId, formatMessage(message, args), throwable);
        } finally {
            MDC.remove(OPERATION);
            MDC.remove(USER_ID);
        }
    }

    /**
     * 记录性能日志
     */
    public static void logPerformance(String operation, long duration, String details) {
        try {
            MDC.put(OPERATION, operation);
            PERFORMANCE_LOGGER.info("[性能] [{}] 耗时:{}ms {}", operation, duration, details);
        } finally {
            MDC.remove(OPERATION);
        }
    }

    /**
     * 记录用户操作日志
     */
    public static void logUserOperation(String userId, String operation, String resource, String result) {
        try {
            MDC.put(USER_ID, userId);
            MDC.put(OPERATION, operation);
            BUSINESS_LOGGER.info("[用户操作] [用户:{}] [操作:{}] [资源:{}] [结果:{}]", userId, operation, resource, result);
        } finally {
            MDC.remove(USER_ID);
            MDC.remove(OPERATION);
        }
    }

    /**
     * 记录文档入库日志
     */
    public static void logIngestion(String documentId, long version, String stage, String result) {
        try {
            MDC.put(DOCUMENT_ID, documentId);
            MDC.put(OPERATION, "INGEST_" + stage);
            BUSINESS_LOGGER.info("[文档入库] [文档:{}] [版本:{}] [阶段:{}] [结果:{}]", documentId, version, stage, result);
        } finally {
            MDC.remove(DOCUMENT_ID);
            MDC.remove(OPERATION);
        }
    }

    /**
     * 记录问答日志
     */
    public static void logChat(String conversationId, String turnId, int questionLength, int citationCount) {
        try {
            MDC.put(CONVERSATION_ID, conversationId);
            MDC.put(OPERATION, "CHAT");
            BUSINESS_LOGGER.info("[问答] [会话:{}] [轮次:{}] [问题长度:{}] [引用数:{}]",
                    conversationId, turnId, questionLength, citationCount);
        } finally {
            MDC.remove(CONVERSATION_ID);
            MDC.remove(OPERATION);
        }
    }

    /**
     * 记录反馈日志
     */
    public static void logFeedback(String turnRef, String author, String kind, String result) {
        try {
            MDC.put(USER_ID, author);
            MDC.put(OPERATION, "FEEDBACK");
            BUSINESS_LOGGER.info("[反馈] [回答:{}] [用户:{}] [类型:{}] [结果:{}]", turnRef, author, kind, result);
        } finally {
            MDC.remove(USER_ID);
            MDC.remove(OPERATION);
        }
    }

    public static void logSystemStart(String component, String status, String details) {
        BUSINESS_LOGGER.info("[系统启动] [组件:{}] [状态:{}] {}", component, status, details);
    }

    public static void logSystemError(String component, String error, Throwable throwable) {
        BUSINESS_LOGGER.error("[系统错误] [组件:{}] [错误:{}]", component, error, throwable);
    }

    /**
     * 设置请求上下文
     */
    public static void setRequestContext(String requestId, String userId, String conversationId) {
        MDC.put(REQUEST_ID, requestId);
        if (userId != null) {
            MDC.put(USER_ID, userId);
        }
        if (conversationId != null) {
            MDC.put(CONVERSATION_ID, conversationId);
        }
    }

    public static void clearRequestContext() {
        MDC.clear();
    }

    private static String formatMessage(String message, Object... args) {
        if (args == null || args.length == 0) {
            return message;
        }
        try {
            return String.format(message, args);
        } catch (Exception e) {
            return message + " [格式化参数失败: " + e.getMessage() + "]";
        }
    }

    /**
     * 性能监控器
     */
    public static class PerformanceMonitor {
        private final String operation;
        private final long startTime;

        public PerformanceMonitor(String operation) {
            this.operation = operation;
            this.startTime = System.currentTimeMillis();
        }

        public void end() {
            end("");
        }

        public void end(String details) {
            long duration = System.currentTimeMillis() - startTime;
            logPerformance(operation, duration, details);
        }
    }

    public static PerformanceMonitor startPerformanceMonitor(String operation) {
        return new PerformanceMonitor(operation);
    }
}
