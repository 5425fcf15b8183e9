package org.knowhub.aspect;

import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.knowhub.annotation.LogAction;
import org.knowhub.utils.LogUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.springframework.web.multipart.MultipartFile;

import java.util.UUID;

@Aspect
@Component
@Slf4j
public class LogAspect {

    // 文件流、Servlet 对象不参与参数日志
    private static final Class<?>[] IGNORED_CLASSES = {
            ServletRequest.class, ServletResponse.class, MultipartFile.class
    };

    static final String USER_HEADER = "X-User-Id";

    @Around("@annotation(logAction)")
    public Object doAround(ProceedingJoinPoint joinPoint, LogAction logAction) throws Throwable {
        String module = logAction.value();
        String action = logAction.action();

        ServletRequestAttributes attributes = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        HttpServletRequest request = attributes != null ? attributes.getRequest() : null;

        // 无鉴权，调用方可通过请求头声明身份，仅用于日志
        String userId = "anonymous";
        String clientIp = "0.0.0.0";
        if (request != null) {
            String header = request.getHeader(USER_HEADER);
            if (header != null && !header.isBlank()) {
                userId = header;
            }
            clientIp = request.getRemoteAddr();
        }
        LogUtils.setRequestContext(UUID.randomUUID().toString(), userId, null);

        LogUtils.PerformanceMonitor monitor = LogUtils.startPerformanceMonitor(module + "-" + action);
        if (logAction.logArgs()) {
            LogUtils.logBusiness(module, userId, "[%s] 请求开始, IP: %s, 参数: %s", action, clientIp, describeArgs(joinPoint));
        }

        try {
            Object result = joinPoint.proceed();
            LogUtils.logUserOperation(userId, module, action, "SUCCESS");
            monitor.end("执行成功");
            return result;
        } catch (Throwable e) {
            LogUtils.logBusinessError(module, userId, action + " 执行异常", e);
            monitor.end("执行失败: " + e.getMessage());
            throw e;
        } finally {
            LogUtils.clearRequestContext();
        }
    }

    private String describeArgs(ProceedingJoinPoint joinPoint) {
        StringBuilder sb = new StringBuilder();
        for (Object arg : joinPoint.getArgs()) {
            if (arg != null && !isIgnored(arg)) {
                sb.append(arg).append(" ");
            }
        }
        return sb.toString().trim();
    }

    private boolean isIgnored(Object arg) {
        for (Class<?> clazz : IGNORED_CLASSES) {
            if (clazz.isInstance(arg)) return true;
        }
        return false;
    }
}
