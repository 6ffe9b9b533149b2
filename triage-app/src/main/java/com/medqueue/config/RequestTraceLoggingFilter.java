package com.medqueue.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 统一 HTTP 链路日志过滤器：写入 traceId/requestId 到 MDC 与响应头，记录 HTTP_IN / HTTP_OUT。
 * <p>
 * 只记录路径、状态与响应 code，不记录请求体和查询参数，病例描述不会进入访问日志。
 * </p>
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestTraceLoggingFilter extends OncePerRequestFilter {

    private static final String HEADER_TRACE_ID = "X-Trace-Id";
    private static final String HEADER_REQUEST_ID = "X-Request-Id";
    private static final String MDC_TRACE_ID = "traceId";
    private static final String MDC_REQUEST_ID = "requestId";

    private final ObjectMapper objectMapper;
    private final HttpTraceLogProperties properties;
    private final AntPathMatcher pathMatcher;

    public RequestTraceLoggingFilter(ObjectMapper objectMapper,
                                     HttpTraceLogProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.pathMatcher = new AntPathMatcher();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (request == null || !properties.isEnabled()) {
            return true;
        }
        String path = normalizePath(request.getRequestURI());
        if (matchesAny(path, properties.getExcludePathPatterns())) {
            return true;
        }
        List<String> includePatterns = properties.getIncludePathPatterns();
        if (includePatterns == null || includePatterns.isEmpty()) {
            return false;
        }
        return !matchesAny(path, includePatterns);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = resolveOrCreate(request.getHeader(HEADER_TRACE_ID));
        String requestId = resolveOrCreate(request.getHeader(HEADER_REQUEST_ID));
        String path = normalizePath(request.getRequestURI());
        String method = request.getMethod();

        response.setHeader(HEADER_TRACE_ID, traceId);
        response.setHeader(HEADER_REQUEST_ID, requestId);
        MDC.put(MDC_TRACE_ID, traceId);
        MDC.put(MDC_REQUEST_ID, requestId);

        long startNs = System.nanoTime();
        boolean sampled = shouldSample();
        ContentCachingResponseWrapper responseWrapper = response instanceof ContentCachingResponseWrapper wrapper
                ? wrapper
                : new ContentCachingResponseWrapper(response);

        if (sampled) {
            log.info("HTTP_IN method={}, path={}, clientIp={}", method, path, resolveClientIp(request));
        }

        Throwable error = null;
        try {
            filterChain.doFilter(request, responseWrapper);
        } catch (IOException | ServletException | RuntimeException ex) {
            error = ex;
            throw ex;
        } finally {
            long costMs = (System.nanoTime() - startNs) / 1_000_000L;
            boolean slowRequest = costMs >= Math.max(properties.getSlowRequestThresholdMs(), 0L);
            if (sampled || error != null || slowRequest) {
                String responseCode = StringUtils.defaultIfBlank(extractResponseCode(responseWrapper), "-");
                if (error == null) {
                    log.info("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}, slow={}",
                            method, path, responseWrapper.getStatus(), responseCode, costMs, slowRequest);
                } else {
                    log.warn("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}, errorType={}, errorMessage={}",
                            method, path, responseWrapper.getStatus(), responseCode, costMs,
                            error.getClass().getSimpleName(), StringUtils.abbreviate(error.getMessage(), 200));
                }
            }
            responseWrapper.copyBodyToResponse();
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_TRACE_ID);
        }
    }

    private String resolveOrCreate(String value) {
        if (StringUtils.isNotBlank(value)) {
            return value.trim();
        }
        return UUID.randomUUID().toString().replace("-", "");
    }

    private boolean shouldSample() {
        double rate = properties.getSampleRate();
        if (rate <= 0D) {
            return false;
        }
        if (rate >= 1D) {
            return true;
        }
        return ThreadLocalRandom.current().nextDouble() <= rate;
    }

    private String extractResponseCode(ContentCachingResponseWrapper responseWrapper) {
        byte[] body = responseWrapper.getContentAsByteArray();
        if (body.length == 0) {
            return null;
        }
        String contentType = responseWrapper.getContentType();
        if (StringUtils.isBlank(contentType)
                || !contentType.toLowerCase(Locale.ROOT).contains(MediaType.APPLICATION_JSON_VALUE)) {
            return null;
        }
        try {
            JsonNode code = objectMapper.readTree(body).get("code");
            return code == null || code.isNull() ? null : code.asText();
        } catch (IOException ex) {
            log.debug("HTTP_OUT response code unreadable. error={}", ex.getMessage());
            return null;
        }
    }

    private String resolveClientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (StringUtils.isNotBlank(forwarded)) {
            String first = StringUtils.substringBefore(forwarded, ",");
            if (StringUtils.isNotBlank(first)) {
                return first.trim();
            }
        }
        return StringUtils.defaultIfBlank(request.getRemoteAddr(), "unknown");
    }

    private boolean matchesAny(String path, List<String> patterns) {
        if (StringUtils.isBlank(path) || patterns == null || patterns.isEmpty()) {
            return false;
        }
        for (String pattern : patterns) {
            if (StringUtils.isNotBlank(pattern) && pathMatcher.match(pattern.trim(), path)) {
                return true;
            }
        }
        return false;
    }

    private String normalizePath(String path) {
        return StringUtils.defaultIfBlank(path, "/").trim();
    }
}
