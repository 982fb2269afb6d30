/**
 * 请求日志过滤器
 *
 * @author zhenglin
 * @date 2026/10/14
 */
package com.svcreg.server.web;

import com.svcreg.common.protocol.RegistryPaths;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * 请求日志过滤器
 * 透传或生成x-request-id，并记录请求开始/结束
 */
@Slf4j
public class RequestLoggingFilter extends OncePerRequestFilter {

    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_SERVICE = "service";

    private static final Set<String> SENSITIVE_HEADERS = Set.of("authorization", "cookie", "x-api-key");
    private static final String REDACTED = "[REDACTED]";

    private final String serviceName;

    public RequestLoggingFilter(String serviceName) {
        this.serviceName = serviceName;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String requestId = request.getHeader(RegistryPaths.REQUEST_ID_HEADER);
        if (!StringUtils.hasText(requestId)) {
            requestId = UUID.randomUUID().toString();
        }
        response.setHeader(RegistryPaths.REQUEST_ID_HEADER, requestId);

        long startTime = System.currentTimeMillis();
        MDC.put(MDC_REQUEST_ID, requestId);
        MDC.put(MDC_SERVICE, serviceName);
        try {
            if (log.isDebugEnabled()) {
                log.debug("Request received: method={}, path={}, ip={}, headers={}",
                    request.getMethod(), request.getRequestURI(), request.getRemoteAddr(), sanitizeHeaders(request));
            }
            filterChain.doFilter(request, response);
        } finally {
            log.info("Request completed: method={}, path={}, status={}, durationMs={}",
                request.getMethod(), request.getRequestURI(), response.getStatus(),
                System.currentTimeMillis() - startTime);
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_SERVICE);
        }
    }

    static Map<String, String> sanitizeHeaders(HttpServletRequest request) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            String value = SENSITIVE_HEADERS.contains(name.toLowerCase()) ? REDACTED : request.getHeader(name);
            headers.put(name, value);
        }
        return headers;
    }
}
