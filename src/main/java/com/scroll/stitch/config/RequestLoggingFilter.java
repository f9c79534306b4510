package com.scroll.stitch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.ContentCachingResponseWrapper;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Component
public class RequestLoggingFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    // 请求体里是 Base64 图片，只打印开头
    private static final int MAX_REQUEST_BODY_LOG = 500;
    private static final int MAX_RESPONSE_BODY_LOG = 2000;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String path = request.getRequestURI();

        // 文档页面和静态资源直接放行
        if (path.startsWith("/swagger-ui") || path.startsWith("/v3/api-docs")) {
            filterChain.doFilter(request, response);
            return;
        }

        ContentCachingRequestWrapper requestWrapper = new ContentCachingRequestWrapper(request);
        ContentCachingResponseWrapper responseWrapper = new ContentCachingResponseWrapper(response);

        long startTime = System.currentTimeMillis();

        try {
            logger.info("=== Incoming Request ===");
            logger.info("Method: {} {}", request.getMethod(), path);

            filterChain.doFilter(requestWrapper, responseWrapper);

        } finally {
            long duration = System.currentTimeMillis() - startTime;

            if (logger.isDebugEnabled()
                    && (request.getMethod().equalsIgnoreCase("POST") || request.getMethod().equalsIgnoreCase("PUT"))) {
                byte[] content = requestWrapper.getContentAsByteArray();
                if (content.length > 0) {
                    logger.debug("Request Body ({} bytes): {}", content.length, abbreviate(content, MAX_REQUEST_BODY_LOG));
                }
            }

            byte[] responseContent = responseWrapper.getContentAsByteArray();
            String contentType = response.getContentType();
            if (logger.isDebugEnabled() && responseContent.length > 0
                    && contentType != null && (contentType.contains("json") || contentType.contains("text"))) {
                logger.debug("Response Body: {}", abbreviate(responseContent, MAX_RESPONSE_BODY_LOG));
            }

            // 必须把缓存的响应写回，否则客户端收不到数据
            responseWrapper.copyBodyToResponse();

            logger.info("Duration: {} ms | Status: {}", duration, response.getStatus());
        }
    }

    private static String abbreviate(byte[] content, int limit) {
        String body = new String(content, 0, Math.min(content.length, limit), StandardCharsets.UTF_8);
        return content.length > limit ? body + "..." : body;
    }
}
