package com.taskengine.api.security;

import com.taskengine.engine.config.EngineProperties;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Rejects requests that do not carry the shared secret, before any pass runs.
 *
 * The secret is accepted as {@code Authorization: Bearer <secret>} or {@code X-Cron-Secret: <secret>}
 * and compared in constant time. While no secret is configured every request is rejected.
 */
public class CronSecretInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(CronSecretInterceptor.class);

    public static final String SECRET_HEADER = "X-Cron-Secret";
    private static final String BEARER_PREFIX = "Bearer ";
    private static final String UNAUTHORIZED_BODY = "{\"error\":\"UNAUTHORIZED\"}";

    private final EngineProperties.Trigger settings;

    public CronSecretInterceptor(EngineProperties properties) {
        this.settings = properties.getTrigger();
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws IOException {
        String expected = settings.getSecret();
        if (expected == null || expected.isBlank()) {
            log.warn("Rejected {} {}: no trigger secret configured", request.getMethod(), request.getRequestURI());
            return reject(response);
        }

        String presented = presentedSecret(request);
        if (presented == null || !MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Rejected {} {}: missing or invalid secret", request.getMethod(), request.getRequestURI());
            return reject(response);
        }
        return true;
    }

    private static String presentedSecret(HttpServletRequest request) {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            return authorization.substring(BEARER_PREFIX.length()).trim();
        }
        return request.getHeader(SECRET_HEADER);
    }

    private static boolean reject(HttpServletResponse response) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(UNAUTHORIZED_BODY);
        return false;
    }
}
