package com.stkbarbershop.bookingservice.interceptors;

import com.stkbarbershop.bookingservice.annotations.RateLimited;
import com.stkbarbershop.bookingservice.configurations.BookingProperties;
import com.stkbarbershop.bookingservice.exceptions.RateLimitExceededException;
import com.stkbarbershop.bookingservice.services.ratelimit.RateLimitDecision;
import com.stkbarbershop.bookingservice.services.ratelimit.SlidingWindowRateLimiter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import java.time.Clock;

/**
 * Enforces the sliding-window rate limit on handlers annotated with {@link RateLimited}.
 * Runs before the request body is read, so abusive clients are turned away
 * before any deserialization or validation work.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RateLimitInterceptor implements HandlerInterceptor {

    static final String UNKNOWN_CLIENT = "unknown";

    private final SlidingWindowRateLimiter rateLimiter;
    private final BookingProperties properties;
    private final Clock clock;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }

        RateLimited rateLimited = handlerMethod.getMethodAnnotation(RateLimited.class);
        if (rateLimited == null) {
            return true;
        }

        String clientIp = getClientIp(request);
        String rateLimitKey = buildRateLimitKey(clientIp, rateLimited.key());

        RateLimitDecision decision = rateLimiter.checkAndRecord(rateLimitKey, clock.instant());
        if (!decision.isAdmitted()) {
            log.warn("Rate limit exceeded for IP: {} on endpoint: {}", clientIp, request.getRequestURI());
            throw new RateLimitExceededException(rateLimited.message(), clientIp, decision.getRetryAfterSeconds());
        }

        return true;
    }

    private String buildRateLimitKey(String clientIp, String customKey) {
        if (customKey != null && !customKey.isEmpty()) {
            return String.format("%s:%s", clientIp, customKey);
        }
        return clientIp;
    }

    private String getClientIp(HttpServletRequest request) {
        String ip = null;
        if (properties.getRateLimit().isTrustForwardedHeaders()) {
            ip = request.getHeader("X-Forwarded-For");
            if (ip == null || ip.isEmpty() || UNKNOWN_CLIENT.equalsIgnoreCase(ip)) {
                ip = request.getHeader("X-Real-IP");
            }
            // Handle multiple IPs (take first one)
            if (ip != null && ip.contains(",")) {
                ip = ip.split(",")[0].trim();
            }
        }
        if (ip == null || ip.isEmpty() || UNKNOWN_CLIENT.equalsIgnoreCase(ip)) {
            ip = request.getRemoteAddr();
        }
        return ip != null && !ip.isEmpty() ? ip : UNKNOWN_CLIENT;
    }
}
