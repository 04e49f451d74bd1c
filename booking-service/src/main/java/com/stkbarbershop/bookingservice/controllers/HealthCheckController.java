package com.stkbarbershop.bookingservice.controllers;

import com.stkbarbershop.bookingservice.services.ratelimit.SlidingWindowRateLimiter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthCheckController {

    private final SlidingWindowRateLimiter rateLimiter;
    private final Clock clock;

    @GetMapping("/")
    public ResponseEntity<Map<String, String>> root() {
        Map<String, String> response = new HashMap<>();
        response.put("service", "Stk Barbershop API");
        response.put("status", "ok");
        return ResponseEntity.ok(response);
    }

    @GetMapping("/api/health/live")
    public ResponseEntity<Map<String, Object>> liveness() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("check", "liveness");
        response.put("timestamp", clock.instant().toString());
        response.put("uptime", getUptime());
        response.put("trackedClients", rateLimiter.trackedClients());
        return ResponseEntity.ok(response);
    }

    private String getUptime() {
        long seconds = ManagementFactory.getRuntimeMXBean().getUptime() / 1000;
        long minutes = seconds / 60;
        long hours = minutes / 60;
        long days = hours / 24;
        return String.format("%d days, %d hours, %d minutes, %d seconds",
                days, hours % 24, minutes % 60, seconds % 60);
    }
}
