package com.openforge.taskmanager.web;

import com.openforge.taskmanager.config.AppProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Unauthenticated liveness check. */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final AppProperties appProperties;

    public record HealthResponse(String status, String version) {}

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("healthy", appProperties.version());
    }
}
