package com.openforge.taskmanager.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Application-level settings.
 *
 * application.yml:
 *
 * app:
 *   name: Task Manager API
 *   version: 1.0.0
 *   cors-origins: "*"            # comma separated, or "*"
 *   rate-limit:
 *     requests: 100
 *     window-seconds: 60
 *
 * The rate-limit block is carried for deployment tooling; the API itself
 * does not enforce it.
 */
@ConfigurationProperties(prefix = "app")
public record AppProperties(
        @DefaultValue("Task Manager API") String       name,
        @DefaultValue("1.0.0")            String       version,
        @DefaultValue("*")                List<String> corsOrigins,
        @DefaultValue                     RateLimit    rateLimit
) {

    public record RateLimit(
            @DefaultValue("100") int requests,
            @DefaultValue("60")  int windowSeconds
    ) {}
}
