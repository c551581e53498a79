package com.openforge.taskmanager.auth;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Token signing settings, read once at startup.
 *
 * app:
 *   jwt:
 *     secret: ${APP_JWT_SECRET}   # HS256 needs at least 32 bytes
 *     expire-minutes: 60
 *
 * Changing the secret invalidates every token already issued.
 */
@ConfigurationProperties(prefix = "app.jwt")
public record JwtProperties(
        String secret,
        @DefaultValue("60") long expireMinutes
) {}
