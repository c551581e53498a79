package com.openforge.taskmanager.auth.dto;

/**
 * OAuth2-style token body: access_token, token_type ("bearer"), expires_in (seconds).
 */
public record TokenResponse(
        String accessToken,
        String tokenType,
        long   expiresIn
) {
}
