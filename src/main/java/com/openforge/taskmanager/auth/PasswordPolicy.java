package com.openforge.taskmanager.auth;

import com.openforge.taskmanager.error.ValidationException;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Registration-time checks on credentials that go beyond field annotations.
 */
public final class PasswordPolicy {

    public static final int MIN_LENGTH = 8;

    /** BCrypt only reads this many bytes of input and rejects anything longer. */
    public static final int MAX_BYTES  = 72;

    private static final Pattern UPPER    = Pattern.compile("[A-Z]");
    private static final Pattern LOWER    = Pattern.compile("[a-z]");
    private static final Pattern DIGIT    = Pattern.compile("\\d");
    private static final Pattern SPECIAL  = Pattern.compile("[!@#$%^&*(),.?\":{}|<>_\\-+=\\[\\]\\\\/;'`~]");
    private static final Pattern USERNAME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9_-]*$");

    private PasswordPolicy() {
    }

    public static void validatePassword(String password) {
        if (password == null || password.length() < MIN_LENGTH) {
            throw weak("Password must be at least " + MIN_LENGTH + " characters long");
        }
        if (exceedsMaxBytes(password)) {
            throw weak("Password must be at most " + MAX_BYTES + " bytes long");
        }
        if (!UPPER.matcher(password).find()) {
            throw weak("Password must contain at least one uppercase letter");
        }
        if (!LOWER.matcher(password).find()) {
            throw weak("Password must contain at least one lowercase letter");
        }
        if (!DIGIT.matcher(password).find()) {
            throw weak("Password must contain at least one digit");
        }
        if (!SPECIAL.matcher(password).find()) {
            throw weak("Password must contain at least one special character");
        }
    }

    /** True when the UTF-8 encoding is longer than BCrypt accepts. */
    public static boolean exceedsMaxBytes(String password) {
        return password != null && password.getBytes(StandardCharsets.UTF_8).length > MAX_BYTES;
    }

    public static void validateUsername(String username) {
        if (username == null || !USERNAME.matcher(username).matches()) {
            throw new ValidationException("username",
                    "Username must start with a letter and contain only letters, numbers, underscores, and hyphens");
        }
    }

    private static ValidationException weak(String reason) {
        return new ValidationException("password", reason);
    }
}
