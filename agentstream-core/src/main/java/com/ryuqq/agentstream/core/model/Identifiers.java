package com.ryuqq.agentstream.core.model;

import com.ryuqq.agentstream.core.error.ValidationException;

import java.util.regex.Pattern;

/**
 * 식별자 값 객체 공통 검증.
 *
 * @author AgentStream Team
 * @since 1.0.0
 */
final class Identifiers {

    static final int MAX_LENGTH = 255;

    private static final Pattern ALLOWED = Pattern.compile("^[A-Za-z0-9._:\\-]+$");

    private Identifiers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static String validate(String typeName, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(typeName + " cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new ValidationException(
                typeName + " length cannot exceed " + MAX_LENGTH + " characters (current: " + value.length() + ")"
            );
        }
        if (!ALLOWED.matcher(value).matches()) {
            throw new ValidationException(
                typeName + " contains invalid characters. Only alphanumeric, dot, colon, hyphen, and underscore are allowed"
            );
        }
        return value;
    }
}
