package me.golemcore.support.tools;

import me.golemcore.support.domain.exception.ToolArgumentException;
import me.golemcore.support.domain.service.EmailAddresses;

import java.util.Map;

/**
 * Argument extraction helpers shared by the tools.
 */
final class ToolArguments {

    private ToolArguments() {
    }

    static String requireString(Map<String, Object> arguments, String name) {
        String value = optionalString(arguments, name);
        if (value == null) {
            throw new ToolArgumentException("Missing required argument: " + name);
        }
        return value;
    }

    static String optionalString(Map<String, Object> arguments, String name) {
        if (arguments == null) {
            return null;
        }
        Object value = arguments.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String)) {
            throw new ToolArgumentException("Argument '" + name + "' must be a string");
        }
        String trimmed = ((String) value).trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    static int optionalInt(Map<String, Object> arguments, String name, int defaultValue, int min, int max) {
        Object value = arguments != null ? arguments.get(name) : null;
        if (value == null) {
            return defaultValue;
        }
        int parsed;
        if (value instanceof Number number) {
            parsed = number.intValue();
        } else if (value instanceof String text) {
            try {
                parsed = Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                throw new ToolArgumentException("Argument '" + name + "' must be an integer");
            }
        } else {
            throw new ToolArgumentException("Argument '" + name + "' must be an integer");
        }
        if (parsed < min || parsed > max) {
            throw new ToolArgumentException("Argument '" + name + "' must be between " + min + " and " + max);
        }
        return parsed;
    }

    /**
     * Normalizes an optional email argument; {@code null} stays {@code null}.
     */
    static String normalizeEmail(String email) {
        if (email == null) {
            return null;
        }
        String normalized = EmailAddresses.normalize(email);
        if (normalized == null) {
            throw new ToolArgumentException("Invalid email address: " + email);
        }
        return normalized;
    }
}
