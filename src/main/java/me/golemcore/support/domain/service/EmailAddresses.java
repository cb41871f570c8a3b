package me.golemcore.support.domain.service;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Email normalization used as the account lookup key.
 */
public final class EmailAddresses {

    private static final Pattern EMAIL_PATTERN = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");

    private EmailAddresses() {
    }

    /**
     * Trims and lower-cases the address.
     *
     * @return the normalized address, or {@code null} if the value is blank or
     *         not shaped like an email
     */
    public static String normalize(String email) {
        if (email == null) {
            return null;
        }
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        int at = normalized.indexOf('@');
        if (at <= 0 || at == normalized.length() - 1 || normalized.chars().anyMatch(Character::isWhitespace)) {
            return null;
        }
        return normalized;
    }

    /**
     * Finds the first email address mentioned in free text.
     */
    public static Optional<String> findIn(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = EMAIL_PATTERN.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.ofNullable(normalize(matcher.group()));
    }
}
