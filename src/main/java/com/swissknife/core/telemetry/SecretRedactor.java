package com.swissknife.core.telemetry;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks credential-looking fragments and bounds text before it is retained
 * in telemetry.
 */
public final class SecretRedactor {

    public static final String REDACTED = "[REDACTED]";
    public static final String TRUNCATED_SUFFIX = "...[TRUNCATED]";

    public static final int LONG_FIELD_MAX_CHARS = 4000;
    public static final int DEFAULT_MAX_CHARS = 1500;

    /** Fields that legitimately carry bulk text and get the larger bound. */
    static final Set<String> LONG_FIELDS = Set.of("cmd", "stdout", "stderr", "content", "error");

    private static final List<Pattern> SECRET_PATTERNS = List.of(
            Pattern.compile("(token|password|secret|api[_-]?key)\\s*[=:]\\s*\\S+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("bearer\\s+[a-z0-9._-]+", Pattern.CASE_INSENSITIVE)
    );

    private SecretRedactor() {}

    public static String redact(String value) {
        return redact(value, LONG_FIELD_MAX_CHARS);
    }

    public static String redact(String value, int maxChars) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        String text = value;
        for (Pattern pattern : SECRET_PATTERNS) {
            text = pattern.matcher(text).replaceAll(REDACTED);
        }
        if (text.length() > maxChars) {
            return text.substring(0, maxChars) + TRUNCATED_SUFFIX;
        }
        return text;
    }

    public static String redactField(String key, String value) {
        int max = key != null && LONG_FIELDS.contains(key) ? LONG_FIELD_MAX_CHARS : DEFAULT_MAX_CHARS;
        return redact(value, max);
    }
}
