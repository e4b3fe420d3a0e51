package com.swissknife.core.security;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds the redacted, shell-quoted command preview stored in audit records.
 */
public final class CommandPreview {

    public static final String MASK = "***";
    public static final int DEFAULT_MAX_LENGTH = 240;

    private static final List<String> SECRET_MARKERS = List.of("password", "secret", "token", "apikey", "api_key");
    private static final Pattern SHELL_SAFE = Pattern.compile("[A-Za-z0-9_@%+=:,./-]+");
    private static final String ELLIPSIS = "...";

    private CommandPreview() {
        // utility class
    }

    public static String render(List<String> argv) {
        return render(argv, DEFAULT_MAX_LENGTH);
    }

    public static String render(List<String> argv, int maxLength) {
        String preview = argv.stream()
                .map(CommandPreview::redactToken)
                .map(CommandPreview::quote)
                .collect(Collectors.joining(" "));
        if (preview.length() > maxLength) {
            return preview.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
        }
        return preview;
    }

    /**
     * Masks the whole token when it mentions a secret marker anywhere, or
     * only the value half of a {@code key=value} token whose key does.
     */
    static String redactToken(String token) {
        if (containsMarker(token)) {
            return MASK;
        }
        int eq = token.indexOf('=');
        if (eq >= 0 && containsMarker(token.substring(0, eq))) {
            return token.substring(0, eq) + "=" + MASK;
        }
        return token;
    }

    /** POSIX single-quote quoting; shell-safe tokens are left bare. */
    static String quote(String token) {
        if (token.isEmpty()) {
            return "''";
        }
        if (SHELL_SAFE.matcher(token).matches()) {
            return token;
        }
        return "'" + token.replace("'", "'\"'\"'") + "'";
    }

    private static boolean containsMarker(String text) {
        String lowered = text.toLowerCase(Locale.ROOT);
        for (String marker : SECRET_MARKERS) {
            if (lowered.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
