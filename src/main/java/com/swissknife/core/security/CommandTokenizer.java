package com.swissknife.core.security;

import com.swissknife.core.result.ErrorCode;
import com.swissknife.core.result.Resolution;

import java.util.ArrayList;
import java.util.List;

/**
 * POSIX shell word splitting without any expansion.
 * <p>
 * Single quotes preserve everything literally. Inside double quotes a
 * backslash only escapes {@code \} and {@code "}; before any other character
 * it is kept as is. Outside quotes a backslash escapes the next character,
 * newline included. Word separators are space, tab, CR and LF. Globs,
 * variables and command substitutions are left as literal text.
 */
public final class CommandTokenizer {

    private CommandTokenizer() {
        // utility class
    }

    private enum State { BETWEEN, WORD, SINGLE, DOUBLE }

    public static Resolution<List<String>> tokenize(String command) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        State state = State.BETWEEN;
        int i = 0;
        int length = command.length();

        while (i < length) {
            char c = command.charAt(i);
            switch (state) {
                case BETWEEN, WORD -> {
                    if (isSeparator(c)) {
                        if (state == State.WORD) {
                            tokens.add(current.toString());
                            current.setLength(0);
                            state = State.BETWEEN;
                        }
                    } else if (c == '\'') {
                        state = State.SINGLE;
                    } else if (c == '"') {
                        state = State.DOUBLE;
                    } else if (c == '\\') {
                        if (i + 1 >= length) {
                            return Resolution.failure(ErrorCode.INVALID_COMMAND,
                                    "invalid_command: No escaped character");
                        }
                        current.append(command.charAt(++i));
                        state = State.WORD;
                    } else {
                        current.append(c);
                        state = State.WORD;
                    }
                }
                case SINGLE -> {
                    if (c == '\'') {
                        state = State.WORD;
                    } else {
                        current.append(c);
                    }
                }
                case DOUBLE -> {
                    if (c == '"') {
                        state = State.WORD;
                    } else if (c == '\\') {
                        if (i + 1 >= length) {
                            return Resolution.failure(ErrorCode.INVALID_COMMAND,
                                    "invalid_command: No escaped character");
                        }
                        char next = command.charAt(++i);
                        if (next != '\\' && next != '"') {
                            current.append(c);
                        }
                        current.append(next);
                    } else {
                        current.append(c);
                    }
                }
            }
            i++;
        }

        if (state == State.SINGLE || state == State.DOUBLE) {
            return Resolution.failure(ErrorCode.INVALID_COMMAND, "invalid_command: No closing quotation");
        }
        if (state == State.WORD) {
            tokens.add(current.toString());
        }
        return Resolution.ok(tokens);
    }

    private static boolean isSeparator(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }
}
