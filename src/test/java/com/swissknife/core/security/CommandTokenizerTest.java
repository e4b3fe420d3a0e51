package com.swissknife.core.security;

import com.swissknife.core.result.ErrorCode;
import com.swissknife.core.result.Resolution;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandTokenizerTest {

    private static List<String> split(String text) {
        Resolution<List<String>> result = CommandTokenizer.tokenize(text);
        assertTrue(result.isOk(), () -> "expected success but got " + result.message());
        return result.value();
    }

    @Test
    @DisplayName("splits on runs of whitespace")
    void splitsOnWhitespace() {
        assertEquals(List.of("ls", "-la", "/tmp"), split("  ls   -la\t/tmp \n"));
    }

    @Test
    @DisplayName("single quotes keep everything literal")
    void singleQuotes() {
        assertEquals(List.of("echo", "a \"b\" \\c"), split("echo 'a \"b\" \\c'"));
    }

    @Test
    @DisplayName("double quotes honour backslash before quote and backslash")
    void doubleQuotes() {
        assertEquals(List.of("echo", "say \"hi\" \\ $HOME"), split("echo \"say \\\"hi\\\" \\\\ $HOME\""));
    }

    @Test
    @DisplayName("inside double quotes a backslash before other characters stays literal")
    void doubleQuotesKeepOtherBackslashes() {
        assertEquals(List.of("echo", "a\\$b", "x\\`y`", "p\\nq"), split("echo \"a\\$b\" \"x\\`y`\" \"p\\nq\""));
    }

    @Test
    @DisplayName("escaped newline outside quotes is kept as a character")
    void escapedNewlineOutsideQuotes() {
        assertEquals(List.of("a\nb"), split("a\\\nb"));
    }

    @Test
    @DisplayName("backslash at the end of an open double quote is invalid_command")
    void trailingBackslashInsideDoubleQuotes() {
        var result = CommandTokenizer.tokenize("echo \"abc\\");
        assertFalse(result.isOk());
        assertEquals("invalid_command: No escaped character", result.message());
    }

    @Test
    @DisplayName("backslash outside quotes escapes the next character")
    void backslashEscape() {
        assertEquals(List.of("touch", "my file"), split("touch my\\ file"));
    }

    @Test
    @DisplayName("adjacent quoted and bare parts join into one word")
    void adjacentPartsJoin() {
        assertEquals(List.of("--name=hello world"), split("--name='hello world'"));
    }

    @Test
    @DisplayName("empty quotes produce an empty argument")
    void emptyQuotes() {
        assertEquals(List.of("printf", ""), split("printf ''"));
    }

    @Test
    @DisplayName("blank input yields no tokens")
    void blankInput() {
        assertEquals(List.of(), split("   "));
    }

    @Test
    @DisplayName("unbalanced quote is invalid_command")
    void unbalancedQuote() {
        var result = CommandTokenizer.tokenize("echo 'oops");
        assertFalse(result.isOk());
        assertEquals(ErrorCode.INVALID_COMMAND, result.error());
        assertEquals("invalid_command: No closing quotation", result.message());
    }

    @Test
    @DisplayName("trailing backslash is invalid_command")
    void trailingBackslash() {
        var result = CommandTokenizer.tokenize("echo foo\\");
        assertFalse(result.isOk());
        assertEquals("invalid_command: No escaped character", result.message());
    }
}
