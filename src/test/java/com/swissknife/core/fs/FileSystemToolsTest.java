package com.swissknife.core.fs;

import com.swissknife.core.result.ToolResult;
import com.swissknife.core.security.SandboxPathResolver;
import com.swissknife.core.security.SandboxProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemToolsTest {

    @TempDir
    Path tempDir;

    private Path root;
    private FileSystemTools tools;

    @BeforeEach
    void setUp() throws Exception {
        root = tempDir.toRealPath();
        SandboxProperties props = new SandboxProperties();
        props.setBaseDir(root.toString());
        props.setMaxReadBytes(1024);
        tools = new FileSystemTools(new SandboxPathResolver(props), props);
    }

    @Nested
    @DisplayName("read")
    class ReadTests {

        @Test
        @DisplayName("returns content and size")
        void readsFile() throws Exception {
            Files.writeString(root.resolve("hello.txt"), "hello world");
            ToolResult result = tools.read("hello.txt", null);
            assertTrue(result.isOk());
            assertEquals("hello world", result.get("content"));
            assertEquals(11L, result.get("size"));
            assertEquals(false, result.get("truncated"));
        }

        @Test
        @DisplayName("truncates at max_bytes")
        void truncates() throws Exception {
            Files.writeString(root.resolve("long.txt"), "abcdefghij");
            ToolResult result = tools.read("long.txt", 4);
            assertEquals("abcd", result.get("content"));
            assertEquals(true, result.get("truncated"));
        }

        @Test
        @DisplayName("invalid UTF-8 falls back to one char per byte")
        void replacesInvalidBytes() throws Exception {
            Files.write(root.resolve("bin.dat"), new byte[]{'o', 'k', (byte) 0xff});
            ToolResult result = tools.read("bin.dat", null);
            assertTrue(result.isOk());
            assertEquals("ok\u00ff", result.get("content"));
        }

        @Test
        @DisplayName("missing file is not_found")
        void missing() {
            ToolResult result = tools.read("nope.txt", null);
            assertEquals("not_found", result.error());
            assertEquals("File not found: nope.txt", result.get("message"));
        }

        @Test
        @DisplayName("directory is invalid_path")
        void directory() throws Exception {
            Files.createDirectory(root.resolve("dir"));
            assertEquals("invalid_path", tools.read("dir", null).error());
        }

        @Test
        @DisplayName("escape from the sandbox is permission_denied")
        void escape() {
            assertEquals("permission_denied", tools.read("../../etc/passwd", null).error());
        }
    }

    @Nested
    @DisplayName("write")
    class WriteTests {

        @Test
        @DisplayName("overwrite creates parent directories")
        void overwrite() throws Exception {
            ToolResult result = tools.write("a/b/c.txt", "first", null);
            assertTrue(result.isOk());
            assertEquals("first", Files.readString(root.resolve("a/b/c.txt")));
            tools.write("a/b/c.txt", "second", "overwrite");
            assertEquals("second", Files.readString(root.resolve("a/b/c.txt")));
            assertFalse(Files.exists(root.resolve("a/b/c.txt.lock")));
        }

        @Test
        @DisplayName("append adds to the end")
        void append() throws Exception {
            tools.write("log.txt", "one\n", "overwrite");
            tools.write("log.txt", "two\n", "append");
            assertEquals("one\ntwo\n", Files.readString(root.resolve("log.txt"), StandardCharsets.UTF_8));
        }

        @Test
        @DisplayName("unknown mode is invalid_argument")
        void unknownMode() {
            ToolResult result = tools.write("x.txt", "data", "truncate");
            assertEquals("invalid_argument", result.error());
            assertEquals("Unsupported mode: truncate", result.get("message"));
        }

        @Test
        @DisplayName("held lock makes the writer time out")
        void lockedFile() throws Exception {
            Files.createFile(root.resolve("busy.txt.lock"));
            ToolResult result = tools.write("busy.txt", "data", null);
            assertEquals("timeout", result.error());
        }

        @Test
        @DisplayName("escape from the sandbox is permission_denied")
        void escape() {
            assertEquals("permission_denied", tools.write("../outside.txt", "x", null).error());
        }
    }

    @Nested
    @DisplayName("list and stat")
    class ListTests {

        @SuppressWarnings("unchecked")
        private List<Map<String, Object>> entries(ToolResult result) {
            return (List<Map<String, Object>>) result.get("entries");
        }

        @Test
        @DisplayName("lists direct children with types")
        void listsChildren() throws Exception {
            Files.createDirectories(root.resolve("src/main"));
            Files.writeString(root.resolve("README"), "hi");
            ToolResult result = tools.list(".", false, null);
            assertTrue(result.isOk());
            Map<String, String> types = entries(result).stream()
                    .collect(Collectors.toMap(e -> (String) e.get("rel_path"), e -> (String) e.get("type")));
            assertEquals(Map.of("src", "dir", "README", "file"), types);
            assertEquals(false, result.get("truncated"));
        }

        @Test
        @DisplayName("recursive listing includes nested entries")
        void listsRecursively() throws Exception {
            Files.createDirectories(root.resolve("src/main"));
            Files.writeString(root.resolve("src/main/App.java"), "class App {}");
            Set<String> paths = entries(tools.list(".", true, null)).stream()
                    .map(e -> (String) e.get("rel_path"))
                    .collect(Collectors.toSet());
            assertEquals(Set.of("src", "src/main", "src/main/App.java"), paths);
        }

        @Test
        @DisplayName("max_entries truncates the listing")
        void truncatesListing() throws Exception {
            for (int i = 0; i < 5; i++) {
                Files.writeString(root.resolve("f" + i), "");
            }
            ToolResult result = tools.list(".", false, 3);
            assertEquals(3, entries(result).size());
            assertEquals(true, result.get("truncated"));
        }

        @Test
        @DisplayName("listing a file is invalid_path and a missing dir is not_found")
        void listErrors() throws Exception {
            Files.writeString(root.resolve("file"), "");
            assertEquals("invalid_path", tools.list("file", false, null).error());
            assertEquals("not_found", tools.list("missing", false, null).error());
        }

        @Test
        @DisplayName("stat reports type size and mtime")
        void stat() throws Exception {
            Files.writeString(root.resolve("s.txt"), "12345");
            ToolResult result = tools.stat("s.txt");
            assertEquals("file", result.get("type"));
            assertEquals(5L, result.get("size"));
            assertInstanceOf(Double.class, result.get("mtime"));
            assertEquals("not_found", tools.stat("ghost").error());
        }
    }
}
