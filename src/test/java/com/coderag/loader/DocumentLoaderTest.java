package com.coderag.loader;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class DocumentLoaderTest {

    @TempDir
    Path root;

    private DocumentLoader loader(int chunkSize, int overlapSize) {
        return new DocumentLoader(root, List.of(".java", ".md", ".js"), List.of("node_modules", ".git", "target"),
            chunkSize, overlapSize, 1_000, 10);
    }

    private static String numberedLines(int count) {
        return IntStream.rangeClosed(1, count).mapToObj(i -> "line " + i).collect(Collectors.joining("\n"));
    }

    private static Document document(String content) {
        return new Document("/abs/Sample.java", "Sample.java", ".java", content, content.length(), false);
    }

    @Test
    @DisplayName("Consecutive chunks share exactly overlapSize lines")
    void overlapBetweenConsecutiveChunks() {
        DocumentLoader loader = loader(10, 3);
        List<Chunk> chunks = loader.chunkDocument(document(numberedLines(25)));

        assertThat(chunks).hasSizeGreaterThanOrEqualTo(2);
        for (int i = 0; i + 1 < chunks.size(); i++) {
            List<String> current = Arrays.asList(chunks.get(i).content.split("\n", -1));
            List<String> next = Arrays.asList(chunks.get(i + 1).content.split("\n", -1));
            assertEquals(current.subList(current.size() - 3, current.size()), next.subList(0, 3),
                "overlap between chunk " + i + " and " + (i + 1));
        }
    }

    @Test
    @DisplayName("Chunks cover every line with 1-based inclusive line ranges")
    void lineRangesAndCoverage() {
        DocumentLoader loader = loader(10, 3);
        List<Chunk> chunks = loader.chunkDocument(document(numberedLines(25)));

        assertEquals(1, chunks.get(0).startLine);
        assertEquals(10, chunks.get(0).endLine);
        assertEquals(8, chunks.get(1).startLine);
        assertEquals(17, chunks.get(1).endLine);
        assertEquals(25, chunks.get(chunks.size() - 1).endLine);

        for (Chunk chunk : chunks) {
            assertEquals(chunk.endLine - chunk.startLine + 1, chunk.lineCount());
            assertThat(chunk.content.split("\n", -1)).hasSize(chunk.lineCount());
        }

        List<String> covered = new ArrayList<>();
        for (int i = 0; i < chunks.size(); i++) {
            List<String> lines = Arrays.asList(chunks.get(i).content.split("\n", -1));
            covered.addAll(i == 0 ? lines : lines.subList(3, lines.size()));
        }
        assertEquals(Arrays.asList(numberedLines(25).split("\n")), covered);
    }

    @Test
    @DisplayName("A document shorter than a chunk yields one chunk")
    void shortDocument() {
        List<Chunk> chunks = loader(10, 3).chunkDocument(document("a\nb\nc"));

        assertEquals(1, chunks.size());
        Chunk only = chunks.get(0);
        assertEquals("a\nb\nc", only.content);
        assertEquals(0, only.chunkIndex);
        assertEquals("/abs/Sample.java#chunk0", only.id);
        assertEquals(1, only.startLine);
        assertEquals(3, only.endLine);
    }

    @Test
    @DisplayName("No trailing chunk made only of carried-over overlap lines")
    void noOverlapOnlyTail() {
        // stride is 7, so 17 lines end exactly on a chunk boundary
        List<Chunk> chunks = loader(10, 3).chunkDocument(document(numberedLines(17)));

        assertEquals(2, chunks.size());
        assertEquals(17, chunks.get(1).endLine);
    }

    @Test
    @DisplayName("Empty content still produces a single empty chunk")
    void emptyDocument() {
        List<Chunk> chunks = loader(10, 3).chunkDocument(document(""));

        assertEquals(1, chunks.size());
        assertEquals("", chunks.get(0).content);
    }

    @Test
    @DisplayName("Walk applies extension and ignore filters and skips oversized files")
    void loadCodebaseFilters() throws Exception {
        Files.createDirectories(root.resolve("src/main"));
        Files.createDirectories(root.resolve("node_modules/lib"));
        Files.createDirectories(root.resolve("target"));
        Files.writeString(root.resolve("src/main/App.java"), "class App {}");
        Files.writeString(root.resolve("README.md"), "# Readme");
        Files.writeString(root.resolve("notes.txt"), "not indexed");
        Files.writeString(root.resolve("node_modules/lib/index.js"), "module.exports = {}");
        Files.writeString(root.resolve("target/Gen.java"), "class Gen {}");
        Files.writeString(root.resolve("src/main/Huge.java"), "x".repeat(2_000));

        List<Document> documents = loader(10, 3).loadCodebase();

        assertThat(documents).extracting(d -> d.source).containsExactly("README.md", "src/main/App.java");
        Document app = documents.get(1);
        assertEquals(".java", app.type);
        assertEquals("class App {}", app.content);
        assertEquals(root.resolve("src/main/App.java").toAbsolutePath().normalize().toString(), app.id);
        assertFalse(app.documentation);
    }

    @Test
    @DisplayName("A file that cannot be decoded is skipped and the walk continues")
    void unreadableFileIsSkipped() throws Exception {
        Files.write(root.resolve("Bad.java"), new byte[]{(byte) 0xC3, (byte) 0x28});
        Files.writeString(root.resolve("Good.java"), "class Good {}");

        List<Document> documents = loader(10, 3).loadCodebase();

        assertThat(documents).extracting(d -> d.source).containsExactly("Good.java");
        assertEquals("class Good {}", documents.get(0).content);
    }

    @Test
    @DisplayName("Directories deeper than maxDepth are not visited")
    void depthLimit() throws Exception {
        Files.createDirectories(root.resolve("a/b/c"));
        Files.writeString(root.resolve("a/Top.java"), "top");
        Files.writeString(root.resolve("a/b/c/Deep.java"), "deep");

        DocumentLoader shallow = new DocumentLoader(root, List.of(".java"), List.of(), 10, 3, 1_000, 1);

        assertThat(shallow.loadCodebase()).extracting(d -> d.source).containsExactly("a/Top.java");
    }

    @Test
    @DisplayName("loadFiles loads named files and silently skips missing or filtered ones")
    void loadFiles() throws Exception {
        Files.createDirectories(root.resolve("src"));
        Files.writeString(root.resolve("src/A.java"), "class A {}");
        Files.writeString(root.resolve("src/B.txt"), "text");

        List<Document> documents = loader(10, 3).loadFiles(List.of("src/A.java", "src/B.txt", "src/Missing.java",
            "../outside.java"));

        assertEquals(1, documents.size());
        assertEquals("src/A.java", documents.get(0).source);
    }

    @Test
    @DisplayName("loadDocumentation picks up markdown only, flagged as documentation")
    void loadDocumentation() throws Exception {
        Files.createDirectories(root.resolve("docs/guides"));
        Files.writeString(root.resolve("docs/intro.md"), "# Intro");
        Files.writeString(root.resolve("docs/guides/setup.md"), "# Setup");
        Files.writeString(root.resolve("docs/diagram.java"), "class Diagram {}");

        DocumentLoader loader = loader(10, 3);
        List<Document> documents = loader.loadDocumentation("docs");

        assertThat(documents).extracting(d -> d.source).containsExactly("docs/guides/setup.md", "docs/intro.md");
        assertThat(documents).allMatch(d -> d.documentation);
        assertThat(loader.loadDocumentation("nope")).isEmpty();
    }

    @Test
    void filterHelpers() {
        DocumentLoader loader = loader(10, 3);

        assertTrue(loader.shouldIgnore("node_modules/x/index.js"));
        assertTrue(loader.shouldIgnore("sub/.git/config"));
        assertFalse(loader.shouldIgnore("src/Main.java"));
        assertTrue(loader.shouldLoadFile("Main.java"));
        assertFalse(loader.shouldLoadFile("Main.class"));
    }

    @Test
    void rejectsInvalidChunkGeometry() {
        assertThatThrownBy(() -> new DocumentLoader(root, List.of(".java"), List.of(), 5, 5, 1_000, 10))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
