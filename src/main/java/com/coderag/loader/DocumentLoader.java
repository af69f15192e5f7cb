package com.coderag.loader;

import com.coderag.config.RagConfig;
import com.coderag.errors.DocumentLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/**
 * DocumentLoader - Walks a codebase, loads eligible files and splits them into
 * overlapping line windows for embedding.
 */
public class DocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(DocumentLoader.class);

    private final Path rootDir;
    private final List<String> extensions;
    private final List<String> ignorePatterns;
    private final int chunkSize;
    private final int overlapSize;
    private final long maxFileSize;
    private final int maxDepth;

    public DocumentLoader(RagConfig config) {
        this(config.rootDir, config.extensions, config.ignorePatterns, config.chunkSize,
            config.overlapSize, config.maxFileSize, config.maxDepth);
    }

    public DocumentLoader(Path rootDir, List<String> extensions, List<String> ignorePatterns,
                          int chunkSize, int overlapSize, long maxFileSize, int maxDepth) {
        if (chunkSize <= 0 || overlapSize < 0 || overlapSize >= chunkSize) {
            throw new IllegalArgumentException(
                "Need 0 <= overlapSize < chunkSize, got overlap=" + overlapSize + " chunk=" + chunkSize);
        }
        this.rootDir = rootDir.toAbsolutePath().normalize();
        this.extensions = List.copyOf(extensions);
        this.ignorePatterns = List.copyOf(ignorePatterns);
        this.chunkSize = chunkSize;
        this.overlapSize = overlapSize;
        this.maxFileSize = maxFileSize;
        this.maxDepth = maxDepth;
    }

    /**
     * Load all eligible documents under the root directory.
     * Unreadable or oversized files are skipped; the walk never aborts on a single file.
     */
    public List<Document> loadCodebase() {
        log.info("📂 Loading codebase from {}...", rootDir);

        List<Document> documents = new ArrayList<>();
        walk(rootDir, 0, documents);

        log.info("✅ Loaded {} documents", documents.size());
        return documents;
    }

    private void walk(Path dir, int depth, List<Document> documents) {
        if (depth > maxDepth) {
            log.debug("Depth limit reached at {}", dir);
            return;
        }

        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            stream.forEach(entries::add);
        } catch (IOException e) {
            log.warn("⚠️  Could not list {}: {}", relativize(dir), e.getMessage());
            return;
        }
        Collections.sort(entries);

        for (Path entry : entries) {
            String relativePath = relativize(entry);
            if (shouldIgnore(relativePath)) {
                continue;
            }

            // symbolic links are neither followed nor loaded
            if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                walk(entry, depth + 1, documents);
            } else if (Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS)
                && shouldLoadFile(entry.getFileName().toString())) {
                try {
                    Document document = readDocument(entry, relativePath, false);
                    if (document != null) {
                        documents.add(document);
                    }
                } catch (DocumentLoadException e) {
                    log.warn("⚠️  Could not read {}: {}", relativePath, e.getMessage());
                }
            }
        }
    }

    /**
     * Load specific root-relative files, e.g. the ones touched by a change.
     * Missing, ignored-extension, oversized and unreadable files are skipped.
     */
    public List<Document> loadFiles(List<String> relativePaths) {
        List<Document> documents = new ArrayList<>();

        for (String relativePath : relativePaths) {
            Path fullPath = rootDir.resolve(relativePath).normalize();
            if (!fullPath.startsWith(rootDir)) {
                log.warn("⚠️  Skipping {}: outside of {}", relativePath, rootDir);
                continue;
            }
            if (!Files.isRegularFile(fullPath) || !shouldLoadFile(fullPath.getFileName().toString())) {
                continue;
            }
            try {
                Document document = readDocument(fullPath, relativize(fullPath), false);
                if (document != null) {
                    documents.add(document);
                }
            } catch (DocumentLoadException e) {
                log.warn("⚠️  Could not read {}: {}", relativePath, e.getMessage());
            }
        }

        return documents;
    }

    /**
     * Load every markdown file below {@code docDir} (relative to the root), flagged as documentation.
     * Returns an empty list when the directory does not exist.
     */
    public List<Document> loadDocumentation(String docDir) {
        Path docPath = rootDir.resolve(docDir).normalize();
        if (!Files.isDirectory(docPath)) {
            return Collections.emptyList();
        }

        List<Document> documents = new ArrayList<>();
        try (Stream<Path> paths = Files.walk(docPath, maxDepth + 1)) {
            paths.filter(p -> Files.isRegularFile(p, LinkOption.NOFOLLOW_LINKS))
                .filter(p -> p.getFileName().toString().endsWith(".md"))
                .sorted()
                .forEach(p -> {
                    try {
                        Document document = readDocument(p, relativize(p), true);
                        if (document != null) {
                            documents.add(document);
                        }
                    } catch (DocumentLoadException e) {
                        log.warn("⚠️  Could not read {}: {}", relativize(p), e.getMessage());
                    }
                });
        } catch (IOException e) {
            log.warn("⚠️  Could not walk documentation directory {}: {}", docDir, e.getMessage());
        }
        return documents;
    }

    /**
     * @return the document, or null when the file exceeds the size ceiling
     */
    private Document readDocument(Path path, String relativePath, boolean documentation) throws DocumentLoadException {
        try {
            long size = Files.size(path);
            if (size > maxFileSize) {
                log.info("⏭️  Skipping {} ({} bytes > {} byte limit)", relativePath, size, maxFileSize);
                return null;
            }
            String content = Files.readString(path);
            return new Document(path.toString(), relativePath, extensionOf(path.getFileName().toString()),
                content, size, documentation);
        } catch (IOException e) {
            throw new DocumentLoadException(path, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Split documents into overlapping chunks of {@code chunkSize} lines, carrying the last
     * {@code overlapSize} lines of each full chunk into the next one.
     */
    public List<Chunk> chunkDocuments(List<Document> documents) {
        log.info("✂️  Chunking {} documents...", documents.size());

        List<Chunk> chunks = new ArrayList<>();
        for (Document document : documents) {
            chunks.addAll(chunkDocument(document));
        }

        double perDocument = documents.isEmpty() ? 0.0 : (double) chunks.size() / documents.size();
        log.info("✅ Created {} chunks (avg {} per document)", chunks.size(), String.format("%.1f", perDocument));
        return chunks;
    }

    public List<Chunk> chunkDocument(Document document) {
        String[] lines = document.content.split("\n", -1);
        List<Chunk> chunks = new ArrayList<>();

        List<String> buffer = new ArrayList<>();
        int bufferStart = 0;    // 0-based line index of buffer.get(0)
        int freshLines = 0;     // lines added since the last emitted chunk
        int chunkNumber = 0;

        for (int i = 0; i < lines.length; i++) {
            buffer.add(lines[i]);
            freshLines++;

            if (buffer.size() >= chunkSize) {
                chunks.add(newChunk(document, chunkNumber++, buffer, bufferStart + 1, i + 1));

                List<String> carried = new ArrayList<>(buffer.subList(buffer.size() - overlapSize, buffer.size()));
                buffer = carried;
                bufferStart = i + 1 - carried.size();
                freshLines = 0;
            }
        }

        // a tail made only of carried lines repeats the previous chunk's end
        if (!buffer.isEmpty() && (freshLines > 0 || chunkNumber == 0)) {
            chunks.add(newChunk(document, chunkNumber, buffer, bufferStart + 1, lines.length));
        }

        return chunks;
    }

    private static Chunk newChunk(Document document, int chunkNumber, List<String> lines, int startLine, int endLine) {
        return new Chunk(document.id + "#chunk" + chunkNumber, document.source, document.type, chunkNumber,
            String.join("\n", lines), startLine, endLine);
    }

    boolean shouldIgnore(String relativePath) {
        for (String pattern : ignorePatterns) {
            if (relativePath.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    boolean shouldLoadFile(String fileName) {
        for (String extension : extensions) {
            if (fileName.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    private String relativize(Path path) {
        return rootDir.relativize(path.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }

    private static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot <= 0 ? "" : fileName.substring(dot);
    }

    public Path getRootDir() {
        return rootDir;
    }
}
