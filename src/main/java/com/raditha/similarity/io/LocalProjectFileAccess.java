package com.raditha.similarity.io;

import com.raditha.similarity.config.SimilarityConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * {@link ProjectFileAccess} backed by the local file system.
 * Lists regular files with a known text extension, skipping paths that match
 * the configured exclude patterns. Excluded directories are not entered, and
 * a directory or file that cannot be read is logged and left out.
 */
public class LocalProjectFileAccess implements ProjectFileAccess {
    private static final Logger logger = LoggerFactory.getLogger(LocalProjectFileAccess.class);

    static final Set<String> TEXT_EXTENSIONS = Set.of(
            "txt", "md", "js", "ts", "jsx", "tsx", "mjs", "html", "css", "scss", "sass", "less",
            "json", "xml", "yaml", "yml", "toml", "ini", "conf", "config", "env",
            "py", "rb", "php", "java", "c", "cc", "cpp", "h", "hpp", "cs", "go", "rs",
            "sh", "bash", "zsh", "fish", "ps1", "bat", "cmd", "sql", "graphql",
            "vue", "svelte", "astro", "prisma", "proto");

    private static final Set<String> TEXT_FILE_NAMES = Set.of("dockerfile", "makefile");

    private final SimilarityConfig config;

    public LocalProjectFileAccess() {
        this(SimilarityConfig.defaults());
    }

    public LocalProjectFileAccess(SimilarityConfig config) {
        this.config = config;
    }

    @Override
    public List<String> listProjectTextFiles(String projectPath) throws IOException {
        if (projectPath == null || projectPath.isBlank()) {
            throw new IOException("Project path is required");
        }
        Path root = Paths.get(projectPath);
        if (!Files.isDirectory(root)) {
            throw new IOException("Project path is not a directory: " + projectPath);
        }

        TextFileCollector collector = new TextFileCollector(root.toAbsolutePath().normalize(), config);
        Files.walkFileTree(collector.base, collector);
        return collector.sortedFiles();
    }

    @Override
    public String readTextFile(String path) throws IOException {
        return Files.readString(Paths.get(path), StandardCharsets.UTF_8);
    }

    /**
     * Decide from the file name whether a file holds text.
     */
    public static boolean isTextFile(String path) {
        String name = Paths.get(path).getFileName().toString().toLowerCase(Locale.ROOT);
        if (TEXT_FILE_NAMES.contains(name)) {
            return true;
        }
        int dot = name.lastIndexOf('.');
        return dot >= 0 && TEXT_EXTENSIONS.contains(name.substring(dot + 1));
    }

    /**
     * Collects text files below a project root. Patterns are matched against
     * the path relative to the root, prefixed with '/'. Directories also get a
     * trailing '/', so a pattern ending in '/**' skips the whole subtree.
     */
    static class TextFileCollector extends SimpleFileVisitor<Path> {

        private final Path base;
        private final SimilarityConfig config;
        private final List<String> files = new ArrayList<>();

        TextFileCollector(Path base, SimilarityConfig config) {
            this.base = base;
            this.config = config;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (!dir.equals(base) && config.shouldExclude(relative(dir) + "/")) {
                return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile()
                    && !config.shouldExclude(relative(file))
                    && isTextFile(file.toString())) {
                files.add(file.toString());
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) {
            logger.warn("Skipping unreadable path {}: {}", file, exc.getMessage());
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
            if (exc != null) {
                logger.warn("Listing of {} stopped early: {}", dir, exc.getMessage());
            }
            return FileVisitResult.CONTINUE;
        }

        List<String> sortedFiles() {
            return files.stream().sorted().toList();
        }

        private String relative(Path path) {
            return "/" + base.relativize(path);
        }
    }
}
