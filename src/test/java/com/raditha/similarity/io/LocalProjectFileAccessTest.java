package com.raditha.similarity.io;

import com.raditha.similarity.config.SimilarityConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LocalProjectFileAccessTest {

    @TempDir
    Path projectDir;

    @Test
    void testListsTextFilesSortedAndAbsolute() throws IOException {
        write("src/b.ts", "export const b = 1;");
        write("src/a.ts", "export const a = 1;");
        write("README.md", "# readme");
        write("logo.png", "binary");
        write("Dockerfile", "FROM alpine");

        List<String> files = new LocalProjectFileAccess().listProjectTextFiles(projectDir.toString());

        Path root = projectDir.toAbsolutePath().normalize();
        assertEquals(List.of(
                root.resolve("Dockerfile").toString(),
                root.resolve("README.md").toString(),
                root.resolve("src/a.ts").toString(),
                root.resolve("src/b.ts").toString()), files);
    }

    @Test
    void testExcludedDirectoriesSkipped() throws IOException {
        write("src/app.js", "function app() {}");
        write("node_modules/lib/index.js", "function lib() {}");
        write("dist/bundle.js", "function bundle() {}");

        List<String> files = new LocalProjectFileAccess(SimilarityConfig.defaults())
                .listProjectTextFiles(projectDir.toString());

        assertEquals(1, files.size());
        assertTrue(files.get(0).endsWith("app.js"));
    }

    @Test
    void testExclusionOnlyBelowProjectRoot() throws IOException {
        Path project = Files.createDirectories(projectDir.resolve("build").resolve("project"));
        Files.writeString(project.resolve("main.js"), "function main() {}");

        List<String> files = new LocalProjectFileAccess().listProjectTextFiles(project.toString());

        assertEquals(1, files.size());
    }

    @Test
    void testUnreadableEntryDoesNotStopListing() throws IOException {
        Path app = write("src/app.js", "function app() {}");
        Path util = write("src/util.js", "function util() {}");
        Path root = projectDir.toAbsolutePath().normalize();
        LocalProjectFileAccess.TextFileCollector collector =
                new LocalProjectFileAccess.TextFileCollector(root, SimilarityConfig.defaults());

        collector.visitFile(app, attributes(app));
        FileVisitResult afterFailure = collector.visitFileFailed(
                root.resolve("locked"), new AccessDeniedException(root.resolve("locked").toString()));
        collector.visitFile(util, attributes(util));

        assertEquals(FileVisitResult.CONTINUE, afterFailure);
        assertEquals(List.of(app.toString(), util.toString()), collector.sortedFiles());
    }

    @Test
    void testExcludedDirectoryNotEntered() throws IOException {
        Path modules = Files.createDirectories(projectDir.resolve("node_modules"));
        Path src = Files.createDirectories(projectDir.resolve("src"));
        Path root = projectDir.toAbsolutePath().normalize();
        LocalProjectFileAccess.TextFileCollector collector =
                new LocalProjectFileAccess.TextFileCollector(root, SimilarityConfig.defaults());

        assertEquals(FileVisitResult.SKIP_SUBTREE, collector.preVisitDirectory(modules, attributes(modules)));
        assertEquals(FileVisitResult.CONTINUE, collector.preVisitDirectory(src, attributes(src)));
        assertEquals(FileVisitResult.CONTINUE, collector.preVisitDirectory(root, attributes(root)));
    }

    @Test
    void testInvalidProjectPath() {
        LocalProjectFileAccess access = new LocalProjectFileAccess();

        assertThrows(IOException.class, () -> access.listProjectTextFiles(projectDir.resolve("missing").toString()));
        assertThrows(IOException.class, () -> access.listProjectTextFiles(" "));
        assertThrows(IOException.class, () -> access.listProjectTextFiles(null));
    }

    @Test
    void testReadTextFile() throws IOException {
        Path file = write("src/a.ts", "const é = 1;\n");

        assertEquals("const é = 1;\n", new LocalProjectFileAccess().readTextFile(file.toString()));
        assertThrows(IOException.class,
                () -> new LocalProjectFileAccess().readTextFile(projectDir.resolve("nope.ts").toString()));
    }

    @ParameterizedTest
    @CsvSource({
            "src/app.ts, true",
            "Makefile, true",
            "scripts/deploy.SH, true",
            "image.png, false",
            "LICENSE, false"
    })
    void testIsTextFile(String path, boolean expected) {
        assertEquals(expected, LocalProjectFileAccess.isTextFile(path));
    }

    // Helper methods

    private static BasicFileAttributes attributes(Path path) throws IOException {
        return Files.readAttributes(path, BasicFileAttributes.class);
    }

    private Path write(String relative, String content) throws IOException {
        Path file = projectDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }
}
