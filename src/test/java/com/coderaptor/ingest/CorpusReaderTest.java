package com.coderaptor.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.coderaptor.runtime.ConfigException;

class CorpusReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReadSupportedFilesWithRelativePathsInOrder() throws Exception {
        Files.createDirectories(tempDir.resolve("src/main"));
        Files.writeString(tempDir.resolve("src/main/App.java"), "class App {}");
        Files.writeString(tempDir.resolve("README.md"), "# readme");
        Files.writeString(tempDir.resolve("image.png"), "not text");

        SourceBatch batch = new CorpusReader(List.of("java", "md"), 100).read(tempDir);

        assertEquals(List.of("README.md", "src/main/App.java"), batch.files().stream().map(SourceFile::path).toList());
        assertEquals("class App {}", batch.files().get(1).text());
        assertTrue(batch.files().get(1).mtime() > 0);
        assertTrue(batch.warnings().isEmpty());
    }

    @Test
    void shouldSkipHiddenAndBuildDirectories() throws Exception {
        Files.createDirectories(tempDir.resolve(".git"));
        Files.createDirectories(tempDir.resolve("target/classes"));
        Files.createDirectories(tempDir.resolve("node_modules/pkg"));
        Files.writeString(tempDir.resolve(".git/config.txt"), "hidden");
        Files.writeString(tempDir.resolve("target/classes/gen.txt"), "generated");
        Files.writeString(tempDir.resolve("node_modules/pkg/index.txt"), "vendored");
        Files.writeString(tempDir.resolve("kept.txt"), "kept");

        SourceBatch batch = new CorpusReader(List.of("txt"), 100).read(tempDir);

        assertEquals(List.of("kept.txt"), batch.files().stream().map(SourceFile::path).toList());
    }

    @Test
    void shouldCapNumberOfFiles() throws Exception {
        for (int i = 0; i < 5; i++) {
            Files.writeString(tempDir.resolve("f" + i + ".txt"), "file " + i);
        }

        SourceBatch batch = new CorpusReader(List.of("txt"), 3).read(tempDir);

        assertEquals(3, batch.files().size());
    }

    @Test
    void shouldRejectMissingRoot() {
        CorpusReader reader = new CorpusReader(List.of("txt"), 10);
        assertThrows(ConfigException.class, () -> reader.read(tempDir.resolve("missing")));
    }
}
