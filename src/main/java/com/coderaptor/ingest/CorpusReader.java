package com.coderaptor.ingest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.coderaptor.runtime.ConfigException;
import com.coderaptor.runtime.IndexConfig;
import com.coderaptor.runtime.IndexWarning;
import com.coderaptor.runtime.WarningKind;

public class CorpusReader {
    private static final Logger log = LoggerFactory.getLogger(CorpusReader.class);

    private static final Set<String> SKIP_DIRS = Set.of(
            "target", "node_modules", "dist", "build", "__pycache__", "venv", "vendor",
            "packages", "out", "bin", "obj", "coverage");

    private final Set<String> extensions;
    private final int maxFiles;

    public CorpusReader(IndexConfig config) {
        this(config.includeExtensions(), config.maxFiles());
    }

    public CorpusReader(List<String> extensions, int maxFiles) {
        this.extensions = new HashSet<>(extensions);
        this.maxFiles = maxFiles;
    }

    public SourceBatch read(Path root) {
        if (root == null || !Files.isDirectory(root)) {
            throw new ConfigException("Invalid corpus root: " + (root == null ? "null" : root.toAbsolutePath().normalize()));
        }
        if (!Files.isReadable(root)) {
            throw new ConfigException("Unreadable corpus root: " + root.toAbsolutePath().normalize());
        }

        List<Path> candidates;
        try (Stream<Path> walk = Files.walk(root)) {
            candidates = walk
                    .filter(path -> !isSkipped(root, path))
                    .filter(Files::isRegularFile)
                    .filter(this::isSupported)
                    .sorted()
                    .limit(maxFiles)
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            throw new ConfigException("Unable to walk corpus root " + root.toAbsolutePath().normalize(), e);
        }

        List<SourceFile> files = new ArrayList<>();
        List<IndexWarning> warnings = new ArrayList<>();
        for (Path file : candidates) {
            String relative = root.relativize(file).toString().replace('\\', '/');
            try {
                String text = Files.readString(file, StandardCharsets.UTF_8);
                long mtime = Files.getLastModifiedTime(file).toMillis();
                files.add(new SourceFile(relative, text, mtime));
            } catch (IOException e) {
                log.warn("corpus.file.skipped path={} reason={}", relative, e.toString());
                warnings.add(IndexWarning.of(WarningKind.IO_ERROR, relative, e.toString()));
            }
        }
        log.debug("corpus.read root={} files={} skipped={}", root, files.size(), warnings.size());
        return new SourceBatch(files, warnings);
    }

    private boolean isSupported(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return false;
        }
        return extensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static boolean isSkipped(Path root, Path path) {
        Path relative = root.relativize(path);
        for (Path segment : relative) {
            String name = segment.toString();
            if (name.startsWith(".") || SKIP_DIRS.contains(name)) {
                return true;
            }
        }
        return false;
    }
}
