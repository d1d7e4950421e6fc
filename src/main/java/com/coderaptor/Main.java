package com.coderaptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.coderaptor.ingest.CorpusReader;
import com.coderaptor.ingest.EmbeddingException;
import com.coderaptor.ingest.EmbeddingService;
import com.coderaptor.ingest.EmbeddingServices;
import com.coderaptor.ingest.SourceBatch;
import com.coderaptor.persist.CorruptIndexException;
import com.coderaptor.retrieval.ContextRetrieval;
import com.coderaptor.retrieval.RetrievalResult;
import com.coderaptor.runtime.AppConfig;
import com.coderaptor.runtime.ConfigException;
import com.coderaptor.runtime.IndexConfig;
import com.coderaptor.runtime.IndexService;
import com.coderaptor.runtime.IndexWarning;
import com.coderaptor.runtime.OpenResult;
import com.coderaptor.summarize.Summarizer;
import com.coderaptor.summarize.Summarizers;
import com.coderaptor.tree.BuildResult;
import com.coderaptor.tree.Snapshot;
import com.coderaptor.tree.UpdateResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "code-raptor",
        mixinStandardHelpOptions = true,
        version = "code-raptor 0.1.0",
        description = "Builds, updates and queries a hierarchical retrieval index over a source tree.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE_ERROR = 2;
    static final int EXIT_INDEX_FAILURE = 3;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "stats")
    Mode mode;

    @Option(names = "--root", description = "Corpus root directory")
    Path root;

    @Option(names = "--index-path", description = "Path for the persisted index JSON", defaultValue = ".coderaptor/index.json")
    Path indexPath;

    @Option(names = "--query", description = "Query text used in query mode")
    String query;

    @Option(names = "--top-k", description = "Top results to return (defaults to retrieval.defaultTopK)")
    Integer topK;

    @Option(names = "--levels", split = ",", description = "Comma separated levels to search, all levels when omitted")
    List<Integer> levels;

    @Option(names = "--with-context", description = "Search summaries first and expand into chunks when they score low", defaultValue = "false")
    boolean withContext;

    private final Map<String, String> environment;
    private EmbeddingService embeddingService;
    private Summarizer summarizer;

    enum Mode {
        build,
        update,
        query,
        stats,
        clear
    }

    public Main() {
        this(System.getenv());
    }

    Main(Map<String, String> environment) {
        this.environment = environment;
    }

    Main(EmbeddingService embeddingService, Summarizer summarizer) {
        this.environment = Map.of();
        this.embeddingService = embeddingService;
        this.summarizer = summarizer;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        AppConfig appConfig;
        IndexConfig indexConfig;
        try {
            appConfig = loadConfig(Path.of(configPath));
            indexConfig = IndexConfig.from(appConfig.getIndex());
            if (embeddingService == null || summarizer == null) {
                OkHttpClient httpClient = new OkHttpClient();
                embeddingService = EmbeddingServices.fromEnvironment(httpClient, environment);
                summarizer = Summarizers.fromEnvironment(httpClient);
            }
        } catch (IOException | ConfigException e) {
            log.error("config.invalid path={} reason={}", configPath, e.getMessage());
            return EXIT_USAGE_ERROR;
        }
        log.info("Starting code-raptor in {} mode", mode);
        log.info("Using config file: {}", configPath);

        try (IndexService service = new IndexService(indexConfig, appConfig.getRetrieval(), embeddingService, summarizer)) {
            CorpusReader reader = new CorpusReader(indexConfig);
            return switch (mode) {
                case build -> runBuild(service, reader);
                case update -> runUpdate(service, reader);
                case query -> runQuery(service, reader, appConfig.getRetrieval());
                case stats -> runStats(service, reader);
                case clear -> runClear(service);
            };
        } catch (ConfigException e) {
            log.error("config.invalid reason={}", e.getMessage());
            return EXIT_USAGE_ERROR;
        } catch (IOException | CorruptIndexException | EmbeddingException e) {
            log.error("index.failed mode={} reason={}", mode, e.getMessage());
            return EXIT_INDEX_FAILURE;
        }
    }

    private int runBuild(IndexService service, CorpusReader reader) throws IOException {
        if (root == null) {
            log.error("--root is required in build mode");
            return EXIT_USAGE_ERROR;
        }
        BuildResult result = service.build(reader.read(root));
        service.save(indexPath);
        log.info("Built index: version={} nodes={} depth={} roots={} durationMs={}",
                result.snapshot().version(),
                result.stats().nodeCount(),
                result.stats().depth(),
                result.snapshot().rootIds().size(),
                result.stats().duration().toMillis());
        logWarnings(result.stats().warnings());
        return EXIT_OK;
    }

    private int runUpdate(IndexService service, CorpusReader reader) throws IOException {
        if (root == null) {
            log.error("--root is required in update mode");
            return EXIT_USAGE_ERROR;
        }
        OpenResult opened = service.open(indexPath, () -> reader.read(root));
        logWarnings(opened.warnings());
        if (opened.loaded()) {
            UpdateResult result = service.update(reader.read(root));
            log.info("Updated index: version={} added={} modified={} deleted={} touched={} rebuilt={} fullRebuild={} durationMs={}",
                    result.snapshot().version(),
                    result.stats().filesAdded(),
                    result.stats().filesModified(),
                    result.stats().filesDeleted(),
                    result.stats().filesTouched(),
                    result.stats().nodesRebuilt(),
                    result.stats().fullRebuild(),
                    result.stats().duration().toMillis());
            logWarnings(result.stats().warnings());
        } else {
            log.info("No usable index at {}, built version={}", indexPath, opened.snapshot().version());
        }
        service.save(indexPath);
        return EXIT_OK;
    }

    private int runQuery(IndexService service, CorpusReader reader, AppConfig.RetrievalSettings retrieval)
            throws IOException, EmbeddingException {
        if (query == null || query.isBlank()) {
            log.error("--query is required in query mode");
            return EXIT_USAGE_ERROR;
        }
        OpenResult opened = service.open(indexPath, corpusOrFail(reader));
        logWarnings(opened.warnings());
        if (!opened.loaded()) {
            service.save(indexPath);
        }
        int k = topK == null ? retrieval.getDefaultTopK() : topK;
        if (withContext) {
            ContextRetrieval context = service.queryWithContext(query, k);
            logResults("Summary", context.summaries());
            if (context.expanded()) {
                logResults("Chunk", context.chunks());
            }
            return EXIT_OK;
        }
        Set<Integer> levelFilter = levels == null ? Set.of() : new LinkedHashSet<>(levels);
        logResults("Result", service.query(query, k, levelFilter));
        return EXIT_OK;
    }

    private int runStats(IndexService service, CorpusReader reader) throws IOException {
        OpenResult opened = service.open(indexPath, corpusOrFail(reader));
        logWarnings(opened.warnings());
        Snapshot snapshot = opened.snapshot();
        log.info("Index stats: version={} nodes={} depth={} roots={} files={} loaded={}",
                snapshot.version(),
                snapshot.nodeCount(),
                snapshot.depth(),
                snapshot.rootIds().size(),
                snapshot.fileRecords().size(),
                opened.loaded());
        for (Map.Entry<Integer, Integer> level : snapshot.levelHistogram().entrySet()) {
            log.info("Level {} nodes={}", level.getKey(), level.getValue());
        }
        return EXIT_OK;
    }

    private int runClear(IndexService service) throws IOException {
        boolean deleted = service.clear(indexPath);
        log.info("Cleared index at {} deleted={}", indexPath, deleted);
        return EXIT_OK;
    }

    private Supplier<SourceBatch> corpusOrFail(CorpusReader reader) {
        return () -> {
            if (root == null) {
                throw new ConfigException("No usable index at " + indexPath + " and no --root to build one from");
            }
            return reader.read(root);
        };
    }

    private static void logResults(String label, List<RetrievalResult> results) {
        for (int i = 0; i < results.size(); i++) {
            RetrievalResult result = results.get(i);
            log.info("{} #{} score={} level={} node={} citation={}",
                    label,
                    i + 1,
                    String.format("%.4f", result.score()),
                    result.level(),
                    result.nodeId(),
                    result.citationSnippet());
        }
    }

    private static void logWarnings(List<IndexWarning> warnings) {
        for (IndexWarning warning : warnings) {
            log.warn("Warning {}", warning);
        }
    }

    static AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig loaded = mapper.readValue(config.toFile(), AppConfig.class);
        return loaded == null ? new AppConfig() : loaded;
    }
}
