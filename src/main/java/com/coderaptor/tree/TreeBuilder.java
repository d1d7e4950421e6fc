package com.coderaptor.tree;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.coderaptor.ingest.Chunker;
import com.coderaptor.ingest.EmbeddingCache;
import com.coderaptor.ingest.SourceBatch;
import com.coderaptor.ingest.SourceFile;
import com.coderaptor.runtime.IndexConfig;
import com.coderaptor.runtime.WarningKind;
import com.coderaptor.summarize.RetryingSummarizer;

public class TreeBuilder {
    private static final Logger log = LoggerFactory.getLogger(TreeBuilder.class);

    private final LeafFactory leafFactory;
    private final LevelAssembler assembler;
    private final String buildParameters;

    public TreeBuilder(IndexConfig config,
            EmbeddingCache cache,
            RetryingSummarizer summarizer,
            ClusteringStrategy clusterer,
            ExecutorService embeddingPool) {
        Chunker chunker = new Chunker(config.maxChars(), config.overlap(), config.boundaryLookback());
        this.leafFactory = new LeafFactory(chunker, cache, embeddingPool);
        this.assembler = new LevelAssembler(clusterer, summarizer, cache, config.similarityThreshold(), config.maxDepth());
        this.buildParameters = config.buildParameters();
    }

    public String buildParameters() {
        return buildParameters;
    }

    public BuildResult build(SourceBatch batch) {
        return build(batch, Snapshot.empty(), YieldCheckpoint.unbounded(), ProgressListener.NONE);
    }

    /**
     * Builds from scratch. The predecessor only supplies the next version number and the first free
     * node id, so ids are never recycled across versions.
     */
    public BuildResult build(SourceBatch batch, Snapshot predecessor, YieldCheckpoint checkpoint, ProgressListener listener) {
        long started = System.nanoTime();
        BuildContext context = newContext(predecessor, checkpoint, listener);
        context.addAll(batch.warnings());
        List<SourceFile> files = distinctByPath(batch.files(), context);
        log.info("index.build.started files={} version={}", files.size(), predecessor.version() + 1);

        LeafFactory.LeafBatch leaves = createLeaves(files, Map.of(), context);
        LevelAssembler.Assembly assembly = assemble(Snapshot.empty(), leaves.leaves(), Set.of(), context);

        context.progress(BuildProgress.COMMITTING, 1, 1, "version " + (predecessor.version() + 1));
        Snapshot snapshot = new Snapshot(predecessor.version() + 1, context.nextNodeId(), assembly.rootIds(),
                assembly.nodes(), leaves.records(), buildParameters);
        Duration duration = Duration.ofNanos(System.nanoTime() - started);
        BuildStats stats = new BuildStats(snapshot.nodeCount(), snapshot.depth(), duration, context.warnings());
        log.info("index.build.completed version={} nodes={} depth={} roots={} durationMs={} warnings={}",
                snapshot.version(), stats.nodeCount(), stats.depth(), snapshot.rootIds().size(),
                duration.toMillis(), stats.warnings().size());
        return new BuildResult(snapshot, stats);
    }

    BuildContext newContext(Snapshot predecessor, YieldCheckpoint checkpoint, ProgressListener listener) {
        return new BuildContext(predecessor.nextNodeId(), checkpoint, listener);
    }

    LeafFactory.LeafBatch createLeaves(List<SourceFile> files, Map<String, float[]> priorEmbeddings, BuildContext context) {
        return leafFactory.createLeaves(files, priorEmbeddings, context);
    }

    LevelAssembler.Assembly assemble(Snapshot base, Collection<Node> leaves, Set<Long> dirty, BuildContext context) {
        return assembler.assemble(base, leaves, dirty, context);
    }

    static List<SourceFile> distinctByPath(List<SourceFile> files, BuildContext context) {
        Set<String> seen = new HashSet<>();
        List<SourceFile> distinct = new ArrayList<>(files.size());
        for (SourceFile file : files) {
            if (seen.add(file.path())) {
                distinct.add(file);
            } else {
                context.warn(WarningKind.DUPLICATE_PATH, file.path(), "repeated in the corpus stream, first occurrence kept");
            }
        }
        distinct.sort((left, right) -> left.path().compareTo(right.path()));
        return distinct;
    }
}
