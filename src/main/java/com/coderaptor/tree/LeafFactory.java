package com.coderaptor.tree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import com.coderaptor.ingest.Chunk;
import com.coderaptor.ingest.Chunker;
import com.coderaptor.ingest.ContentHash;
import com.coderaptor.ingest.EmbeddingCache;
import com.coderaptor.ingest.EmbeddingException;
import com.coderaptor.ingest.SourceFile;
import com.coderaptor.runtime.WarningKind;

final class LeafFactory {
    private final Chunker chunker;
    private final EmbeddingCache cache;
    private final ExecutorService embeddingPool;

    LeafFactory(Chunker chunker, EmbeddingCache cache, ExecutorService embeddingPool) {
        this.chunker = chunker;
        this.cache = cache;
        this.embeddingPool = embeddingPool;
    }

    LeafBatch createLeaves(List<SourceFile> files, Map<String, float[]> priorEmbeddings, BuildContext context) {
        List<PendingLeaf> pending = new ArrayList<>();
        Map<String, FileRecord> records = new LinkedHashMap<>();
        try {
            for (SourceFile file : files) {
                context.checkpoint().throwIfCancelled();
                List<Long> leafIds = new ArrayList<>();
                for (Chunk chunk : chunker.chunk(file.path(), file.text())) {
                    long id = context.allocateId();
                    leafIds.add(id);
                    Future<float[]> embedding = embeddingPool.submit(() -> cache.getOrCompute(chunk.text()));
                    pending.add(new PendingLeaf(id, chunk, embedding));
                }
                records.put(file.path(),
                        new FileRecord(file.path(), file.mtime(), ContentHash.sha256(file.text()), leafIds));
            }

            List<Node> leaves = new ArrayList<>(pending.size());
            for (PendingLeaf leaf : pending) {
                context.checkpoint().tick();
                float[] embedding = await(leaf, priorEmbeddings, context);
                leaves.add(Node.leaf(leaf.id(), leaf.chunk().sourcePath(), leaf.chunk().startOffset(),
                        leaf.chunk().text(), embedding));
                context.progress(BuildProgress.EMBEDDING, leaves.size(), pending.size(), leaf.chunk().sourcePath());
            }
            return new LeafBatch(leaves, records);
        } catch (RuntimeException e) {
            pending.forEach(leaf -> leaf.embedding().cancel(true));
            throw e;
        }
    }

    private static float[] await(PendingLeaf leaf, Map<String, float[]> priorEmbeddings, BuildContext context) {
        String subject = leaf.chunk().sourcePath() + "@" + leaf.chunk().startOffset();
        try {
            return leaf.embedding().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IndexingCancelledException("interrupted while embedding " + subject);
        } catch (CancellationException e) {
            throw new IndexingCancelledException("embedding cancelled for " + subject);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (!(cause instanceof EmbeddingException)) {
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new IllegalStateException("unexpected embedding failure for " + subject, cause);
            }
            float[] prior = priorEmbeddings.get(leaf.chunk().contentHash());
            if (prior != null) {
                context.warn(WarningKind.EMBEDDING_FAILED, subject, "kept prior embedding: " + cause.getMessage());
                return prior;
            }
            context.warn(WarningKind.EMBEDDING_FAILED, subject, "leaf degraded: " + cause.getMessage());
            return null;
        }
    }

    record LeafBatch(List<Node> leaves, Map<String, FileRecord> records) {
    }

    private record PendingLeaf(long id, Chunk chunk, Future<float[]> embedding) {
    }
}
