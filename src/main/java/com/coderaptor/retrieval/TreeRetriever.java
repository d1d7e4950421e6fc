package com.coderaptor.retrieval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.function.IntPredicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.coderaptor.ingest.EmbeddingCache;
import com.coderaptor.ingest.EmbeddingException;
import com.coderaptor.tree.Node;
import com.coderaptor.tree.Snapshot;
import com.coderaptor.tree.VectorMath;

public class TreeRetriever {
    private static final Logger log = LoggerFactory.getLogger(TreeRetriever.class);

    static final Comparator<RetrievalResult> RANKING = Comparator.comparingDouble(RetrievalResult::score).reversed()
            .thenComparingLong(RetrievalResult::nodeId);

    private final EmbeddingCache cache;

    public TreeRetriever(EmbeddingCache cache) {
        this.cache = cache;
    }

    public List<RetrievalResult> query(Snapshot snapshot, String queryText, int topK) throws EmbeddingException {
        return query(snapshot, queryText, topK, Set.of());
    }

    public List<RetrievalResult> query(Snapshot snapshot, String queryText, int topK, Set<Integer> levels)
            throws EmbeddingException {
        if (topK < 0) {
            throw new IllegalArgumentException("topK must be >= 0");
        }
        if (topK == 0 || snapshot.isEmpty()) {
            return List.of();
        }
        float[] queryEmbedding = cache.getOrCompute(queryText);
        IntPredicate levelFilter = levels == null || levels.isEmpty() ? level -> true : levels::contains;
        List<RetrievalResult> results = rank(snapshot, queryEmbedding, topK, levelFilter);
        log.debug("retrieval.query version={} topK={} levels={} results={}",
                snapshot.version(), topK, levels, results.size());
        return results;
    }

    public ContextRetrieval retrieveWithContext(Snapshot snapshot,
            String queryText,
            int topK,
            int expandK,
            double chunkThreshold) throws EmbeddingException {
        if (snapshot.isEmpty()) {
            return new ContextRetrieval(List.of(), List.of(), false);
        }
        float[] queryEmbedding = cache.getOrCompute(queryText);
        List<RetrievalResult> summaries = rank(snapshot, queryEmbedding, topK, level -> level > 0);
        if (!summaries.isEmpty() && summaries.get(0).score() >= chunkThreshold) {
            return new ContextRetrieval(summaries, List.of(), false);
        }
        List<RetrievalResult> chunks = rank(snapshot, queryEmbedding, expandK, level -> level == 0);
        log.debug("retrieval.expanded version={} bestSummary={} chunks={}", snapshot.version(),
                summaries.isEmpty() ? "none" : summaries.get(0).score(), chunks.size());
        return new ContextRetrieval(summaries, chunks, true);
    }

    private static List<RetrievalResult> rank(Snapshot snapshot, float[] queryEmbedding, int limit, IntPredicate levels) {
        if (limit <= 0) {
            return List.of();
        }
        // min-heap on ranking order keeps the best `limit` candidates
        PriorityQueue<RetrievalResult> best = new PriorityQueue<>(RANKING.reversed());
        for (Node node : snapshot.nodes().values()) {
            if (!levels.test(node.level()) || !node.hasUsableEmbedding()
                    || node.embedding().length != queryEmbedding.length) {
                continue;
            }
            double score = VectorMath.cosine(queryEmbedding, node.embedding());
            if (Double.isNaN(score)) {
                continue;
            }
            best.offer(new RetrievalResult(node.id(), node.level(), node.text(), node.sourcePaths(), score));
            if (best.size() > limit) {
                best.poll();
            }
        }
        List<RetrievalResult> ranked = new ArrayList<>(best);
        ranked.sort(RANKING);
        return Collections.unmodifiableList(ranked);
    }
}
