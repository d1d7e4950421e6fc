package com.coderaptor.runtime;

import java.util.List;
import java.util.Locale;

public record IndexConfig(
        int maxChars,
        int overlap,
        int boundaryLookback,
        double similarityThreshold,
        int maxDepth,
        int embeddingRetryCount,
        int summarizerRetryCount,
        long retryBackoffMs,
        int embeddingCacheCapacity,
        int summaryInputMaxChars,
        int summaryMaxChars,
        int embeddingWorkers,
        int yieldEvery,
        int maxFiles,
        List<String> includeExtensions) {

    public IndexConfig {
        if (maxChars <= 0) {
            throw new ConfigException("maxChars must be > 0, was " + maxChars);
        }
        if (overlap < 0 || overlap >= maxChars) {
            throw new ConfigException("overlap must satisfy 0 <= overlap < maxChars, was " + overlap);
        }
        if (boundaryLookback < 0) {
            throw new ConfigException("boundaryLookback must be >= 0");
        }
        if (Double.isNaN(similarityThreshold) || similarityThreshold < -1.0 || similarityThreshold > 1.0) {
            throw new ConfigException("similarityThreshold must be within [-1, 1], was " + similarityThreshold);
        }
        if (maxDepth < 1) {
            throw new ConfigException("maxDepth must be >= 1");
        }
        if (embeddingRetryCount < 0 || summarizerRetryCount < 0 || retryBackoffMs < 0) {
            throw new ConfigException("retry settings must be >= 0");
        }
        if (embeddingCacheCapacity < 0) {
            throw new ConfigException("embeddingCacheCapacity must be >= 0");
        }
        if (summaryInputMaxChars <= 0 || summaryMaxChars <= 0) {
            throw new ConfigException("summary limits must be > 0");
        }
        if (embeddingWorkers < 1 || yieldEvery < 1 || maxFiles < 1) {
            throw new ConfigException("embeddingWorkers, yieldEvery and maxFiles must be >= 1");
        }
        includeExtensions = includeExtensions == null
                ? List.of()
                : includeExtensions.stream()
                        .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
                        .map(ext -> ext.toLowerCase(Locale.ROOT))
                        .toList();
    }

    public static IndexConfig from(AppConfig.IndexSettings settings) {
        return new IndexConfig(
                settings.getMaxChars(),
                settings.getOverlap(),
                settings.getBoundaryLookback(),
                settings.getSimilarityThreshold(),
                settings.getMaxDepth(),
                settings.getEmbeddingRetryCount(),
                settings.getSummarizerRetryCount(),
                settings.getRetryBackoffMs(),
                settings.getEmbeddingCacheCapacity(),
                settings.getSummaryInputMaxChars(),
                settings.getSummaryMaxChars(),
                settings.getEmbeddingWorkers(),
                settings.getYieldEvery(),
                settings.getMaxFiles(),
                settings.getIncludeExtensions());
    }

    public static IndexConfig defaults() {
        return from(new AppConfig.IndexSettings());
    }

    public RetryPolicy embeddingRetryPolicy() {
        return new RetryPolicy(embeddingRetryCount, retryBackoffMs);
    }

    public RetryPolicy summarizerRetryPolicy() {
        return new RetryPolicy(summarizerRetryCount, retryBackoffMs);
    }

    public String buildParameters() {
        return "maxChars=" + maxChars
                + " overlap=" + overlap
                + " boundaryLookback=" + boundaryLookback
                + " similarityThreshold=" + similarityThreshold
                + " maxDepth=" + maxDepth
                + " summaryInputMaxChars=" + summaryInputMaxChars
                + " summaryMaxChars=" + summaryMaxChars;
    }
}
