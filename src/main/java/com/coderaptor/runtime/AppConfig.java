package com.coderaptor.runtime;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private IndexSettings index = new IndexSettings();
    private RetrievalSettings retrieval = new RetrievalSettings();

    public IndexSettings getIndex() {
        return index;
    }

    public void setIndex(IndexSettings index) {
        this.index = index == null ? new IndexSettings() : index;
    }

    public RetrievalSettings getRetrieval() {
        return retrieval;
    }

    public void setRetrieval(RetrievalSettings retrieval) {
        this.retrieval = retrieval == null ? new RetrievalSettings() : retrieval;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexSettings {
        private int maxChars = 2000;
        private int overlap = 200;
        private int boundaryLookback = 200;
        private double similarityThreshold = 0.82;
        private int maxDepth = 8;
        private int embeddingRetryCount = 2;
        private int summarizerRetryCount = 2;
        private long retryBackoffMs = 100;
        private int embeddingCacheCapacity = 1000;
        private int summaryInputMaxChars = 4000;
        private int summaryMaxChars = 300;
        private int embeddingWorkers = 4;
        private int yieldEvery = 64;
        private int maxFiles = 500;
        private List<String> includeExtensions = List.of(
                "rs", "py", "js", "ts", "tsx", "jsx", "go", "java", "kt", "c", "cpp", "h", "hpp",
                "md", "toml", "yaml", "yml", "json", "txt");

        public int getMaxChars() {
            return maxChars;
        }

        public void setMaxChars(int maxChars) {
            this.maxChars = maxChars;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }

        public int getBoundaryLookback() {
            return boundaryLookback;
        }

        public void setBoundaryLookback(int boundaryLookback) {
            this.boundaryLookback = boundaryLookback;
        }

        public double getSimilarityThreshold() {
            return similarityThreshold;
        }

        public void setSimilarityThreshold(double similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
        }

        public int getMaxDepth() {
            return maxDepth;
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
        }

        public int getEmbeddingRetryCount() {
            return embeddingRetryCount;
        }

        public void setEmbeddingRetryCount(int embeddingRetryCount) {
            this.embeddingRetryCount = embeddingRetryCount;
        }

        public int getSummarizerRetryCount() {
            return summarizerRetryCount;
        }

        public void setSummarizerRetryCount(int summarizerRetryCount) {
            this.summarizerRetryCount = summarizerRetryCount;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }

        public int getEmbeddingCacheCapacity() {
            return embeddingCacheCapacity;
        }

        public void setEmbeddingCacheCapacity(int embeddingCacheCapacity) {
            this.embeddingCacheCapacity = embeddingCacheCapacity;
        }

        public int getSummaryInputMaxChars() {
            return summaryInputMaxChars;
        }

        public void setSummaryInputMaxChars(int summaryInputMaxChars) {
            this.summaryInputMaxChars = summaryInputMaxChars;
        }

        public int getSummaryMaxChars() {
            return summaryMaxChars;
        }

        public void setSummaryMaxChars(int summaryMaxChars) {
            this.summaryMaxChars = summaryMaxChars;
        }

        public int getEmbeddingWorkers() {
            return embeddingWorkers;
        }

        public void setEmbeddingWorkers(int embeddingWorkers) {
            this.embeddingWorkers = embeddingWorkers;
        }

        public int getYieldEvery() {
            return yieldEvery;
        }

        public void setYieldEvery(int yieldEvery) {
            this.yieldEvery = yieldEvery;
        }

        public int getMaxFiles() {
            return maxFiles;
        }

        public void setMaxFiles(int maxFiles) {
            this.maxFiles = maxFiles;
        }

        public List<String> getIncludeExtensions() {
            return includeExtensions;
        }

        public void setIncludeExtensions(List<String> includeExtensions) {
            this.includeExtensions = includeExtensions == null ? List.of() : includeExtensions;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrievalSettings {
        private int defaultTopK = 5;
        private double chunkThreshold = 0.6;
        private int expandK = 8;

        public int getDefaultTopK() {
            return defaultTopK;
        }

        public void setDefaultTopK(int defaultTopK) {
            this.defaultTopK = defaultTopK;
        }

        public double getChunkThreshold() {
            return chunkThreshold;
        }

        public void setChunkThreshold(double chunkThreshold) {
            this.chunkThreshold = chunkThreshold;
        }

        public int getExpandK() {
            return expandK;
        }

        public void setExpandK(int expandK) {
            this.expandK = expandK;
        }
    }
}
