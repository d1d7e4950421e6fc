package com.coderaptor.tree;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.coderaptor.runtime.IndexWarning;
import com.coderaptor.runtime.WarningKind;

final class BuildContext {
    private static final Logger log = LoggerFactory.getLogger(BuildContext.class);

    private final YieldCheckpoint checkpoint;
    private final ProgressListener listener;
    private final List<IndexWarning> warnings = new ArrayList<>();
    private long nextNodeId;
    private int nodesCreated;

    BuildContext(long firstNodeId, YieldCheckpoint checkpoint, ProgressListener listener) {
        this.nextNodeId = firstNodeId;
        this.checkpoint = checkpoint == null ? YieldCheckpoint.unbounded() : checkpoint;
        this.listener = listener == null ? ProgressListener.NONE : listener;
    }

    long allocateId() {
        nodesCreated++;
        return nextNodeId++;
    }

    long nextNodeId() {
        return nextNodeId;
    }

    int nodesCreated() {
        return nodesCreated;
    }

    YieldCheckpoint checkpoint() {
        return checkpoint;
    }

    void progress(String stage, int current, int total, String detail) {
        log.debug("index.progress stage={} current={} total={} detail={}", stage, current, total, detail);
        listener.onProgress(new BuildProgress(stage, current, total, detail));
    }

    void warn(WarningKind kind, String subject, String message) {
        IndexWarning warning = IndexWarning.of(kind, subject, message);
        log.warn("index.warning kind={} subject={} message={}", kind, subject, message);
        warnings.add(warning);
    }

    void addAll(List<IndexWarning> carried) {
        warnings.addAll(carried);
    }

    List<IndexWarning> warnings() {
        return List.copyOf(warnings);
    }
}
