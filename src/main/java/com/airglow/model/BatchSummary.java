package com.airglow.model;

public class BatchSummary {
    public final int completed;
    public final int withoutMetadata;
    public final int failed;

    public BatchSummary(int completed, int withoutMetadata, int failed) {
        this.completed = completed;
        this.withoutMetadata = withoutMetadata;
        this.failed = failed;
    }

    @Override
    public String toString() {
        return String.format("%d plates written, %d without metadata, %d failed", completed, withoutMetadata, failed);
    }
}
