package com.example.bpmn_transformer.dto;

import java.nio.file.Path;

public class TransformResult {
    private final TransformMode mode;
    private final int count;
    private final int removedFragments;
    private final Path output;

    public TransformResult(TransformMode mode, int count, int removedFragments, Path output) {
        this.mode = mode;
        this.count = count;
        this.removedFragments = removedFragments;
        this.output = output;
    }

    public TransformMode getMode() { return mode; }
    /** groups created (fragment) or tasks masked (mask) */
    public int getCount() { return count; }
    public int getRemovedFragments() { return removedFragments; }
    public Path getOutput() { return output; }

    public String summaryLine() {
        return mode == TransformMode.MASK
                ? "Masked " + count + " task(s)"
                : "Fragmented into " + count + " group(s)";
    }
}
