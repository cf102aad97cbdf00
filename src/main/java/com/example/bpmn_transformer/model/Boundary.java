package com.example.bpmn_transformer.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Nearest unmasked neighbours of a masked node, reached through masked nodes only.
 */
public final class Boundary {
    private final String maskedId;
    private final Set<String> preds;
    private final Set<String> succs;

    public Boundary(String maskedId, Set<String> preds, Set<String> succs) {
        this.maskedId = maskedId;
        this.preds = Collections.unmodifiableSet(new LinkedHashSet<>(preds));
        this.succs = Collections.unmodifiableSet(new LinkedHashSet<>(succs));
    }

    public String getMaskedId() { return maskedId; }
    public Set<String> getPreds() { return preds; }
    public Set<String> getSuccs() { return succs; }

    @Override
    public String toString() {
        return "Boundary{" + maskedId + ": preds=" + preds + ", succs=" + succs + "}";
    }
}
