package com.example.bpmn_transformer.model;

import java.util.Objects;

/** Snapshot of one sequence flow; {@code coupling} is null when absent or not numeric. */
public final class FlowEdge {
    private final String id;
    private final String sourceRef;
    private final String targetRef;
    private final Double coupling;

    public FlowEdge(String id, String sourceRef, String targetRef, Double coupling) {
        this.id = id;
        this.sourceRef = sourceRef;
        this.targetRef = targetRef;
        this.coupling = coupling;
    }

    public String getId() { return id; }
    public String getSourceRef() { return sourceRef; }
    public String getTargetRef() { return targetRef; }
    public Double getCoupling() { return coupling; }

    public boolean hasCoupling() { return coupling != null; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FlowEdge)) return false;
        FlowEdge other = (FlowEdge) o;
        return Objects.equals(id, other.id) && Objects.equals(sourceRef, other.sourceRef)
                && Objects.equals(targetRef, other.targetRef) && Objects.equals(coupling, other.coupling);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, sourceRef, targetRef, coupling);
    }

    @Override
    public String toString() {
        return id + "(" + sourceRef + " -> " + targetRef + (coupling != null ? ", w=" + coupling : "") + ")";
    }
}
