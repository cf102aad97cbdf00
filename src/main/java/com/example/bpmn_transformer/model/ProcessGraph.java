package com.example.bpmn_transformer.model;

import java.util.*;

/**
 * Read-only projection of a process: its activities (in document order), their
 * privacy values, every direct sequence flow and the boundary events attached
 * to each activity. Adjacency covers all flow nodes, not only activities.
 */
public final class ProcessGraph {

    private final List<String> activityIds;
    private final Map<String, Integer> activityIndex;
    private final Map<String, Double> privacy;
    private final List<FlowEdge> flows;

    private final Map<String, List<String>> successors = new HashMap<>();
    private final Map<String, List<String>> predecessors = new HashMap<>();
    private final Set<String> flowPairs = new HashSet<>();
    private final Map<String, List<String>> boundaryEvents = new HashMap<>();
    private final Map<String, String> hosts = new HashMap<>();

    public ProcessGraph(List<String> activityIds, Map<String, Double> privacy, List<FlowEdge> flows) {
        this(activityIds, privacy, flows, Collections.emptyMap());
    }

    /**
     * @param attachments boundary event id to the id of the activity it is attached to
     */
    public ProcessGraph(List<String> activityIds, Map<String, Double> privacy, List<FlowEdge> flows,
                        Map<String, String> attachments) {
        this.activityIds = List.copyOf(activityIds);
        this.privacy = Collections.unmodifiableMap(new LinkedHashMap<>(privacy));
        this.flows = List.copyOf(flows);

        Map<String, Integer> idx = new HashMap<>();
        for (int i = 0; i < this.activityIds.size(); i++) idx.putIfAbsent(this.activityIds.get(i), i);
        this.activityIndex = Collections.unmodifiableMap(idx);

        for (FlowEdge f : this.flows) {
            String s = f.getSourceRef();
            String t = f.getTargetRef();
            if (s == null || t == null) continue;
            successors.computeIfAbsent(s, k -> new ArrayList<>()).add(t);
            predecessors.computeIfAbsent(t, k -> new ArrayList<>()).add(s);
            flowPairs.add(pairKey(s, t));
        }

        for (Map.Entry<String, String> e : attachments.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            hosts.put(e.getKey(), e.getValue());
            boundaryEvents.computeIfAbsent(e.getValue(), k -> new ArrayList<>()).add(e.getKey());
        }
    }

    public List<String> getActivityIds() { return activityIds; }
    public int activityCount() { return activityIds.size(); }
    public boolean isActivity(String id) { return activityIndex.containsKey(id); }

    /** Index of the activity, or -1 when the id is not an activity of this process. */
    public int indexOf(String id) {
        Integer i = activityIndex.get(id);
        return i == null ? -1 : i;
    }

    public Double getPrivacy(String activityId) { return privacy.get(activityId); }
    public List<FlowEdge> getFlows() { return flows; }

    public List<String> successorsOf(String id) {
        return successors.getOrDefault(id, Collections.emptyList());
    }

    public List<String> predecessorsOf(String id) {
        return predecessors.getOrDefault(id, Collections.emptyList());
    }

    public List<String> boundaryEventsOf(String activityId) {
        return boundaryEvents.getOrDefault(activityId, Collections.emptyList());
    }

    /** Activity a boundary event is attached to, or null. */
    public String hostOf(String boundaryEventId) {
        return hosts.get(boundaryEventId);
    }

    /** Flow successors followed by the boundary events attached to {@code id}. */
    public List<String> downstreamOf(String id) {
        List<String> events = boundaryEventsOf(id);
        if (events.isEmpty()) return successorsOf(id);
        List<String> out = new ArrayList<>(successorsOf(id));
        out.addAll(events);
        return out;
    }

    /** Flow predecessors, plus the host activity when {@code id} is a boundary event. */
    public List<String> upstreamOf(String id) {
        String host = hostOf(id);
        if (host == null) return predecessorsOf(id);
        List<String> out = new ArrayList<>(predecessorsOf(id));
        out.add(host);
        return out;
    }

    public boolean hasFlow(String sourceRef, String targetRef) {
        return flowPairs.contains(pairKey(sourceRef, targetRef));
    }

    public static String pairKey(String sourceRef, String targetRef) {
        return sourceRef + "→" + targetRef;
    }
}
