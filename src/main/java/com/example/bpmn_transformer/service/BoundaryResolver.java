package com.example.bpmn_transformer.service;

import com.example.bpmn_transformer.model.Boundary;
import com.example.bpmn_transformer.model.ProcessGraph;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Function;

/**
 * Finds, for a masked node, the unmasked nodes reachable backwards and forwards
 * when only masked nodes may be passed through. A boundary event counts as
 * downstream of the activity it is attached to.
 */
@Component
public class BoundaryResolver {

    public Boundary resolve(ProcessGraph graph, String maskedId, Set<String> masked) {
        Set<String> preds = frontier(maskedId, masked, graph::upstreamOf);
        Set<String> succs = frontier(maskedId, masked, graph::downstreamOf);
        return new Boundary(maskedId, preds, succs);
    }

    /** One boundary per masked id, in the iteration order of {@code masked}. */
    public List<Boundary> resolveAll(ProcessGraph graph, Collection<String> maskedIds) {
        Set<String> masked = new LinkedHashSet<>(maskedIds);
        List<Boundary> out = new ArrayList<>(masked.size());
        for (String id : masked) out.add(resolve(graph, id, masked));
        return out;
    }

    /**
     * BFS from {@code start} over {@code next}; masked nodes are expanded,
     * unmasked ones are recorded and not expanded.
     */
    private Set<String> frontier(String start, Set<String> masked, Function<String, List<String>> next) {
        Set<String> found = new LinkedHashSet<>();
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        seen.add(start);
        queue.add(start);

        while (!queue.isEmpty()) {
            String cur = queue.poll();
            for (String n : next.apply(cur)) {
                if (masked.contains(n)) {
                    if (seen.add(n)) queue.add(n);
                } else {
                    found.add(n);
                }
            }
        }
        return found;
    }
}
