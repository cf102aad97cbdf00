package com.example.bpmn_transformer.service;

import com.example.bpmn_transformer.model.FlowEdge;
import com.example.bpmn_transformer.model.ProcessGraph;
import com.example.bpmn_transformer.util.DisjointSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups activities connected by flows whose coupling meets the threshold.
 */
@Service
public class ClusterService {

    private static final Logger log = LoggerFactory.getLogger(ClusterService.class);

    public List<List<String>> cluster(ProcessGraph graph, double threshold, boolean includeSingletons) {
        DisjointSet uf = new DisjointSet(graph.activityCount());

        int used = 0;
        for (FlowEdge f : graph.getFlows()) {
            if (!f.hasCoupling()) continue;
            if (!(f.getCoupling() >= threshold)) continue;
            int s = graph.indexOf(f.getSourceRef());
            int t = graph.indexOf(f.getTargetRef());
            if (s < 0 || t < 0) continue;
            uf.union(s, t);
            used++;
        }

        List<List<String>> classes = new ArrayList<>();
        for (List<Integer> members : uf.groups()) {
            if (!includeSingletons && members.size() == 1) continue;
            List<String> ids = new ArrayList<>(members.size());
            for (int i : members) ids.add(graph.getActivityIds().get(i));
            classes.add(ids);
        }

        log.debug("Clustered {} activities with {} flow(s) at threshold {} into {} class(es)",
                graph.activityCount(), used, threshold, classes.size());
        return classes;
    }
}
