package com.example.bpmn_transformer.service;

import com.example.bpmn_transformer.dto.PrivacyDirection;
import com.example.bpmn_transformer.model.Boundary;
import com.example.bpmn_transformer.model.Box;
import com.example.bpmn_transformer.model.CouplingSchema;
import com.example.bpmn_transformer.model.ProcessDocument;
import com.example.bpmn_transformer.model.ProcessGraph;
import com.example.bpmn_transformer.util.LayoutGeometry;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;
import org.camunda.bpm.model.bpmn.instance.FlowNode;
import org.camunda.bpm.model.bpmn.instance.SequenceFlow;
import org.camunda.bpm.model.xml.instance.ModelElementInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Removes privacy-sensitive tasks together with the boundary events attached to
 * them. Every unmasked predecessor/successor pair that was connected only
 * through removed nodes gets one direct bypass flow.
 * <p>
 * All bypasses are created before anything is removed: removal deletes the
 * masked-to-masked flows the boundary search walks over.
 */
@Service
public class MaskService {

    private static final Logger log = LoggerFactory.getLogger(MaskService.class);

    @Autowired
    private GraphExtractorService graphExtractorService;

    @Autowired
    private BoundaryResolver boundaryResolver;

    @Autowired
    private ArtifactService artifactService;

    @Autowired
    private DiagramService diagramService;

    /** @return number of tasks masked */
    public int maskByPrivacy(ProcessDocument document, double privacyThreshold, PrivacyDirection direction) {
        ProcessGraph graph = graphExtractorService.extract(document);

        List<String> maskedIds = discover(graph, privacyThreshold, direction);
        if (maskedIds.isEmpty()) {
            log.info("No task matches privacy {} {}; nothing masked", direction, privacyThreshold);
            return 0;
        }

        List<String> attached = attachedBoundaryEvents(graph, maskedIds);
        List<String> removed = new ArrayList<>(maskedIds);
        removed.addAll(attached);

        List<String> bypasses = synthesizeBypasses(document, graph, removed);

        // boundary events go before their hosts, otherwise the host's removal clears attachedToRef
        List<String> exciseOrder = new ArrayList<>(attached);
        exciseOrder.addAll(maskedIds);
        excise(document, exciseOrder);

        log.info("Masked {} task(s) {} and {} boundary event(s), created {} bypass flow(s)",
                maskedIds.size(), maskedIds, attached.size(), bypasses.size());
        return maskedIds.size();
    }

    List<String> attachedBoundaryEvents(ProcessGraph graph, List<String> maskedIds) {
        List<String> events = new ArrayList<>();
        for (String id : maskedIds) events.addAll(graph.boundaryEventsOf(id));
        return events;
    }

    public List<String> discover(ProcessGraph graph, double privacyThreshold, PrivacyDirection direction) {
        List<String> masked = new ArrayList<>();
        for (String id : graph.getActivityIds()) {
            if (direction.shouldMask(graph.getPrivacy(id), privacyThreshold)) masked.add(id);
        }
        return masked;
    }

    /** @return ids of the created bypass flows, in creation order */
    List<String> synthesizeBypasses(ProcessDocument document, ProcessGraph graph, List<String> removedIds) {
        Map<String, Box> bounds = diagramService.boundsMap(document);
        Set<String> synthesized = new HashSet<>();
        List<String> created = new ArrayList<>();
        Counter counter = new Counter();

        for (Boundary boundary : boundaryResolver.resolveAll(graph, removedIds)) {
            for (String src : boundary.getPreds()) {
                for (String tgt : boundary.getSuccs()) {
                    if (src.equals(tgt)) continue;
                    String key = ProcessGraph.pairKey(src, tgt);
                    if (synthesized.contains(key)) continue;
                    if (graph.hasFlow(src, tgt)) {
                        log.debug("Flow {} -> {} already exists, no bypass needed", src, tgt);
                        continue;
                    }
                    synthesized.add(key);

                    SequenceFlow flow = createBypassFlow(document, src, tgt, counter);
                    if (flow == null) continue;
                    created.add(flow.getId());

                    Box srcBox = bounds.get(src);
                    Box tgtBox = bounds.get(tgt);
                    if (srcBox != null && tgtBox != null) {
                        diagramService.addEdge(document, flow, LayoutGeometry.forwardConnector(srcBox, tgtBox));
                    }
                }
            }
        }
        return created;
    }

    private SequenceFlow createBypassFlow(ProcessDocument document, String src, String tgt, Counter counter) {
        BpmnModelInstance model = document.getModel();
        ModelElementInstance source = model.getModelElementById(src);
        ModelElementInstance target = model.getModelElementById(tgt);
        if (!(source instanceof FlowNode) || !(target instanceof FlowNode)) {
            log.debug("Skipping bypass {} -> {}: endpoint is not a flow node", src, tgt);
            return null;
        }

        String id;
        do {
            id = CouplingSchema.AUTO_FLOW_PREFIX + (++counter.value);
        } while (document.hasElement(id) || document.hasElement(CouplingSchema.diId(id)));

        SequenceFlow flow = model.newInstance(SequenceFlow.class);
        flow.setId(id);
        flow.setSource((FlowNode) source);
        flow.setTarget((FlowNode) target);
        document.getProcess().addChildElement(flow);
        log.debug("Bypass {}: {} -> {}", id, src, tgt);
        return flow;
    }

    private static final class Counter { int value = 0; }

    void excise(ProcessDocument document, List<String> removedIds) {
        BpmnModelInstance model = document.getModel();
        for (String mid : removedIds) {
            List<SequenceFlow> touching = new ArrayList<>();
            for (SequenceFlow f : graphExtractorService.getSequenceFlows(document)) {
                if (mid.equals(f.getAttributeValue("sourceRef")) || mid.equals(f.getAttributeValue("targetRef"))) {
                    touching.add(f);
                }
            }
            for (SequenceFlow f : touching) {
                String fid = f.getId();
                artifactService.removeAllAssociationsTouching(document, fid);
                diagramService.removeEdgesFor(document, fid);
                ArtifactService.detach(f);
            }

            artifactService.removeAllAssociationsTouching(document, mid);
            diagramService.removeShapesFor(document, mid);
            ModelElementInstance node = model.getModelElementById(mid);
            if (node != null) ArtifactService.detach(node);
        }
    }
}
