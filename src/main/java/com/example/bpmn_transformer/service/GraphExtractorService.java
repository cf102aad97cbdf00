package com.example.bpmn_transformer.service;

import com.example.bpmn_transformer.model.CouplingSchema;
import com.example.bpmn_transformer.model.FlowEdge;
import com.example.bpmn_transformer.model.ProcessDocument;
import com.example.bpmn_transformer.model.ProcessGraph;
import com.example.bpmn_transformer.util.Refs;
import org.camunda.bpm.model.bpmn.instance.BoundaryEvent;
import org.camunda.bpm.model.bpmn.instance.FlowElement;
import org.camunda.bpm.model.bpmn.instance.SequenceFlow;
import org.camunda.bpm.model.bpmn.instance.Task;
import org.camunda.bpm.model.xml.instance.ModelElementInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
public class GraphExtractorService {

    private static final Logger log = LoggerFactory.getLogger(GraphExtractorService.class);

    /** Task-like direct children of the process (task, userTask, serviceTask, ...) in document order. */
    public List<Task> getTaskList(ProcessDocument document) {
        List<Task> tasks = new ArrayList<>();
        for (FlowElement e : document.getProcess().getFlowElements()) {
            if (e instanceof Task) tasks.add((Task) e);
        }
        return tasks;
    }

    public List<SequenceFlow> getSequenceFlows(ProcessDocument document) {
        List<SequenceFlow> flows = new ArrayList<>();
        for (FlowElement e : document.getProcess().getFlowElements()) {
            if (e instanceof SequenceFlow) flows.add((SequenceFlow) e);
        }
        return flows;
    }

    /** Boundary event id to the id of the activity it is attached to, in document order. */
    public Map<String, String> getAttachments(ProcessDocument document) {
        Map<String, String> attachments = new LinkedHashMap<>();
        for (FlowElement e : document.getProcess().getFlowElements()) {
            if (!(e instanceof BoundaryEvent)) continue;
            String host = Refs.id(e, "attachedToRef");
            if (host != null) attachments.put(e.getId(), host);
        }
        return attachments;
    }

    public ProcessGraph extract(ProcessDocument document) {
        List<String> activityIds = new ArrayList<>();
        Map<String, Double> privacy = new LinkedHashMap<>();
        for (Task task : getTaskList(document)) {
            activityIds.add(task.getId());
            Double p = numericAttribute(task, CouplingSchema.ATTR_PRIVACY);
            if (p != null) privacy.put(task.getId(), p);
        }

        List<FlowEdge> flows = new ArrayList<>();
        for (SequenceFlow sf : getSequenceFlows(document)) {
            flows.add(new FlowEdge(
                    sf.getId(),
                    sf.getAttributeValue("sourceRef"),
                    sf.getAttributeValue("targetRef"),
                    numericAttribute(sf, CouplingSchema.ATTR_COUPLING)));
        }

        Map<String, String> attachments = getAttachments(document);

        log.debug("Extracted {} activities ({} with privacy), {} flows and {} boundary events from process '{}'",
                activityIds.size(), privacy.size(), flows.size(), attachments.size(), document.getProcess().getId());
        return new ProcessGraph(activityIds, privacy, flows, attachments);
    }

    /**
     * Reads a {@code cpl:} attribute as a finite double; absent or non-numeric
     * values yield null.
     */
    public static Double numericAttribute(ModelElementInstance element, String localName) {
        String raw = element.getAttributeValueNs(CouplingSchema.NAMESPACE, localName);
        if (raw == null || raw.isBlank()) return null;
        try {
            double v = Double.parseDouble(raw.trim());
            return Double.isFinite(v) ? v : null;
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric {}:{}='{}' on {}", CouplingSchema.PREFIX, localName, raw,
                    element.getAttributeValue("id"));
            return null;
        }
    }
}
