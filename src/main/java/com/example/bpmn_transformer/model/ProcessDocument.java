package com.example.bpmn_transformer.model;

import org.camunda.bpm.model.bpmn.BpmnModelInstance;
import org.camunda.bpm.model.bpmn.instance.Definitions;
import org.camunda.bpm.model.bpmn.instance.Process;
import org.camunda.bpm.model.bpmn.instance.bpmndi.BpmnPlane;

/**
 * One loaded BPMN document and the process being rewritten. A run owns its
 * instance exclusively; every component receives it explicitly.
 */
public class ProcessDocument {

    private final BpmnModelInstance model;
    private final Definitions definitions;
    private final Process process;
    private BpmnPlane plane;

    public ProcessDocument(BpmnModelInstance model, Definitions definitions, Process process, BpmnPlane plane) {
        this.model = model;
        this.definitions = definitions;
        this.process = process;
        this.plane = plane;
    }

    public BpmnModelInstance getModel() { return model; }
    public Definitions getDefinitions() { return definitions; }
    public Process getProcess() { return process; }

    /** May be null until a writer needs a plane; see DiagramService#ensurePlane. */
    public BpmnPlane getPlane() { return plane; }
    public void setPlane(BpmnPlane plane) { this.plane = plane; }

    public boolean hasElement(String id) {
        return id != null && model.getModelElementById(id) != null;
    }
}
