package com.example.bpmn_transformer.service;

import com.example.bpmn_transformer.model.Box;
import com.example.bpmn_transformer.model.CouplingSchema;
import com.example.bpmn_transformer.model.Point;
import com.example.bpmn_transformer.model.ProcessDocument;
import com.example.bpmn_transformer.util.Refs;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;
import org.camunda.bpm.model.bpmn.instance.BaseElement;
import org.camunda.bpm.model.bpmn.instance.bpmndi.BpmnDiagram;
import org.camunda.bpm.model.bpmn.instance.bpmndi.BpmnEdge;
import org.camunda.bpm.model.bpmn.instance.bpmndi.BpmnPlane;
import org.camunda.bpm.model.bpmn.instance.bpmndi.BpmnShape;
import org.camunda.bpm.model.bpmn.instance.dc.Bounds;
import org.camunda.bpm.model.bpmn.instance.di.Waypoint;
import org.camunda.bpm.model.xml.instance.ModelElementInstance;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Diagram interchange (bpmndi) bookkeeping: shape lookup, creation and removal.
 */
@Service
public class DiagramService {

    public BpmnPlane ensurePlane(ProcessDocument document) {
        if (document.getPlane() != null) return document.getPlane();

        BpmnModelInstance model = document.getModel();
        BpmnDiagram diagram = model.newInstance(BpmnDiagram.class);
        diagram.setId(CouplingSchema.DIAGRAM_ID);
        BpmnPlane plane = model.newInstance(BpmnPlane.class);
        plane.setId(CouplingSchema.PLANE_ID);
        plane.setBpmnElement(document.getProcess());
        diagram.setBpmnPlane(plane);
        document.getDefinitions().addChildElement(diagram);

        document.setPlane(plane);
        return plane;
    }

    /** Bounds of every shape keyed by the element it draws; first shape wins. */
    public Map<String, Box> boundsMap(ProcessDocument document) {
        Map<String, Box> out = new HashMap<>();
        for (BpmnShape shape : document.getModel().getModelElementsByType(BpmnShape.class)) {
            String elementId = Refs.id(shape, "bpmnElement");
            Box box = toBox(shape.getBounds());
            if (elementId != null && box != null) out.putIfAbsent(elementId, box);
        }
        return out;
    }

    public BpmnShape addShape(ProcessDocument document, BaseElement element, Box box) {
        BpmnModelInstance model = document.getModel();
        BpmnShape shape = model.newInstance(BpmnShape.class);
        shape.setId(CouplingSchema.diId(element.getId()));
        shape.setBpmnElement(element);

        Bounds bounds = model.newInstance(Bounds.class);
        bounds.setX(box.getX());
        bounds.setY(box.getY());
        bounds.setWidth(box.getWidth());
        bounds.setHeight(box.getHeight());
        shape.setBounds(bounds);

        ensurePlane(document).addChildElement(shape);
        return shape;
    }

    public BpmnEdge addEdge(ProcessDocument document, BaseElement element, Point... waypoints) {
        BpmnModelInstance model = document.getModel();
        BpmnEdge edge = model.newInstance(BpmnEdge.class);
        edge.setId(CouplingSchema.diId(element.getId()));
        edge.setBpmnElement(element);
        for (Point p : waypoints) {
            Waypoint wp = model.newInstance(Waypoint.class);
            wp.setX(p.getX());
            wp.setY(p.getY());
            edge.getWaypoints().add(wp);
        }
        ensurePlane(document).addChildElement(edge);
        return edge;
    }

    public int removeShapesFor(ProcessDocument document, String elementId) {
        return removeShapesMatching(document, elementId::equals);
    }

    public int removeShapesMatching(ProcessDocument document, Predicate<String> elementIdMatches) {
        return removeAll(new ArrayList<>(document.getModel().getModelElementsByType(BpmnShape.class)), elementIdMatches);
    }

    public int removeEdgesFor(ProcessDocument document, String elementId) {
        return removeAll(new ArrayList<>(document.getModel().getModelElementsByType(BpmnEdge.class)), elementId::equals);
    }

    private int removeAll(List<? extends ModelElementInstance> diElements, Predicate<String> elementIdMatches) {
        int removed = 0;
        for (ModelElementInstance di : diElements) {
            String ref = Refs.id(di, "bpmnElement");
            if (ref == null || !elementIdMatches.test(ref)) continue;
            ModelElementInstance parent = di.getParentElement();
            if (parent != null && parent.removeChildElement(di)) removed++;
        }
        return removed;
    }

    private static Box toBox(Bounds b) {
        if (b == null || b.getX() == null || b.getY() == null || b.getWidth() == null || b.getHeight() == null) {
            return null;
        }
        return new Box(b.getX(), b.getY(), b.getWidth(), b.getHeight());
    }
}
