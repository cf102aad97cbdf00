package com.example.bpmn_transformer.service;

import com.example.bpmn_transformer.model.Box;
import com.example.bpmn_transformer.model.Point;
import com.example.bpmn_transformer.model.ProcessDocument;
import com.example.bpmn_transformer.util.Refs;
import org.camunda.bpm.model.bpmn.instance.Association;
import org.camunda.bpm.model.bpmn.instance.SequenceFlow;
import org.camunda.bpm.model.bpmn.instance.TextAnnotation;
import org.camunda.bpm.model.bpmn.instance.bpmndi.BpmnEdge;
import org.camunda.bpm.model.bpmn.instance.bpmndi.BpmnShape;
import org.camunda.bpm.model.bpmn.instance.dc.Bounds;
import org.camunda.bpm.model.bpmn.instance.di.Waypoint;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Fixture loading and document-wide invariant checks shared by the service tests.
 */
final class BpmnTestSupport {

    static final String HEADER = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
            + "<bpmn:definitions xmlns:bpmn=\"http://www.omg.org/spec/BPMN/20100524/MODEL\"\n"
            + "    xmlns:bpmndi=\"http://www.omg.org/spec/BPMN/20100524/DI\"\n"
            + "    xmlns:dc=\"http://www.omg.org/spec/DD/20100524/DC\"\n"
            + "    xmlns:di=\"http://www.omg.org/spec/DD/20100524/DI\"\n"
            + "    xmlns:cpl=\"http://example.com/schema/coupling\"\n"
            + "    id=\"Definitions_1\" targetNamespace=\"http://bpmn.io/schema/bpmn\">\n";

    private BpmnTestSupport() {}

    static ProcessDocument load(BpmnDocumentService service, String fixture) {
        String path = "/bpmn/" + fixture;
        try (InputStream in = BpmnTestSupport.class.getResourceAsStream(path)) {
            assertNotNull(in, "missing fixture " + path);
            return service.read(in, fixture);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Wraps process children into a minimal valid document. */
    static String processXml(String body) {
        return HEADER + "  <bpmn:process id=\"Process_1\" isExecutable=\"false\">\n" + body
                + "\n  </bpmn:process>\n</bpmn:definitions>\n";
    }

    static ProcessDocument parse(BpmnDocumentService service, String xml) {
        return service.read(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "inline");
    }

    static SequenceFlow flowBetween(ProcessDocument doc, String src, String tgt) {
        for (SequenceFlow f : doc.getModel().getModelElementsByType(SequenceFlow.class)) {
            if (src.equals(f.getAttributeValue("sourceRef")) && tgt.equals(f.getAttributeValue("targetRef"))) return f;
        }
        return null;
    }

    static List<SequenceFlow> flowsWithPrefix(ProcessDocument doc, String prefix) {
        List<SequenceFlow> out = new ArrayList<>();
        for (SequenceFlow f : doc.getModel().getModelElementsByType(SequenceFlow.class)) {
            if (f.getId().startsWith(prefix)) out.add(f);
        }
        return out;
    }

    static BpmnShape shapeFor(ProcessDocument doc, String elementId) {
        for (BpmnShape s : doc.getModel().getModelElementsByType(BpmnShape.class)) {
            if (elementId.equals(Refs.id(s, "bpmnElement"))) return s;
        }
        return null;
    }

    static BpmnEdge edgeFor(ProcessDocument doc, String elementId) {
        for (BpmnEdge e : doc.getModel().getModelElementsByType(BpmnEdge.class)) {
            if (elementId.equals(Refs.id(e, "bpmnElement"))) return e;
        }
        return null;
    }

    static Box box(BpmnShape shape) {
        Bounds b = shape.getBounds();
        return new Box(b.getX(), b.getY(), b.getWidth(), b.getHeight());
    }

    static List<Point> waypoints(BpmnEdge edge) {
        List<Point> out = new ArrayList<>();
        for (Waypoint w : edge.getWaypoints()) out.add(new Point(w.getX(), w.getY()));
        return out;
    }

    /**
     * No flow, association or DI element points at a missing element, and every
     * text annotation still has an association.
     */
    static void assertNoDanglingReferences(ProcessDocument doc) {
        for (SequenceFlow f : doc.getModel().getModelElementsByType(SequenceFlow.class)) {
            assertTrue(doc.hasElement(f.getAttributeValue("sourceRef")), f.getId() + " has a dangling source");
            assertTrue(doc.hasElement(f.getAttributeValue("targetRef")), f.getId() + " has a dangling target");
        }
        for (Association a : doc.getModel().getModelElementsByType(Association.class)) {
            assertTrue(doc.hasElement(Refs.id(a, "sourceRef")), a.getId() + " has a dangling source");
            assertTrue(doc.hasElement(Refs.id(a, "targetRef")), a.getId() + " has a dangling target");
        }
        for (BpmnShape s : doc.getModel().getModelElementsByType(BpmnShape.class)) {
            assertTrue(doc.hasElement(Refs.id(s, "bpmnElement")), "shape " + s.getId() + " is dangling");
        }
        for (BpmnEdge e : doc.getModel().getModelElementsByType(BpmnEdge.class)) {
            assertTrue(doc.hasElement(Refs.id(e, "bpmnElement")), "edge " + e.getId() + " is dangling");
        }
        for (TextAnnotation ta : doc.getModel().getModelElementsByType(TextAnnotation.class)) {
            boolean linked = false;
            for (Association a : doc.getModel().getModelElementsByType(Association.class)) {
                if (ta.getId().equals(Refs.id(a, "sourceRef")) || ta.getId().equals(Refs.id(a, "targetRef"))) {
                    linked = true;
                    break;
                }
            }
            assertTrue(linked, "annotation " + ta.getId() + " is orphaned");
        }
    }
}
