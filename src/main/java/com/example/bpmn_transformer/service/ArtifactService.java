package com.example.bpmn_transformer.service;

import com.example.bpmn_transformer.model.ProcessDocument;
import com.example.bpmn_transformer.util.Refs;
import org.camunda.bpm.model.bpmn.instance.Association;
import org.camunda.bpm.model.bpmn.instance.TextAnnotation;
import org.camunda.bpm.model.xml.instance.ModelElementInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Association removal with orphan cascade: a text annotation left without any
 * association is removed together with its shape.
 */
@Service
public class ArtifactService {

    private static final Logger log = LoggerFactory.getLogger(ArtifactService.class);

    @Autowired
    private DiagramService diagramService;

    /** Snapshot of the associations whose sourceRef or targetRef is {@code elementId}. */
    public List<Association> associationsTouching(ProcessDocument document, String elementId) {
        List<Association> touching = new ArrayList<>();
        for (Association a : document.getModel().getModelElementsByType(Association.class)) {
            if (elementId.equals(Refs.id(a, "sourceRef")) || elementId.equals(Refs.id(a, "targetRef"))) {
                touching.add(a);
            }
        }
        return touching;
    }

    public int countAssociationsTouching(ProcessDocument document, String elementId) {
        return associationsTouching(document, elementId).size();
    }

    /** @return number of associations removed */
    public int removeAllAssociationsTouching(ProcessDocument document, String elementId) {
        int removed = 0;
        for (Association a : associationsTouching(document, elementId)) {
            if (removeAssociationCascade(document, a)) removed++;
        }
        return removed;
    }

    public boolean removeAssociationCascade(ProcessDocument document, Association association) {
        if (association == null) return false;
        String src = Refs.id(association, "sourceRef");
        String tgt = Refs.id(association, "targetRef");

        diagramService.removeEdgesFor(document, association.getId());
        boolean removed = detach(association);

        removeAnnotationIfOrphaned(document, src);
        if (tgt != null && !tgt.equals(src)) removeAnnotationIfOrphaned(document, tgt);
        return removed;
    }

    public boolean removeAnnotationIfOrphaned(ProcessDocument document, String elementId) {
        if (elementId == null) return false;
        ModelElementInstance element = document.getModel().getModelElementById(elementId);
        if (!(element instanceof TextAnnotation)) return false;
        if (countAssociationsTouching(document, elementId) > 0) return false;

        diagramService.removeShapesFor(document, elementId);
        detach(element);
        log.debug("Removed orphaned text annotation {}", elementId);
        return true;
    }

    static boolean detach(ModelElementInstance element) {
        ModelElementInstance parent = element.getParentElement();
        return parent != null && parent.removeChildElement(element);
    }
}
