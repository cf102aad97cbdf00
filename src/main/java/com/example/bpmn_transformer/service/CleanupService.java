package com.example.bpmn_transformer.service;

import com.example.bpmn_transformer.model.CouplingSchema;
import com.example.bpmn_transformer.model.ProcessDocument;
import com.example.bpmn_transformer.util.Refs;
import org.camunda.bpm.model.bpmn.instance.Artifact;
import org.camunda.bpm.model.bpmn.instance.Association;
import org.camunda.bpm.model.bpmn.instance.Category;
import org.camunda.bpm.model.bpmn.instance.Group;
import org.camunda.bpm.model.xml.instance.ModelElementInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes what an earlier fragmentation run generated, so runs do not pile up
 * groups. Running it twice equals running it once.
 */
@Service
public class CleanupService {

    private static final Logger log = LoggerFactory.getLogger(CleanupService.class);

    @Autowired
    private ArtifactService artifactService;

    @Autowired
    private DiagramService diagramService;

    /** @return number of groups removed */
    public int clearOldFragments(ProcessDocument document) {
        List<Group> oldGroups = new ArrayList<>();
        for (Artifact artifact : document.getProcess().getArtifacts()) {
            if (artifact instanceof Group && isGenerated((Group) artifact)) oldGroups.add((Group) artifact);
        }

        for (Group group : oldGroups) {
            String groupId = group.getId();
            String categoryValueRef = Refs.id(group, "categoryValueRef");

            artifactService.removeAllAssociationsTouching(document, groupId);
            diagramService.removeShapesFor(document, groupId);
            ArtifactService.detach(group);
            removeCategoryValue(document, categoryValueRef);
        }

        int staleAssociations = 0;
        for (Association a : new ArrayList<>(document.getModel().getModelElementsByType(Association.class))) {
            String src = Refs.id(a, "sourceRef");
            if (src != null && src.startsWith(CouplingSchema.FRAGMENT_PREFIX)
                    && artifactService.removeAssociationCascade(document, a)) {
                staleAssociations++;
            }
        }
        int staleShapes = diagramService.removeShapesMatching(document, id -> id.startsWith(CouplingSchema.FRAGMENT_PREFIX));
        removeCategoryIfEmpty(document);

        if (!oldGroups.isEmpty() || staleAssociations > 0 || staleShapes > 0) {
            log.info("Cleared {} old fragment group(s), {} stale association(s), {} stale shape(s)",
                    oldGroups.size(), staleAssociations, staleShapes);
        }
        return oldGroups.size();
    }

    static boolean isGenerated(Group group) {
        if (group.getAttributeValueNs(CouplingSchema.NAMESPACE, CouplingSchema.ATTR_FRAGMENT_ID) != null) return true;
        String id = group.getId();
        return id != null && id.startsWith(CouplingSchema.FRAGMENT_PREFIX);
    }

    private void removeCategoryValue(ProcessDocument document, String categoryValueId) {
        if (categoryValueId == null) return;
        ModelElementInstance value = document.getModel().getModelElementById(categoryValueId);
        if (value != null && value.getParentElement() instanceof Category
                && CouplingSchema.CATEGORY_ID.equals(((Category) value.getParentElement()).getId())) {
            ArtifactService.detach(value);
        }
    }

    private void removeCategoryIfEmpty(ProcessDocument document) {
        ModelElementInstance category = document.getModel().getModelElementById(CouplingSchema.CATEGORY_ID);
        if (category instanceof Category && ((Category) category).getCategoryValues().isEmpty()) {
            ArtifactService.detach(category);
        }
    }
}
