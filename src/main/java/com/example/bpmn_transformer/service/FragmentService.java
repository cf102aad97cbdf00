package com.example.bpmn_transformer.service;

import com.example.bpmn_transformer.model.Box;
import com.example.bpmn_transformer.model.CouplingSchema;
import com.example.bpmn_transformer.model.ProcessDocument;
import com.example.bpmn_transformer.model.ProcessGraph;
import com.example.bpmn_transformer.util.LayoutGeometry;
import org.camunda.bpm.model.bpmn.AssociationDirection;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;
import org.camunda.bpm.model.bpmn.instance.Association;
import org.camunda.bpm.model.bpmn.instance.Artifact;
import org.camunda.bpm.model.bpmn.instance.BaseElement;
import org.camunda.bpm.model.bpmn.instance.Category;
import org.camunda.bpm.model.bpmn.instance.CategoryValue;
import org.camunda.bpm.model.bpmn.instance.Group;
import org.camunda.bpm.model.bpmn.instance.Text;
import org.camunda.bpm.model.bpmn.instance.TextAnnotation;
import org.camunda.bpm.model.xml.instance.ModelElementInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns coupling clusters into BPMN groups: one group, category value, shape,
 * member associations and a describing text annotation per cluster.
 */
@Service
public class FragmentService {

    private static final Logger log = LoggerFactory.getLogger(FragmentService.class);
    private static final Pattern FRAGMENT_ID = Pattern.compile("^" + CouplingSchema.FRAGMENT_PREFIX + "(\\d+)$");

    @Autowired
    private GraphExtractorService graphExtractorService;

    @Autowired
    private ClusterService clusterService;

    @Autowired
    private DiagramService diagramService;

    @Value("${app.layout.padding:24}")
    private double padding;

    @Value("${app.layout.annotation-offset:48}")
    private double annotationOffset;

    @Value("${app.layout.annotation-width:160}")
    private double annotationWidth;

    @Value("${app.layout.annotation-height:40}")
    private double annotationHeight;

    @Value("${app.layout.placeholder-x:100}")
    private double placeholderX;

    @Value("${app.layout.placeholder-y:100}")
    private double placeholderY;

    @Value("${app.layout.placeholder-width:100}")
    private double placeholderWidth;

    @Value("${app.layout.placeholder-height:80}")
    private double placeholderHeight;

    /** @return number of groups created */
    public int fragmentByCoupling(ProcessDocument document, double threshold, boolean includeSingletons) {
        ProcessGraph graph = graphExtractorService.extract(document);
        List<List<String>> classes = clusterService.cluster(graph, threshold, includeSingletons);
        if (classes.isEmpty()) {
            log.info("No fragment at threshold {} (singletons included: {})", threshold, includeSingletons);
            return 0;
        }

        diagramService.ensurePlane(document);
        Map<String, Box> bounds = diagramService.boundsMap(document);
        Category category = ensureCategory(document);

        int ordinal = highestFragmentOrdinal(document);
        for (List<String> members : classes) {
            ordinal = nextFreeOrdinal(document, ordinal + 1);
            materialize(document, category, bounds, members, ordinal, threshold);
        }

        log.info("Fragmented {} task(s) into {} group(s) at threshold {}",
                graph.activityCount(), classes.size(), threshold);
        return classes.size();
    }

    private void materialize(ProcessDocument document, Category category, Map<String, Box> bounds,
                             List<String> memberIds, int ordinal, double threshold) {
        BpmnModelInstance model = document.getModel();
        String fragId = CouplingSchema.fragmentId(ordinal);

        CategoryValue categoryValue = model.newInstance(CategoryValue.class);
        categoryValue.setId(CouplingSchema.categoryValueId(fragId));
        categoryValue.setValue(fragId);
        category.addChildElement(categoryValue);

        Group group = model.newInstance(Group.class);
        group.setId(fragId);
        group.setCategory(categoryValue);
        group.setAttributeValueNs(CouplingSchema.NAMESPACE, CouplingSchema.ATTR_FRAGMENT_ID, fragId);
        group.setAttributeValueNs(CouplingSchema.NAMESPACE, CouplingSchema.ATTR_FRAGMENT_NAME, fragId);
        group.setAttributeValueNs(CouplingSchema.NAMESPACE, CouplingSchema.ATTR_FRAGMENT_SIZE, String.valueOf(memberIds.size()));
        group.setAttributeValueNs(CouplingSchema.NAMESPACE, CouplingSchema.ATTR_COUPLING_THRESHOLD, formatThreshold(threshold));
        document.getProcess().addChildElement(group);

        Box placeholder = new Box(placeholderX, placeholderY, placeholderWidth, placeholderHeight);
        Box groupBox = LayoutGeometry.enclosingBox(memberIds, bounds::get, placeholder, padding);
        diagramService.addShape(document, group, groupBox);

        for (String memberId : memberIds) {
            ModelElementInstance member = model.getModelElementById(memberId);
            if (!(member instanceof BaseElement)) continue;
            addAssociation(document, CouplingSchema.memberAssociationId(fragId, memberId), group, (BaseElement) member);
        }

        addAnnotation(document, fragId, fragId + "\nsize=" + memberIds.size(), group, groupBox);
    }

    /** Note placed above the group, linked edge-to-edge to the group's box. */
    private void addAnnotation(ProcessDocument document, String fragId, String label, Group group, Box groupBox) {
        BpmnModelInstance model = document.getModel();

        TextAnnotation annotation = model.newInstance(TextAnnotation.class);
        annotation.setId(CouplingSchema.annotationId(fragId));
        Text text = model.newInstance(Text.class);
        text.setTextContent(label);
        annotation.setText(text);
        document.getProcess().addChildElement(annotation);

        Association link = addAssociation(document, CouplingSchema.annotationAssociationId(fragId), annotation, group);

        Box noteBox = new Box(groupBox.getX(), groupBox.getY() - annotationOffset, annotationWidth, annotationHeight);
        diagramService.addShape(document, annotation, noteBox);
        diagramService.addEdge(document, link,
                LayoutGeometry.edgeAnchor(groupBox, noteBox),
                LayoutGeometry.edgeAnchor(noteBox, groupBox));
    }

    /** Shortest decimal form: 1.0 is written as "1", 0.70 as "0.7". */
    static String formatThreshold(double threshold) {
        return BigDecimal.valueOf(threshold).stripTrailingZeros().toPlainString();
    }

    private Association addAssociation(ProcessDocument document, String id, BaseElement source, BaseElement target) {
        Association association = document.getModel().newInstance(Association.class);
        association.setId(id);
        association.setAssociationDirection(AssociationDirection.None);
        association.setSource(source);
        association.setTarget(target);
        document.getProcess().addChildElement(association);
        return association;
    }

    private Category ensureCategory(ProcessDocument document) {
        ModelElementInstance existing = document.getModel().getModelElementById(CouplingSchema.CATEGORY_ID);
        if (existing instanceof Category) return (Category) existing;

        Category category = document.getModel().newInstance(Category.class);
        category.setId(CouplingSchema.CATEGORY_ID);
        document.getDefinitions().addChildElement(category);
        return category;
    }

    /** Highest n of a {@code Fragment_<n>} group left by an earlier run, 0 if none. */
    int highestFragmentOrdinal(ProcessDocument document) {
        int max = 0;
        for (Artifact artifact : document.getProcess().getArtifacts()) {
            if (!(artifact instanceof Group) || artifact.getId() == null) continue;
            Matcher m = FRAGMENT_ID.matcher(artifact.getId());
            if (m.matches()) max = Math.max(max, Integer.parseInt(m.group(1)));
        }
        return max;
    }

    private int nextFreeOrdinal(ProcessDocument document, int candidate) {
        int ordinal = candidate;
        while (true) {
            String fragId = CouplingSchema.fragmentId(ordinal);
            if (!document.hasElement(fragId)
                    && !document.hasElement(CouplingSchema.categoryValueId(fragId))
                    && !document.hasElement(CouplingSchema.annotationId(fragId))) {
                return ordinal;
            }
            ordinal++;
        }
    }
}
