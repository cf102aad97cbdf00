package com.example.bpmn_transformer.model;

/**
 * Names shared by the reader and the writers: the custom attribute namespace
 * and the id conventions of generated elements.
 */
public final class CouplingSchema {

    public static final String NAMESPACE = "http://example.com/schema/coupling";
    public static final String PREFIX = "cpl";

    public static final String ATTR_COUPLING = "coupling";
    public static final String ATTR_PRIVACY = "privacy";
    public static final String ATTR_FRAGMENT_ID = "fragmentId";
    public static final String ATTR_FRAGMENT_NAME = "fragmentName";
    public static final String ATTR_FRAGMENT_SIZE = "fragmentSize";
    public static final String ATTR_COUPLING_THRESHOLD = "couplingThreshold";

    public static final String FRAGMENT_PREFIX = "Fragment_";
    public static final String CATEGORY_ID = "Category_Fragments";
    public static final String AUTO_FLOW_PREFIX = "AutoFlow_";

    public static final String DIAGRAM_ID = "BPMNDiagram_Auto";
    public static final String PLANE_ID = "BPMNPlane_Auto";

    private CouplingSchema() {}

    public static String fragmentId(int ordinal) { return FRAGMENT_PREFIX + ordinal; }
    public static String categoryValueId(String fragmentId) { return fragmentId + "_CV"; }
    public static String memberAssociationId(String fragmentId, String memberId) { return fragmentId + "_A_" + memberId; }
    public static String annotationId(String fragmentId) { return fragmentId + "_TA"; }
    public static String annotationAssociationId(String fragmentId) { return fragmentId + "_TA_Assoc"; }
    public static String diId(String elementId) { return elementId + "_di"; }
}
