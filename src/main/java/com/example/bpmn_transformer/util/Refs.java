package com.example.bpmn_transformer.util;

import org.camunda.bpm.model.xml.instance.ModelElementInstance;

/**
 * Reads id references as plain ids. QName-typed references
 * ({@code association/@sourceRef}, {@code BPMNShape/@bpmnElement}) may carry a prefix.
 */
public final class Refs {

    private Refs() {}

    public static String id(ModelElementInstance element, String attribute) {
        return local(element.getAttributeValue(attribute));
    }

    public static String local(String ref) {
        if (ref == null) return null;
        int colon = ref.indexOf(':');
        return colon >= 0 ? ref.substring(colon + 1) : ref;
    }
}
