package com.example.bpmn_transformer.dto;

import java.util.Locale;

public enum TransformMode {
    FRAGMENT,
    MASK;

    /** Parses {@code fragment} / {@code mask}; returns null for anything else. */
    public static TransformMode fromValue(String value) {
        if (value == null) return null;
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "fragment": return FRAGMENT;
            case "mask": return MASK;
            default: return null;
        }
    }
}
