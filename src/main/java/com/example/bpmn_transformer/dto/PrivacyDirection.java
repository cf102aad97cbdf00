package com.example.bpmn_transformer.dto;

import java.util.Locale;

/**
 * Which side of the privacy threshold gets masked.
 */
public enum PrivacyDirection {
    /** mask when {@code privacy >= threshold} */
    ABOVE,
    /** mask when {@code privacy < threshold} */
    BELOW;

    public boolean shouldMask(Double privacy, double threshold) {
        if (privacy == null || !Double.isFinite(privacy)) return false;
        return this == ABOVE ? privacy >= threshold : privacy < threshold;
    }

    public static PrivacyDirection fromValue(String value) {
        if (value == null) return null;
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "above": return ABOVE;
            case "below": return BELOW;
            default: return null;
        }
    }
}
