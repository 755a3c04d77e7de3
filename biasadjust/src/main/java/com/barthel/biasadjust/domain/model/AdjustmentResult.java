package com.barthel.biasadjust.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Corrected series together with a description of how it was produced.
 *
 * @param method     the technique applied
 * @param values     corrected samples aligned with the input {@code simp}
 * @param attributes provenance attributes ({@code biasadjust_*})
 */
public record AdjustmentResult(AdjustmentMethod method, double[] values, Map<String, String> attributes) {
    public AdjustmentResult {
        if (method == null || values == null) {
            throw new IllegalArgumentException("Method and values are required");
        }
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
