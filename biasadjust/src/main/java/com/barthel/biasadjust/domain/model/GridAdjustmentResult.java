package com.barthel.biasadjust.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Corrected grid shaped like the input {@code simp}.
 *
 * @param method     the technique applied
 * @param values     corrected samples indexed {@code [lat][lon][time]}
 * @param attributes provenance attributes ({@code biasadjust_*})
 */
public record GridAdjustmentResult(AdjustmentMethod method, double[][][] values, Map<String, String> attributes) {
    public GridAdjustmentResult {
        if (method == null || values == null) {
            throw new IllegalArgumentException("Method and values are required");
        }
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
