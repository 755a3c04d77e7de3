package com.barthel.biasadjust.domain.model;

import com.barthel.biasadjust.domain.exception.UnknownMethodException;

import java.util.Arrays;
import java.util.List;

/**
 * The closed set of implemented bias correction techniques.
 */
public enum AdjustmentMethod {
    LINEAR_SCALING("linear_scaling", Family.SCALING),
    VARIANCE_SCALING("variance_scaling", Family.SCALING),
    DELTA_METHOD("delta_method", Family.SCALING),
    QUANTILE_MAPPING("quantile_mapping", Family.DISTRIBUTION),
    DETRENDED_QUANTILE_MAPPING("detrended_quantile_mapping", Family.DISTRIBUTION),
    QUANTILE_DELTA_MAPPING("quantile_delta_mapping", Family.DISTRIBUTION);

    public enum Family {
        SCALING,
        DISTRIBUTION
    }

    private final String methodName;
    private final Family family;

    AdjustmentMethod(String methodName, Family family) {
        this.methodName = methodName;
        this.family = family;
    }

    public String methodName() {
        return methodName;
    }

    public boolean isScalingBased() {
        return family == Family.SCALING;
    }

    public boolean isDistributionBased() {
        return family == Family.DISTRIBUTION;
    }

    /**
     * @return all method names in their canonical order
     */
    public static List<String> names() {
        return Arrays.stream(values()).map(AdjustmentMethod::methodName).toList();
    }

    public static AdjustmentMethod fromName(String name) {
        for (AdjustmentMethod method : values()) {
            if (method.methodName.equals(name)) {
                return method;
            }
        }
        throw new UnknownMethodException(name, names());
    }
}
