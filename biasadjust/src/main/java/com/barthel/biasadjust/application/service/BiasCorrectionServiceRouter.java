package com.barthel.biasadjust.application.service;

import com.barthel.biasadjust.application.port.in.BiasCorrectionUseCase;
import com.barthel.biasadjust.domain.model.AdjustmentMethod;
import com.barthel.biasadjust.domain.model.AdjustmentParameters;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Facade routing a technique to the corrector implementing it. The routing table is
 * built once from the available implementations.
 */
@Service
@Primary
public class BiasCorrectionServiceRouter implements BiasCorrectionUseCase {

    private final Map<AdjustmentMethod, BiasCorrectionUseCase> routes;

    public BiasCorrectionServiceRouter(List<BiasCorrectionUseCase> implementations) {
        Map<AdjustmentMethod, BiasCorrectionUseCase> table = new EnumMap<>(AdjustmentMethod.class);
        for (AdjustmentMethod method : AdjustmentMethod.values()) {
            implementations.stream()
                    .filter(i -> i != this && i.supports(method))
                    .findFirst()
                    .ifPresent(i -> table.put(method, i));
        }
        this.routes = Collections.unmodifiableMap(table);
    }

    @Override
    public double[] correct(AdjustmentMethod method, double[] obs, double[] simh, double[] simp,
                            AdjustmentParameters parameters) {
        BiasCorrectionUseCase corrector = routes.get(method);
        if (corrector == null) {
            throw new UnsupportedOperationException("No corrector for method: " + method.methodName());
        }
        return corrector.correct(method, obs, simh, simp, parameters);
    }

    @Override
    public boolean supports(AdjustmentMethod method) {
        return routes.containsKey(method);
    }
}
