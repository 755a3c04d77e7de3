package com.barthel.biasadjust.application.service;

import com.barthel.biasadjust.application.port.in.BiasCorrectionUseCase;
import com.barthel.biasadjust.domain.exception.GroupingNotSupportedException;
import com.barthel.biasadjust.domain.model.AdjustmentMethod;
import com.barthel.biasadjust.domain.model.AdjustmentParameters;
import com.barthel.biasadjust.domain.model.Grouping;
import com.barthel.biasadjust.domain.model.TimeSeries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.Map;
import java.util.SortedMap;

/**
 * Applies a corrector to the whole series or, when a grouping is configured, once per
 * calendar group, scattering each group's result back to its original positions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GroupedCorrectionService {

    private final BiasCorrectionUseCase corrector;

    public double[] apply(AdjustmentMethod method, TimeSeries obs, TimeSeries simh, TimeSeries simp,
                          AdjustmentParameters parameters) {
        if (!parameters.isGrouped()) {
            return corrector.correct(method, obs.values(), simh.values(), simp.values(), parameters);
        }
        if (!method.isScalingBased()) {
            throw new GroupingNotSupportedException("Can't use group for distribution based methods.");
        }
        Grouping grouping = parameters.getGrouping();
        SortedMap<Integer, int[]> obsGroups = obs.partition(grouping);
        SortedMap<Integer, int[]> simhGroups = simh.partition(grouping);
        SortedMap<Integer, int[]> simpGroups = simp.partition(grouping);
        if (obsGroups.size() != simhGroups.size() || simhGroups.size() != simpGroups.size()) {
            throw new GroupingNotSupportedException("Grouping by " + grouping.key() + " yields "
                    + obsGroups.size() + " obs, " + simhGroups.size() + " simh and "
                    + simpGroups.size() + " simp groups");
        }

        // groups are paired in ascending key order so that e.g. years of different periods line up
        double[] result = new double[simp.size()];
        Iterator<int[]> obsIt = obsGroups.values().iterator();
        Iterator<int[]> simhIt = simhGroups.values().iterator();
        for (Map.Entry<Integer, int[]> simpGroup : simpGroups.entrySet()) {
            int[] simpIndices = simpGroup.getValue();
            double[] corrected = corrector.correct(method, obs.select(obsIt.next()), simh.select(simhIt.next()),
                    simp.select(simpIndices), parameters);
            if (corrected.length != simpIndices.length) {
                throw new IllegalArgumentException(method.methodName() + " returned " + corrected.length
                        + " values for " + simpIndices.length + " samples of group " + simpGroup.getKey());
            }
            for (int i = 0; i < simpIndices.length; i++) {
                result[simpIndices[i]] = corrected[i];
            }
            log.debug("Adjusted {} group {} ({} samples)", grouping.key(), simpGroup.getKey(), simpIndices.length);
        }
        return result;
    }
}
