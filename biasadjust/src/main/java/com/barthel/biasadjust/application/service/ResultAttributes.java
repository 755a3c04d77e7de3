package com.barthel.biasadjust.application.service;

import com.barthel.biasadjust.config.BiasAdjustProperties;
import com.barthel.biasadjust.domain.model.AdjustmentMethod;
import com.barthel.biasadjust.domain.model.AdjustmentParameters;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the provenance attributes attached to every adjustment result.
 */
@Component
@RequiredArgsConstructor
public class ResultAttributes {

    public static final String PREFIX = "biasadjust_";

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final BiasAdjustProperties properties;
    private final Clock clock;

    public Map<String, String> describe(AdjustmentMethod method, AdjustmentParameters parameters) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put(PREFIX + "version", properties.version());
        attributes.put(PREFIX + "method", method.methodName());
        attributes.put(PREFIX + "kind", parameters.getKind().symbol());
        if (parameters.getNQuantiles() != null) {
            attributes.put(PREFIX + "n_quantiles", String.valueOf(parameters.getNQuantiles()));
        }
        if (parameters.getGrouping() != null) {
            attributes.put(PREFIX + "group", parameters.getGrouping().key());
        }
        attributes.put(PREFIX + "timestamp", TIMESTAMP.format(clock.instant()));
        return attributes;
    }
}
