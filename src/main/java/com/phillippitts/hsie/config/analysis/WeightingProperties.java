package com.phillippitts.hsie.config.analysis;

import com.phillippitts.hsie.domain.AnalyzerKind;
import com.phillippitts.hsie.domain.WeightingConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

import java.util.EnumMap;
import java.util.Map;

/**
 * Default HSI/HSIE weighting, bound from {@code hsie.weighting.*}.
 *
 * @param weights        raw weight per dimension; unset dimensions weigh 1.0
 * @param escalationStep HSIE increment per repeated speaker pair
 * @param escalationCap  upper bound of the HSIE factor
 */
@ConfigurationProperties(prefix = "hsie.weighting")
public record WeightingProperties(Map<AnalyzerKind, Double> weights, Double escalationStep, Double escalationCap) {

    @ConstructorBinding
    public WeightingProperties {
    }

    public WeightingProperties() {
        this(null, null, null);
    }

    public WeightingConfig toWeightingConfig() {
        Map<AnalyzerKind, Double> w = new EnumMap<>(AnalyzerKind.class);
        for (AnalyzerKind kind : AnalyzerKind.values()) {
            w.put(kind, weights == null ? 1.0 : weights.getOrDefault(kind, 1.0));
        }
        return new WeightingConfig(w,
                escalationStep == null ? WeightingConfig.DEFAULT_ESCALATION_STEP : escalationStep,
                escalationCap == null ? WeightingConfig.DEFAULT_ESCALATION_CAP : escalationCap);
    }
}
