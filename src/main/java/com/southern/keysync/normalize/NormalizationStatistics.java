package com.southern.keysync.normalize;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Map;
import java.util.TreeMap;

@Data
@AllArgsConstructor
public class NormalizationStatistics {
    private long totalNormalized;
    /**
     * 变换名 -> 实际生效次数
     */
    private Map<String, Long> transformations;
    private Map<String, Object> configuration;

    /**
     * 相对于 earlier 的增量，用于单次运行的统计
     */
    public NormalizationStatistics since(NormalizationStatistics earlier) {
        Map<String, Long> delta = new TreeMap<>();
        transformations.forEach((name, count) -> {
            long diff = count - earlier.getTransformations().getOrDefault(name, 0L);
            if (diff > 0) {
                delta.put(name, diff);
            }
        });
        return new NormalizationStatistics(totalNormalized - earlier.getTotalNormalized(), delta, configuration);
    }
}
