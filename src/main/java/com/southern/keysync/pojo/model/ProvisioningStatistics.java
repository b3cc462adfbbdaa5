package com.southern.keysync.pojo.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.TreeMap;

/**
 * 主键提议统计：provisioner 中为进程内累计值，运行记录中为该次运行的增量
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ProvisioningStatistics {
    private long keysProposed;
    private long keysActivated;
    private long keysSkipped;
    private long keysFailed;
    /**
     * 策略名 -> 使用次数
     */
    private Map<String, Long> strategyUsed;

    public ProvisioningStatistics since(ProvisioningStatistics earlier) {
        Map<String, Long> used = new TreeMap<>();
        strategyUsed.forEach((name, count) -> {
            long diff = count - earlier.getStrategyUsed().getOrDefault(name, 0L);
            if (diff > 0) {
                used.put(name, diff);
            }
        });
        return ProvisioningStatistics.builder()
                .keysProposed(keysProposed - earlier.getKeysProposed())
                .keysActivated(keysActivated - earlier.getKeysActivated())
                .keysSkipped(keysSkipped - earlier.getKeysSkipped())
                .keysFailed(keysFailed - earlier.getKeysFailed())
                .strategyUsed(used)
                .build();
    }
}
