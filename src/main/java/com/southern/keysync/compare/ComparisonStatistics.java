package com.southern.keysync.compare;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class ComparisonStatistics {
    int totalUniqueKeys;
    int keysInAuthority;
    int keysOnlyInAuthority;
    int keysMissingInAuthority;
    int keysInAllSystems;
    double matchPercentage;
    /**
     * 系统 -> 归一化后的键数
     */
    Map<String, Integer> systemCounts;
    /**
     * 系统 -> 重复组数
     */
    Map<String, Integer> duplicateGroupCounts;
    long totalKeysProcessed;
    List<String> systemsCompared;
    int errorCount;
}
