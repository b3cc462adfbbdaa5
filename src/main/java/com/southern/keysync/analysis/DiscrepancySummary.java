package com.southern.keysync.analysis;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Set;

@Value
@Builder
public class DiscrepancySummary {
    int totalOutOfAuthority;
    int totalPropagationGaps;
    int totalDuplicateGroups;
    /**
     * 系统 -> 缺失的键数
     */
    Map<String, Integer> gapsBySystem;
    Set<String> affectedSystems;
}
