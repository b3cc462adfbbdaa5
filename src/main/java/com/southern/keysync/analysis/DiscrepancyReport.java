package com.southern.keysync.analysis;

import com.southern.keysync.pojo.dto.SystemKeyRef;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Value
@Builder
public class DiscrepancyReport {

    /**
     * 归一化键 -> 出现的 (系统, 原始键)，按系统、原始键排序，直接交给 MasterKeyProvisioner
     */
    Map<String, List<SystemKeyRef>> outOfAuthority;

    List<Discrepancy.PropagationGap> propagationGaps;

    List<Discrepancy.DuplicateGroup> duplicateGroups;

    DiscrepancySummary summary;

    public boolean hasOutOfAuthority() {
        return !outOfAuthority.isEmpty();
    }

    public List<Discrepancy.OutOfAuthority> outOfAuthorityDiscrepancies() {
        return outOfAuthority.entrySet().stream()
                .map(e -> new Discrepancy.OutOfAuthority(e.getKey(), e.getValue()))
                .collect(Collectors.toList());
    }
}
