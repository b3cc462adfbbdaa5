package com.southern.keysync.analysis;

import com.southern.keysync.compare.ComparisonResult;
import com.southern.keysync.pojo.dto.SystemKeyRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 把比较结果拆成三类差异并汇总
 */
@Slf4j
@Component
public class DiscrepancyAnalyzer {

    public DiscrepancyReport analyze(ComparisonResult comparison) {
        String authority = comparison.getAuthoritySystem();
        Map<String, Map<String, Set<String>>> systemKeys = comparison.getSystemKeys();

        Map<String, List<SystemKeyRef>> outOfAuthority = new TreeMap<>();
        for (String normalizedKey : comparison.getKeysMissingInAuthority()) {
            List<SystemKeyRef> refs = new ArrayList<>();
            // systemKeys 是 TreeMap，原始键是 TreeSet，结果天然有序
            systemKeys.forEach((system, keys) -> {
                if (system.equals(authority)) {
                    return;
                }
                Set<String> rawKeys = keys.get(normalizedKey);
                if (rawKeys != null) {
                    rawKeys.forEach(raw -> refs.add(new SystemKeyRef(system, raw)));
                }
            });
            if (!refs.isEmpty()) {
                outOfAuthority.put(normalizedKey, Collections.unmodifiableList(refs));
            }
        }

        List<Discrepancy.PropagationGap> gaps = new ArrayList<>();
        Map<String, Integer> gapsBySystem = new TreeMap<>();
        Set<String> affected = new TreeSet<>();
        comparison.getSystemGaps().forEach((system, missing) -> {
            if (missing.isEmpty()) {
                return;
            }
            missing.forEach(key -> gaps.add(new Discrepancy.PropagationGap(system, key)));
            gapsBySystem.put(system, missing.size());
            affected.add(system);
        });

        List<Discrepancy.DuplicateGroup> duplicates = new ArrayList<>();
        comparison.getDuplicates().forEach((system, groups) -> {
            groups.forEach((key, rawKeys) -> duplicates.add(new Discrepancy.DuplicateGroup(system, key, rawKeys)));
            if (!groups.isEmpty()) {
                affected.add(system);
            }
        });

        outOfAuthority.values().forEach(refs -> refs.forEach(ref -> affected.add(ref.getSystem())));

        DiscrepancySummary summary = DiscrepancySummary.builder()
                .totalOutOfAuthority(outOfAuthority.size())
                .totalPropagationGaps(gaps.size())
                .totalDuplicateGroups(duplicates.size())
                .gapsBySystem(Collections.unmodifiableMap(gapsBySystem))
                .affectedSystems(Collections.unmodifiableSet(affected))
                .build();

        log.info("Discrepancy analysis complete: {} out-of-authority, {} propagation gaps, {} duplicate groups",
                summary.getTotalOutOfAuthority(), summary.getTotalPropagationGaps(), summary.getTotalDuplicateGroups());

        return DiscrepancyReport.builder()
                .outOfAuthority(Collections.unmodifiableMap(outOfAuthority))
                .propagationGaps(Collections.unmodifiableList(gaps))
                .duplicateGroups(Collections.unmodifiableList(duplicates))
                .summary(summary)
                .build();
    }
}
