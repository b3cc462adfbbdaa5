package com.southern.keysync.analysis;

import com.alibaba.fastjson2.JSON;
import com.southern.keysync.compare.ComparisonResult;
import com.southern.keysync.pojo.entity.ReconciliationRun;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;

class IncrementalChangeCalculatorTest {

    private final IncrementalChangeCalculator calculator = new IncrementalChangeCalculator();

    private static Set<String> set(String... values) {
        return new TreeSet<>(Arrays.asList(values));
    }

    private static ComparisonResult comparison(Set<String> all, Set<String> inAll) {
        return ComparisonResult.builder()
                .authoritySystem("A")
                .authorityPresent(true)
                .allKeys(all)
                .keysInAllSystems(inAll)
                .build();
    }

    private ReconciliationRun baseline(Long runId, ComparisonResult prior) {
        Map<String, Object> stats = Collections.singletonMap(
                IncrementalChangeCalculator.SNAPSHOT_KEY, calculator.snapshot(prior));
        return ReconciliationRun.builder().runId(runId).statsJson(JSON.toJSONString(stats)).build();
    }

    @Test
    void diffsAgainstBaselineSnapshot() {
        ComparisonResult prior = comparison(set("K1", "K2", "K3", "K4"), set("K1", "K2"));
        ComparisonResult current = comparison(set("K1", "K2", "K4", "K5"), set("K1", "K4"));

        IncrementalChanges changes = calculator.calculate(current, baseline(3L, prior));

        assertThat(changes.getBaselineRunId()).isEqualTo(3L);
        assertThat(changes.getNewKeys()).containsExactly("K5");
        assertThat(changes.getRemovedKeys()).containsExactly("K3");
        assertThat(changes.getNewlySynchronized()).containsExactly("K4");
        assertThat(changes.getNewlyDiverged()).containsExactly("K2");
    }

    @Test
    void removedKeysAreNotReportedAsDiverged() {
        ComparisonResult prior = comparison(set("K1", "K2"), set("K1", "K2"));
        ComparisonResult current = comparison(set("K1"), set("K1"));

        IncrementalChanges changes = calculator.calculate(current, baseline(1L, prior));

        assertThat(changes.getRemovedKeys()).containsExactly("K2");
        assertThat(changes.getNewlyDiverged()).isEmpty();
    }

    @Test
    void noBaselineMeansNoChanges() {
        ComparisonResult current = comparison(set("K1"), set("K1"));

        assertThat(calculator.calculate(current, null)).isNull();
        assertThat(calculator.calculate(current, ReconciliationRun.builder().runId(1L).build())).isNull();
        assertThat(calculator.calculate(current, ReconciliationRun.builder().runId(1L).statsJson("{}").build())).isNull();
    }
}
