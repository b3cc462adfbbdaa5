package com.southern.keysync.analysis;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.southern.keysync.compare.ComparisonResult;
import com.southern.keysync.pojo.entity.ReconciliationRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 增量模式：用上一次成功运行 stats 中保存的键快照做差集
 */
@Slf4j
@Component
public class IncrementalChangeCalculator {

    public static final String SNAPSHOT_KEY = "comparisonSnapshot";
    static final String ALL_KEYS = "allKeys";
    static final String KEYS_IN_ALL_SYSTEMS = "keysInAllSystems";

    /**
     * 写入运行 stats 的快照，供下一次增量运行使用
     */
    public Map<String, Object> snapshot(ComparisonResult comparison) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put(ALL_KEYS, new ArrayList<>(comparison.getAllKeys()));
        snapshot.put(KEYS_IN_ALL_SYSTEMS, new ArrayList<>(comparison.getKeysInAllSystems()));
        return snapshot;
    }

    /**
     * @return 没有可用的基线时返回 null
     */
    public IncrementalChanges calculate(ComparisonResult current, ReconciliationRun baseline) {
        if (baseline == null) {
            log.info("No previous successful run - incremental changes unavailable");
            return null;
        }
        JSONObject snapshot = readSnapshot(baseline);
        if (snapshot == null) {
            log.info("Run {} has no comparison snapshot - incremental changes unavailable", baseline.getRunId());
            return null;
        }
        log.info("Calculating incremental changes from run {}", baseline.getRunId());

        Set<String> priorAll = toSet(snapshot.getJSONArray(ALL_KEYS));
        Set<String> priorInAll = toSet(snapshot.getJSONArray(KEYS_IN_ALL_SYSTEMS));
        Set<String> currentAll = current.getAllKeys();
        Set<String> currentInAll = current.getKeysInAllSystems();

        Set<String> newKeys = difference(currentAll, priorAll);
        Set<String> removedKeys = difference(priorAll, currentAll);
        Set<String> newlySynchronized = difference(currentInAll, priorInAll);
        Set<String> newlyDiverged = difference(priorInAll, currentInAll);
        newlyDiverged.retainAll(currentAll);

        return IncrementalChanges.builder()
                .baselineRunId(baseline.getRunId())
                .newKeys(Collections.unmodifiableSet(newKeys))
                .removedKeys(Collections.unmodifiableSet(removedKeys))
                .newlySynchronized(Collections.unmodifiableSet(newlySynchronized))
                .newlyDiverged(Collections.unmodifiableSet(newlyDiverged))
                .build();
    }

    private JSONObject readSnapshot(ReconciliationRun run) {
        if (run.getStatsJson() == null) {
            return null;
        }
        JSONObject stats = JSON.parseObject(run.getStatsJson());
        return stats == null ? null : stats.getJSONObject(SNAPSHOT_KEY);
    }

    private static Set<String> toSet(JSONArray array) {
        Set<String> set = new TreeSet<>();
        if (array != null) {
            set.addAll(array.toJavaList(String.class));
        }
        return set;
    }

    private static Set<String> difference(Collection<String> left, Collection<String> right) {
        Set<String> result = new TreeSet<>(left);
        result.removeAll(right);
        return result;
    }
}
