package com.southern.keysync.compare;

import com.southern.keysync.pojo.model.ErrorRecord;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 一次对账的比较快照，构建后不再修改
 * 所有集合按键排序，与线程完成顺序、批大小无关
 */
@Value
@Builder
public class ComparisonResult {

    String authoritySystem;

    /**
     * 权威系统缺失时为 false，此时比较字段全部为空
     */
    boolean authorityPresent;

    /**
     * 系统 -> (归一化键 -> 原始键集合)
     */
    Map<String, Map<String, Set<String>>> systemKeys;

    Set<String> allKeys;

    Set<String> keysOnlyInAuthority;

    Set<String> keysMissingInAuthority;

    Set<String> keysInAllSystems;

    /**
     * 依赖系统 -> A 中有而该系统没有的键
     */
    Map<String, Set<String>> systemGaps;

    /**
     * 系统 -> (归一化键 -> 多个原始键)
     */
    Map<String, Map<String, Set<String>>> duplicates;

    ComparisonStatistics statistics;

    List<ErrorRecord> loadErrors;

    Set<String> failedSystems;

    /**
     * 加载操作名 -> 失败的读取次数
     */
    Map<String, Integer> recoveryAttempts;
}
