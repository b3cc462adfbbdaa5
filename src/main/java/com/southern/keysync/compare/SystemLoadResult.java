package com.southern.keysync.compare;

import com.southern.keysync.pojo.model.ErrorRecord;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 单个工作线程的局部结果，在所有任务结束后由 SystemComparator 合并
 */
@Getter
@AllArgsConstructor
class SystemLoadResult {
    private final String system;
    private final String file;
    private final Map<String, Set<String>> normalized;
    private final Map<String, Set<String>> duplicates;
    private final long keysProcessed;
    private final List<ErrorRecord> errors;
}
