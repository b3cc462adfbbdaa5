package com.southern.keysync.service;

import com.southern.keysync.analysis.DiscrepancyReport;
import com.southern.keysync.analysis.IncrementalChanges;
import com.southern.keysync.common.enums.ExecutionMode;
import com.southern.keysync.common.enums.RunMode;
import com.southern.keysync.compare.ComparisonResult;
import com.southern.keysync.pojo.dto.ProposedMasterKey;
import com.southern.keysync.pojo.model.ErrorSummary;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 一次成功运行的完整结果
 */
@Value
@Builder
public class ReconciliationOutcome {
    Long runId;
    RunMode mode;
    ExecutionMode executionMode;
    ComparisonResult comparison;
    DiscrepancyReport discrepancies;
    List<ProposedMasterKey> proposedKeys;
    int activatedKeys;
    int trackedKeys;
    /**
     * 非增量模式或没有基线时为 null
     */
    IncrementalChanges incrementalChanges;
    ErrorSummary errorSummary;
    /**
     * 写入 reconciliation_runs.stats_json 的内容
     */
    Map<String, Object> stats;
}
