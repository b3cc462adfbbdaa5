package com.southern.keysync.service.impl;

import com.alibaba.fastjson2.JSON;
import com.github.pagehelper.PageInfo;
import com.southern.keysync.analysis.IncrementalChangeCalculator;
import com.southern.keysync.common.enums.ExecutionMode;
import com.southern.keysync.common.enums.RunMode;
import com.southern.keysync.common.exception.BusinessException;
import com.southern.keysync.config.KeySyncProperties;
import com.southern.keysync.normalize.KeyNormalizer;
import com.southern.keysync.pojo.dto.RunRequest;
import com.southern.keysync.pojo.entity.AuditEvent;
import com.southern.keysync.pojo.entity.ReconciliationRun;
import com.southern.keysync.pojo.model.CheckpointEntry;
import com.southern.keysync.pojo.vo.ReconciliationRunVO;
import com.southern.keysync.pojo.vo.RunResultVO;
import com.southern.keysync.service.MasterKeyProvisioner;
import com.southern.keysync.service.ReconciliationOrchestrator;
import com.southern.keysync.service.ReconciliationOutcome;
import com.southern.keysync.service.ReconciliationService;
import com.southern.keysync.service.RunStateStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class ReconciliationServiceImpl implements ReconciliationService {

    @Autowired
    private ReconciliationOrchestrator orchestrator;

    @Autowired
    private RunStateStore runStateStore;

    @Autowired
    private MasterKeyProvisioner provisioner;

    @Autowired
    private KeyNormalizer normalizer;

    @Autowired
    private KeySyncProperties properties;

    @Override
    public RunResultVO runReconciliation(RunRequest request) {
        RunRequest req = request != null ? request : new RunRequest();
        RunMode mode = req.getMode() == null
                ? properties.getProcessing().getMode() : RunMode.fromValue(req.getMode());
        ExecutionMode executionMode;
        if (req.getExecutionMode() != null) {
            executionMode = ExecutionMode.fromValue(req.getExecutionMode());
        } else {
            executionMode = properties.getProvisioning().isAutoApprove() ? ExecutionMode.AUTO_APPROVE : ExecutionMode.NORMAL;
        }

        ReconciliationOutcome outcome = orchestrator.reconcile(mode, executionMode, req.getSystemFiles());
        return RunResultVO.builder()
                .runId(outcome.getRunId())
                .mode(outcome.getMode().getValue())
                .executionMode(outcome.getExecutionMode().getValue())
                .statistics(outcome.getComparison().getStatistics())
                .discrepancySummary(outcome.getDiscrepancies().getSummary())
                .proposedKeys(outcome.getProposedKeys())
                .activatedKeys(outcome.getActivatedKeys())
                .trackedKeys(outcome.getTrackedKeys())
                .incrementalChanges(outcome.getIncrementalChanges())
                .errorSummary(outcome.getErrorSummary())
                .failedSystems(outcome.getComparison().getFailedSystems())
                .build();
    }

    @Override
    public PageInfo<ReconciliationRunVO> listRuns(int page, int size) {
        PageInfo<ReconciliationRun> runs = runStateStore.listRuns(page, size);
        List<ReconciliationRunVO> list = runs.getList().stream()
                .map(ReconciliationServiceImpl::toVO)
                .collect(Collectors.toList());
        PageInfo<ReconciliationRunVO> result = new PageInfo<>(list);
        result.setPageNum(runs.getPageNum());
        result.setPageSize(runs.getPageSize());
        result.setTotal(runs.getTotal());
        result.setPages(runs.getPages());
        return result;
    }

    @Override
    public ReconciliationRunVO getRun(Long runId) {
        ReconciliationRun run = runStateStore.getRun(runId);
        if (run == null) {
            throw new BusinessException("Run not found: " + runId);
        }
        return toVO(run);
    }

    @Override
    public ReconciliationRunVO getLastSuccessfulRun() {
        ReconciliationRun run = runStateStore.getLastSuccessfulRun();
        return run == null ? null : toVO(run);
    }

    @Override
    public PageInfo<AuditEvent> getAuditEvents(Long runId, int page, int size) {
        if (runStateStore.getRun(runId) == null) {
            throw new BusinessException("Run not found: " + runId);
        }
        return runStateStore.getAuditEvents(runId, page, size);
    }

    @Override
    public CheckpointEntry getLatestCheckpoint(Long runId) {
        return orchestrator.getLatestCheckpoint(runId);
    }

    @Override
    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("store", runStateStore.getStatistics());
        stats.put("provisioning", provisioner.getStatistics());
        stats.put("normalization", normalizer.getStatistics());
        return stats;
    }

    /**
     * stats 中的键快照只给增量对比用，不返回给接口
     */
    private static ReconciliationRunVO toVO(ReconciliationRun run) {
        Map<String, Object> stats = run.getStatsJson() == null ? null : JSON.parseObject(run.getStatsJson());
        if (stats != null) {
            stats.remove(IncrementalChangeCalculator.SNAPSHOT_KEY);
        }
        Map<String, Object> config = run.getConfigSnapshot() == null ? null : JSON.parseObject(run.getConfigSnapshot());
        return ReconciliationRunVO.builder()
                .runId(run.getRunId())
                .runTimestamp(run.getRunTimestamp())
                .runMode(run.getRunMode())
                .executionMode(run.getExecutionMode())
                .status(run.getStatus())
                .errorMessage(run.getErrorMessage())
                .completedAt(run.getCompletedAt())
                .config(config)
                .stats(stats)
                .build();
    }
}
