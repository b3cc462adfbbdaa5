package com.southern.keysync.service;

import com.southern.keysync.analysis.DiscrepancyAnalyzer;
import com.southern.keysync.analysis.DiscrepancyReport;
import com.southern.keysync.analysis.IncrementalChangeCalculator;
import com.southern.keysync.analysis.IncrementalChanges;
import com.southern.keysync.common.enums.ExecutionMode;
import com.southern.keysync.common.enums.RunMode;
import com.southern.keysync.common.exception.BusinessException;
import com.southern.keysync.common.exception.SystemUnavailableException;
import com.southern.keysync.compare.ComparisonResult;
import com.southern.keysync.compare.SystemComparator;
import com.southern.keysync.config.KeySyncProperties;
import com.southern.keysync.normalize.KeyNormalizer;
import com.southern.keysync.normalize.NormalizationStatistics;
import com.southern.keysync.pojo.dto.ProposedMasterKey;
import com.southern.keysync.pojo.entity.AuditEvent;
import com.southern.keysync.pojo.entity.KeyTrackingEntry;
import com.southern.keysync.pojo.model.CheckpointEntry;
import com.southern.keysync.pojo.model.ErrorRecord;
import com.southern.keysync.pojo.model.ErrorSummary;
import com.southern.keysync.pojo.model.ProvisioningStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 一次对账的完整流程：
 * 开始运行 -> 比较 -> 差异分析 -> 键追踪 -> 主键提议/激活 -> 增量对比 -> 结束运行
 * 每次调用的中间状态都是局部变量，可以被不同线程调用
 */
@Slf4j
@Service
public class ReconciliationOrchestrator {

    public static final String CHECKPOINT_COMPARISON = "comparison_complete";
    public static final String CHECKPOINT_DISCREPANCY = "discrepancy_analysis_complete";

    private final KeySyncProperties properties;
    private final SystemComparator comparator;
    private final DiscrepancyAnalyzer discrepancyAnalyzer;
    private final MasterKeyProvisioner provisioner;
    private final IncrementalChangeCalculator incrementalChangeCalculator;
    private final RunStateStore store;
    private final ErrorPolicyHandler errorPolicyHandler;
    private final KeyNormalizer normalizer;

    public ReconciliationOrchestrator(KeySyncProperties properties,
                                      SystemComparator comparator,
                                      DiscrepancyAnalyzer discrepancyAnalyzer,
                                      MasterKeyProvisioner provisioner,
                                      IncrementalChangeCalculator incrementalChangeCalculator,
                                      RunStateStore store,
                                      ErrorPolicyHandler errorPolicyHandler,
                                      KeyNormalizer normalizer) {
        this.properties = properties;
        this.comparator = comparator;
        this.discrepancyAnalyzer = discrepancyAnalyzer;
        this.provisioner = provisioner;
        this.incrementalChangeCalculator = incrementalChangeCalculator;
        this.store = store;
        this.errorPolicyHandler = errorPolicyHandler;
        this.normalizer = normalizer;
    }

    /**
     * 使用配置的 keysync.sources 运行
     */
    public ReconciliationOutcome reconcile(RunMode mode, ExecutionMode executionMode) {
        return reconcile(mode, executionMode, null);
    }

    /**
     * @param systemFiles 系统名 -> 文件路径，为空时使用 keysync.sources
     */
    public ReconciliationOutcome reconcile(RunMode mode, ExecutionMode executionMode, Map<String, String> systemFiles) {
        RunMode runMode = mode != null ? mode : properties.getProcessing().getMode();
        ExecutionMode execMode = executionMode != null ? executionMode : ExecutionMode.NORMAL;
        Map<String, String> files = systemFiles == null || systemFiles.isEmpty()
                ? properties.getSources() : systemFiles;
        if (files == null || files.isEmpty()) {
            throw new BusinessException("No system files configured");
        }

        Long runId = store.startRun(runMode, execMode, configSnapshot(files));
        Map<String, Object> startDetails = new LinkedHashMap<>();
        startDetails.put("mode", runMode.getValue());
        startDetails.put("executionMode", execMode.getValue());
        startDetails.put("systems", new ArrayList<>(files.keySet()));
        store.logEvent(runId, AuditEvent.RUN_STARTED, startDetails);

        try {
            return execute(runId, runMode, execMode, files);
        } catch (RuntimeException e) {
            log.error("Reconciliation run {} failed: {}", runId, e.getMessage(), e);
            markFailed(runId, e);
            throw e;
        }
    }

    private ReconciliationOutcome execute(Long runId, RunMode mode, ExecutionMode executionMode,
                                          Map<String, String> files) {
        Map<String, CheckpointEntry> checkpoints = new LinkedHashMap<>();
        // 计数器是进程内累计的，运行记录只保存本次的增量
        NormalizationStatistics normalizationBefore = normalizer.getStatistics();
        ProvisioningStatistics provisioningBefore = provisioner.getStatistics();

        log.info("Starting system comparison for run {}", runId);
        ComparisonResult comparison = comparator.compareAll(files);
        if (!comparison.isAuthorityPresent()) {
            throw new SystemUnavailableException("System " + comparison.getAuthoritySystem()
                    + " data not found - cannot perform comparison");
        }
        saveCheckpoint(runId, checkpoints, CHECKPOINT_COMPARISON, "ComparisonResult", comparison.getAllKeys().size());

        DiscrepancyReport report = discrepancyAnalyzer.analyze(comparison);
        saveCheckpoint(runId, checkpoints, CHECKPOINT_DISCREPANCY, "DiscrepancyReport",
                report.getSummary().getTotalOutOfAuthority()
                        + report.getSummary().getTotalPropagationGaps()
                        + report.getSummary().getTotalDuplicateGroups());

        int tracked = trackKeys(runId, comparison);
        Map<String, Object> trackedDetails = new LinkedHashMap<>();
        trackedDetails.put("count", tracked);
        store.logEvent(runId, AuditEvent.KEYS_TRACKED, trackedDetails);

        List<ProposedMasterKey> proposed = Collections.emptyList();
        int activated = 0;
        if (report.hasOutOfAuthority()) {
            log.info("Provisioning master keys for {} out-of-authority keys", report.getOutOfAuthority().size());
            proposed = provisioner.propose(runId, report.getOutOfAuthority());
            for (ProposedMasterKey key : proposed) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("normalizedKey", key.getNormalizedKey());
                details.put("strategy", key.getStrategy());
                details.put("affectedSystems", key.getAffectedSystems());
                store.logEvent(runId, AuditEvent.MASTER_KEY_PROPOSED, details,
                        key.getSourceSystem(), key.getMasterKey(), "propose", "proposed");
            }
            Map<String, Object> proposedDetails = new LinkedHashMap<>();
            proposedDetails.put("count", proposed.size());
            store.logEvent(runId, AuditEvent.MASTER_KEYS_PROPOSED, proposedDetails);

            if (executionMode == ExecutionMode.AUTO_APPROVE) {
                activated = provisioner.activate(runId, true);
                Map<String, Object> activatedDetails = new LinkedHashMap<>();
                activatedDetails.put("count", activated);
                store.logEvent(runId, AuditEvent.MASTER_KEYS_ACTIVATED, activatedDetails);
            }
        }

        IncrementalChanges changes = null;
        if (mode == RunMode.INCREMENTAL) {
            changes = incrementalChangeCalculator.calculate(comparison, store.getLastSuccessfulRun());
            store.logEvent(runId, AuditEvent.INCREMENTAL_CHANGES, incrementalDetails(changes));
        }

        ErrorSummary errorSummary = errorPolicyHandler.summarize(comparison.getLoadErrors(),
                comparison.getRecoveryAttempts());
        for (ErrorRecord error : comparison.getLoadErrors()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("file", error.getFile());
            details.put("row", error.getRow());
            details.put("error", error.getError());
            store.logEvent(runId, AuditEvent.LOAD_ERROR, details,
                    error.getSystem(), null, error.getAction(), error.getType());
        }

        Map<String, Object> provisioning = new LinkedHashMap<>();
        provisioning.put("proposed", proposed.size());
        provisioning.put("activated", activated);
        provisioning.put("statistics", provisioner.getStatistics().since(provisioningBefore));

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("comparison", comparison.getStatistics());
        stats.put("discrepancies", report.getSummary());
        stats.put("provisioning", provisioning);
        stats.put("trackedKeys", tracked);
        stats.put("errors", errorSummary);
        stats.put("failedSystems", comparison.getFailedSystems());
        stats.put("normalization", normalizer.getStatistics().since(normalizationBefore));
        if (changes != null) {
            stats.put("incrementalChanges", incrementalDetails(changes));
        }
        stats.put(IncrementalChangeCalculator.SNAPSHOT_KEY, incrementalChangeCalculator.snapshot(comparison));

        store.completeRun(runId, stats, null);
        store.logEvent(runId, AuditEvent.RECONCILIATION_COMPLETE, null, null, null, null, "success");
        log.info("Reconciliation run {} complete: {} unique keys, {} proposed, {} activated",
                runId, comparison.getAllKeys().size(), proposed.size(), activated);

        return ReconciliationOutcome.builder()
                .runId(runId)
                .mode(mode)
                .executionMode(executionMode)
                .comparison(comparison)
                .discrepancies(report)
                .proposedKeys(proposed)
                .activatedKeys(activated)
                .trackedKeys(tracked)
                .incrementalChanges(changes)
                .errorSummary(errorSummary)
                .stats(stats)
                .build();
    }

    /**
     * 最近一个合法检查点，只用于排查，不会据此恢复运行
     */
    public CheckpointEntry getLatestCheckpoint(Long runId) {
        if (store.getRun(runId) == null) {
            throw new BusinessException("Run not found: " + runId);
        }
        return errorPolicyHandler.latestValidCheckpoint(store.getCheckpoints(runId));
    }

    private int trackKeys(Long runId, ComparisonResult comparison) {
        List<KeyTrackingEntry> entries = new ArrayList<>();
        comparison.getSystemKeys().forEach((system, keys) ->
                keys.forEach((normalizedKey, rawKeys) -> {
                    for (String raw : rawKeys) {
                        entries.add(KeyTrackingEntry.builder()
                                .systemName(system)
                                .keyValue(raw)
                                .normalizedKey(normalizedKey)
                                .build());
                    }
                }));
        int tracked = store.trackKeys(runId, entries);
        log.info("Tracked {} keys for temporal analysis", tracked);
        return tracked;
    }

    private void saveCheckpoint(Long runId, Map<String, CheckpointEntry> checkpoints,
                                String stage, String dataType, long size) {
        checkpoints.put(stage, CheckpointEntry.builder()
                .stage(stage)
                .timestamp(LocalDateTime.now().toString())
                .dataType(dataType)
                .size(size)
                .build());
        store.saveCheckpoint(runId, checkpoints);
        log.debug("Checkpoint saved: {}", stage);
    }

    private void markFailed(Long runId, RuntimeException cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        try {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("error", message);
            store.logEvent(runId, AuditEvent.RECONCILIATION_FAILED, details, null, null, null, "failure");
            store.completeRun(runId, null, message);
        } catch (RuntimeException e) {
            log.error("Could not record failure of run {}: {}", runId, e.getMessage(), e);
            cause.addSuppressed(e);
        }
    }

    private Map<String, Object> configSnapshot(Map<String, String> files) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("systemFiles", new LinkedHashMap<>(files));
        snapshot.put("authoritySystem", properties.getAuthoritySystem());
        snapshot.put("normalize", properties.getNormalize());
        snapshot.put("provisioning", properties.getProvisioning());
        snapshot.put("processing", properties.getProcessing());
        snapshot.put("errorHandling", properties.getErrorHandling());
        return snapshot;
    }

    private static Map<String, Object> incrementalDetails(IncrementalChanges changes) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (changes == null) {
            details.put("baselineRunId", null);
            details.put("available", false);
            return details;
        }
        details.put("baselineRunId", changes.getBaselineRunId());
        details.put("available", true);
        details.put("newKeys", counted(changes.getNewKeys()));
        details.put("removedKeys", counted(changes.getRemovedKeys()));
        details.put("newlySynchronized", counted(changes.getNewlySynchronized()));
        details.put("newlyDiverged", counted(changes.getNewlyDiverged()));
        return details;
    }

    private static Map<String, Object> counted(Set<String> keys) {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("count", keys.size());
        value.put("keys", new ArrayList<>(keys));
        return value;
    }
}
