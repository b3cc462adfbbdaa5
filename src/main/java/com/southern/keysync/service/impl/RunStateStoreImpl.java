package com.southern.keysync.service.impl;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.TypeReference;
import com.github.pagehelper.PageHelper;
import com.github.pagehelper.PageInfo;
import com.southern.keysync.common.enums.ExecutionMode;
import com.southern.keysync.common.enums.MasterKeyStatus;
import com.southern.keysync.common.enums.RunMode;
import com.southern.keysync.common.enums.RunStatus;
import com.southern.keysync.mapper.AuditLogMapper;
import com.southern.keysync.mapper.KeyTrackingMapper;
import com.southern.keysync.mapper.MasterKeyRegistryMapper;
import com.southern.keysync.mapper.ReconciliationRunMapper;
import com.southern.keysync.pojo.entity.AuditEvent;
import com.southern.keysync.pojo.entity.KeyTrackingEntry;
import com.southern.keysync.pojo.entity.MasterKeyRecord;
import com.southern.keysync.pojo.entity.ReconciliationRun;
import com.southern.keysync.pojo.model.CheckpointEntry;
import com.southern.keysync.service.RunStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
public class RunStateStoreImpl implements RunStateStore {

    /**
     * 单条 INSERT 的行数上限，避免超过 SQLite 的参数个数限制
     */
    static final int TRACKING_CHUNK_SIZE = 500;

    @Autowired
    private ReconciliationRunMapper runMapper;

    @Autowired
    private MasterKeyRegistryMapper masterKeyMapper;

    @Autowired
    private KeyTrackingMapper keyTrackingMapper;

    @Autowired
    private AuditLogMapper auditLogMapper;

    @Override
    public Long startRun(RunMode mode, ExecutionMode executionMode, Map<String, Object> configSnapshot) {
        ReconciliationRun run = ReconciliationRun.builder()
                .runTimestamp(LocalDateTime.now())
                .runMode(mode.getValue())
                .executionMode(executionMode.getValue())
                .status(RunStatus.RUNNING.getValue())
                .configSnapshot(configSnapshot == null ? null : JSON.toJSONString(configSnapshot))
                .build();
        runMapper.insertRun(run);
        log.info("Started reconciliation run {} ({}, {})", run.getRunId(), mode.getValue(), executionMode.getValue());
        return run.getRunId();
    }

    @Override
    public void completeRun(Long runId, Map<String, Object> stats, String errorMessage) {
        RunStatus status = errorMessage == null ? RunStatus.COMPLETED : RunStatus.FAILED;
        int updated = runMapper.completeRun(runId, status.getValue(),
                stats == null ? null : JSON.toJSONString(stats),
                errorMessage, LocalDateTime.now());
        if (updated == 0) {
            throw new IllegalStateException("Run " + runId + " does not exist or has already finished");
        }
        log.info("Completed reconciliation run {} with status: {}", runId, status.getValue());
    }

    @Override
    public void saveCheckpoint(Long runId, Map<String, CheckpointEntry> checkpoints) {
        runMapper.updateCheckpointData(runId, JSON.toJSONString(checkpoints));
    }

    @Override
    public Map<String, CheckpointEntry> getCheckpoints(Long runId) {
        ReconciliationRun run = runMapper.selectById(runId);
        if (run == null || run.getCheckpointData() == null) {
            return new LinkedHashMap<>();
        }
        return JSON.parseObject(run.getCheckpointData(),
                new TypeReference<LinkedHashMap<String, CheckpointEntry>>() {
                });
    }

    @Override
    @Transactional
    public int trackKeys(Long runId, List<KeyTrackingEntry> entries) {
        LocalDateTime now = LocalDateTime.now();
        List<KeyTrackingEntry> chunk = new ArrayList<>(TRACKING_CHUNK_SIZE);
        int written = 0;
        for (KeyTrackingEntry entry : entries) {
            entry.setRunId(runId);
            entry.setFirstSeenAt(now);
            entry.setLastSeenAt(now);
            chunk.add(entry);
            if (chunk.size() == TRACKING_CHUNK_SIZE) {
                keyTrackingMapper.upsertBatch(chunk);
                written += chunk.size();
                chunk = new ArrayList<>(TRACKING_CHUNK_SIZE);
            }
        }
        if (!chunk.isEmpty()) {
            keyTrackingMapper.upsertBatch(chunk);
            written += chunk.size();
        }
        log.debug("Tracked {} keys for run {}", written, runId);
        return written;
    }

    @Override
    public void logEvent(Long runId, String eventType, Map<String, Object> details) {
        logEvent(runId, eventType, details, null, null, null, null);
    }

    @Override
    public void logEvent(Long runId, String eventType, Map<String, Object> details,
                         String system, String key, String action, String result) {
        AuditEvent event = AuditEvent.builder()
                .timestamp(LocalDateTime.now())
                .runId(runId)
                .eventType(eventType)
                .eventDetails(details == null ? null : JSON.toJSONString(details))
                .systemName(system)
                .keyValue(key)
                .actionTaken(action)
                .result(result)
                .build();
        auditLogMapper.insertEvent(event);
    }

    @Override
    public Long proposeMasterKey(MasterKeyRecord record) {
        record.setStatus(MasterKeyStatus.PROPOSED.getValue());
        record.setCreatedAt(LocalDateTime.now());
        masterKeyMapper.insertMasterKey(record);
        log.debug("Proposed master key: {} for run {}", record.getMasterKey(), record.getRunId());
        return record.getMasterKeyId();
    }

    @Override
    public int activateMasterKeys(Long runId) {
        int count = masterKeyMapper.activateProposedForRun(runId, LocalDateTime.now());
        log.info("Activated {} master keys for run {}", count, runId);
        return count;
    }

    @Override
    public boolean deprecateMasterKey(Long masterKeyId) {
        boolean deprecated = masterKeyMapper.deprecate(masterKeyId, LocalDateTime.now()) > 0;
        if (deprecated) {
            log.info("Deprecated master key {}", masterKeyId);
        }
        return deprecated;
    }

    @Override
    public List<MasterKeyRecord> getMasterKeys(MasterKeyStatus status) {
        return masterKeyMapper.selectByStatus(status == null ? null : status.getValue());
    }

    @Override
    public List<MasterKeyRecord> getMasterKeysForRun(Long runId) {
        return masterKeyMapper.selectByRunId(runId);
    }

    @Override
    public MasterKeyRecord getMasterKey(Long masterKeyId) {
        return masterKeyMapper.selectById(masterKeyId);
    }

    @Override
    public Set<String> getReservedNormalizedKeys() {
        return new LinkedHashSet<>(masterKeyMapper.selectReservedNormalizedKeys());
    }

    @Override
    public boolean existsMasterKey(String masterKey) {
        return masterKeyMapper.countByMasterKey(masterKey) > 0;
    }

    @Override
    public ReconciliationRun getLastSuccessfulRun() {
        return runMapper.selectLastSuccessful();
    }

    @Override
    public ReconciliationRun getRun(Long runId) {
        return runMapper.selectById(runId);
    }

    @Override
    public PageInfo<ReconciliationRun> listRuns(int page, int size) {
        PageHelper.startPage(page, size);
        List<ReconciliationRun> runs = runMapper.selectAll();
        return new PageInfo<>(runs);
    }

    @Override
    public PageInfo<AuditEvent> getAuditEvents(Long runId, int page, int size) {
        PageHelper.startPage(page, size);
        List<AuditEvent> events = auditLogMapper.selectByRunId(runId);
        return new PageInfo<>(events);
    }

    @Override
    public List<AuditEvent> getAuditEvents(Long runId) {
        return auditLogMapper.selectByRunId(runId);
    }

    @Override
    public List<KeyTrackingEntry> getTrackedKeys(String system) {
        return keyTrackingMapper.selectBySystem(system);
    }

    @Override
    public Map<String, Integer> getStatistics() {
        Map<String, Integer> stats = new LinkedHashMap<>();
        for (RunStatus status : RunStatus.values()) {
            stats.put(status.getValue() + "_runs", runMapper.countByStatus(status.getValue()));
        }
        for (MasterKeyStatus status : MasterKeyStatus.values()) {
            stats.put(status.getValue() + "_master_keys", masterKeyMapper.countByStatus(status.getValue()));
        }
        stats.put("tracked_keys", keyTrackingMapper.countAll());
        return stats;
    }
}
