package com.southern.keysync.service;

import com.github.pagehelper.PageInfo;
import com.southern.keysync.common.enums.ExecutionMode;
import com.southern.keysync.common.enums.MasterKeyStatus;
import com.southern.keysync.common.enums.RunMode;
import com.southern.keysync.pojo.entity.AuditEvent;
import com.southern.keysync.pojo.entity.KeyTrackingEntry;
import com.southern.keysync.pojo.entity.MasterKeyRecord;
import com.southern.keysync.pojo.entity.ReconciliationRun;
import com.southern.keysync.pojo.model.CheckpointEntry;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 持久化的运行状态：运行记录、主键注册表、键追踪、审计日志
 */
public interface RunStateStore {

    /**
     * 新建一条 running 状态的运行记录
     *
     * @return run_id
     */
    Long startRun(RunMode mode, ExecutionMode executionMode, Map<String, Object> configSnapshot);

    /**
     * 结束运行：errorMessage 为空则 completed，否则 failed
     * 运行不存在或已结束时抛出 IllegalStateException
     */
    void completeRun(Long runId, Map<String, Object> stats, String errorMessage);

    void saveCheckpoint(Long runId, Map<String, CheckpointEntry> checkpoints);

    /**
     * @return 按写入顺序排列的检查点，没有则为空 Map
     */
    Map<String, CheckpointEntry> getCheckpoints(Long runId);

    /**
     * 按 (system, normalized_key) 写入或更新 last_seen_at / run_id
     *
     * @return 写入的条数
     */
    int trackKeys(Long runId, List<KeyTrackingEntry> entries);

    void logEvent(Long runId, String eventType, Map<String, Object> details);

    void logEvent(Long runId, String eventType, Map<String, Object> details,
                  String system, String key, String action, String result);

    /**
     * @return 新主键的 id
     */
    Long proposeMasterKey(MasterKeyRecord record);

    /**
     * @return 被激活的主键数
     */
    int activateMasterKeys(Long runId);

    /**
     * @return 是否有主键被废弃，已废弃或不存在时返回 false
     */
    boolean deprecateMasterKey(Long masterKeyId);

    /**
     * @param status 为 null 时返回全部
     */
    List<MasterKeyRecord> getMasterKeys(MasterKeyStatus status);

    List<MasterKeyRecord> getMasterKeysForRun(Long runId);

    MasterKeyRecord getMasterKey(Long masterKeyId);

    Set<String> getReservedNormalizedKeys();

    boolean existsMasterKey(String masterKey);

    /**
     * @return 最近一次 completed 的运行，没有则为 null
     */
    ReconciliationRun getLastSuccessfulRun();

    ReconciliationRun getRun(Long runId);

    PageInfo<ReconciliationRun> listRuns(int page, int size);

    PageInfo<AuditEvent> getAuditEvents(Long runId, int page, int size);

    List<AuditEvent> getAuditEvents(Long runId);

    List<KeyTrackingEntry> getTrackedKeys(String system);

    /**
     * 运行数、各状态主键数、追踪的键数
     */
    Map<String, Integer> getStatistics();
}
