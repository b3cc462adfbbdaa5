package com.southern.keysync.service;

import com.github.pagehelper.PageInfo;
import com.southern.keysync.pojo.dto.RunRequest;
import com.southern.keysync.pojo.entity.AuditEvent;
import com.southern.keysync.pojo.model.CheckpointEntry;
import com.southern.keysync.pojo.vo.ReconciliationRunVO;
import com.southern.keysync.pojo.vo.RunResultVO;

import java.util.Map;

public interface ReconciliationService {

    RunResultVO runReconciliation(RunRequest request);

    PageInfo<ReconciliationRunVO> listRuns(int page, int size);

    ReconciliationRunVO getRun(Long runId);

    /**
     * @return 没有成功运行时为 null
     */
    ReconciliationRunVO getLastSuccessfulRun();

    PageInfo<AuditEvent> getAuditEvents(Long runId, int page, int size);

    CheckpointEntry getLatestCheckpoint(Long runId);

    Map<String, Object> getStatistics();
}
