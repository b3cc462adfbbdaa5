package com.southern.keysync.service.impl;

import com.southern.keysync.common.enums.MasterKeyStatus;
import com.southern.keysync.common.exception.BusinessException;
import com.southern.keysync.pojo.entity.AuditEvent;
import com.southern.keysync.pojo.entity.MasterKeyRecord;
import com.southern.keysync.pojo.vo.ProvisioningSummaryVO;
import com.southern.keysync.service.MasterKeyProvisioner;
import com.southern.keysync.service.MasterKeyService;
import com.southern.keysync.service.RunStateStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class MasterKeyServiceImpl implements MasterKeyService {

    @Autowired
    private MasterKeyProvisioner provisioner;

    @Autowired
    private RunStateStore runStateStore;

    @Override
    public List<MasterKeyRecord> listMasterKeys(String status) {
        MasterKeyStatus filter = status == null || status.isEmpty() ? null : MasterKeyStatus.fromValue(status);
        return runStateStore.getMasterKeys(filter);
    }

    @Override
    public ProvisioningSummaryVO getSummary(Long runId) {
        requireRun(runId);
        return provisioner.getProvisioningSummary(runId);
    }

    @Override
    public int approve(Long runId) {
        requireRun(runId);
        int activated = provisioner.approve(runId);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("count", activated);
        runStateStore.logEvent(runId, AuditEvent.MASTER_KEYS_ACTIVATED, details, null, null, "approve", "success");
        return activated;
    }

    @Override
    public void deprecate(Long masterKeyId) {
        MasterKeyRecord record = runStateStore.getMasterKey(masterKeyId);
        if (record == null) {
            throw new BusinessException("Master key not found: " + masterKeyId);
        }
        if (!provisioner.deprecate(masterKeyId)) {
            throw new BusinessException("Master key " + masterKeyId + " is already deprecated");
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("masterKeyId", masterKeyId);
        runStateStore.logEvent(record.getRunId(), AuditEvent.MASTER_KEY_DEPRECATED, details,
                record.getSourceSystem(), record.getMasterKey(), "deprecate", "success");
    }

    private void requireRun(Long runId) {
        if (runStateStore.getRun(runId) == null) {
            throw new BusinessException("Run not found: " + runId);
        }
    }
}
