package com.southern.keysync.service;

import com.southern.keysync.pojo.entity.MasterKeyRecord;
import com.southern.keysync.pojo.vo.ProvisioningSummaryVO;

import java.util.List;

public interface MasterKeyService {

    /**
     * @param status proposed / active / deprecated，为空时返回全部
     */
    List<MasterKeyRecord> listMasterKeys(String status);

    ProvisioningSummaryVO getSummary(Long runId);

    /**
     * @return 激活的主键数
     */
    int approve(Long runId);

    void deprecate(Long masterKeyId);
}
