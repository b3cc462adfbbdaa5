package com.southern.keysync.service.impl;

import com.southern.keysync.AbstractSqliteStoreTest;
import com.southern.keysync.common.enums.ExecutionMode;
import com.southern.keysync.common.enums.RunMode;
import com.southern.keysync.common.exception.BusinessException;
import com.southern.keysync.pojo.entity.AuditEvent;
import com.southern.keysync.pojo.entity.MasterKeyRecord;
import com.southern.keysync.pojo.vo.ProvisioningSummaryVO;
import com.southern.keysync.service.MasterKeyService;
import com.southern.keysync.service.RunStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MasterKeyServiceImplTest extends AbstractSqliteStoreTest {

    @Autowired
    private MasterKeyService masterKeyService;

    @Autowired
    private RunStateStore store;

    private Long runId;
    private Long masterKeyId;

    @BeforeEach
    void proposeOneKey() {
        runId = store.startRun(RunMode.FULL, ExecutionMode.NORMAL, Collections.emptyMap());
        masterKeyId = store.proposeMasterKey(MasterKeyRecord.builder()
                .masterKey("K4")
                .normalizedKey("K4")
                .sourceSystem("B")
                .sourceKey("k4")
                .provisioningStrategy("mirror")
                .runId(runId)
                .build());
    }

    @Test
    void approveActivatesAndAudits() {
        assertThat(masterKeyService.approve(runId)).isEqualTo(1);

        assertThat(masterKeyService.listMasterKeys("active")).extracting(MasterKeyRecord::getMasterKey)
                .containsExactly("K4");
        assertThat(masterKeyService.listMasterKeys("proposed")).isEmpty();
        assertThat(store.getAuditEvents(runId)).extracting(AuditEvent::getEventType)
                .containsExactly(AuditEvent.MASTER_KEYS_ACTIVATED);

        ProvisioningSummaryVO summary = masterKeyService.getSummary(runId);
        assertThat(summary.getTotalActivated()).isEqualTo(1);
        assertThat(summary.getTotalProposed()).isZero();
        assertThat(summary.getStrategy()).isEqualTo("mirror");
    }

    @Test
    void approveUnknownRunFails() {
        assertThatThrownBy(() -> masterKeyService.approve(runId + 100))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("Run not found");
    }

    @Test
    void deprecateOnlyOnce() {
        masterKeyService.deprecate(masterKeyId);

        assertThat(store.getMasterKey(masterKeyId).getStatus()).isEqualTo("deprecated");
        assertThat(store.getAuditEvents(runId)).extracting(AuditEvent::getKeyValue).containsExactly("K4");
        assertThatThrownBy(() -> masterKeyService.deprecate(masterKeyId))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("already deprecated");
        assertThatThrownBy(() -> masterKeyService.deprecate(masterKeyId + 100))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void listWithoutStatusReturnsEverything() {
        assertThat(masterKeyService.listMasterKeys(null)).hasSize(1);
        assertThat(masterKeyService.listMasterKeys("")).hasSize(1);
        assertThatThrownBy(() -> masterKeyService.listMasterKeys("retired"))
                .isInstanceOf(BusinessException.class);
    }
}
