package com.southern.keysync.service.impl;

import com.github.pagehelper.PageInfo;
import com.southern.keysync.AbstractSqliteStoreTest;
import com.southern.keysync.common.exception.BusinessException;
import com.southern.keysync.pojo.dto.RunRequest;
import com.southern.keysync.pojo.vo.ReconciliationRunVO;
import com.southern.keysync.pojo.vo.RunResultVO;
import com.southern.keysync.service.ReconciliationService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.data.Offset.offset;

class ReconciliationServiceImplTest extends AbstractSqliteStoreTest {

    @TempDir
    Path tempDir;

    @Autowired
    private ReconciliationService reconciliationService;

    private RunRequest request(String mode, String executionMode) throws IOException {
        Path a = tempDir.resolve("A.csv");
        Path b = tempDir.resolve("B.csv");
        Files.write(a, "key\nK1\nK2\n".getBytes(StandardCharsets.UTF_8));
        Files.write(b, "key\nK1\nK5\n".getBytes(StandardCharsets.UTF_8));
        Map<String, String> files = new LinkedHashMap<>();
        files.put("A", a.toString());
        files.put("B", b.toString());
        return RunRequest.builder().mode(mode).executionMode(executionMode).systemFiles(files).build();
    }

    @Test
    void runWithRequestValues() throws IOException {
        RunResultVO result = reconciliationService.runReconciliation(request("full", "auto-approve"));

        assertThat(result.getMode()).isEqualTo("full");
        assertThat(result.getExecutionMode()).isEqualTo("auto-approve");
        assertThat(result.getStatistics().getMatchPercentage()).isCloseTo(33.33, offset(0.01));
        assertThat(result.getProposedKeys()).extracting("masterKey").containsExactly("K5");
        assertThat(result.getActivatedKeys()).isEqualTo(1);
        assertThat(result.getFailedSystems()).isEmpty();
    }

    @Test
    void missingExecutionModeFallsBackToNormal() throws IOException {
        RunResultVO result = reconciliationService.runReconciliation(request(null, null));

        assertThat(result.getMode()).isEqualTo("full");
        assertThat(result.getExecutionMode()).isEqualTo("normal");
        assertThat(result.getActivatedKeys()).isZero();
    }

    @Test
    void unknownModeIsRejected() throws IOException {
        RunRequest request = request("sometimes", null);

        assertThatThrownBy(() -> reconciliationService.runReconciliation(request))
                .isInstanceOf(BusinessException.class);
    }

    @Test
    void runViewHidesKeySnapshot() throws IOException {
        Long runId = reconciliationService.runReconciliation(request("full", "normal")).getRunId();

        ReconciliationRunVO run = reconciliationService.getRun(runId);
        assertThat(run.getStatus()).isEqualTo("completed");
        assertThat(run.getStats()).containsKeys("comparison", "discrepancies", "trackedKeys")
                .doesNotContainKey("comparisonSnapshot");
        assertThat(run.getConfig()).containsKey("systemFiles");
        assertThat(reconciliationService.getLastSuccessfulRun().getRunId()).isEqualTo(runId);

        PageInfo<ReconciliationRunVO> page = reconciliationService.listRuns(1, 10);
        assertThat(page.getTotal()).isEqualTo(1);
        assertThat(page.getList()).extracting(ReconciliationRunVO::getRunId).containsExactly(runId);
        assertThat(reconciliationService.getAuditEvents(runId, 1, 50).getList()).isNotEmpty();
        assertThat(reconciliationService.getStatistics()).containsKeys("store", "provisioning", "normalization");
    }

    @Test
    void unknownRunIsBusinessError() {
        assertThatThrownBy(() -> reconciliationService.getRun(404L)).isInstanceOf(BusinessException.class);
        assertThatThrownBy(() -> reconciliationService.getLatestCheckpoint(404L)).isInstanceOf(BusinessException.class);
        assertThat(reconciliationService.getLastSuccessfulRun()).isNull();
    }
}
