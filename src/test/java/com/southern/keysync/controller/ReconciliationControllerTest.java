package com.southern.keysync.controller;

import com.github.pagehelper.PageInfo;
import com.southern.keysync.common.exception.BusinessException;
import com.southern.keysync.common.exception.CheckpointRecoveryException;
import com.southern.keysync.common.exception.GlobalExceptionHandler;
import com.southern.keysync.common.exception.SystemUnavailableException;
import com.southern.keysync.pojo.dto.RunRequest;
import com.southern.keysync.pojo.vo.ReconciliationRunVO;
import com.southern.keysync.pojo.vo.RunResultVO;
import com.southern.keysync.service.ReconciliationService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ReconciliationController.class)
@Import(GlobalExceptionHandler.class)
class ReconciliationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReconciliationService reconciliationService;

    @Test
    void runPassesRequestThrough() throws Exception {
        when(reconciliationService.runReconciliation(any())).thenReturn(
                RunResultVO.builder().runId(3L).mode("incremental").executionMode("dry-run").activatedKeys(0).build());

        mockMvc.perform(post("/api/reconciliation/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mode\":\"incremental\",\"executionMode\":\"dry-run\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(1))
                .andExpect(jsonPath("$.data.runId").value(3))
                .andExpect(jsonPath("$.data.mode").value("incremental"));

        ArgumentCaptor<RunRequest> captor = ArgumentCaptor.forClass(RunRequest.class);
        verify(reconciliationService).runReconciliation(captor.capture());
        assertThat(captor.getValue().getMode()).isEqualTo("incremental");
        assertThat(captor.getValue().getExecutionMode()).isEqualTo("dry-run");
    }

    @Test
    void runWithoutBodyUsesConfiguration() throws Exception {
        when(reconciliationService.runReconciliation(null))
                .thenReturn(RunResultVO.builder().runId(4L).mode("full").build());

        mockMvc.perform(post("/api/reconciliation/run"))
                .andExpect(jsonPath("$.code").value(1))
                .andExpect(jsonPath("$.data.runId").value(4));
    }

    @Test
    void failedRunIsReportedAsError() throws Exception {
        when(reconciliationService.runReconciliation(any()))
                .thenThrow(new SystemUnavailableException("System A data not found - cannot perform comparison"));

        mockMvc.perform(post("/api/reconciliation/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(0))
                .andExpect(jsonPath("$.msg").value("System A data not found - cannot perform comparison"));
    }

    @Test
    void listRunsUsesDefaultPaging() throws Exception {
        PageInfo<ReconciliationRunVO> page = new PageInfo<>(Collections.singletonList(
                ReconciliationRunVO.builder().runId(9L).status("completed").build()));
        when(reconciliationService.listRuns(1, 20)).thenReturn(page);

        mockMvc.perform(get("/api/reconciliation/runs"))
                .andExpect(jsonPath("$.code").value(1))
                .andExpect(jsonPath("$.data.list[0].runId").value(9))
                .andExpect(jsonPath("$.data.list[0].status").value("completed"));
    }

    @Test
    void unknownRunIsBusinessError() throws Exception {
        when(reconciliationService.getRun(42L)).thenThrow(new BusinessException("Run not found: 42"));

        mockMvc.perform(get("/api/reconciliation/runs/42"))
                .andExpect(jsonPath("$.code").value(0))
                .andExpect(jsonPath("$.msg").value("Run not found: 42"));
    }

    @Test
    void missingCheckpointIsReported() throws Exception {
        when(reconciliationService.getLatestCheckpoint(5L))
                .thenThrow(new CheckpointRecoveryException("No checkpoint data available"));

        mockMvc.perform(get("/api/reconciliation/runs/5/checkpoint"))
                .andExpect(jsonPath("$.code").value(0))
                .andExpect(jsonPath("$.msg").value("No checkpoint data available"));
    }
}
