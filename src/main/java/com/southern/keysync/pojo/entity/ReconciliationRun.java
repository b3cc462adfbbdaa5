package com.southern.keysync.pojo.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * reconciliation_runs 表
 * status: running -> completed / failed，结束后不再修改
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ReconciliationRun implements Serializable {
    private static final long serialVersionUID = 1L;
    private Long runId;
    private LocalDateTime runTimestamp;
    private String runMode;
    private String executionMode;
    private String status;
    private String configSnapshot;
    private String statsJson;
    private String errorMessage;
    private String checkpointData;
    private LocalDateTime completedAt;
}
