package com.southern.keysync.pojo.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.Map;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ReconciliationRunVO implements Serializable {
    private static final long serialVersionUID = 1L;
    private Long runId;
    private LocalDateTime runTimestamp;
    private String runMode;
    private String executionMode;
    private String status;
    private String errorMessage;
    private LocalDateTime completedAt;
    private Map<String, Object> config;
    private Map<String, Object> stats;
}
