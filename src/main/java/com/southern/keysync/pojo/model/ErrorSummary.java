package com.southern.keysync.pojo.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ErrorSummary {
    private int totalErrors;
    private Map<String, Integer> errorsByType;
    /**
     * 操作名 -> 失败后重试的次数
     */
    private Map<String, Integer> recoveryAttempts;
    private boolean canContinue;
    private List<ErrorRecord> records;
}
