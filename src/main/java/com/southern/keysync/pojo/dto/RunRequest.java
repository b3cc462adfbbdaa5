package com.southern.keysync.pojo.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 触发对账的请求，字段都可以为空，为空时使用配置
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunRequest {
    private String mode;           // full / incremental
    private String executionMode;  // normal / dry-run / auto-approve
    private Map<String, String> systemFiles;
}
