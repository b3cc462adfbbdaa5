package com.southern.keysync.pojo.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 检查点只记录阶段名和数据概要（类型、规模），不足以恢复运行
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CheckpointEntry {
    private String stage;
    private String timestamp;
    private String dataType;
    private Long size;
}
