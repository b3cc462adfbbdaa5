package com.southern.keysync.pojo.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 源文件中的一行，归一化之后即丢弃
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RawKeyRecord {
    private String system;
    private String rawValue;
    /**
     * key 以外的列，例如 last_seen_at、status
     */
    private Map<String, String> metadata;
    private long lineNumber;
}
