package com.southern.keysync.pojo.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 某系统中的一个原始键
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class SystemKeyRef {
    private String system;
    private String rawKey;
}
