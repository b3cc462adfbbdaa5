package com.southern.keysync.compare;

import com.southern.keysync.pojo.dto.RawKeyRecord;
import com.southern.keysync.pojo.model.ErrorRecord;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * 单个系统文件的加载结果
 */
@Getter
@AllArgsConstructor
public class SystemKeyData {
    private final String system;
    private final String file;
    private final List<RawKeyRecord> records;
    private final List<ErrorRecord> errors;
}
