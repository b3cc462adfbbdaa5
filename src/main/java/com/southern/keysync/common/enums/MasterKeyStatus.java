package com.southern.keysync.common.enums;

import com.southern.keysync.common.exception.BusinessException;

/**
 * 主键生命周期：proposed -> active -> deprecated（终态）
 */
public enum MasterKeyStatus {
    PROPOSED("proposed"),
    ACTIVE("active"),
    DEPRECATED("deprecated");

    private final String value;

    MasterKeyStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static MasterKeyStatus fromValue(String value) {
        for (MasterKeyStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new BusinessException("Unknown master key status: " + value);
    }
}
