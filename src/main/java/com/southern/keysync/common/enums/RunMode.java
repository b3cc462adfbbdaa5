package com.southern.keysync.common.enums;

import com.southern.keysync.common.exception.BusinessException;

/**
 * 对账模式：全量 / 增量
 */
public enum RunMode {
    FULL("full"),
    INCREMENTAL("incremental");

    private final String value;

    RunMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static RunMode fromValue(String value) {
        for (RunMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new BusinessException("Unknown run mode: " + value);
    }
}
