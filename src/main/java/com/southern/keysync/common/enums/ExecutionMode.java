package com.southern.keysync.common.enums;

import com.southern.keysync.common.exception.BusinessException;

/**
 * 执行方式
 * normal：只提议主键；dry-run：照常执行，调用方跳过激活和报表；auto-approve：提议后直接激活
 */
public enum ExecutionMode {
    NORMAL("normal"),
    DRY_RUN("dry-run"),
    AUTO_APPROVE("auto-approve");

    private final String value;

    ExecutionMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ExecutionMode fromValue(String value) {
        for (ExecutionMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new BusinessException("Unknown execution mode: " + value);
    }
}
