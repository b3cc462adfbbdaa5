package com.southern.keysync.common.enums;

public enum CorruptDataPolicy {
    LOG,
    SKIP,
    FAIL
}
