package com.southern.keysync.common.enums;

public enum DiscrepancyType {
    /** 依赖系统有、权威系统 A 没有 */
    OUT_OF_AUTHORITY,
    /** A 有、某个依赖系统没有 */
    PROPAGATION_GAP,
    /** 同一系统内多个原始键归一化后相同 */
    DUPLICATE_GROUP
}
