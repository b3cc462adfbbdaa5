package com.southern.keysync.common.enums;

public enum MissingFilePolicy {
    /** 当作空键集继续 */
    SKIP,
    /** 直接终止本次对账 */
    FAIL
}
