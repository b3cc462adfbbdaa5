package com.southern.keysync.analysis;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * 与上一次成功运行相比的变化，均为归一化键
 */
@Value
@Builder
public class IncrementalChanges {
    Long baselineRunId;
    /** 本次出现、上次没有 */
    Set<String> newKeys;
    /** 上次出现、本次没有 */
    Set<String> removedKeys;
    /** 本次在所有系统中出现、上次没有 */
    Set<String> newlySynchronized;
    /** 上次在所有系统中出现、本次仍存在但不再全部出现 */
    Set<String> newlyDiverged;
}
