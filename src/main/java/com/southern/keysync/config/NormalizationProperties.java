package com.southern.keysync.config;

import lombok.Data;

import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.Size;

/**
 * 键归一化规则
 * leftPadNumbers 为 null 表示未显式配置：此时不补零（只有完全不传配置时才默认补零）
 */
@Data
public class NormalizationProperties {

    private boolean uppercase = true;

    private boolean trimWhitespace = true;

    private boolean stripNonAlnum = true;

    /**
     * 折叠后的分隔符，单个字符；空串表示不折叠
     */
    @Size(max = 1)
    private String collapseDelims = "-";

    private Boolean leftPadNumbers;

    @Min(1)
    @Max(64)
    private int padLength = 6;
}
