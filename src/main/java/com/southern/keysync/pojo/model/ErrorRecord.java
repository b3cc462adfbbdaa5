package com.southern.keysync.pojo.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * 加载过程中被容忍的错误，随比较结果保留，供事后排查
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ErrorRecord implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String MISSING_FILE = "missing_file";
    public static final String CORRUPT_DATA = "corrupt_data";
    public static final String LOAD_FAILURE = "load_failure";

    private String type;
    private String system;
    private String file;
    private Long row;
    private String error;
    private String action;
    private LocalDateTime timestamp;
}
