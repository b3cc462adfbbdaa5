package com.southern.keysync.pojo.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * audit_log 表，只追加
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class AuditEvent implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String RUN_STARTED = "run_started";
    public static final String KEYS_TRACKED = "keys_tracked";
    public static final String MASTER_KEY_PROPOSED = "master_key_proposed";
    public static final String MASTER_KEYS_PROPOSED = "master_keys_proposed";
    public static final String MASTER_KEYS_ACTIVATED = "master_keys_activated";
    public static final String MASTER_KEY_DEPRECATED = "master_key_deprecated";
    public static final String LOAD_ERROR = "load_error";
    public static final String INCREMENTAL_CHANGES = "incremental_changes";
    public static final String RECONCILIATION_COMPLETE = "reconciliation_complete";
    public static final String RECONCILIATION_FAILED = "reconciliation_failed";

    private Long auditId;
    private LocalDateTime timestamp;
    private Long runId;
    private String eventType;
    private String eventDetails;
    private String systemName;
    private String keyValue;
    private String actionTaken;
    private String result;
}
