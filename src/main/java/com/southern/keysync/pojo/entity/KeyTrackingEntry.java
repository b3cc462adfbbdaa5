package com.southern.keysync.pojo.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * key_tracking 表，(system_name, normalized_key) 唯一
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class KeyTrackingEntry implements Serializable {
    private static final long serialVersionUID = 1L;
    private Long trackingId;
    private String systemName;
    private String keyValue;
    private String normalizedKey;
    private LocalDateTime firstSeenAt;
    private LocalDateTime lastSeenAt;
    private Long runId;
}
