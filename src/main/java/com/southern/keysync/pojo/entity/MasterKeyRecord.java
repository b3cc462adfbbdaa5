package com.southern.keysync.pojo.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class MasterKeyRecord implements Serializable {
    private static final long serialVersionUID = 1L;
    private Long masterKeyId;
    private String masterKey;
    private String normalizedKey;
    private String sourceSystem;
    private String sourceKey;
    private String status;
    private String provisioningStrategy;
    private LocalDateTime createdAt;
    private LocalDateTime activatedAt;
    private LocalDateTime deprecatedAt;
    private Long runId;
}
