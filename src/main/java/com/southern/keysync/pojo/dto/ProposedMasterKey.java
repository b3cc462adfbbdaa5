package com.southern.keysync.pojo.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ProposedMasterKey {
    private Long masterKeyId;
    private String masterKey;
    private String normalizedKey;
    private String sourceSystem;
    private String sourceKey;
    private String strategy;
    /**
     * 出现该键的所有系统
     */
    private List<String> affectedSystems;
}
