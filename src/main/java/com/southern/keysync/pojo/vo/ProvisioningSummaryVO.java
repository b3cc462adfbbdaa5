package com.southern.keysync.pojo.vo;

import com.southern.keysync.pojo.model.ProvisioningStatistics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ProvisioningSummaryVO implements Serializable {
    private static final long serialVersionUID = 1L;
    private Long runId;
    private int totalProposed;
    private int totalActivated;
    private int totalDeprecated;
    private String strategy;
    private boolean autoApprove;
    private ProvisioningStatistics stats;
}
