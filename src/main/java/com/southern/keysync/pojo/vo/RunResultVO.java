package com.southern.keysync.pojo.vo;

import com.southern.keysync.analysis.DiscrepancySummary;
import com.southern.keysync.analysis.IncrementalChanges;
import com.southern.keysync.compare.ComparisonStatistics;
import com.southern.keysync.pojo.dto.ProposedMasterKey;
import com.southern.keysync.pojo.model.ErrorSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;
import java.util.Set;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RunResultVO implements Serializable {
    private static final long serialVersionUID = 1L;
    private Long runId;
    private String mode;
    private String executionMode;
    private ComparisonStatistics statistics;
    private DiscrepancySummary discrepancySummary;
    private List<ProposedMasterKey> proposedKeys;
    private int activatedKeys;
    private int trackedKeys;
    private IncrementalChanges incrementalChanges;
    private ErrorSummary errorSummary;
    private Set<String> failedSystems;
}
