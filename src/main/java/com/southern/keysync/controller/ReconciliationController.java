package com.southern.keysync.controller;

import com.github.pagehelper.PageInfo;
import com.southern.keysync.common.result.Result;
import com.southern.keysync.pojo.dto.RunRequest;
import com.southern.keysync.pojo.entity.AuditEvent;
import com.southern.keysync.pojo.model.CheckpointEntry;
import com.southern.keysync.pojo.vo.ReconciliationRunVO;
import com.southern.keysync.pojo.vo.RunResultVO;
import com.southern.keysync.service.ReconciliationService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/reconciliation")
public class ReconciliationController {

    @Autowired
    private ReconciliationService reconciliationService;

    /**
     * 触发一次对账，同步执行
     */
    @PostMapping("/run")
    public Result<RunResultVO> run(@RequestBody(required = false) RunRequest request) {
        return Result.success(reconciliationService.runReconciliation(request));
    }

    /**
     * 分页查询运行记录
     */
    @GetMapping("/runs")
    public Result<PageInfo<ReconciliationRunVO>> listRuns(@RequestParam(defaultValue = "1") int page,
                                                          @RequestParam(defaultValue = "20") int size) {
        return Result.success(reconciliationService.listRuns(page, size));
    }

    @GetMapping("/runs/last-successful")
    public Result<ReconciliationRunVO> lastSuccessfulRun() {
        return Result.success(reconciliationService.getLastSuccessfulRun());
    }

    @GetMapping("/runs/{runId}")
    public Result<ReconciliationRunVO> getRun(@PathVariable Long runId) {
        return Result.success(reconciliationService.getRun(runId));
    }

    @GetMapping("/runs/{runId}/audit")
    public Result<PageInfo<AuditEvent>> auditEvents(@PathVariable Long runId,
                                                    @RequestParam(defaultValue = "1") int page,
                                                    @RequestParam(defaultValue = "50") int size) {
        return Result.success(reconciliationService.getAuditEvents(runId, page, size));
    }

    /**
     * 最近一个合法检查点，不存在时返回错误
     */
    @GetMapping("/runs/{runId}/checkpoint")
    public Result<CheckpointEntry> latestCheckpoint(@PathVariable Long runId) {
        return Result.success(reconciliationService.getLatestCheckpoint(runId));
    }

    @GetMapping("/statistics")
    public Result<Map<String, Object>> statistics() {
        return Result.success(reconciliationService.getStatistics());
    }
}
