package com.southern.keysync.controller;

import com.southern.keysync.common.result.Result;
import com.southern.keysync.pojo.entity.MasterKeyRecord;
import com.southern.keysync.pojo.vo.ProvisioningSummaryVO;
import com.southern.keysync.service.MasterKeyService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/master-keys")
public class MasterKeyController {

    @Autowired
    private MasterKeyService masterKeyService;

    /**
     * 查询主键，可按状态筛选
     */
    @GetMapping("/list")
    public Result<List<MasterKeyRecord>> list(@RequestParam(required = false) String status) {
        return Result.success(masterKeyService.listMasterKeys(status));
    }

    @GetMapping("/summary/{runId}")
    public Result<ProvisioningSummaryVO> summary(@PathVariable Long runId) {
        return Result.success(masterKeyService.getSummary(runId));
    }

    /**
     * 人工审批：激活该运行提议的所有主键
     */
    @PostMapping("/approve/{runId}")
    public Result<Integer> approve(@PathVariable Long runId) {
        return Result.success(masterKeyService.approve(runId));
    }

    @PostMapping("/deprecate/{masterKeyId}")
    public Result deprecate(@PathVariable Long masterKeyId) {
        masterKeyService.deprecate(masterKeyId);
        return Result.success();
    }
}
