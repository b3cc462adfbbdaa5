package com.southern.keysync.service;

import com.southern.keysync.common.enums.CorruptDataPolicy;
import com.southern.keysync.common.enums.MissingFilePolicy;
import com.southern.keysync.common.exception.CheckpointRecoveryException;
import com.southern.keysync.common.exception.DataValidationException;
import com.southern.keysync.common.exception.SystemUnavailableException;
import com.southern.keysync.config.KeySyncProperties;
import com.southern.keysync.pojo.model.CheckpointEntry;
import com.southern.keysync.pojo.model.ErrorRecord;
import com.southern.keysync.pojo.model.ErrorSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 按配置的策略处理文件缺失、数据损坏、系统不可用
 * 本身不保存错误列表，错误记录由调用方按系统收集后合并
 */
@Slf4j
@Component
public class ErrorPolicyHandler {

    private final KeySyncProperties.ErrorHandling config;

    public ErrorPolicyHandler(KeySyncProperties properties) {
        this.config = properties.getErrorHandling();
    }

    /**
     * skip：返回错误记录，调用方按空键集处理；fail：抛出 SystemUnavailableException
     */
    public ErrorRecord handleMissingFile(String system, Path file) {
        MissingFilePolicy policy = config.getOnMissingFile();
        if (policy == MissingFilePolicy.FAIL) {
            throw new SystemUnavailableException("Required file missing for system " + system + ": " + file);
        }
        log.warn("File not found for system {}: {} - skipping", system, file);
        return ErrorRecord.builder()
                .type(ErrorRecord.MISSING_FILE)
                .system(system)
                .file(String.valueOf(file))
                .error("File does not exist")
                .action(policy.name().toLowerCase())
                .timestamp(LocalDateTime.now())
                .build();
    }

    /**
     * log / skip：返回错误记录并继续；fail：抛出 DataValidationException
     */
    public ErrorRecord handleCorruptData(String system, Path file, long row, String error) {
        CorruptDataPolicy policy = config.getOnCorruptData();
        switch (policy) {
            case FAIL:
                throw new DataValidationException("Corrupt data in " + file + " row " + row + ": " + error);
            case SKIP:
                log.debug("Skipping corrupt row {} in {}", row, file);
                break;
            case LOG:
            default:
                log.warn("Corrupt data in {} row {}: {}", file, row, error);
                break;
        }
        return ErrorRecord.builder()
                .type(ErrorRecord.CORRUPT_DATA)
                .system(system)
                .file(String.valueOf(file))
                .row(row)
                .error(error)
                .action(policy.name().toLowerCase())
                .timestamp(LocalDateTime.now())
                .build();
    }

    public ErrorRecord loadFailure(String system, String file, Throwable cause) {
        return ErrorRecord.builder()
                .type(ErrorRecord.LOAD_FAILURE)
                .system(system)
                .file(file)
                .error(String.valueOf(cause.getMessage()))
                .action("excluded")
                .timestamp(LocalDateTime.now())
                .build();
    }

    /**
     * 错误累计超过上限时终止
     */
    public void ensureWithinErrorCeiling(int errorCount) {
        if (errorCount > config.getMaxErrorsBeforeFail()) {
            throw new DataValidationException("Error count " + errorCount
                    + " exceeds the configured ceiling of " + config.getMaxErrorsBeforeFail());
        }
    }

    /**
     * 依赖系统缺失时是否继续：权威系统缺失不在这里判断
     */
    public void checkPartialAvailability(Set<String> availableSystems, Collection<String> requiredSystems) {
        Set<String> missing = new TreeSet<>(requiredSystems);
        missing.removeAll(availableSystems);
        if (missing.isEmpty()) {
            return;
        }
        log.warn("Missing systems: {}", missing);
        if (!config.isEnablePartialProcessing()) {
            throw new SystemUnavailableException("Partial processing disabled - unavailable systems: " + missing);
        }
        log.info("Continuing with partial system availability");
    }

    /**
     * 找到最后一个合法的检查点
     * 只定位，不恢复运行
     */
    public CheckpointEntry latestValidCheckpoint(Map<String, CheckpointEntry> checkpoints) {
        if (checkpoints == null || checkpoints.isEmpty()) {
            throw new CheckpointRecoveryException("No checkpoint data available");
        }
        List<String> stages = new ArrayList<>(checkpoints.keySet());
        for (int i = stages.size() - 1; i >= 0; i--) {
            CheckpointEntry entry = checkpoints.get(stages.get(i));
            if (isValid(entry)) {
                return entry;
            }
        }
        throw new CheckpointRecoveryException("No valid checkpoint found");
    }

    public ErrorSummary summarize(List<ErrorRecord> errors) {
        return summarize(errors, Collections.emptyMap());
    }

    /**
     * 汇总的同时保留每条错误记录，运行结束后仍可按文件和行号排查
     */
    public ErrorSummary summarize(List<ErrorRecord> errors, Map<String, Integer> recoveryAttempts) {
        Map<String, Integer> byType = new TreeMap<>();
        for (ErrorRecord error : errors) {
            String type = error.getType() != null ? error.getType() : "unknown";
            byType.merge(type, 1, Integer::sum);
        }
        return ErrorSummary.builder()
                .totalErrors(errors.size())
                .errorsByType(byType)
                .recoveryAttempts(recoveryAttempts == null ? new TreeMap<>() : new TreeMap<>(recoveryAttempts))
                .canContinue(errors.size() <= config.getMaxErrorsBeforeFail())
                .records(new ArrayList<>(errors))
                .build();
    }

    private boolean isValid(CheckpointEntry entry) {
        return entry != null && entry.getTimestamp() != null && entry.getDataType() != null && entry.getSize() != null;
    }
}
