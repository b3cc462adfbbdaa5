package com.southern.keysync.compare;

import com.southern.keysync.common.exception.ReconciliationException;
import com.southern.keysync.config.KeySyncProperties;
import com.southern.keysync.normalize.KeyNormalizer;
import com.southern.keysync.pojo.dto.RawKeyRecord;
import com.southern.keysync.pojo.model.ErrorRecord;
import com.southern.keysync.service.ErrorPolicyHandler;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 加载各系统的键、归一化并做跨系统集合运算
 * 各系统在固定大小的线程池中并行加载，每个任务返回自己的统计，全部完成后再合并
 */
@Slf4j
public class SystemComparator {

    private final KeyNormalizer normalizer;
    private final SystemKeyLoader loader;
    private final ErrorPolicyHandler errorPolicyHandler;
    private final String authoritySystem;
    private final boolean parallel;
    private final int batchSize;
    private final int maxWorkers;

    public SystemComparator(KeyNormalizer normalizer,
                            SystemKeyLoader loader,
                            ErrorPolicyHandler errorPolicyHandler,
                            KeySyncProperties properties) {
        this.normalizer = normalizer;
        this.loader = loader;
        this.errorPolicyHandler = errorPolicyHandler;
        this.authoritySystem = properties.getAuthoritySystem();
        this.parallel = properties.getProcessing().isParallel();
        this.batchSize = properties.getProcessing().getBatchSize();
        this.maxWorkers = properties.getProcessing().getMaxWorkers();
    }

    public ComparisonResult compareAll(Map<String, String> systemFiles) {
        Map<String, SystemLoadResult> loaded = new TreeMap<>();
        List<ErrorRecord> errors = new ArrayList<>();
        Set<String> failedSystems = new TreeSet<>();
        Map<String, Integer> recoveryAttempts = new ConcurrentHashMap<>();

        if (parallel && systemFiles.size() > 1) {
            loadInParallel(systemFiles, loaded, errors, failedSystems, recoveryAttempts);
        } else {
            for (Map.Entry<String, String> entry : systemFiles.entrySet()) {
                try {
                    loaded.put(entry.getKey(), loadAndNormalize(entry.getKey(), entry.getValue(), recoveryAttempts));
                } catch (ReconciliationException e) {
                    throw e;
                } catch (RuntimeException e) {
                    recordFailure(entry.getKey(), entry.getValue(), e, errors, failedSystems);
                }
            }
        }

        // 合并各系统的局部统计
        Map<String, Map<String, Set<String>>> systemKeys = new TreeMap<>();
        Map<String, Map<String, Set<String>>> duplicates = new TreeMap<>();
        long totalKeysProcessed = 0;
        for (SystemLoadResult result : loaded.values()) {
            systemKeys.put(result.getSystem(), result.getNormalized());
            if (!result.getDuplicates().isEmpty()) {
                duplicates.put(result.getSystem(), result.getDuplicates());
                log.info("Found {} duplicate groups in system {}", result.getDuplicates().size(), result.getSystem());
            }
            errors.addAll(result.getErrors());
            totalKeysProcessed += result.getKeysProcessed();
        }

        errorPolicyHandler.ensureWithinErrorCeiling(errors.size());

        if (!systemKeys.containsKey(authoritySystem)) {
            log.error("System {} data not found - cannot perform comparison", authoritySystem);
            return emptyComparison(systemKeys, duplicates, errors, failedSystems, totalKeysProcessed,
                    recoveryAttempts);
        }

        errorPolicyHandler.checkPartialAvailability(systemKeys.keySet(), systemFiles.keySet());

        return compare(systemKeys, duplicates, errors, failedSystems, totalKeysProcessed, recoveryAttempts);
    }

    /**
     * 加载单个系统并分批归一化，批边界不影响结果
     * 归一化后为空串的键按损坏数据处理
     */
    SystemLoadResult loadAndNormalize(String system, String file, Map<String, Integer> recoveryAttempts) {
        Path path = file == null ? null : Paths.get(file);
        String operation = SystemKeyLoader.operationName(system);
        recoveryAttempts.putIfAbsent(operation, 0);
        SystemKeyData data = loader.load(system, path, () -> recoveryAttempts.merge(operation, 1, Integer::sum));
        List<RawKeyRecord> records = data.getRecords();
        List<ErrorRecord> errors = new ArrayList<>(data.getErrors());

        Map<String, Set<String>> normalized = new TreeMap<>();
        for (int start = 0; start < records.size(); start += batchSize) {
            int end = Math.min(start + batchSize, records.size());
            Map<String, Set<String>> batch = normalizeBatch(system, path, records.subList(start, end), errors);
            batch.forEach((normKey, rawKeys) ->
                    normalized.computeIfAbsent(normKey, k -> new TreeSet<>()).addAll(rawKeys));
        }

        Map<String, Set<String>> duplicates = new TreeMap<>();
        normalized.forEach((normKey, rawKeys) -> {
            if (rawKeys.size() > 1) {
                duplicates.put(normKey, Collections.unmodifiableSet(rawKeys));
            }
        });

        Map<String, Set<String>> frozen = new TreeMap<>();
        normalized.forEach((normKey, rawKeys) -> frozen.put(normKey, Collections.unmodifiableSet(rawKeys)));

        return new SystemLoadResult(system, data.getFile(),
                Collections.unmodifiableMap(frozen),
                Collections.unmodifiableMap(duplicates),
                records.size(),
                errors);
    }

    private Map<String, Set<String>> normalizeBatch(String system, Path path, List<RawKeyRecord> batch,
                                                    List<ErrorRecord> errors) {
        Map<String, Set<String>> result = new LinkedHashMap<>();
        for (RawKeyRecord record : batch) {
            String normalized = normalizer.normalize(record.getRawValue());
            if (normalized.isEmpty()) {
                errors.add(errorPolicyHandler.handleCorruptData(system, path, record.getLineNumber(),
                        "Key '" + record.getRawValue() + "' normalizes to an empty string"));
                continue;
            }
            result.computeIfAbsent(normalized, k -> new TreeSet<>()).add(record.getRawValue());
        }
        return result;
    }

    private void loadInParallel(Map<String, String> systemFiles,
                                Map<String, SystemLoadResult> loaded,
                                List<ErrorRecord> errors,
                                Set<String> failedSystems,
                                Map<String, Integer> recoveryAttempts) {
        int poolSize = Math.min(maxWorkers, systemFiles.size());
        ExecutorService executor = Executors.newFixedThreadPool(poolSize);
        Map<String, Future<SystemLoadResult>> futures = new LinkedHashMap<>();
        try {
            for (Map.Entry<String, String> entry : systemFiles.entrySet()) {
                String system = entry.getKey();
                String file = entry.getValue();
                futures.put(system, executor.submit(() -> loadAndNormalize(system, file, recoveryAttempts)));
            }

            for (Map.Entry<String, Future<SystemLoadResult>> entry : futures.entrySet()) {
                String system = entry.getKey();
                try {
                    loaded.put(system, entry.getValue().get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof ReconciliationException) {
                        throw (ReconciliationException) cause;
                    }
                    recordFailure(system, systemFiles.get(system), cause, errors, failedSystems);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReconciliationException("Interrupted while loading systems", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private void recordFailure(String system, String file, Throwable cause,
                               List<ErrorRecord> errors, Set<String> failedSystems) {
        log.error("Error processing system {}: {}", system, cause.getMessage(), cause);
        errors.add(errorPolicyHandler.loadFailure(system, file, cause));
        failedSystems.add(system);
    }

    private ComparisonResult compare(Map<String, Map<String, Set<String>>> systemKeys,
                                     Map<String, Map<String, Set<String>>> duplicates,
                                     List<ErrorRecord> errors,
                                     Set<String> failedSystems,
                                     long totalKeysProcessed,
                                     Map<String, Integer> recoveryAttempts) {
        Set<String> authorityKeys = systemKeys.get(authoritySystem).keySet();

        Set<String> allKeys = new TreeSet<>();
        systemKeys.values().forEach(map -> allKeys.addAll(map.keySet()));

        Set<String> keysOnlyInAuthority = new TreeSet<>(authorityKeys);
        Set<String> keysInDependents = new TreeSet<>();
        Set<String> keysInAll = new TreeSet<>(authorityKeys);
        Map<String, Set<String>> systemGaps = new TreeMap<>();

        for (Map.Entry<String, Map<String, Set<String>>> entry : systemKeys.entrySet()) {
            String system = entry.getKey();
            if (system.equals(authoritySystem)) {
                continue;
            }
            Set<String> keys = entry.getValue().keySet();
            keysOnlyInAuthority.removeAll(keys);
            keysInDependents.addAll(keys);
            keysInAll.retainAll(keys);

            Set<String> gap = new TreeSet<>(authorityKeys);
            gap.removeAll(keys);
            systemGaps.put(system, Collections.unmodifiableSet(gap));
        }

        Set<String> keysMissingInAuthority = new TreeSet<>(keysInDependents);
        keysMissingInAuthority.removeAll(authorityKeys);

        double matchPercentage = allKeys.isEmpty() ? 0.0 : keysInAll.size() * 100.0 / allKeys.size();

        ComparisonStatistics statistics = ComparisonStatistics.builder()
                .totalUniqueKeys(allKeys.size())
                .keysInAuthority(authorityKeys.size())
                .keysOnlyInAuthority(keysOnlyInAuthority.size())
                .keysMissingInAuthority(keysMissingInAuthority.size())
                .keysInAllSystems(keysInAll.size())
                .matchPercentage(matchPercentage)
                .systemCounts(systemCounts(systemKeys))
                .duplicateGroupCounts(duplicateCounts(duplicates))
                .totalKeysProcessed(totalKeysProcessed)
                .systemsCompared(new ArrayList<>(systemKeys.keySet()))
                .errorCount(errors.size())
                .build();

        log.info("Comparison complete: {} match rate", String.format("%.1f%%", matchPercentage));

        return ComparisonResult.builder()
                .authoritySystem(authoritySystem)
                .authorityPresent(true)
                .systemKeys(Collections.unmodifiableMap(systemKeys))
                .allKeys(Collections.unmodifiableSet(allKeys))
                .keysOnlyInAuthority(Collections.unmodifiableSet(keysOnlyInAuthority))
                .keysMissingInAuthority(Collections.unmodifiableSet(keysMissingInAuthority))
                .keysInAllSystems(Collections.unmodifiableSet(keysInAll))
                .systemGaps(Collections.unmodifiableMap(systemGaps))
                .duplicates(Collections.unmodifiableMap(duplicates))
                .statistics(statistics)
                .loadErrors(Collections.unmodifiableList(errors))
                .failedSystems(Collections.unmodifiableSet(failedSystems))
                .recoveryAttempts(Collections.unmodifiableMap(new TreeMap<>(recoveryAttempts)))
                .build();
    }

    private ComparisonResult emptyComparison(Map<String, Map<String, Set<String>>> systemKeys,
                                             Map<String, Map<String, Set<String>>> duplicates,
                                             List<ErrorRecord> errors,
                                             Set<String> failedSystems,
                                             long totalKeysProcessed,
                                             Map<String, Integer> recoveryAttempts) {
        ComparisonStatistics statistics = ComparisonStatistics.builder()
                .systemCounts(systemCounts(systemKeys))
                .duplicateGroupCounts(duplicateCounts(duplicates))
                .totalKeysProcessed(totalKeysProcessed)
                .systemsCompared(new ArrayList<>(systemKeys.keySet()))
                .errorCount(errors.size())
                .build();

        return ComparisonResult.builder()
                .authoritySystem(authoritySystem)
                .authorityPresent(false)
                .systemKeys(Collections.unmodifiableMap(systemKeys))
                .allKeys(Collections.emptySet())
                .keysOnlyInAuthority(Collections.emptySet())
                .keysMissingInAuthority(Collections.emptySet())
                .keysInAllSystems(Collections.emptySet())
                .systemGaps(Collections.emptyMap())
                .duplicates(Collections.unmodifiableMap(duplicates))
                .statistics(statistics)
                .loadErrors(Collections.unmodifiableList(errors))
                .failedSystems(Collections.unmodifiableSet(failedSystems))
                .recoveryAttempts(Collections.unmodifiableMap(new TreeMap<>(recoveryAttempts)))
                .build();
    }

    private static Map<String, Integer> systemCounts(Map<String, Map<String, Set<String>>> systemKeys) {
        Map<String, Integer> counts = new TreeMap<>();
        systemKeys.forEach((system, keys) -> counts.put(system, keys.size()));
        return counts;
    }

    private static Map<String, Integer> duplicateCounts(Map<String, Map<String, Set<String>>> duplicates) {
        Map<String, Integer> counts = new TreeMap<>();
        duplicates.forEach((system, groups) -> counts.put(system, groups.size()));
        return counts;
    }
}
