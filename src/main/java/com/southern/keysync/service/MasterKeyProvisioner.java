package com.southern.keysync.service;

import com.southern.keysync.common.enums.MasterKeyStatus;
import com.southern.keysync.config.KeySyncProperties;
import com.southern.keysync.factory.MasterKeyStrategyFactory;
import com.southern.keysync.pojo.dto.ProposedMasterKey;
import com.southern.keysync.pojo.dto.SystemKeyRef;
import com.southern.keysync.pojo.entity.MasterKeyRecord;
import com.southern.keysync.pojo.model.ProvisioningStatistics;
import com.southern.keysync.pojo.vo.ProvisioningSummaryVO;
import com.southern.keysync.strategy.MasterKeyStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * 为权威系统之外出现的键提议主键，并按配置激活
 */
@Slf4j
@Service
public class MasterKeyProvisioner {

    private final RunStateStore store;
    private final MasterKeyStrategyFactory strategyFactory;
    private final KeySyncProperties.Provisioning config;

    private final AtomicLong keysProposed = new AtomicLong();
    private final AtomicLong keysActivated = new AtomicLong();
    private final AtomicLong keysSkipped = new AtomicLong();
    private final AtomicLong keysFailed = new AtomicLong();
    private final Map<String, AtomicLong> strategyUsed = new ConcurrentHashMap<>();

    public MasterKeyProvisioner(RunStateStore store,
                                MasterKeyStrategyFactory strategyFactory,
                                KeySyncProperties properties) {
        this.store = store;
        this.strategyFactory = strategyFactory;
        this.config = properties.getProvisioning();
    }

    /**
     * 为每个归一化键提议一个主键
     * 注册表中已有 proposed / active 记录的归一化键跳过；生成的主键已存在（任意状态）也跳过
     *
     * @param outOfAuthority 归一化键 -> 出现该键的 (系统, 原始键)
     */
    public List<ProposedMasterKey> propose(Long runId, Map<String, List<SystemKeyRef>> outOfAuthority) {
        MasterKeyStrategy strategy = strategyFactory.getStrategy(config.getStrategy());
        Set<String> reserved = new HashSet<>(store.getReservedNormalizedKeys());
        List<ProposedMasterKey> proposed = new ArrayList<>();

        for (Map.Entry<String, List<SystemKeyRef>> entry : outOfAuthority.entrySet()) {
            String normalizedKey = entry.getKey();
            List<SystemKeyRef> refs = entry.getValue();
            if (refs == null || refs.isEmpty()) {
                continue;
            }
            if (reserved.contains(normalizedKey)) {
                log.info("Master key already exists for '{}', skipping", normalizedKey);
                keysSkipped.incrementAndGet();
                continue;
            }

            SystemKeyRef source = chooseSource(refs);
            String masterKey = strategy.generate(source.getSystem(), source.getRawKey(), normalizedKey);

            try {
                if (store.existsMasterKey(masterKey)) {
                    log.warn("Master key '{}' is already registered, skipping '{}'", masterKey, normalizedKey);
                    keysSkipped.incrementAndGet();
                    continue;
                }
                MasterKeyRecord record = MasterKeyRecord.builder()
                        .masterKey(masterKey)
                        .normalizedKey(normalizedKey)
                        .sourceSystem(source.getSystem())
                        .sourceKey(source.getRawKey())
                        .provisioningStrategy(strategy.name())
                        .runId(runId)
                        .build();
                Long id = store.proposeMasterKey(record);
                reserved.add(normalizedKey);

                proposed.add(ProposedMasterKey.builder()
                        .masterKeyId(id)
                        .masterKey(masterKey)
                        .normalizedKey(normalizedKey)
                        .sourceSystem(source.getSystem())
                        .sourceKey(source.getRawKey())
                        .strategy(strategy.name())
                        .affectedSystems(refs.stream().map(SystemKeyRef::getSystem).distinct().collect(Collectors.toList()))
                        .build());
                keysProposed.incrementAndGet();
                strategyUsed.computeIfAbsent(strategy.name(), k -> new AtomicLong()).incrementAndGet();
                log.info("Proposed master key: '{}' for normalized key '{}'", masterKey, normalizedKey);
            } catch (DataAccessException e) {
                keysFailed.incrementAndGet();
                log.error("Failed to propose master key for '{}': {}", normalizedKey, e.getMessage(), e);
            }
        }
        return proposed;
    }

    /**
     * 按配置的 auto-approve 激活
     */
    public int activate(Long runId) {
        return activate(runId, config.isAutoApprove());
    }

    public int activate(Long runId, boolean autoApprove) {
        if (!autoApprove) {
            log.info("Auto-approve is disabled, keys remain in proposed state");
            return 0;
        }
        return approve(runId);
    }

    /**
     * 人工审批：激活该运行下所有 proposed 主键
     */
    public int approve(Long runId) {
        int activated = store.activateMasterKeys(runId);
        keysActivated.addAndGet(activated);
        log.info("Activated {} master keys from run {}", activated, runId);
        return activated;
    }

    public boolean deprecate(Long masterKeyId) {
        return store.deprecateMasterKey(masterKeyId);
    }

    public ProvisioningSummaryVO getProvisioningSummary(Long runId) {
        List<MasterKeyRecord> runKeys = store.getMasterKeysForRun(runId);
        return ProvisioningSummaryVO.builder()
                .runId(runId)
                .totalProposed(countStatus(runKeys, MasterKeyStatus.PROPOSED))
                .totalActivated(countStatus(runKeys, MasterKeyStatus.ACTIVE))
                .totalDeprecated(countStatus(runKeys, MasterKeyStatus.DEPRECATED))
                .strategy(config.getStrategy())
                .autoApprove(config.isAutoApprove())
                .stats(getStatistics())
                .build();
    }

    public ProvisioningStatistics getStatistics() {
        Map<String, Long> used = new TreeMap<>();
        strategyUsed.forEach((name, count) -> used.put(name, count.get()));
        return ProvisioningStatistics.builder()
                .keysProposed(keysProposed.get())
                .keysActivated(keysActivated.get())
                .keysSkipped(keysSkipped.get())
                .keysFailed(keysFailed.get())
                .strategyUsed(used)
                .build();
    }

    public void resetStatistics() {
        keysProposed.set(0);
        keysActivated.set(0);
        keysSkipped.set(0);
        keysFailed.set(0);
        strategyUsed.clear();
    }

    /**
     * 按 source-priority 选择来源系统，都不在优先列表中时取第一个
     */
    SystemKeyRef chooseSource(List<SystemKeyRef> refs) {
        for (String preferred : config.getSourcePriority()) {
            for (SystemKeyRef ref : refs) {
                if (preferred.equals(ref.getSystem())) {
                    return ref;
                }
            }
        }
        return refs.get(0);
    }

    private static int countStatus(List<MasterKeyRecord> records, MasterKeyStatus status) {
        return (int) records.stream().filter(r -> status.getValue().equals(r.getStatus())).count();
    }
}
