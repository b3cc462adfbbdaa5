package com.southern.keysync.factory;

import com.southern.keysync.strategy.MasterKeyStrategy;
import com.southern.keysync.strategy.impl.MirrorStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

@Slf4j
@Service
public class MasterKeyStrategyFactory {
    // 策略名称 -> 策略实体

    private final Map<String, MasterKeyStrategy> strategyMap;

    public MasterKeyStrategyFactory(Map<String, MasterKeyStrategy> strategyMap) {
        this.strategyMap = strategyMap;
    }

    /**
     * 未知的策略名回退到 mirror
     */
    public MasterKeyStrategy getStrategy(String name) {
        MasterKeyStrategy strategy = name == null ? null : strategyMap.get(name);
        if (strategy == null) {
            log.warn("Unknown provisioning strategy '{}', falling back to {}", name, MirrorStrategy.NAME);
            strategy = strategyMap.get(MirrorStrategy.NAME);
        }
        if (strategy == null) {
            throw new IllegalStateException("No " + MirrorStrategy.NAME + " strategy registered");
        }
        return strategy;
    }
}
