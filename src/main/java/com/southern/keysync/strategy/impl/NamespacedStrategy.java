package com.southern.keysync.strategy.impl;

import com.southern.keysync.config.KeySyncProperties;
import com.southern.keysync.strategy.MasterKeyStrategy;
import org.springframework.stereotype.Component;

/**
 * {prefix}-{来源系统}-{归一化键}
 */
@Component(NamespacedStrategy.NAME)
public class NamespacedStrategy implements MasterKeyStrategy {

    public static final String NAME = "namespaced";

    private final String prefix;

    public NamespacedStrategy(KeySyncProperties properties) {
        this.prefix = properties.getProvisioning().getNamespacePrefix();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String generate(String sourceSystem, String sourceKey, String normalizedKey) {
        return prefix + "-" + sourceSystem + "-" + normalizedKey;
    }
}
