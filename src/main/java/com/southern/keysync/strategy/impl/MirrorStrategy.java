package com.southern.keysync.strategy.impl;

import com.southern.keysync.strategy.MasterKeyStrategy;
import org.springframework.stereotype.Component;

/**
 * 主键直接使用归一化键
 */
@Component(MirrorStrategy.NAME)
public class MirrorStrategy implements MasterKeyStrategy {

    public static final String NAME = "mirror";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String generate(String sourceSystem, String sourceKey, String normalizedKey) {
        return normalizedKey;
    }
}
