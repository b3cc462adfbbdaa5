package com.southern.keysync.strategy;

/**
 * 主键生成策略，bean 名即配置中的策略名
 */
public interface MasterKeyStrategy {

    String name();

    String generate(String sourceSystem, String sourceKey, String normalizedKey);
}
