package com.southern.keysync.config;

import com.southern.keysync.compare.SystemComparator;
import com.southern.keysync.compare.SystemKeyLoader;
import com.southern.keysync.normalize.KeyNormalizer;
import com.southern.keysync.service.ErrorPolicyHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ReconciliationConfig {

    @Bean
    public KeyNormalizer keyNormalizer(KeySyncProperties properties) {
        return new KeyNormalizer(properties.getNormalize());
    }

    @Bean
    public SystemComparator systemComparator(KeyNormalizer keyNormalizer,
                                             SystemKeyLoader systemKeyLoader,
                                             ErrorPolicyHandler errorPolicyHandler,
                                             KeySyncProperties properties) {
        return new SystemComparator(keyNormalizer, systemKeyLoader, errorPolicyHandler, properties);
    }
}
