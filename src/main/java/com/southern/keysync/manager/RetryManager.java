package com.southern.keysync.manager;

import com.southern.keysync.common.exception.ReconciliationException;
import com.southern.keysync.config.KeySyncProperties;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * 固定次数、固定间隔的重试
 * 只包在显式调用它的操作外面（目前是源文件读取），策略类异常不重试
 */
@Component
public class RetryManager {

    private static final Logger logger = LoggerFactory.getLogger(RetryManager.class);

    private final RetryConfig retryConfig;

    public RetryManager(KeySyncProperties properties) {
        KeySyncProperties.ErrorHandling errorHandling = properties.getErrorHandling();
        long delaySeconds = errorHandling.getRetryDelaySeconds();
        RetryConfig.Builder<Object> builder = RetryConfig.custom()
                .maxAttempts(errorHandling.getRetryAttempts())
                .retryOnException(e -> !(e instanceof ReconciliationException));
        if (delaySeconds > 0) {
            builder.waitDuration(Duration.ofSeconds(delaySeconds));
        } else {
            builder.intervalFunction(attempt -> 0L);
        }
        this.retryConfig = builder.build();
    }

    public <T> T execute(String operationName, Supplier<T> operation) {
        return execute(operationName, operation, () -> {
        });
    }

    /**
     * @param onFailedAttempt 每次尝试失败（包括最后一次）时回调
     */
    public <T> T execute(String operationName, Supplier<T> operation, Runnable onFailedAttempt) {
        Retry retry = Retry.of(operationName, retryConfig);
        retry.getEventPublisher()
                .onRetry(event -> {
                    onFailedAttempt.run();
                    logger.warn("Attempt {}/{} failed for {}: {}",
                            event.getNumberOfRetryAttempts(), retry.getRetryConfig().getMaxAttempts(),
                            operationName, String.valueOf(event.getLastThrowable()));
                })
                .onError(event -> {
                    onFailedAttempt.run();
                    logger.error("All {} attempts failed for {}",
                            event.getNumberOfRetryAttempts(), operationName);
                });
        return retry.executeSupplier(operation);
    }
}
