package com.southern.keysync.config;

import com.southern.keysync.common.enums.MissingFilePolicy;
import com.southern.keysync.common.enums.RunMode;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class KeySyncPropertiesValidationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
            .withUserConfiguration(PropertiesConfig.class);

    @Configuration
    @EnableConfigurationProperties(KeySyncProperties.class)
    static class PropertiesConfig {
    }

    @Test
    void defaultsApplyWhenNothingConfigured() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            KeySyncProperties properties = context.getBean(KeySyncProperties.class);
            assertThat(properties.getAuthoritySystem()).isEqualTo("A");
            assertThat(properties.getProcessing().getMaxWorkers()).isEqualTo(5);
            assertThat(properties.getErrorHandling().getOnMissingFile()).isEqualTo(MissingFilePolicy.SKIP);
            assertThat(properties.getSchedule().isEnabled()).isFalse();
        });
    }

    @Test
    void bindsKebabCaseValues() {
        contextRunner.withPropertyValues(
                        "keysync.authority-system=CORE",
                        "keysync.sources.CORE=/tmp/core.csv",
                        "keysync.sources.EDGE=/tmp/edge.csv",
                        "keysync.processing.mode=incremental",
                        "keysync.error-handling.on-missing-file=fail",
                        "keysync.provisioning.source-priority=EDGE,CORE")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    KeySyncProperties properties = context.getBean(KeySyncProperties.class);
                    assertThat(properties.getSources()).containsKeys("CORE", "EDGE");
                    assertThat(properties.getProcessing().getMode()).isEqualTo(RunMode.INCREMENTAL);
                    assertThat(properties.getErrorHandling().getOnMissingFile()).isEqualTo(MissingFilePolicy.FAIL);
                    assertThat(properties.getProvisioning().getSourcePriority()).containsExactly("EDGE", "CORE");
                });
    }

    @Test
    void rejectsTooManyWorkers() {
        contextRunner.withPropertyValues("keysync.processing.max-workers=100")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void rejectsZeroRetryAttempts() {
        contextRunner.withPropertyValues("keysync.error-handling.retry-attempts=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void enabledScheduleNeedsCron() {
        contextRunner.withPropertyValues("keysync.schedule.enabled=true", "keysync.schedule.cron=")
                .run(context -> assertThat(context).hasFailed());
    }
}
