package com.southern.keysync.config;

import com.southern.keysync.common.enums.CorruptDataPolicy;
import com.southern.keysync.common.enums.ExecutionMode;
import com.southern.keysync.common.enums.MissingFilePolicy;
import com.southern.keysync.common.enums.RunMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.Valid;
import javax.validation.constraints.AssertTrue;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * keysync.* 配置，对应 application.yml
 * 各字段的默认值即未配置时的行为
 */
@Data
@Validated
@ConfigurationProperties(prefix = "keysync")
public class KeySyncProperties {

    /**
     * 权威系统名称
     */
    @NotBlank
    private String authoritySystem = "A";

    /**
     * 系统名 -> CSV 文件路径，保持配置顺序
     */
    private Map<String, String> sources = new LinkedHashMap<>();

    @Valid
    private Database database = new Database();

    @Valid
    private NormalizationProperties normalize = new NormalizationProperties();

    @Valid
    private Provisioning provisioning = new Provisioning();

    @Valid
    private Processing processing = new Processing();

    @Valid
    private ErrorHandling errorHandling = new ErrorHandling();

    @Valid
    private Schedule schedule = new Schedule();

    @Data
    public static class Database {
        @NotBlank
        private String path = "./data/keysync.db";
        /**
         * SQLite 单写者，默认只开一个连接
         */
        @Min(1)
        private int poolSize = 1;
    }

    @Data
    public static class Provisioning {
        @NotBlank
        private String strategy = "mirror";
        private boolean autoApprove = false;
        @NotBlank
        private String namespacePrefix = "MASTER";
        /**
         * 多个来源时优先选用的系统顺序，为空则取第一个
         */
        private List<String> sourcePriority = new ArrayList<>();
    }

    @Data
    public static class Processing {
        @NotNull
        private RunMode mode = RunMode.FULL;
        @Min(1)
        private int batchSize = 1000;
        private boolean parallel = true;
        @Min(1)
        @Max(64)
        private int maxWorkers = 5;
    }

    @Data
    public static class ErrorHandling {
        @NotNull
        private MissingFilePolicy onMissingFile = MissingFilePolicy.SKIP;
        @NotNull
        private CorruptDataPolicy onCorruptData = CorruptDataPolicy.LOG;
        @Min(1)
        private int retryAttempts = 3;
        @Min(0)
        private long retryDelaySeconds = 5;
        @Min(0)
        private int maxErrorsBeforeFail = 100;
        private boolean enablePartialProcessing = true;
    }

    @Data
    public static class Schedule {
        private boolean enabled = false;
        private String cron = "0 0 2 * * *";
        @NotNull
        private RunMode mode = RunMode.FULL;
        @NotNull
        private ExecutionMode executionMode = ExecutionMode.NORMAL;

        @AssertTrue(message = "cron must be set when the schedule is enabled")
        public boolean isCronPresentWhenEnabled() {
            return !enabled || (cron != null && !cron.trim().isEmpty());
        }
    }
}
