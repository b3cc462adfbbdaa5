package com.southern.keysync.compare;

import com.southern.keysync.common.enums.MissingFilePolicy;
import com.southern.keysync.common.exception.DataValidationException;
import com.southern.keysync.common.exception.SystemUnavailableException;
import com.southern.keysync.config.KeySyncProperties;
import com.southern.keysync.manager.RetryManager;
import com.southern.keysync.normalize.KeyNormalizer;
import com.southern.keysync.pojo.model.ErrorRecord;
import com.southern.keysync.service.ErrorPolicyHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SystemComparatorTest {

    @TempDir
    Path tempDir;

    private KeySyncProperties properties;

    @BeforeEach
    void setUp() {
        properties = new KeySyncProperties();
        properties.getErrorHandling().setRetryAttempts(1);
        properties.getErrorHandling().setRetryDelaySeconds(0);
    }

    private SystemComparator comparator() {
        ErrorPolicyHandler handler = new ErrorPolicyHandler(properties);
        SystemKeyLoader loader = new SystemKeyLoader(handler, new RetryManager(properties));
        return new SystemComparator(new KeyNormalizer(), loader, handler, properties);
    }

    private String csv(String name, String... keys) throws IOException {
        StringBuilder content = new StringBuilder("key,status\n");
        for (String key : keys) {
            content.append(key).append(",active\n");
        }
        return write(name, content.toString());
    }

    private String write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file.toString();
    }

    @Test
    void twoSystemExample() throws IOException {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("A", csv("A.csv", "K1", "K2", "K3"));
        files.put("B", csv("B.csv", "K1", "K2", "K4"));

        ComparisonResult result = comparator().compareAll(files);

        assertThat(result.isAuthorityPresent()).isTrue();
        assertThat(result.getKeysOnlyInAuthority()).containsExactly("K3");
        assertThat(result.getKeysMissingInAuthority()).containsExactly("K4");
        assertThat(result.getKeysInAllSystems()).containsExactly("K1", "K2");
        assertThat(result.getAllKeys()).containsExactly("K1", "K2", "K3", "K4");
        assertThat(result.getSystemGaps()).containsOnlyKeys("B");
        assertThat(result.getSystemGaps().get("B")).containsExactly("K3");
        assertThat(result.getStatistics().getMatchPercentage()).isEqualTo(50.0);
        assertThat(result.getStatistics().getSystemCounts()).containsEntry("A", 3).containsEntry("B", 3);
        assertThat(result.getStatistics().getTotalKeysProcessed()).isEqualTo(6);
    }

    @Test
    void setAlgebraLawsHold() throws IOException {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("A", csv("A.csv", "K1", "K2", "K3", "K5"));
        files.put("B", csv("B.csv", "K1", "K2", "K4"));
        files.put("C", csv("C.csv", "K1", "K6", "k-2"));

        ComparisonResult result = comparator().compareAll(files);

        assertThat(result.getAllKeys()).containsAll(result.getKeysInAllSystems());
        Set<String> overlap = new TreeSet<>(result.getKeysOnlyInAuthority());
        overlap.retainAll(result.getKeysMissingInAuthority());
        assertThat(overlap).isEmpty();
        assertThat(result.getStatistics().getMatchPercentage()).isBetween(0.0, 100.0);
        assertThat(result.getKeysInAllSystems()).containsExactly("K1");
        assertThat(result.getKeysMissingInAuthority()).containsExactly("K-000002", "K4", "K6");
    }

    @Test
    void duplicateGroupsArePerSystem() throws IOException {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("A", csv("A.csv", "KEY-001", "key-001", "KEY-002"));
        files.put("B", csv("B.csv", "KEY-001"));

        ComparisonResult result = comparator().compareAll(files);

        assertThat(result.getDuplicates()).containsOnlyKeys("A");
        assertThat(result.getDuplicates().get("A")).containsOnlyKeys("KEY-000001");
        assertThat(result.getDuplicates().get("A").get("KEY-000001")).containsExactlyInAnyOrder("KEY-001", "key-001");
        assertThat(result.getStatistics().getDuplicateGroupCounts()).containsEntry("A", 1);
    }

    @Test
    void resultIsIndependentOfBatchSizeAndParallelism() throws IOException {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("A", csv("A.csv", "k-1", "K_1", "k-2", "k-3", "x 9"));
        files.put("B", csv("B.csv", "k-2", "k-4"));
        files.put("C", csv("C.csv", "k-1", "k-2", "k-5"));

        properties.getProcessing().setParallel(true);
        properties.getProcessing().setBatchSize(1000);
        ComparisonResult parallel = comparator().compareAll(files);

        properties.getProcessing().setParallel(false);
        properties.getProcessing().setBatchSize(1);
        ComparisonResult sequential = comparator().compareAll(files);

        assertThat(sequential.getSystemKeys()).isEqualTo(parallel.getSystemKeys());
        assertThat(sequential.getAllKeys()).isEqualTo(parallel.getAllKeys());
        assertThat(sequential.getKeysInAllSystems()).isEqualTo(parallel.getKeysInAllSystems());
        assertThat(sequential.getDuplicates()).isEqualTo(parallel.getDuplicates());
        assertThat(sequential.getStatistics()).isEqualTo(parallel.getStatistics());
    }

    @Test
    void missingAuthorityGivesEmptyComparison() throws IOException {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("B", csv("B.csv", "K1"));

        ComparisonResult result = comparator().compareAll(files);

        assertThat(result.isAuthorityPresent()).isFalse();
        assertThat(result.getAllKeys()).isEmpty();
        assertThat(result.getKeysMissingInAuthority()).isEmpty();
        assertThat(result.getSystemKeys()).containsOnlyKeys("B");
    }

    @Test
    void missingDependentFileUnderSkipIsEmptySystem() throws IOException {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("A", csv("A.csv", "K1"));
        files.put("B", tempDir.resolve("B.csv").toString());

        ComparisonResult result = comparator().compareAll(files);

        assertThat(result.getLoadErrors()).extracting(ErrorRecord::getType).containsExactly(ErrorRecord.MISSING_FILE);
        assertThat(result.getStatistics().getSystemCounts()).containsEntry("B", 0);
        assertThat(result.getKeysOnlyInAuthority()).containsExactly("K1");
        assertThat(result.getFailedSystems()).isEmpty();
    }

    @Test
    void missingFileUnderFailPolicyAborts() throws IOException {
        properties.getErrorHandling().setOnMissingFile(MissingFilePolicy.FAIL);
        Map<String, String> files = new LinkedHashMap<>();
        files.put("A", csv("A.csv", "K1"));
        files.put("B", tempDir.resolve("B.csv").toString());

        assertThatThrownBy(() -> comparator().compareAll(files)).isInstanceOf(SystemUnavailableException.class);
    }

    @Test
    void unreadableSystemIsExcludedAndOthersContinue() throws IOException {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("A", csv("A.csv", "K1", "K2"));
        files.put("B", write("B.csv", "key,status\n\"K1,active\n"));
        files.put("C", csv("C.csv", "K1"));

        ComparisonResult result = comparator().compareAll(files);

        assertThat(result.getFailedSystems()).containsExactly("B");
        assertThat(result.getLoadErrors()).extracting(ErrorRecord::getType).contains(ErrorRecord.LOAD_FAILURE);
        assertThat(result.getSystemKeys()).containsOnlyKeys("A", "C");
        assertThat(result.getKeysInAllSystems()).containsExactly("K1");
        assertThat(result.getRecoveryAttempts())
                .containsEntry("load-A", 0)
                .containsEntry("load-B", 1)
                .containsEntry("load-C", 0);
    }

    @Test
    void keyWithoutLettersOrDigitsIsCorruptRow() throws IOException {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("A", csv("A.csv", "K1"));
        files.put("B", csv("B.csv", "K1", "***"));

        ComparisonResult result = comparator().compareAll(files);

        assertThat(result.getAllKeys()).containsExactly("K1").doesNotContain("");
        assertThat(result.getKeysMissingInAuthority()).isEmpty();
        assertThat(result.getLoadErrors()).singleElement().satisfies(error -> {
            assertThat(error.getType()).isEqualTo(ErrorRecord.CORRUPT_DATA);
            assertThat(error.getSystem()).isEqualTo("B");
            assertThat(error.getRow()).isEqualTo(3L);
        });
    }

    @Test
    void unreadableSystemFailsWhenPartialProcessingDisabled() throws IOException {
        properties.getErrorHandling().setEnablePartialProcessing(false);
        Map<String, String> files = new LinkedHashMap<>();
        files.put("A", csv("A.csv", "K1"));
        files.put("B", write("B.csv", "key,status\n\"K1,active\n"));

        assertThatThrownBy(() -> comparator().compareAll(files)).isInstanceOf(SystemUnavailableException.class);
    }

    @Test
    void errorCeilingAbortsComparison() throws IOException {
        properties.getErrorHandling().setMaxErrorsBeforeFail(1);
        Map<String, String> files = new LinkedHashMap<>();
        files.put("A", write("A.csv", "key,status\nK1,active\n,x\n,y\n"));

        assertThatThrownBy(() -> comparator().compareAll(files)).isInstanceOf(DataValidationException.class);
    }

    @Test
    void emptyInputsGiveZeroMatch() throws IOException {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("A", write("A.csv", "key,status\n"));
        files.put("B", write("B.csv", "key,status\n"));

        ComparisonResult result = comparator().compareAll(files);

        assertThat(result.getAllKeys()).isEmpty();
        assertThat(result.getStatistics().getMatchPercentage()).isZero();
    }
}
