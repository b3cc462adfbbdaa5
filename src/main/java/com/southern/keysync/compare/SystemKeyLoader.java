package com.southern.keysync.compare;

import com.southern.keysync.manager.RetryManager;
import com.southern.keysync.pojo.dto.RawKeyRecord;
import com.southern.keysync.pojo.model.ErrorRecord;
import com.southern.keysync.service.ErrorPolicyHandler;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 读取单个系统的 CSV 文件，要求表头至少包含 key 列
 * 其余列作为 metadata 透传
 */
@Slf4j
@Component
public class SystemKeyLoader {

    public static final String KEY_COLUMN = "key";

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            .build();

    private final ErrorPolicyHandler errorPolicyHandler;
    private final RetryManager retryManager;

    public SystemKeyLoader(ErrorPolicyHandler errorPolicyHandler, RetryManager retryManager) {
        this.errorPolicyHandler = errorPolicyHandler;
        this.retryManager = retryManager;
    }

    public SystemKeyData load(String system, Path file) {
        return load(system, file, () -> {
        });
    }

    /**
     * @param onFailedAttempt 每次读取失败时回调，用于统计重试次数
     */
    public SystemKeyData load(String system, Path file, Runnable onFailedAttempt) {
        if (file == null || !Files.isRegularFile(file)) {
            ErrorRecord missing = errorPolicyHandler.handleMissingFile(system, file);
            return new SystemKeyData(system, String.valueOf(file), Collections.emptyList(),
                    Collections.singletonList(missing));
        }

        SystemKeyData data = retryManager.execute(operationName(system), () -> read(system, file), onFailedAttempt);
        log.info("Loaded {} keys from {} for system {}", data.getRecords().size(), file, system);
        return data;
    }

    public static String operationName(String system) {
        return "load-" + system;
    }

    private SystemKeyData read(String system, Path file) {
        List<RawKeyRecord> records = new ArrayList<>();
        List<ErrorRecord> errors = new ArrayList<>();

        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = FORMAT.parse(reader)) {

            String keyColumn = findKeyColumn(parser.getHeaderNames());
            if (keyColumn == null) {
                errors.add(errorPolicyHandler.handleCorruptData(system, file, 1, "Missing 'key' column"));
                return new SystemKeyData(system, file.toString(), records, errors);
            }

            for (CSVRecord record : parser) {
                // 表头占第 1 行
                long row = record.getRecordNumber() + 1;
                if (!record.isConsistent()) {
                    errors.add(errorPolicyHandler.handleCorruptData(system, file, row,
                            "Expected " + parser.getHeaderNames().size() + " columns, found " + record.size()));
                    continue;
                }
                String rawKey = record.get(keyColumn);
                if (rawKey == null || rawKey.trim().isEmpty()) {
                    errors.add(errorPolicyHandler.handleCorruptData(system, file, row, "Empty key field"));
                    continue;
                }
                records.add(RawKeyRecord.builder()
                        .system(system)
                        .rawValue(rawKey)
                        .metadata(metadataOf(record, keyColumn))
                        .lineNumber(row)
                        .build());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Error loading " + file, e);
        }
        return new SystemKeyData(system, file.toString(), records, errors);
    }

    private String findKeyColumn(List<String> headerNames) {
        for (String header : headerNames) {
            if (header != null && KEY_COLUMN.equalsIgnoreCase(header.replace("\uFEFF", "").trim())) {
                return header;
            }
        }
        return null;
    }

    private Map<String, String> metadataOf(CSVRecord record, String keyColumn) {
        Map<String, String> metadata = new LinkedHashMap<>(record.toMap());
        metadata.remove(keyColumn);
        return metadata;
    }
}
