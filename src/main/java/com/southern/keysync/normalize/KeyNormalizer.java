package com.southern.keysync.normalize;

import com.southern.keysync.config.NormalizationProperties;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 键归一化
 * 固定顺序：去首尾空白 -> 转大写 -> 折叠分隔符 -> 去非字母数字 -> 独立数字左补零
 * 结果只取决于配置和输入，可在多个线程中共用一个实例
 */
@Slf4j
public class KeyNormalizer {

    public static final String TRIM = "trim";
    public static final String UPPERCASE = "uppercase";
    public static final String COLLAPSE_DELIMS = "collapse_delims";
    public static final String STRIP_NON_ALNUM = "strip_non_alnum";
    public static final String PAD_NUMBERS = "pad_numbers";

    private static final Pattern DELIMITER_RUN = Pattern.compile("[\\s_-]+");
    private static final Pattern STANDALONE_NUMBER = Pattern.compile("\\b(\\d+)\\b");
    private static final String DEFAULT_KEPT_DELIMITER = "-";

    private final boolean trimWhitespace;
    private final boolean uppercase;
    private final String delimiter;
    private final boolean stripNonAlnum;
    private final boolean padNumbers;
    private final int padLength;
    private final Pattern disallowedChars;

    private final AtomicLong totalNormalized = new AtomicLong();
    private final Map<String, LongAdder> transformationsApplied = new ConcurrentHashMap<>();

    /**
     * 完全使用默认规则，数字补零默认开启
     */
    public KeyNormalizer() {
        this(null);
    }

    /**
     * 传入配置时，只有显式设置 leftPadNumbers=true 才补零
     */
    public KeyNormalizer(NormalizationProperties properties) {
        boolean usingDefaults = properties == null;
        NormalizationProperties config = usingDefaults ? new NormalizationProperties() : properties;

        String delim = config.getCollapseDelims();
        if (delim != null && delim.length() > 1) {
            throw new IllegalArgumentException("collapse-delims must be a single character, got '" + delim + "'");
        }
        if (config.getPadLength() < 1) {
            throw new IllegalArgumentException("pad-length must be positive, got " + config.getPadLength());
        }

        this.trimWhitespace = config.isTrimWhitespace();
        this.uppercase = config.isUppercase();
        this.delimiter = (delim == null || delim.isEmpty()) ? null : delim;
        this.stripNonAlnum = config.isStripNonAlnum();
        this.padNumbers = usingDefaults || Boolean.TRUE.equals(config.getLeftPadNumbers());
        this.padLength = config.getPadLength();

        String kept = this.delimiter != null ? this.delimiter : DEFAULT_KEPT_DELIMITER;
        this.disallowedChars = Pattern.compile("[^A-Za-z0-9" + escapeForCharClass(kept) + "]");
    }

    public String normalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }

        String key = raw;
        List<String> applied = new ArrayList<>(5);

        if (trimWhitespace) {
            String next = key.trim();
            if (!next.equals(key)) {
                applied.add(TRIM);
            }
            key = next;
        }

        if (uppercase) {
            String next = key.toUpperCase(Locale.ROOT);
            if (!next.equals(key)) {
                applied.add(UPPERCASE);
            }
            key = next;
        }

        if (delimiter != null) {
            // 空白、下划线、连字符以及它们的混合串都折叠成一个分隔符
            String next = DELIMITER_RUN.matcher(key).replaceAll(Matcher.quoteReplacement(delimiter));
            if (!next.equals(key)) {
                applied.add(COLLAPSE_DELIMS);
            }
            key = next;
        }

        if (stripNonAlnum) {
            String next = disallowedChars.matcher(key).replaceAll("");
            if (!next.equals(key)) {
                applied.add(STRIP_NON_ALNUM);
            }
            key = next;
        }

        if (padNumbers) {
            String next = padStandaloneNumbers(key);
            if (!next.equals(key)) {
                applied.add(PAD_NUMBERS);
            }
            key = next;
        }

        totalNormalized.incrementAndGet();
        for (String transformation : applied) {
            transformationsApplied.computeIfAbsent(transformation, k -> new LongAdder()).increment();
        }

        if (log.isDebugEnabled() && !raw.equals(key)) {
            log.debug("Normalized: '{}' -> '{}' (transforms: {})", raw, key, applied);
        }
        return key;
    }

    public List<String> normalizeBatch(Collection<String> keys) {
        List<String> result = new ArrayList<>(keys.size());
        for (String key : keys) {
            result.add(normalize(key));
        }
        return result;
    }

    /**
     * 原始键 -> 归一化键，保持输入顺序
     */
    public Map<String, String> normalizeWithMapping(Collection<String> keys) {
        Map<String, String> mapping = new LinkedHashMap<>();
        for (String key : keys) {
            mapping.put(key, normalize(key));
        }
        return mapping;
    }

    public NormalizationStatistics getStatistics() {
        Map<String, Long> counts = new TreeMap<>();
        transformationsApplied.forEach((name, adder) -> counts.put(name, adder.sum()));
        return new NormalizationStatistics(totalNormalized.get(), counts, describeConfiguration());
    }

    public void resetStatistics() {
        totalNormalized.set(0);
        transformationsApplied.clear();
    }

    public boolean isPadNumbersEnabled() {
        return padNumbers;
    }

    private String padStandaloneNumbers(String key) {
        Matcher matcher = STANDALONE_NUMBER.matcher(key);
        if (!matcher.find()) {
            return key;
        }
        StringBuilder sb = new StringBuilder(key.length() + padLength);
        do {
            String digits = matcher.group(1);
            matcher.appendReplacement(sb, zeroPad(digits));
        } while (matcher.find());
        matcher.appendTail(sb);
        return sb.toString();
    }

    private String zeroPad(String digits) {
        if (digits.length() >= padLength) {
            return digits;
        }
        StringBuilder sb = new StringBuilder(padLength);
        for (int i = digits.length(); i < padLength; i++) {
            sb.append('0');
        }
        return sb.append(digits).toString();
    }

    private Map<String, Object> describeConfiguration() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("trim_whitespace", trimWhitespace);
        config.put("uppercase", uppercase);
        config.put("collapse_delims", delimiter);
        config.put("strip_non_alnum", stripNonAlnum);
        config.put("left_pad_numbers", padNumbers);
        config.put("pad_length", padLength);
        return config;
    }

    private static String escapeForCharClass(String chars) {
        StringBuilder sb = new StringBuilder();
        for (char c : chars.toCharArray()) {
            if ("\\^-[]&".indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
