package org.whileverifier.verification;

import lombok.Builder;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

/**
 * 验证器配置。
 * <p>
 * 可以通过 builder 构造，也可以从系统属性读取：
 * <ul>
 *     <li>whileverifier.timeout.ms: 单个验证条件的求解超时，默认 10000</li>
 *     <li>whileverifier.parallelism: 并行求解数，默认为处理器数</li>
 *     <li>whileverifier.reporting: first 或 all，默认 first</li>
 *     <li>whileverifier.division-check: 是否生成除数非零条件，默认 false</li>
 * </ul>
 */
@Getter
@Builder(toBuilder = true)
public final class VerifierOptions {

    private static final Logger logger = LoggerFactory.getLogger(VerifierOptions.class);

    public static final String TIMEOUT_PROPERTY = "whileverifier.timeout.ms";
    public static final String PARALLELISM_PROPERTY = "whileverifier.parallelism";
    public static final String REPORTING_PROPERTY = "whileverifier.reporting";
    public static final String DIVISION_CHECK_PROPERTY = "whileverifier.division-check";

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    @Builder.Default
    private final Duration timeout = DEFAULT_TIMEOUT;

    @Builder.Default
    private final int parallelism = Runtime.getRuntime().availableProcessors();

    @Builder.Default
    private final ReportingMode reportingMode = ReportingMode.FIRST_FAILURE;

    @Builder.Default
    private final boolean checkDivisionDefinedness = false;

    public static VerifierOptions defaults() {
        return VerifierOptions.builder().build();
    }

    public static VerifierOptions fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * 未设置的属性使用默认值。
     * @throws IllegalArgumentException 如果属性值无法解析。
     */
    public static VerifierOptions fromProperties(Properties properties) {
        VerifierOptionsBuilder builder = VerifierOptions.builder();

        String timeout = properties.getProperty(TIMEOUT_PROPERTY);
        if (timeout != null) {
            long millis = parseLong(TIMEOUT_PROPERTY, timeout);
            if (millis < 0) {
                throw new IllegalArgumentException(TIMEOUT_PROPERTY + " 不能为负数: " + timeout);
            }
            builder.timeout(Duration.ofMillis(millis));
        }

        String parallelism = properties.getProperty(PARALLELISM_PROPERTY);
        if (parallelism != null) {
            long value = parseLong(PARALLELISM_PROPERTY, parallelism);
            if (value < 1 || value > Integer.MAX_VALUE) {
                throw new IllegalArgumentException(PARALLELISM_PROPERTY + " 必须是正整数: " + parallelism);
            }
            builder.parallelism((int) value);
        }

        String reporting = properties.getProperty(REPORTING_PROPERTY);
        if (reporting != null) {
            builder.reportingMode(switch (reporting.trim().toLowerCase(Locale.ROOT)) {
                case "first" -> ReportingMode.FIRST_FAILURE;
                case "all" -> ReportingMode.ALL_FAILURES;
                default -> throw new IllegalArgumentException(REPORTING_PROPERTY + " 只能是 first 或 all: " + reporting);
            });
        }

        String divisionCheck = properties.getProperty(DIVISION_CHECK_PROPERTY);
        if (divisionCheck != null) {
            builder.checkDivisionDefinedness(Boolean.parseBoolean(divisionCheck.trim()));
        }

        VerifierOptions options = builder.build();
        logger.debug("读取配置: {}", options);
        return options;
    }

    private static long parseLong(String property, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.error("无法解析配置 {}={}", property, value);
            throw new IllegalArgumentException(property + " 不是整数: " + value, e);
        }
    }

    @Override
    public String toString() {
        return "VerifierOptions(timeout=" + timeout + ", parallelism=" + parallelism
                + ", reportingMode=" + reportingMode + ", checkDivisionDefinedness=" + checkDivisionDefinedness + ")";
    }
}
