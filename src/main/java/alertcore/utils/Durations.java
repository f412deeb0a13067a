package alertcore.utils;

import alertcore.config.ConfigurationException;
import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 时间周期解析，支持 "30s"、"5m"、"1h30m"、"500ms" 以及 {minutes: 5} 形式
 */
public final class Durations {

    private static final Pattern PART = Pattern.compile("(\\d+)(ms|s|m|h|d|w)");

    private Durations() {
    }

    public static Duration parse(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Duration) {
            return (Duration) value;
        }
        if (value instanceof Number) {
            // 纯数字按秒处理
            return Duration.ofSeconds(((Number) value).longValue());
        }
        if (value instanceof String) {
            return parseString((String) value);
        }
        if (value instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> map = (Map<String, Object>) value;
            return parseMap(map);
        }
        throw new ConfigurationException("无效的时间周期格式: " + value);
    }

    public static Duration parse(Object value, Duration defaultValue) {
        Duration parsed = parse(value);
        return parsed != null ? parsed : defaultValue;
    }

    /**
     * 解析时间周期字符串
     */
    public static Duration parseString(String value) {
        String text = StringUtils.trimToEmpty(value).toLowerCase();
        if (text.isEmpty()) {
            throw new ConfigurationException("时间周期不能为空");
        }
        if (text.equals("0")) {
            return Duration.ZERO;
        }

        Matcher matcher = PART.matcher(text);
        Duration duration = Duration.ZERO;
        int consumed = 0;
        while (matcher.find()) {
            if (matcher.start() != consumed) {
                throw new ConfigurationException("无效的时间周期: " + value);
            }
            long amount = Long.parseLong(matcher.group(1));
            switch (matcher.group(2)) {
                case "ms":
                    duration = duration.plusMillis(amount);
                    break;
                case "s":
                    duration = duration.plusSeconds(amount);
                    break;
                case "m":
                    duration = duration.plusMinutes(amount);
                    break;
                case "h":
                    duration = duration.plusHours(amount);
                    break;
                case "d":
                    duration = duration.plusDays(amount);
                    break;
                default:
                    duration = duration.plusDays(amount * 7);
            }
            consumed = matcher.end();
        }
        if (consumed != text.length()) {
            throw new ConfigurationException("无效的时间单位: " + value);
        }
        return duration;
    }

    /**
     * 解析时间周期映射
     */
    public static Duration parseMap(Map<String, Object> map) {
        Duration duration = Duration.ZERO;

        for (Map.Entry<String, Object> entry : map.entrySet()) {
            String unit = entry.getKey().toLowerCase();
            if (!(entry.getValue() instanceof Number)) {
                throw new ConfigurationException("无效的时间数值: " + entry);
            }
            long amount = ((Number) entry.getValue()).longValue();

            switch (unit) {
                case "milliseconds":
                    duration = duration.plusMillis(amount);
                    break;
                case "seconds":
                    duration = duration.plusSeconds(amount);
                    break;
                case "minutes":
                    duration = duration.plusMinutes(amount);
                    break;
                case "hours":
                    duration = duration.plusHours(amount);
                    break;
                case "days":
                    duration = duration.plusDays(amount);
                    break;
                default:
                    throw new ConfigurationException("无效的时间单位: " + unit);
            }
        }

        return duration;
    }
}
