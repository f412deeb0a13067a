package alertcore.config;

import alertcore.utils.Durations;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 引擎全局配置 - alertcore.yml，按点分隔的键读取
 */
public class AlertCoreConfig {
    private final Map<String, Object> config;
    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    private AlertCoreConfig(Map<String, Object> config) {
        this.config = config;
    }

    /**
     * 加载配置文件
     */
    @SuppressWarnings("unchecked")
    public static AlertCoreConfig load(String configPath) {
        try {
            Path path = Paths.get(configPath);
            Map<String, Object> config = yamlMapper.readValue(
                    new File(path.toAbsolutePath().toString()),
                    Map.class
            );
            return new AlertCoreConfig(config == null ? Collections.emptyMap() : config);
        } catch (Exception e) {
            throw new ConfigurationException("加载配置文件失败: " + configPath, e);
        }
    }

    public static AlertCoreConfig of(Map<String, Object> config) {
        return new AlertCoreConfig(config == null ? Collections.emptyMap() : config);
    }

    /**
     * 获取字符串配置
     */
    public String getString(String key) {
        return getString(key, null);
    }

    public String getString(String key, String defaultValue) {
        Object value = getValue(key);
        return value != null ? value.toString() : defaultValue;
    }

    /**
     * 获取整数配置
     */
    public int getInt(String key, int defaultValue) {
        Object value = getValue(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt((String) value);
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public double getDouble(String key, double defaultValue) {
        Object value = getValue(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble((String) value);
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * 获取时间周期配置
     */
    public Duration getDuration(String key, Duration defaultValue) {
        return Durations.parse(getValue(key), defaultValue);
    }

    /**
     * 获取对象列表配置，如接收器列表
     */
    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> getMapList(String key) {
        Object value = getValue(key);
        if (value == null) {
            return Collections.emptyList();
        }
        if (!(value instanceof List)) {
            throw new ConfigurationException("配置项必须是列表: " + key);
        }
        for (Object item : (List<Object>) value) {
            if (!(item instanceof Map)) {
                throw new ConfigurationException("配置项列表元素必须是对象: " + key);
            }
        }
        return (List<Map<String, Object>>) value;
    }

    /**
     * 获取子配置
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getSubConfig(String key) {
        Object value = getValue(key);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return Collections.emptyMap();
    }

    /**
     * 获取配置值
     */
    @SuppressWarnings("unchecked")
    private Object getValue(String key) {
        if (StringUtils.isEmpty(key)) {
            return null;
        }

        String[] parts = key.split("\\.");
        Map<String, Object> current = config;

        for (int i = 0; i < parts.length - 1; i++) {
            Object value = current.get(parts[i]);
            if (!(value instanceof Map)) {
                return null;
            }
            current = (Map<String, Object>) value;
        }

        return current.get(parts[parts.length - 1]);
    }

    /**
     * 验证配置
     */
    public void validate() {
        validatePositive("evaluation.interval", "规则执行间隔必须大于0");
        validatePositive("dispatch.interval", "通知调度间隔必须大于0");
        if (getInt("evaluation.concurrency", 1) <= 0) {
            throw new ConfigurationException("evaluation.concurrency必须大于0");
        }
        if (getInt("notifier.retry.max_attempts", 1) <= 0) {
            throw new ConfigurationException("notifier.retry.max_attempts必须大于0");
        }
    }

    private void validatePositive(String key, String message) {
        Duration value = getDuration(key, null);
        if (value != null && (value.isZero() || value.isNegative())) {
            throw new ConfigurationException(message);
        }
    }
}
