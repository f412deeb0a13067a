package alertcore.label;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.codec.digest.DigestUtils;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 不可变标签集合 - 与规则名一起唯一标识一个告警实例
 */
public final class LabelSet {

    public static final LabelSet EMPTY = new LabelSet(new TreeMap<>());

    private final SortedMap<String, String> labels;
    private final int hash;
    private volatile String fingerprint;

    private LabelSet(SortedMap<String, String> labels) {
        this.labels = Collections.unmodifiableSortedMap(labels);
        this.hash = labels.hashCode();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static LabelSet of(Map<String, String> labels) {
        if (labels == null || labels.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, String> copy = new TreeMap<>();
        labels.forEach((name, value) -> {
            if (name == null) {
                throw new IllegalArgumentException("标签名不能为空");
            }
            copy.put(name, value == null ? "" : value);
        });
        return new LabelSet(copy);
    }

    public static LabelSet of(String... nameValues) {
        if (nameValues.length % 2 != 0) {
            throw new IllegalArgumentException("标签必须成对出现: name, value");
        }
        TreeMap<String, String> copy = new TreeMap<>();
        for (int i = 0; i < nameValues.length; i += 2) {
            copy.put(nameValues[i], nameValues[i + 1]);
        }
        return new LabelSet(copy);
    }

    /**
     * 读取标签值，缺失的标签按空字符串处理
     */
    public String get(String name) {
        String value = labels.get(name);
        return value == null ? "" : value;
    }

    public boolean contains(String name) {
        return labels.containsKey(name);
    }

    public int size() {
        return labels.size();
    }

    public boolean isEmpty() {
        return labels.isEmpty();
    }

    @JsonValue
    public Map<String, String> asMap() {
        return labels;
    }

    /**
     * 合并标签，other中的同名标签覆盖当前值
     */
    public LabelSet merge(LabelSet other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        TreeMap<String, String> merged = new TreeMap<>(labels);
        merged.putAll(other.labels);
        return new LabelSet(merged);
    }

    public LabelSet with(String name, String value) {
        TreeMap<String, String> copy = new TreeMap<>(labels);
        copy.put(name, value);
        return new LabelSet(copy);
    }

    /**
     * 投影到指定标签名上，用于提取分组键
     */
    public LabelSet project(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, String> projected = new TreeMap<>();
        for (String name : names) {
            String value = labels.get(name);
            if (value != null) {
                projected.put(name, value);
            }
        }
        return new LabelSet(projected);
    }

    /**
     * 稳定的标签指纹
     */
    public String fingerprint() {
        String result = fingerprint;
        if (result == null) {
            result = DigestUtils.md5Hex(toString());
            fingerprint = result;
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LabelSet)) {
            return false;
        }
        LabelSet other = (LabelSet) o;
        return hash == other.hash && labels.equals(other.labels);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, String> entry : labels.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(escape(entry.getKey())).append("=\"").append(escape(entry.getValue())).append('"');
            first = false;
        }
        return sb.append('}').toString();
    }

    // 转义反斜杠和引号，保证不同标签集的文本形式不会相同
    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
