package alertcore.label;

import alertcore.config.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 标签匹配谓词，路由和静默共用
 */
public final class Matcher {

    /**
     * 匹配类型
     */
    public enum MatchType {
        EQUAL("="),
        NOT_EQUAL("!="),
        REGEX("=~"),
        NOT_REGEX("!~");

        private final String operator;

        MatchType(String operator) {
            this.operator = operator;
        }

        public String getOperator() {
            return operator;
        }
    }

    private static final Pattern SYNTAX = Pattern.compile(
            "^\\s*([a-zA-Z_][a-zA-Z0-9_]*)\\s*(=~|!~|!=|=)\\s*(.*?)\\s*$");

    private final String name;
    private final MatchType type;
    private final String value;
    private final Pattern pattern;

    private Matcher(String name, MatchType type, String value) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.value = value == null ? "" : value;
        if (type == MatchType.REGEX || type == MatchType.NOT_REGEX) {
            try {
                // 正则完全锚定
                this.pattern = Pattern.compile("^(?:" + this.value + ")$");
            } catch (PatternSyntaxException e) {
                throw new ConfigurationException("无效的正则表达式: " + name + type.getOperator() + this.value, e);
            }
        } else {
            this.pattern = null;
        }
    }

    public static Matcher of(String name, MatchType type, String value) {
        return new Matcher(name, type, value);
    }

    public static Matcher equal(String name, String value) {
        return new Matcher(name, MatchType.EQUAL, value);
    }

    public static Matcher notEqual(String name, String value) {
        return new Matcher(name, MatchType.NOT_EQUAL, value);
    }

    public static Matcher regex(String name, String value) {
        return new Matcher(name, MatchType.REGEX, value);
    }

    public static Matcher notRegex(String name, String value) {
        return new Matcher(name, MatchType.NOT_REGEX, value);
    }

    /**
     * 解析文本形式的匹配器，例如 severity=~"warning|critical"
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Matcher parse(String text) {
        if (text == null) {
            throw new ConfigurationException("匹配器不能为空");
        }
        java.util.regex.Matcher m = SYNTAX.matcher(text);
        if (!m.matches()) {
            throw new ConfigurationException("无效的匹配器语法: " + text);
        }
        MatchType type;
        switch (m.group(2)) {
            case "=":
                type = MatchType.EQUAL;
                break;
            case "!=":
                type = MatchType.NOT_EQUAL;
                break;
            case "=~":
                type = MatchType.REGEX;
                break;
            default:
                type = MatchType.NOT_REGEX;
        }
        return new Matcher(m.group(1), type, unquote(m.group(3), text));
    }

    private static String unquote(String raw, String text) {
        if (raw.length() >= 2 && raw.startsWith("\"") && raw.endsWith("\"")) {
            return raw.substring(1, raw.length() - 1).replace("\\\"", "\"");
        }
        if (raw.startsWith("\"") || raw.endsWith("\"")) {
            throw new ConfigurationException("匹配器引号不成对: " + text);
        }
        return raw;
    }

    public boolean matches(LabelSet labels) {
        String actual = labels.get(name);
        switch (type) {
            case EQUAL:
                return actual.equals(value);
            case NOT_EQUAL:
                return !actual.equals(value);
            case REGEX:
                return pattern.matcher(actual).matches();
            case NOT_REGEX:
                return !pattern.matcher(actual).matches();
            default:
                throw new IllegalStateException("未知的匹配类型: " + type);
        }
    }

    public String getName() {
        return name;
    }

    public MatchType getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Matcher)) {
            return false;
        }
        Matcher other = (Matcher) o;
        return name.equals(other.name) && type == other.type && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, value);
    }

    @JsonValue
    @Override
    public String toString() {
        return name + type.getOperator() + "\"" + value.replace("\"", "\\\"") + "\"";
    }
}
