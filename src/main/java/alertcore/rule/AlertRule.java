package alertcore.rule;

import alertcore.config.ConfigurationException;
import alertcore.label.LabelSet;
import lombok.Builder;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;

/**
 * 告警规则 - 加载后不可变，规则集整体重载
 */
@Data
@Builder
public class AlertRule {
    public static final String ALERT_NAME_LABEL = "alertname";
    public static final String SEVERITY_LABEL = "severity";

    private final String name;                       // 规则名称
    private final String expression;                 // 交给指标源执行的表达式
    @Builder.Default
    private final Duration hold = Duration.ZERO;     // 触发前需要持续满足的时长
    @Builder.Default
    private final LabelSet labels = LabelSet.EMPTY;  // 合并到结果上的静态标签
    @Builder.Default
    private final Map<String, String> annotations = Collections.emptyMap(); // 注解模板
    private final String severity;                   // 告警级别
    private final Duration interval;                 // 执行间隔，为空时使用全局配置
    private final String group;                      // 规则组名称
    private final String sourcePath;                 // 规则文件路径

    /**
     * 合并到每个实例上的标签：静态标签 + alertname + severity
     */
    public LabelSet staticLabels() {
        LabelSet result = labels.with(ALERT_NAME_LABEL, name);
        if (StringUtils.isNotBlank(severity) && !labels.contains(SEVERITY_LABEL)) {
            result = result.with(SEVERITY_LABEL, severity);
        }
        return result;
    }

    /**
     * 验证规则配置
     */
    public void validate() {
        if (StringUtils.isBlank(name)) {
            throw new ConfigurationException("规则名称不能为空");
        }
        if (StringUtils.isBlank(expression)) {
            throw new ConfigurationException("规则表达式不能为空: " + name);
        }
        if (hold == null || hold.isNegative()) {
            throw new ConfigurationException("规则保持时长不能为负数: " + name);
        }
        if (interval != null && (interval.isZero() || interval.isNegative())) {
            throw new ConfigurationException("规则执行间隔必须大于0: " + name);
        }
    }
}
