package alertcore.config;

import alertcore.rule.AlertRule;

/**
 * 规则变更监听器接口，配置整体替换后按规则逐条回调
 */
public interface RuleChangeListener {
    void onRuleAdded(AlertRule rule);
    void onRuleUpdated(AlertRule rule);
    void onRuleDeleted(AlertRule rule);
}
