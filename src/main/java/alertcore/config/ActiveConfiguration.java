package alertcore.config;

import alertcore.notify.Notifier;
import alertcore.route.Route;
import alertcore.rule.AlertRule;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 当前生效的配置：全局设置、规则、路由树和接收器，构建完成并校验后整体替换
 */
@Getter
@Builder
public class ActiveConfiguration {
    private final AlertCoreConfig global;
    private final List<AlertRule> rules;
    private final Route route;
    private final Map<String, Notifier> receivers;
    private final String hash;          // 所有配置文件内容的摘要
    private final Instant loadedAt;

    public Optional<Notifier> receiver(String name) {
        return Optional.ofNullable(receivers.get(name));
    }

    public boolean sendsResolved(String receiverName) {
        Notifier notifier = receivers.get(receiverName);
        return notifier != null && notifier.isSendResolved();
    }
}
