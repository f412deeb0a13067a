package alertcore.store;

import alertcore.label.LabelSet;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;

/**
 * 告警实例 - 一个(规则, 标签集)的跟踪记录，不可变，由规则执行器整体替换
 */
@Data
@Builder(toBuilder = true)
public class AlertInstance {
    private final String ruleName;
    private final LabelSet labels;
    private final AlertState state;
    private final Instant activeSince;       // 进入Pending的时间
    private final Instant firingSince;       // 进入Firing的时间，未触发时为空
    private final Instant resolvedAt;        // 进入Resolved的时间
    private final Instant lastEvaluatedAt;   // 最近一次出现在查询结果中的时间
    private final double value;              // 最近一次观测值
    @Builder.Default
    private final Map<String, String> annotations = Collections.emptyMap();

    @JsonIgnore
    public AlertKey getKey() {
        return new AlertKey(ruleName, labels);
    }

    @JsonIgnore
    public boolean isFiring() {
        return state == AlertState.FIRING;
    }

    @JsonIgnore
    public boolean isResolved() {
        return state == AlertState.RESOLVED;
    }

    /**
     * Pending是否已经持续了保持时长
     */
    public boolean heldFor(Duration hold, Instant now) {
        return !Duration.between(activeSince, now).minus(hold).isNegative();
    }

    public String fingerprint() {
        return labels.fingerprint();
    }
}
