package alertcore.route;

import alertcore.notify.DeliveryStatus;
import alertcore.store.AlertInstance;
import alertcore.store.AlertKey;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 通知组 - 同一接收器、同一分组标签下的告警集合及其发送记录
 *
 * <p>成员保存的是告警实例的副本，实例从告警表消失后组内仍然可以报告其解除。
 * 状态只在Router的锁内修改。
 */
@Getter
public class NotificationGroup {
    private final GroupKey key;
    @Setter
    private Route route;
    private final Map<AlertKey, AlertInstance> members = new LinkedHashMap<>();
    private final Instant firstSeen;
    @Setter
    private Instant lastSent;
    @Setter
    private Instant lastAttempt;
    @Setter
    private DeliveryStatus lastStatus;
    @Setter
    private String lastError;
    @Setter
    private Instant emptySince;
    // 最近一次成功通知时处于Firing的成员
    private Set<AlertKey> lastNotifiedFiring = Collections.emptySet();
    @Setter
    private boolean inFlight;

    public NotificationGroup(GroupKey key, Route route, Instant firstSeen) {
        this.key = key;
        this.route = route;
        this.firstSeen = firstSeen;
    }

    public String getReceiver() {
        return key.getReceiver();
    }

    public void setLastNotifiedFiring(Set<AlertKey> keys) {
        this.lastNotifiedFiring = Collections.unmodifiableSet(new HashSet<>(keys));
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }
}
