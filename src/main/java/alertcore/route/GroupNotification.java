package alertcore.route;

import alertcore.store.AlertInstance;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * 到期通知组的快照，投递期间不持有任何锁
 */
@Data
@Builder
public class GroupNotification {
    private final GroupKey groupKey;
    private final List<AlertInstance> firing;     // 未被静默的Firing成员
    private final List<AlertInstance> resolved;   // 需要报告解除的成员
    private final Instant createdAt;

    public String getReceiver() {
        return groupKey.getReceiver();
    }
}
