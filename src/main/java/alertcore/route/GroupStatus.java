package alertcore.route;

import alertcore.notify.DeliveryStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * 通知组状态，用于状态查询
 */
@Data
@Builder
public class GroupStatus {
    private final String groupKey;
    private final String receiver;
    private final String route;
    private final Map<String, String> groupLabels;
    private final int members;
    private final int firing;
    private final Instant firstSeen;
    private final Instant lastSent;
    private final Instant lastAttempt;
    private final DeliveryStatus lastStatus;
    private final String lastError;
}
