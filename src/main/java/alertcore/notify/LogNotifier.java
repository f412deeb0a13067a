package alertcore.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * 只写日志的接收器，未配置webhook的接收器使用
 */
public class LogNotifier extends Notifier {
    private static final Logger logger = LoggerFactory.getLogger(LogNotifier.class);

    private final Clock clock;

    public LogNotifier(String name, boolean sendResolved, Clock clock) {
        super(NotifierType.LOG, name, sendResolved);
        this.clock = clock;
    }

    @Override
    public DeliveryOutcome deliver(NotificationPayload payload) {
        logger.info("[{}] 告警通知: groupKey={}, status={}, firing={}, resolved={}, commonLabels={}",
                name, payload.getGroupKey(), payload.getStatus(),
                payload.getFiringCount(), payload.getResolvedCount(), payload.getCommonLabels());
        return DeliveryOutcome.success(1, 0, clock.instant());
    }
}
