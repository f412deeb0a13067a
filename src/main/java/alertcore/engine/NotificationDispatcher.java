package alertcore.engine;

import alertcore.config.ActiveConfiguration;
import alertcore.notify.DeliveryOutcome;
import alertcore.notify.NotificationPayload;
import alertcore.notify.Notifier;
import alertcore.route.GroupNotification;
import alertcore.route.Router;
import alertcore.silence.Silencer;
import alertcore.store.AlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * 通知调度 - 每轮：告警表快照 -> 路由 -> 到期组 -> 构建通知体 -> 在投递线程池上发送
 */
public class NotificationDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final AlertStore alertStore;
    private final Router router;
    private final Silencer silencer;
    private final Supplier<ActiveConfiguration> configuration;
    private final Executor deliveryExecutor;
    private final Clock clock;

    public NotificationDispatcher(AlertStore alertStore, Router router, Silencer silencer,
                                  Supplier<ActiveConfiguration> configuration, Executor deliveryExecutor, Clock clock) {
        this.alertStore = alertStore;
        this.router = router;
        this.silencer = silencer;
        this.configuration = configuration;
        this.deliveryExecutor = deliveryExecutor;
        this.clock = clock;
    }

    /**
     * 执行一轮调度
     *
     * @return 本轮提交投递的组数量
     */
    public int runOnce(Instant now) {
        ActiveConfiguration config = configuration.get();
        router.route(alertStore.getAll(), now);
        List<GroupNotification> due = router.dueGroups(now, silencer, config::sendsResolved);
        if (due.isEmpty()) {
            return 0;
        }
        logger.debug("本轮到期通知组 {} 个", due.size());

        for (GroupNotification notification : due) {
            Notifier notifier = config.receiver(notification.getReceiver()).orElse(null);
            if (notifier == null) {
                router.recordOutcome(notification, DeliveryOutcome.failed(0, 0,
                        "接收器不存在: " + notification.getReceiver(), now));
                continue;
            }
            NotificationPayload payload = NotificationPayload.from(notification);
            try {
                deliveryExecutor.execute(() -> deliver(notifier, notification, payload));
            } catch (RejectedExecutionException e) {
                logger.error("投递任务被拒绝: {}", notification.getGroupKey(), e);
                router.recordOutcome(notification, DeliveryOutcome.failed(0, 0, "投递任务被拒绝", now));
            }
        }
        return due.size();
    }

    private void deliver(Notifier notifier, GroupNotification notification, NotificationPayload payload) {
        DeliveryOutcome outcome;
        try {
            outcome = notifier.deliver(payload);
        } catch (RuntimeException e) {
            logger.error("投递异常: {}", notification.getGroupKey(), e);
            outcome = DeliveryOutcome.failed(1, 0, e.getMessage(), clock.instant());
        }
        router.recordOutcome(notification, outcome);
    }
}
