package alertcore.notify;

import lombok.Getter;

/**
 * 接收器基类 - 一个命名的通知目的地
 */
@Getter
public abstract class Notifier {

    public enum NotifierType {
        WEBHOOK,
        LOG
    }

    protected final String name;
    protected final String type;
    protected final boolean sendResolved;   // 是否发送解除通知

    protected Notifier(NotifierType type, String name, boolean sendResolved) {
        this.type = type.name();
        this.name = name;
        this.sendResolved = sendResolved;
    }

    /**
     * 投递一条通知，失败不抛异常，结果通过返回值报告
     */
    public abstract DeliveryOutcome deliver(NotificationPayload payload);
}
