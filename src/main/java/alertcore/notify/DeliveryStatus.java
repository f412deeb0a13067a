package alertcore.notify;

/**
 * 通知组最近一次投递结果
 */
public enum DeliveryStatus {
    SUCCESS,
    FAILED
}
