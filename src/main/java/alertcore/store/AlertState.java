package alertcore.store;

/**
 * 告警实例生命周期状态
 */
public enum AlertState {
    PENDING,
    FIRING,
    RESOLVED;

    public String value() {
        return name().toLowerCase();
    }
}
