package alertcore.store;

import alertcore.label.LabelSet;

import java.util.Objects;

/**
 * 告警实例键 - (规则名, 标签集)
 */
public final class AlertKey {
    private final String ruleName;
    private final LabelSet labels;

    public AlertKey(String ruleName, LabelSet labels) {
        this.ruleName = Objects.requireNonNull(ruleName, "ruleName");
        this.labels = Objects.requireNonNull(labels, "labels");
    }

    public String getRuleName() {
        return ruleName;
    }

    public LabelSet getLabels() {
        return labels;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AlertKey)) {
            return false;
        }
        AlertKey other = (AlertKey) o;
        return ruleName.equals(other.ruleName) && labels.equals(other.labels);
    }

    @Override
    public int hashCode() {
        return 31 * ruleName.hashCode() + labels.hashCode();
    }

    @Override
    public String toString() {
        return ruleName + labels;
    }
}
