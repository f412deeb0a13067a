package alertcore.route;

import alertcore.label.LabelSet;

import java.util.Objects;

/**
 * 通知组标识：(接收器, 分组标签)
 */
public final class GroupKey {
    private final String receiver;
    private final LabelSet groupLabels;

    public GroupKey(String receiver, LabelSet groupLabels) {
        this.receiver = receiver;
        this.groupLabels = groupLabels;
    }

    public String getReceiver() {
        return receiver;
    }

    public LabelSet getGroupLabels() {
        return groupLabels;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GroupKey)) {
            return false;
        }
        GroupKey that = (GroupKey) o;
        return receiver.equals(that.receiver)
                && groupLabels.equals(that.groupLabels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(receiver, groupLabels);
    }

    @Override
    public String toString() {
        return receiver + ":" + groupLabels;
    }
}
