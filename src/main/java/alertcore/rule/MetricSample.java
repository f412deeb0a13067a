package alertcore.rule;

import alertcore.label.LabelSet;

/**
 * 指标源返回的一条带标签的瞬时样本
 */
public final class MetricSample {
    private final LabelSet labels;
    private final double value;

    public MetricSample(LabelSet labels, double value) {
        this.labels = labels == null ? LabelSet.EMPTY : labels;
        this.value = value;
    }

    public static MetricSample of(LabelSet labels, double value) {
        return new MetricSample(labels, value);
    }

    public LabelSet getLabels() {
        return labels;
    }

    public double getValue() {
        return value;
    }

    @Override
    public String toString() {
        return labels + " " + value;
    }
}
