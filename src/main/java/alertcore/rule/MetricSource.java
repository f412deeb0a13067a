package alertcore.rule;

import java.time.Instant;
import java.util.List;

/**
 * 指标源接口 - 在给定时刻执行表达式，返回带标签的样本集合
 *
 * <p>实现可能很慢，也可能失败；失败时抛出 {@link EvaluationException}。
 */
@FunctionalInterface
public interface MetricSource {
    List<MetricSample> evaluate(String expression, Instant instant) throws EvaluationException;
}
