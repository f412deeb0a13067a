package alertcore.rule;

import alertcore.label.LabelSet;
import alertcore.store.AlertInstance;
import alertcore.store.AlertState;
import alertcore.store.AlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 规则执行器 - 负责单条规则的周期执行和告警实例状态推进
 *
 * <p>每个tick：查询指标源，新出现的标签集创建Pending实例，持续满足保持时长的实例转为Firing，
 * 从结果中消失的实例转为Resolved，并在保留一个通知周期后清除。
 */
public class RuleEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(RuleEvaluator.class);

    private final AlertRule rule;
    private final MetricSource metricSource;
    private final AlertStore alertStore;
    private final Duration resolvedRetention;

    // 同一条规则的tick不允许重叠
    private final AtomicBoolean running;
    private final RuleHealthStatus health;

    public RuleEvaluator(AlertRule rule, MetricSource metricSource, AlertStore alertStore, Duration resolvedRetention) {
        this(rule, metricSource, alertStore, resolvedRetention, new AtomicBoolean(false));
    }

    /**
     * @param running 执行标记，规则更新后新旧执行器共用同一个标记
     */
    public RuleEvaluator(AlertRule rule, MetricSource metricSource, AlertStore alertStore, Duration resolvedRetention,
                         AtomicBoolean running) {
        this.rule = rule;
        this.running = running;
        this.metricSource = metricSource;
        this.alertStore = alertStore;
        this.resolvedRetention = resolvedRetention == null ? Duration.ZERO : resolvedRetention;
        this.health = new RuleHealthStatus();
        this.health.setRuleName(rule.getName());
        this.health.setStatus("UNKNOWN");
    }

    /**
     * 执行一次规则检查
     *
     * @return 上一轮仍在执行而跳过时返回false
     */
    public boolean evaluate(Instant now) {
        if (!running.compareAndSet(false, true)) {
            logger.debug("规则上一轮仍在执行，跳过本轮: {}", rule.getName());
            return false;
        }

        long startNanos = System.nanoTime();
        try {
            List<MetricSample> samples;
            String error = null;
            try {
                samples = metricSource.evaluate(rule.getExpression(), now);
                if (samples == null) {
                    samples = Collections.emptyList();
                }
            } catch (RuntimeException e) {
                // 查询失败按空结果处理，已触发的实例开始解除
                logger.warn("规则执行失败，本轮按空结果处理: {}", rule.getName(), e);
                samples = Collections.emptyList();
                error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            }

            applyResults(samples, now);
            updateHealth(now, error, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
            return true;
        } finally {
            running.set(false);
        }
    }

    /**
     * 根据查询结果推进实例状态
     */
    private void applyResults(List<MetricSample> samples, Instant now) {
        LabelSet staticLabels = rule.staticLabels();

        Map<LabelSet, MetricSample> results = new LinkedHashMap<>();
        for (MetricSample sample : samples) {
            LabelSet labels = sample.getLabels().merge(staticLabels);
            if (results.putIfAbsent(labels, sample) != null) {
                logger.warn("规则 {} 合并静态标签后出现重复标签集，忽略: {}", rule.getName(), labels);
            }
        }

        Map<LabelSet, AlertInstance> tracked = new HashMap<>();
        for (AlertInstance instance : alertStore.getForRule(rule.getName())) {
            tracked.put(instance.getLabels(), instance);
        }

        for (Map.Entry<LabelSet, MetricSample> entry : results.entrySet()) {
            LabelSet labels = entry.getKey();
            double value = entry.getValue().getValue();
            AlertInstance existing = tracked.get(labels);

            if (existing == null || existing.isResolved()) {
                AlertInstance created = newInstance(labels, value, now);
                if (existing == null) {
                    alertStore.create(created);
                } else {
                    alertStore.upsert(created);
                }
                logger.info("告警实例进入{}: {}{}", created.getState(), rule.getName(), labels);
            } else if (existing.getState() == AlertState.PENDING) {
                if (existing.heldFor(rule.getHold(), now)) {
                    alertStore.upsert(refresh(existing, value, now)
                            .state(AlertState.FIRING)
                            .firingSince(now)
                            .build());
                    logger.info("告警实例触发: {}{}, pending自 {}", rule.getName(), labels, existing.getActiveSince());
                } else {
                    alertStore.upsert(refresh(existing, value, now).build());
                }
            } else {
                alertStore.upsert(refresh(existing, value, now).build());
            }
        }

        for (AlertInstance instance : tracked.values()) {
            if (results.containsKey(instance.getLabels())) {
                continue;
            }
            if (!instance.isResolved()) {
                alertStore.upsert(instance.toBuilder()
                        .state(AlertState.RESOLVED)
                        .resolvedAt(now)
                        .build());
                logger.info("告警实例解除: {}{}, 解除前状态: {}", rule.getName(), instance.getLabels(), instance.getState());
            } else if (!Duration.between(instance.getResolvedAt(), now).minus(resolvedRetention).isNegative()) {
                alertStore.remove(instance.getKey());
                logger.debug("清除已解除的告警实例: {}{}", rule.getName(), instance.getLabels());
            }
        }
    }

    private AlertInstance newInstance(LabelSet labels, double value, Instant now) {
        boolean fireNow = rule.getHold().isZero();
        return AlertInstance.builder()
                .ruleName(rule.getName())
                .labels(labels)
                .state(fireNow ? AlertState.FIRING : AlertState.PENDING)
                .activeSince(now)
                .firingSince(fireNow ? now : null)
                .lastEvaluatedAt(now)
                .value(value)
                .annotations(AnnotationTemplate.renderAll(rule.getAnnotations(), labels, value))
                .build();
    }

    private AlertInstance.AlertInstanceBuilder refresh(AlertInstance existing, double value, Instant now) {
        return existing.toBuilder()
                .value(value)
                .lastEvaluatedAt(now)
                .annotations(AnnotationTemplate.renderAll(rule.getAnnotations(), existing.getLabels(), value));
    }

    private void updateHealth(Instant now, String error, long durationMillis) {
        synchronized (health) {
            health.setLastExecutionTime(now);
            health.setLastDurationMillis(durationMillis);
            if (error == null) {
                health.setStatus("OK");
                health.setConsecutiveFailures(0);
                health.setLastError(null);
            } else {
                health.setStatus("ERROR");
                health.setConsecutiveFailures(health.getConsecutiveFailures() + 1);
                health.setTotalFailures(health.getTotalFailures() + 1);
                health.setLastError(error);
            }
            int pending = 0;
            int firing = 0;
            for (AlertInstance instance : alertStore.getForRule(rule.getName())) {
                if (instance.getState() == AlertState.PENDING) {
                    pending++;
                } else if (instance.isFiring()) {
                    firing++;
                }
            }
            health.setPendingCount(pending);
            health.setFiringCount(firing);
        }
    }

    public RuleHealthStatus getHealth() {
        synchronized (health) {
            RuleHealthStatus copy = new RuleHealthStatus();
            copy.setRuleName(health.getRuleName());
            copy.setStatus(health.getStatus());
            copy.setLastExecutionTime(health.getLastExecutionTime());
            copy.setLastDurationMillis(health.getLastDurationMillis());
            copy.setConsecutiveFailures(health.getConsecutiveFailures());
            copy.setTotalFailures(health.getTotalFailures());
            copy.setLastError(health.getLastError());
            copy.setPendingCount(health.getPendingCount());
            copy.setFiringCount(health.getFiringCount());
            return copy;
        }
    }

    public AlertRule getRule() {
        return rule;
    }

    public boolean isRunning() {
        return running.get();
    }
}
