package alertcore.engine;

import alertcore.config.ActiveConfiguration;
import alertcore.config.AlertCoreConfig;
import alertcore.config.ConfigLoader;
import alertcore.config.ConfigurationException;
import alertcore.config.RuleChangeListener;
import alertcore.route.Router;
import alertcore.rule.AlertRule;
import alertcore.rule.MetricSource;
import alertcore.rule.PrometheusMetricSource;
import alertcore.rule.RuleEvaluator;
import alertcore.rule.RuleHealthStatus;
import alertcore.silence.FileSilenceStore;
import alertcore.silence.InMemorySilenceStore;
import alertcore.silence.SilenceStore;
import alertcore.silence.Silencer;
import alertcore.store.AlertInstance;
import alertcore.store.AlertState;
import alertcore.store.AlertStore;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 告警引擎主类 - 持有线程池、规则调度、通知调度、静默清理和配置重载
 */
public class AlertCoreApplication implements AutoCloseable, RuleChangeListener {
    private static final Logger logger = LoggerFactory.getLogger(AlertCoreApplication.class);

    private final ConfigLoader configLoader;
    private final AtomicReference<ActiveConfiguration> active = new AtomicReference<>();
    private final Clock clock;
    private final AlertStore alertStore;
    private final MetricSource metricSource;
    private final Silencer silencer;
    private final Router router;
    private final NotificationDispatcher dispatcher;

    private final ScheduledExecutorService scheduler;
    private final ThreadPoolExecutor evaluationPool;
    private final ThreadPoolExecutor dispatchPool;
    private final Map<String, RuleEvaluator> ruleEvaluators = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> ruleSchedules = new ConcurrentHashMap<>();
    // 按规则名保存执行标记，规则更新或删除后旧执行器未结束的tick仍然占用它
    private final Map<String, AtomicBoolean> ruleGuards = new ConcurrentHashMap<>();

    private final Duration evaluationInterval;
    private final Duration dispatchInterval;
    private final Duration resolvedRetention;
    private final Duration gracePeriod;

    private volatile boolean running;
    private volatile boolean closed;
    private volatile Instant startedAt;
    private volatile ReloadResult lastReload;
    private volatile String lastRejectedHash;

    /**
     * 构造函数，初始配置无效时直接失败
     *
     * @param metricSource 为空时按 metric_source.url 创建Prometheus指标源
     * @param silenceStore 为空时按 silences.path 选择文件或内存存储
     */
    public AlertCoreApplication(ConfigLoader configLoader, MetricSource metricSource,
                                SilenceStore silenceStore, Clock clock) {
        this.configLoader = configLoader;
        this.clock = clock;

        // 加载配置
        ActiveConfiguration initial = configLoader.load();
        this.active.set(initial);
        this.lastReload = reloadResult(true, "startup", "初始配置加载成功", initial);
        AlertCoreConfig config = initial.getGlobal();

        this.evaluationInterval = config.getDuration("evaluation.interval", Duration.ofMinutes(1));
        this.dispatchInterval = config.getDuration("dispatch.interval", Duration.ofSeconds(10));
        this.resolvedRetention = config.getDuration("alerts.resolved_retention", dispatchInterval);
        this.gracePeriod = config.getDuration("shutdown.grace_period", Duration.ofSeconds(30));

        this.metricSource = metricSource != null ? metricSource : createMetricSource(config);
        this.alertStore = new AlertStore();
        this.silencer = new Silencer(
                silenceStore != null ? silenceStore : createSilenceStore(config),
                clock,
                config.getDuration("silences.retention", Duration.ofHours(24)));
        this.router = new Router(initial.getRoute());

        // 初始化线程池
        this.scheduler = Executors.newScheduledThreadPool(
                config.getInt("threadpool.scheduler.size", 2),
                new ThreadFactoryBuilder()
                        .setNameFormat("alertcore-scheduler-%d")
                        .build()
        );
        int evaluationConcurrency = config.getInt("evaluation.concurrency", 4);
        this.evaluationPool = new ThreadPoolExecutor(
                evaluationConcurrency,
                evaluationConcurrency,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(1000),
                new ThreadFactoryBuilder()
                        .setNameFormat("alertcore-evaluator-%d")
                        .build(),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
        int dispatchConcurrency = config.getInt("dispatch.concurrency", 4);
        this.dispatchPool = new ThreadPoolExecutor(
                dispatchConcurrency,
                dispatchConcurrency,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(1000),
                new ThreadFactoryBuilder()
                        .setNameFormat("alertcore-notifier-%d")
                        .build(),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        this.dispatcher = new NotificationDispatcher(alertStore, router, silencer, active::get, dispatchPool, clock);
    }

    private MetricSource createMetricSource(AlertCoreConfig config) {
        String url = config.getString("metric_source.url");
        if (StringUtils.isBlank(url)) {
            throw new ConfigurationException("缺少metric_source.url配置");
        }
        Map<String, String> headers = new HashMap<>();
        config.getSubConfig("metric_source.headers").forEach((k, v) -> headers.put(k, String.valueOf(v)));
        return new PrometheusMetricSource(url, config.getDuration("metric_source.timeout", Duration.ofSeconds(10)), headers);
    }

    private SilenceStore createSilenceStore(AlertCoreConfig config) {
        String path = config.getString("silences.path");
        if (StringUtils.isBlank(path)) {
            logger.warn("未配置silences.path，静默只保存在内存中");
            return new InMemorySilenceStore();
        }
        return new FileSilenceStore(Paths.get(path));
    }

    /**
     * 启动应用
     */
    public synchronized void start() {
        if (running) {
            logger.warn("告警引擎已经在运行");
            return;
        }
        if (closed) {
            throw new IllegalStateException("告警引擎已关闭，不能再次启动");
        }

        logger.info("正在启动告警引擎...");
        running = true;
        startedAt = clock.instant();

        // 调度规则
        for (AlertRule rule : active.get().getRules()) {
            scheduleRule(rule);
        }

        // 通知调度
        scheduler.scheduleWithFixedDelay(this::runDispatchPass,
                dispatchInterval.toMillis(), dispatchInterval.toMillis(), TimeUnit.MILLISECONDS);

        // 静默清理
        Duration reapInterval = active.get().getGlobal().getDuration("silences.reap_interval", Duration.ofMinutes(1));
        scheduler.scheduleWithFixedDelay(this::reapSilences,
                reapInterval.toMillis(), reapInterval.toMillis(), TimeUnit.MILLISECONDS);

        // 配置文件变更检查
        Duration checkInterval = active.get().getGlobal().getDuration("config.check_interval", Duration.ofMinutes(1));
        if (!checkInterval.isZero()) {
            scheduler.scheduleWithFixedDelay(this::checkConfigChanges,
                    checkInterval.toMillis(), checkInterval.toMillis(), TimeUnit.MILLISECONDS);
        }

        // 健康检查
        Duration healthInterval = active.get().getGlobal().getDuration("health.check_interval", Duration.ofMinutes(1));
        scheduler.scheduleAtFixedRate(this::performHealthCheck,
                healthInterval.toMillis(), healthInterval.toMillis(), TimeUnit.MILLISECONDS);

        logger.info("告警引擎启动成功，规则 {} 条，通知调度间隔 {}", ruleEvaluators.size(), dispatchInterval);
    }

    /**
     * 调度规则执行
     */
    private void scheduleRule(AlertRule rule) {
        AtomicBoolean guard = ruleGuards.computeIfAbsent(rule.getName(), name -> new AtomicBoolean(false));
        RuleEvaluator evaluator = new RuleEvaluator(rule, metricSource, alertStore, resolvedRetention, guard);
        ruleEvaluators.put(rule.getName(), evaluator);

        Duration interval = rule.getInterval() != null ? rule.getInterval() : evaluationInterval;
        ScheduledFuture<?> future = scheduler.scheduleWithFixedDelay(
                () -> executeRule(evaluator),
                randomInitialDelay(interval),
                interval.toMillis(),
                TimeUnit.MILLISECONDS
        );
        ruleSchedules.put(rule.getName(), future);
        logger.info("规则已调度: {}, 间隔: {}", rule.getName(), interval);
    }

    /**
     * 执行规则，上一轮未结束时跳过
     */
    private void executeRule(RuleEvaluator evaluator) {
        if (!running) {
            return;
        }
        if (evaluator.isRunning()) {
            logger.debug("规则上一轮仍在执行，跳过: {}", evaluator.getRule().getName());
            return;
        }
        evaluationPool.execute(() -> {
            try {
                evaluator.evaluate(clock.instant());
            } catch (Exception e) {
                logger.error("规则执行失败: {}", evaluator.getRule().getName(), e);
            }
        });
    }

    /**
     * 停止规则执行
     */
    private void stopRule(String ruleName) {
        ruleEvaluators.remove(ruleName);
        ScheduledFuture<?> future = ruleSchedules.remove(ruleName);
        if (future != null) {
            future.cancel(false);
        }
    }

    private void runDispatchPass() {
        if (!running) {
            return;
        }
        try {
            dispatcher.runOnce(clock.instant());
        } catch (Exception e) {
            logger.error("通知调度失败", e);
        }
    }

    private void reapSilences() {
        try {
            silencer.reap(clock.instant());
        } catch (Exception e) {
            logger.error("清理过期静默失败", e);
        }
    }

    private void checkConfigChanges() {
        try {
            String hash = configLoader.currentHash();
            if (hash.equals(active.get().getHash()) || hash.equals(lastRejectedHash)) {
                return;
            }
            logger.info("检测到配置文件变更，开始重载");
            reload("file-change");
        } catch (Exception e) {
            logger.error("检查配置文件变更失败", e);
        }
    }

    /**
     * 重载配置，新配置无效时保留当前配置
     */
    public synchronized ReloadResult reload(String trigger) {
        ActiveConfiguration next;
        try {
            next = configLoader.load();
        } catch (ConfigurationException e) {
            logger.error("配置重载失败，保留当前配置: {}", e.getMessage());
            lastRejectedHash = safeHash();
            lastReload = ReloadResult.builder()
                    .success(false)
                    .trigger(trigger)
                    .message(e.getMessage())
                    .hash(active.get().getHash())
                    .rules(active.get().getRules().size())
                    .receivers(active.get().getReceivers().size())
                    .time(clock.instant())
                    .build();
            return lastReload;
        }

        ActiveConfiguration previous = active.getAndSet(next);
        router.setRoot(next.getRoute());
        lastRejectedHash = null;
        if (running) {
            applyRuleChanges(previous.getRules(), next.getRules());
        }
        lastReload = reloadResult(true, trigger, "配置重载成功", next);
        logger.info("配置重载成功: trigger={}, hash={}", trigger, next.getHash());
        return lastReload;
    }

    private String safeHash() {
        try {
            return configLoader.currentHash();
        } catch (ConfigurationException e) {
            return null;
        }
    }

    private void applyRuleChanges(List<AlertRule> previous, List<AlertRule> next) {
        Map<String, AlertRule> before = new HashMap<>();
        previous.forEach(rule -> before.put(rule.getName(), rule));
        Map<String, AlertRule> after = new HashMap<>();
        next.forEach(rule -> after.put(rule.getName(), rule));

        for (AlertRule rule : previous) {
            if (!after.containsKey(rule.getName())) {
                onRuleDeleted(rule);
            }
        }
        for (AlertRule rule : next) {
            AlertRule existing = before.get(rule.getName());
            if (existing == null) {
                onRuleAdded(rule);
            } else if (!existing.equals(rule)) {
                onRuleUpdated(rule);
            }
        }
    }

    @Override
    public void onRuleAdded(AlertRule rule) {
        logger.info("添加新规则: {}", rule.getName());
        scheduleRule(rule);
    }

    @Override
    public void onRuleUpdated(AlertRule rule) {
        logger.info("更新规则: {}", rule.getName());
        stopRule(rule.getName());
        scheduleRule(rule);
    }

    @Override
    public void onRuleDeleted(AlertRule rule) {
        logger.info("删除规则: {}", rule.getName());
        stopRule(rule.getName());
        // 实例从告警表移除后，通知组会按解除处理
        alertStore.removeRule(rule.getName());
    }

    private ReloadResult reloadResult(boolean success, String trigger, String message, ActiveConfiguration config) {
        return ReloadResult.builder()
                .success(success)
                .trigger(trigger)
                .message(message)
                .hash(config.getHash())
                .rules(config.getRules().size())
                .receivers(config.getReceivers().size())
                .time(clock.instant())
                .build();
    }

    /**
     * 当前健康状态
     */
    public HealthStatus getHealthStatus() {
        Instant now = clock.instant();
        HealthStatus health = new HealthStatus();
        health.setStartedAt(startedAt);
        health.setLastCheckTime(now);
        health.setConfigHash(active.get().getHash());
        health.setConfigLoadedAt(active.get().getLoadedAt());
        health.setLastReload(lastReload);

        Map<String, RuleHealthStatus> rules = new TreeMap<>();
        List<String> issues = new ArrayList<>();
        for (RuleEvaluator evaluator : ruleEvaluators.values()) {
            RuleHealthStatus status = evaluator.getHealth();
            rules.put(status.getRuleName(), status);
            if (status.getConsecutiveFailures() > 0) {
                issues.add("规则执行失败: " + status.getRuleName() + " (" + status.getLastError() + ")");
            }
        }
        health.setRuleHealth(rules);

        for (AlertInstance instance : alertStore.getAll()) {
            if (instance.getState() == AlertState.PENDING) {
                health.setPendingAlerts(health.getPendingAlerts() + 1);
            } else if (instance.isFiring()) {
                health.setFiringAlerts(health.getFiringAlerts() + 1);
            } else {
                health.setResolvedAlerts(health.getResolvedAlerts() + 1);
            }
        }
        health.setNotificationGroups(router.groupCount());
        health.setActiveSilences(silencer.listActive(now).size());

        if (lastReload != null && !lastReload.isSuccess()) {
            issues.add("最近一次配置重载失败: " + lastReload.getMessage());
        }
        health.setIssues(issues);
        health.setStatus(issues.isEmpty() ? "HEALTHY" : "DEGRADED");
        return health;
    }

    /**
     * 执行健康检查
     */
    private void performHealthCheck() {
        try {
            HealthStatus health = getHealthStatus();
            if ("HEALTHY".equals(health.getStatus())) {
                logger.debug("健康检查通过: firing={}, pending={}, groups={}",
                        health.getFiringAlerts(), health.getPendingAlerts(), health.getNotificationGroups());
            } else {
                logger.warn("健康检查发现问题：{}，状态：{}", String.join(", ", health.getIssues()), health.getStatus());
            }
        } catch (Exception e) {
            logger.error("健康检查失败", e);
        }
    }

    /**
     * 关闭应用：停止调度，在宽限期内等待执行中的规则和投递完成
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        logger.info("正在关闭告警引擎...");
        closed = true;
        running = false;

        // 取消所有规则调度
        ruleSchedules.values().forEach(future -> future.cancel(false));
        ruleSchedules.clear();

        scheduler.shutdown();
        evaluationPool.shutdown();
        dispatchPool.shutdown();

        long deadline = System.nanoTime() + gracePeriod.toNanos();
        try {
            awaitTermination(scheduler, deadline);
            awaitTermination(evaluationPool, deadline);
            awaitTermination(dispatchPool, deadline);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
            evaluationPool.shutdownNow();
            dispatchPool.shutdownNow();
        }
        logger.info("告警引擎已关闭");
    }

    private void awaitTermination(ExecutorService executor, long deadlineNanos) throws InterruptedException {
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0 || !executor.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
            List<Runnable> dropped = executor.shutdownNow();
            logger.warn("线程池未在宽限期内结束，强制关闭，丢弃任务 {} 个", dropped.size());
        }
    }

    /**
     * 生成随机初始延迟，分散规则的执行时间
     */
    private long randomInitialDelay(Duration interval) {
        long bound = Math.min(interval.toMillis(), 15_000L);
        return bound <= 0 ? 0 : ThreadLocalRandom.current().nextLong(bound);
    }

    public boolean isRunning() {
        return running;
    }

    public ActiveConfiguration getActiveConfiguration() {
        return active.get();
    }

    public AlertStore getAlertStore() {
        return alertStore;
    }

    public Silencer getSilencer() {
        return silencer;
    }

    public Router getRouter() {
        return router;
    }
}
