package alertcore.engine;

import alertcore.MutableClock;
import alertcore.config.ActiveConfiguration;
import alertcore.label.LabelSet;
import alertcore.label.Matcher;
import alertcore.notify.DeliveryOutcome;
import alertcore.notify.DeliveryStatus;
import alertcore.notify.NotificationPayload;
import alertcore.notify.Notifier;
import alertcore.notify.RetryPolicy;
import alertcore.notify.WebhookNotifier;
import alertcore.route.GroupStatus;
import alertcore.route.Route;
import alertcore.route.Router;
import alertcore.rule.AlertRule;
import alertcore.rule.MetricSample;
import alertcore.rule.RuleEvaluator;
import alertcore.silence.InMemorySilenceStore;
import alertcore.silence.Silencer;
import alertcore.store.AlertInstance;
import alertcore.store.AlertState;
import alertcore.store.AlertStore;
import com.google.common.util.concurrent.MoreExecutors;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class NotificationDispatcherTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    /**
     * 记录收到的通知体，可切换为失败
     */
    private static class CapturingNotifier extends Notifier {
        private final MutableClock clock;
        private final List<NotificationPayload> received = new ArrayList<>();
        private boolean failing;

        CapturingNotifier(String name, boolean sendResolved, MutableClock clock) {
            super(NotifierType.LOG, name, sendResolved);
            this.clock = clock;
        }

        @Override
        public DeliveryOutcome deliver(NotificationPayload payload) {
            if (failing) {
                throw new IllegalStateException("connection refused");
            }
            received.add(payload);
            return DeliveryOutcome.success(1, 200, clock.instant());
        }
    }

    private MutableClock clock;
    private AlertStore store;
    private Silencer silencer;
    private CapturingNotifier oncall;
    private AtomicReference<List<MetricSample>> results;
    private RuleEvaluator evaluator;
    private NotificationDispatcher dispatcher;
    private Router router;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new AlertStore();
        silencer = new Silencer(new InMemorySilenceStore(), clock, Duration.ofHours(1));
        oncall = new CapturingNotifier("oncall", true, clock);
        results = new AtomicReference<>(Collections.emptyList());

        AlertRule rule = AlertRule.builder()
                .name("HighCpu")
                .expression("cpu > 90")
                .hold(Duration.ofMinutes(5))
                .severity("critical")
                .build();
        evaluator = new RuleEvaluator(rule, (expression, instant) -> results.get(), store, Duration.ofMinutes(5));

        Route root = Route.builder()
                .path("root")
                .receiver("oncall")
                .groupBy(List.of("alertname"))
                .groupWait(Duration.ofSeconds(30))
                .groupInterval(Duration.ofMinutes(1))
                .repeatInterval(Duration.ofHours(4))
                .build();
        ActiveConfiguration config = ActiveConfiguration.builder()
                .rules(List.of(rule))
                .route(root)
                .receivers(Map.of("oncall", oncall))
                .build();
        router = new Router(root);
        dispatcher = new NotificationDispatcher(store, router, silencer, () -> config,
                MoreExecutors.directExecutor(), clock);
    }

    private void cpu(double value) {
        results.set(List.of(MetricSample.of(LabelSet.of("instance", "db-1"), value)));
    }

    private void cpuNormal() {
        results.set(Collections.emptyList());
    }

    /**
     * 推进到指定时刻，每分钟执行一次规则，每10秒调度一次
     */
    private void runUntil(Instant end) {
        while (clock.instant().isBefore(end)) {
            clock.advance(Duration.ofSeconds(10));
            Instant now = clock.instant();
            if (now.getEpochSecond() % 60 == 0) {
                evaluator.evaluate(now);
            }
            dispatcher.runOnce(now);
        }
    }

    @Test
    void sustainedConditionProducesOneFiringAndOneResolvedNotice() {
        cpu(95);
        evaluator.evaluate(T0);
        dispatcher.runOnce(T0);

        runUntil(T0.plus(Duration.ofMinutes(5)).minusSeconds(10));
        assertTrue(oncall.received.isEmpty(), "notified before hold elapsed");

        runUntil(T0.plus(Duration.ofMinutes(10)).minusSeconds(10));
        assertEquals(1, oncall.received.size());
        NotificationPayload firing = oncall.received.get(0);
        assertEquals("firing", firing.getStatus());
        assertEquals(1, firing.getFiringCount());
        assertEquals("HighCpu", firing.getCommonLabels().get("alertname"));
        assertEquals(T0.plus(Duration.ofMinutes(5)), firing.getAlerts().get(0).getStartsAt());

        cpuNormal();
        runUntil(T0.plus(Duration.ofMinutes(30)));
        assertEquals(2, oncall.received.size());
        NotificationPayload resolved = oncall.received.get(1);
        assertEquals("resolved", resolved.getStatus());
        assertEquals(1, resolved.getResolvedCount());
        assertEquals(T0.plus(Duration.ofMinutes(10)), resolved.getAlerts().get(0).getEndsAt());
    }

    @Test
    void conditionClearedBeforeHoldNeverNotifies() {
        cpu(95);
        evaluator.evaluate(T0);
        runUntil(T0.plus(Duration.ofMinutes(3)));
        cpuNormal();
        runUntil(T0.plus(Duration.ofMinutes(20)));

        assertTrue(oncall.received.isEmpty());
        assertEquals(0, router.groupCount());
    }

    @Test
    void silenceSuppressesUntilWindowEnds() {
        silencer.create(List.of(Matcher.equal("instance", "db-1")), T0.plus(Duration.ofMinutes(1)),
                T0.plus(Duration.ofMinutes(20)), "ops", "maintenance");
        cpu(95);
        evaluator.evaluate(T0);

        runUntil(T0.plus(Duration.ofMinutes(20)).minusSeconds(10));
        assertTrue(oncall.received.isEmpty());

        runUntil(T0.plus(Duration.ofMinutes(20)));
        assertEquals(1, oncall.received.size());
        assertEquals("firing", oncall.received.get(0).getStatus());
    }

    @Test
    void evaluationContinuesWhileSilenced() {
        silencer.create(List.of(Matcher.equal("instance", "db-1")), T0,
                T0.plus(Duration.ofMinutes(30)), "ops", "maintenance");
        cpu(95);
        evaluator.evaluate(T0);

        runUntil(T0.plus(Duration.ofMinutes(4)));
        assertEquals(AlertState.PENDING, store.getAll().get(0).getState());

        runUntil(T0.plus(Duration.ofMinutes(10)));
        AlertInstance firing = store.getAll().get(0);
        assertEquals(AlertState.FIRING, firing.getState());
        assertEquals(T0.plus(Duration.ofMinutes(5)), firing.getFiringSince());

        cpuNormal();
        runUntil(T0.plus(Duration.ofMinutes(15)));
        AlertInstance resolved = store.getAll().get(0);
        assertEquals(AlertState.RESOLVED, resolved.getState());
        assertEquals(T0.plus(Duration.ofMinutes(11)), resolved.getResolvedAt());

        runUntil(T0.plus(Duration.ofMinutes(40)));
        assertTrue(store.getAll().isEmpty());
        // 触发通知从未发出，解除通知也不发
        assertTrue(oncall.received.isEmpty());
    }

    @Test
    void webhookRetriesAreRecordedOnGroup() throws IOException {
        MockWebServer server = new MockWebServer();
        server.start();
        try {
            for (int i = 0; i < 3; i++) {
                server.enqueue(new MockResponse().setResponseCode(503));
            }
            server.enqueue(new MockResponse().setResponseCode(200));

            AtomicReference<Instant> firstAttempt = new AtomicReference<>();
            WebhookNotifier.Sleeper sleeper = d -> {
                firstAttempt.compareAndSet(null, clock.instant());
                clock.advance(d);
            };
            WebhookNotifier webhook = new WebhookNotifier("oncall", server.url("/hook").toString(), Map.of(), null,
                    true, Duration.ofSeconds(2), RetryPolicy.defaults(), clock, sleeper);
            ActiveConfiguration config = ActiveConfiguration.builder()
                    .route(router.getRoot())
                    .receivers(Map.of("oncall", webhook))
                    .build();
            dispatcher = new NotificationDispatcher(store, router, silencer, () -> config,
                    MoreExecutors.directExecutor(), clock);

            cpu(95);
            evaluator.evaluate(T0);
            runUntil(T0.plus(Duration.ofMinutes(7)));

            assertEquals(4, server.getRequestCount());
            GroupStatus group = router.groups().get(0);
            assertEquals(DeliveryStatus.SUCCESS, group.getLastStatus());
            assertNull(group.getLastError());
            // 退避 0.5s + 1s + 2s 之后的最后一次尝试
            Instant lastAttempt = firstAttempt.get().plusMillis(3500);
            assertEquals(lastAttempt, group.getLastSent());
            assertEquals(lastAttempt, group.getLastAttempt());
        } finally {
            server.shutdown();
        }
    }

    @Test
    void failedDeliveryIsRetriedOnLaterPass() {
        oncall.failing = true;
        cpu(95);
        evaluator.evaluate(T0);
        runUntil(T0.plus(Duration.ofMinutes(6)));
        assertTrue(oncall.received.isEmpty());
        assertEquals("connection refused", router.groups().get(0).getLastError());

        oncall.failing = false;
        runUntil(T0.plus(Duration.ofMinutes(7)).plusSeconds(30));
        assertEquals(1, oncall.received.size());
        assertNull(router.groups().get(0).getLastError());
    }

    @Test
    void missingReceiverIsRecordedAsFailure() {
        Route orphan = Route.builder().path("root").receiver("gone").build();
        router.setRoot(orphan);
        cpu(95);
        evaluator.evaluate(T0);
        runUntil(T0.plus(Duration.ofMinutes(6)));

        assertTrue(oncall.received.isEmpty());
        assertTrue(router.groups().get(0).getLastError().contains("gone"));
    }
}
