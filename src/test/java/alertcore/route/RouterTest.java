package alertcore.route;

import alertcore.MutableClock;
import alertcore.label.LabelSet;
import alertcore.label.Matcher;
import alertcore.notify.DeliveryOutcome;
import alertcore.silence.InMemorySilenceStore;
import alertcore.silence.Silencer;
import alertcore.store.AlertInstance;
import alertcore.store.AlertState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RouterTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private Silencer silencer;

    @BeforeEach
    void setUp() {
        silencer = new Silencer(new InMemorySilenceStore(), new MutableClock(T0), Duration.ofHours(1));
    }

    private static Route.RouteBuilder node(String path, String receiver) {
        return Route.builder()
                .path(path)
                .receiver(receiver)
                .groupBy(List.of("alertname"))
                .groupWait(Duration.ofSeconds(10))
                .groupInterval(Duration.ofMinutes(1))
                .repeatInterval(Duration.ofHours(1));
    }

    private static AlertInstance firing(String alertname, String host, String severity, Instant since) {
        return AlertInstance.builder()
                .ruleName(alertname)
                .labels(LabelSet.of("alertname", alertname, "instance", host, "severity", severity))
                .state(AlertState.FIRING)
                .activeSince(since)
                .firingSince(since)
                .lastEvaluatedAt(since)
                .build();
    }

    private static AlertInstance resolved(AlertInstance instance, Instant at) {
        return instance.toBuilder().state(AlertState.RESOLVED).resolvedAt(at).build();
    }

    private static DeliveryOutcome ok(Instant at) {
        return DeliveryOutcome.success(1, 200, at);
    }

    @Test
    void firstMatchingChildWinsDepthFirst() {
        Route critical = node("root.0", "pager")
                .matchers(List.of(Matcher.equal("severity", "critical")))
                .children(List.of(node("root.0.0", "dba")
                        .matchers(List.of(Matcher.regex("instance", "db-.*"))).build()))
                .build();
        Route warning = node("root.1", "chat").matchers(List.of(Matcher.regex("severity", "critical|warning"))).build();
        Route root = node("root", "default").children(List.of(critical, warning)).build();

        List<Route> db = root.match(LabelSet.of("severity", "critical", "instance", "db-1"));
        assertEquals(1, db.size());
        assertEquals("dba", db.get(0).getReceiver());

        List<Route> web = root.match(LabelSet.of("severity", "critical", "instance", "web-1"));
        assertEquals("pager", web.get(0).getReceiver());

        List<Route> warn = root.match(LabelSet.of("severity", "warning"));
        assertEquals("chat", warn.get(0).getReceiver());

        List<Route> other = root.match(LabelSet.of("severity", "info"));
        assertEquals("default", other.get(0).getReceiver());
    }

    @Test
    void continueFansOutToLaterSiblings() {
        Route audit = node("root.0", "audit").continueMatching(true).build();
        Route pager = node("root.1", "pager").matchers(List.of(Matcher.equal("severity", "critical"))).build();
        Route chat = node("root.2", "chat").build();
        Route root = node("root", "default").children(List.of(audit, pager, chat)).build();

        List<Route> matched = root.match(LabelSet.of("severity", "critical"));
        List<String> receivers = new ArrayList<>();
        matched.forEach(r -> receivers.add(r.getReceiver()));
        assertEquals(List.of("audit", "pager"), receivers);
    }

    @Test
    void alertsWithinGroupWaitProduceOneNotification() {
        Router router = new Router(node("root", "default").build());
        AlertInstance a = firing("HighCpu", "db-1", "critical", T0);
        AlertInstance b = firing("HighCpu", "db-2", "critical", T0.plusSeconds(3));

        router.route(List.of(a), T0);
        assertTrue(router.dueGroups(T0, silencer).isEmpty());

        router.route(List.of(a, b), T0.plusSeconds(3));
        assertTrue(router.dueGroups(T0.plusSeconds(3), silencer).isEmpty());

        router.route(List.of(a, b), T0.plusSeconds(10));
        List<GroupNotification> due = router.dueGroups(T0.plusSeconds(10), silencer);
        assertEquals(1, due.size());
        assertEquals(2, due.get(0).getFiring().size());
        assertEquals(LabelSet.of("alertname", "HighCpu"), due.get(0).getGroupKey().getGroupLabels());
    }

    @Test
    void groupsByGroupByLabels() {
        Router router = new Router(node("root", "default").build());
        router.route(List.of(
                firing("HighCpu", "db-1", "critical", T0),
                firing("InstanceDown", "db-1", "critical", T0)), T0);

        assertEquals(2, router.groupCount());
        assertEquals(2, router.dueGroups(T0.plusSeconds(10), silencer).size());
    }

    @Test
    void repeatedPassesAreIdempotentUntilRepeatInterval() {
        Router router = new Router(node("root", "default").build());
        AlertInstance a = firing("HighCpu", "db-1", "critical", T0);

        router.route(List.of(a), T0);
        List<GroupNotification> due = router.dueGroups(T0.plusSeconds(10), silencer);
        assertEquals(1, due.size());
        router.recordOutcome(due.get(0), ok(T0.plusSeconds(10)));

        for (int minute = 1; minute < 60; minute += 7) {
            Instant now = T0.plusSeconds(10).plus(Duration.ofMinutes(minute));
            router.route(List.of(a), now);
            assertTrue(router.dueGroups(now, silencer).isEmpty(), "unexpected notification at minute " + minute);
        }

        Instant repeat = T0.plusSeconds(10).plus(Duration.ofHours(1));
        router.route(List.of(a), repeat);
        assertEquals(1, router.dueGroups(repeat, silencer).size());
    }

    @Test
    void inFlightGroupIsNotReturnedTwice() {
        Router router = new Router(node("root", "default").build());
        router.route(List.of(firing("HighCpu", "db-1", "critical", T0)), T0);

        assertEquals(1, router.dueGroups(T0.plusSeconds(10), silencer).size());
        assertTrue(router.dueGroups(T0.plusSeconds(11), silencer).isEmpty());
    }

    @Test
    void newMemberWaitsGroupInterval() {
        Router router = new Router(node("root", "default").build());
        AlertInstance a = firing("HighCpu", "db-1", "critical", T0);
        router.route(List.of(a), T0);
        GroupNotification first = router.dueGroups(T0.plusSeconds(10), silencer).get(0);
        router.recordOutcome(first, ok(T0.plusSeconds(10)));

        AlertInstance b = firing("HighCpu", "db-2", "critical", T0.plusSeconds(20));
        router.route(List.of(a, b), T0.plusSeconds(20));
        assertTrue(router.dueGroups(T0.plusSeconds(20), silencer).isEmpty());

        Instant afterInterval = T0.plusSeconds(70);
        router.route(List.of(a, b), afterInterval);
        List<GroupNotification> due = router.dueGroups(afterInterval, silencer);
        assertEquals(1, due.size());
        assertEquals(2, due.get(0).getFiring().size());
    }

    @Test
    void resolvedMemberIsReportedOnceAfterFiringNotice() {
        Router router = new Router(node("root", "default").build());
        AlertInstance a = firing("HighCpu", "db-1", "critical", T0);
        router.route(List.of(a), T0);
        router.recordOutcome(router.dueGroups(T0.plusSeconds(10), silencer).get(0), ok(T0.plusSeconds(10)));

        Instant resolvedAt = T0.plus(Duration.ofMinutes(2));
        router.route(List.of(resolved(a, resolvedAt)), resolvedAt);
        List<GroupNotification> due = router.dueGroups(resolvedAt, silencer);
        assertEquals(1, due.size());
        assertTrue(due.get(0).getFiring().isEmpty());
        assertEquals(1, due.get(0).getResolved().size());
        router.recordOutcome(due.get(0), ok(resolvedAt));

        Instant later = resolvedAt.plus(Duration.ofMinutes(5));
        router.route(List.of(), later);
        assertTrue(router.dueGroups(later, silencer).isEmpty());
    }

    @Test
    void memberMissingFromStoreIsTreatedAsResolved() {
        Router router = new Router(node("root", "default").build());
        AlertInstance a = firing("HighCpu", "db-1", "critical", T0);
        router.route(List.of(a), T0);
        router.recordOutcome(router.dueGroups(T0.plusSeconds(10), silencer).get(0), ok(T0.plusSeconds(10)));

        Instant gone = T0.plus(Duration.ofMinutes(2));
        router.route(List.of(), gone);
        List<GroupNotification> due = router.dueGroups(gone, silencer);
        assertEquals(1, due.size());
        assertEquals(AlertState.RESOLVED, due.get(0).getResolved().get(0).getState());
    }

    @Test
    void resolvedWithoutFiringNoticeIsDropped() {
        Router router = new Router(node("root", "default").build());
        AlertInstance a = firing("HighCpu", "db-1", "critical", T0);
        router.route(List.of(a), T0);

        router.route(List.of(resolved(a, T0.plusSeconds(5))), T0.plusSeconds(5));
        assertTrue(router.dueGroups(T0.plusSeconds(10), silencer).isEmpty());
    }

    @Test
    void failedDeliveryRetriesAfterGroupInterval() {
        Router router = new Router(node("root", "default").build());
        AlertInstance a = firing("HighCpu", "db-1", "critical", T0);
        router.route(List.of(a), T0);
        GroupNotification first = router.dueGroups(T0.plusSeconds(10), silencer).get(0);
        router.recordOutcome(first, DeliveryOutcome.failed(5, 503, "unavailable", T0.plusSeconds(20)));

        router.route(List.of(a), T0.plusSeconds(60));
        assertTrue(router.dueGroups(T0.plusSeconds(60), silencer).isEmpty());

        router.route(List.of(a), T0.plusSeconds(80));
        assertEquals(1, router.dueGroups(T0.plusSeconds(80), silencer).size());
    }

    @Test
    void silencedMembersAreExcludedFromNotification() {
        Router router = new Router(node("root", "default").build());
        silencer.create(List.of(Matcher.equal("instance", "db-1")), null, T0.plus(Duration.ofHours(1)), "ops", null);
        AlertInstance a = firing("HighCpu", "db-1", "critical", T0);
        AlertInstance b = firing("HighCpu", "db-2", "critical", T0);

        router.route(List.of(a, b), T0);
        List<GroupNotification> due = router.dueGroups(T0.plusSeconds(10), silencer);
        assertEquals(1, due.size());
        assertEquals(1, due.get(0).getFiring().size());
        assertEquals("db-2", due.get(0).getFiring().get(0).getLabels().get("instance"));
    }

    @Test
    void emptyGroupIsCollectedAfterRepeatInterval() {
        Router router = new Router(node("root", "default").build());
        AlertInstance a = firing("HighCpu", "db-1", "critical", T0);
        router.route(List.of(a), T0);
        router.recordOutcome(router.dueGroups(T0.plusSeconds(10), silencer).get(0), ok(T0.plusSeconds(10)));
        Instant resolvedAt = T0.plus(Duration.ofMinutes(2));
        router.route(List.of(resolved(a, resolvedAt)), resolvedAt);
        router.recordOutcome(router.dueGroups(resolvedAt, silencer).get(0), ok(resolvedAt));

        Instant emptySince = resolvedAt.plusSeconds(10);
        router.route(List.of(), emptySince);
        assertEquals(1, router.groupCount());

        router.route(List.of(), emptySince.plus(Duration.ofMinutes(30)));
        assertEquals(1, router.groupCount());

        router.route(List.of(), emptySince.plus(Duration.ofHours(1)));
        assertEquals(0, router.groupCount());
    }

    @Test
    void receiverWithoutResolvedNoticesDropsResolvedMembers() {
        Router router = new Router(node("root", "default").build());
        AlertInstance a = firing("HighCpu", "db-1", "critical", T0);
        router.route(List.of(a), T0);
        router.recordOutcome(router.dueGroups(T0.plusSeconds(10), silencer).get(0), ok(T0.plusSeconds(10)));

        Instant resolvedAt = T0.plus(Duration.ofMinutes(2));
        router.route(List.of(resolved(a, resolvedAt)), resolvedAt);
        assertTrue(router.dueGroups(resolvedAt, silencer, receiver -> false).isEmpty());
        assertEquals(0, router.groups().get(0).getMembers());
    }

    @Test
    void branchesToSameReceiverShareOneGroup() {
        Route critical = node("root.0", "oncall").matchers(List.of(Matcher.equal("severity", "critical"))).build();
        Route db = node("root.1", "oncall").matchers(List.of(Matcher.equal("team", "db"))).build();
        Router router = new Router(node("root", "default").children(List.of(critical, db)).build());

        AlertInstance a = firing("HighCpu", "db-1", "critical", T0);
        AlertInstance b = AlertInstance.builder()
                .ruleName("HighCpu")
                .labels(LabelSet.of("alertname", "HighCpu", "instance", "db-2", "team", "db"))
                .state(AlertState.FIRING)
                .activeSince(T0)
                .firingSince(T0)
                .lastEvaluatedAt(T0)
                .build();

        router.route(List.of(a, b), T0);
        assertEquals(1, router.groupCount());

        List<GroupNotification> due = router.dueGroups(T0.plusSeconds(10), silencer);
        assertEquals(1, due.size());
        assertEquals(2, due.get(0).getFiring().size());
        assertEquals(new GroupKey("oncall", LabelSet.of("alertname", "HighCpu")), due.get(0).getGroupKey());
    }

    @Test
    void continueToSameReceiverNotifiesOnce() {
        Route audit = node("root.0", "oncall").continueMatching(true)
                .groupWait(Duration.ofSeconds(5)).build();
        Route critical = node("root.1", "oncall").matchers(List.of(Matcher.equal("severity", "critical"))).build();
        Router router = new Router(node("root", "default").children(List.of(audit, critical)).build());

        router.route(List.of(firing("HighCpu", "db-1", "critical", T0)), T0);

        assertEquals(1, router.groupCount());
        // 第一个匹配节点决定时序
        assertEquals("root.0", router.groups().get(0).getRoute());
        List<GroupNotification> due = router.dueGroups(T0.plusSeconds(5), silencer);
        assertEquals(1, due.size());
        assertEquals(1, due.get(0).getFiring().size());
    }
}
