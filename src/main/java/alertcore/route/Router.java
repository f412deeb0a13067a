package alertcore.route;

import alertcore.notify.DeliveryOutcome;
import alertcore.notify.DeliveryStatus;
import alertcore.silence.Silencer;
import alertcore.store.AlertInstance;
import alertcore.store.AlertKey;
import alertcore.store.AlertState;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 路由器 - 把告警实例按路由树分配到通知组，并按时序策略计算到期的组
 *
 * <p>没有每组定时器，由调度器每轮调用 {@link #route} 和 {@link #dueGroups} 重新计算。
 * 所有组状态的修改都在本对象的锁内完成，投递过程不持锁。
 */
public class Router {
    private static final Logger logger = LoggerFactory.getLogger(Router.class);

    private volatile Route root;
    private final Map<GroupKey, NotificationGroup> groups = new LinkedHashMap<>();

    public Router(Route root) {
        this.root = root;
    }

    /**
     * 配置重载时替换路由树，已有的组在下一轮重新归属
     */
    public void setRoot(Route root) {
        this.root = root;
    }

    public Route getRoot() {
        return root;
    }

    /**
     * 用告警表快照更新通知组成员
     */
    public synchronized void route(Collection<AlertInstance> snapshot, Instant now) {
        Route tree = root;
        Map<AlertKey, AlertInstance> present = new HashMap<>();
        Map<GroupKey, Map<AlertKey, AlertInstance>> routed = new LinkedHashMap<>();
        Map<GroupKey, Route> routeOf = new HashMap<>();

        for (AlertInstance instance : snapshot) {
            present.put(instance.getKey(), instance);
            if (instance.getState() == AlertState.PENDING) {
                continue;
            }
            // 从未触发过的解除实例不需要通知
            if (instance.isResolved() && instance.getFiringSince() == null) {
                continue;
            }
            // 同一接收器只取第一个匹配节点
            Set<String> receivers = new HashSet<>();
            for (Route matched : tree.match(instance.getLabels())) {
                if (!receivers.add(matched.getReceiver())) {
                    continue;
                }
                GroupKey key = new GroupKey(matched.getReceiver(), matched.groupLabels(instance.getLabels()));
                routed.computeIfAbsent(key, k -> new LinkedHashMap<>()).put(instance.getKey(), instance);
                routeOf.putIfAbsent(key, matched);
            }
        }

        for (Map.Entry<GroupKey, Map<AlertKey, AlertInstance>> entry : routed.entrySet()) {
            GroupKey key = entry.getKey();
            NotificationGroup group = groups.get(key);
            if (group == null) {
                boolean anyFiring = entry.getValue().values().stream().anyMatch(AlertInstance::isFiring);
                if (!anyFiring) {
                    continue;
                }
                group = new NotificationGroup(key, routeOf.get(key), now);
                groups.put(key, group);
                logger.info("创建通知组: {}", key);
            }
            group.setRoute(routeOf.get(key));
            for (AlertInstance instance : entry.getValue().values()) {
                if (instance.isResolved() && !group.getMembers().containsKey(instance.getKey())) {
                    continue;
                }
                group.getMembers().put(instance.getKey(), instance);
            }
        }

        Iterator<NotificationGroup> it = groups.values().iterator();
        while (it.hasNext()) {
            NotificationGroup group = it.next();
            Map<AlertKey, AlertInstance> routedHere = routed.getOrDefault(group.getKey(), Collections.emptyMap());
            reconcileMembers(group, routedHere, present, now);

            if (!group.isEmpty()) {
                group.setEmptySince(null);
            } else if (group.getEmptySince() == null) {
                group.setEmptySince(now);
            } else if (!group.isInFlight()
                    && !now.isBefore(group.getEmptySince().plus(group.getRoute().getRepeatInterval()))) {
                it.remove();
                logger.info("回收空通知组: {}", group.getKey());
            }
        }
    }

    private void reconcileMembers(NotificationGroup group, Map<AlertKey, AlertInstance> routedHere,
                                  Map<AlertKey, AlertInstance> present, Instant now) {
        Iterator<Map.Entry<AlertKey, AlertInstance>> it = group.getMembers().entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<AlertKey, AlertInstance> entry = it.next();
            AlertInstance member = entry.getValue();
            if (!routedHere.containsKey(entry.getKey())) {
                AlertInstance current = present.get(entry.getKey());
                if (current != null && !current.isResolved()) {
                    // 仍然活跃但不再路由到本组，说明路由配置变了
                    it.remove();
                    continue;
                }
                if (!member.isResolved()) {
                    // 实例已从告警表清除，按解除处理
                    member = member.toBuilder().state(AlertState.RESOLVED).resolvedAt(now).build();
                    entry.setValue(member);
                }
            }
            if (member.isResolved() && !group.getLastNotifiedFiring().contains(entry.getKey())) {
                it.remove();
            }
        }
    }

    public List<GroupNotification> dueGroups(Instant now, Silencer silencer) {
        return dueGroups(now, silencer, receiver -> true);
    }

    /**
     * 计算本轮到期的通知组，返回的组被标记为投递中，必须通过 {@link #recordOutcome} 释放
     *
     * @param sendsResolved 接收器是否发送解除通知
     */
    public synchronized List<GroupNotification> dueGroups(Instant now, Silencer silencer,
                                                          Predicate<String> sendsResolved) {
        List<GroupNotification> due = new ArrayList<>();
        for (NotificationGroup group : groups.values()) {
            if (group.isInFlight()) {
                logger.debug("通知组正在投递，跳过: {}", group.getKey());
                continue;
            }

            List<AlertInstance> firing = new ArrayList<>();
            List<AlertInstance> resolved = new ArrayList<>();
            for (AlertInstance member : group.getMembers().values()) {
                if (member.isFiring()) {
                    if (silencer == null || !silencer.isSilenced(member.getLabels(), now)) {
                        firing.add(member);
                    }
                } else if (member.isResolved() && group.getLastNotifiedFiring().contains(member.getKey())) {
                    resolved.add(member);
                }
            }

            if (!resolved.isEmpty() && !sendsResolved.test(group.getReceiver())) {
                dropResolved(group, resolved);
                resolved.clear();
            }
            if (firing.isEmpty() && resolved.isEmpty()) {
                continue;
            }
            if (!isDue(group, firing, resolved, now)) {
                continue;
            }

            group.setInFlight(true);
            due.add(GroupNotification.builder()
                    .groupKey(group.getKey())
                    .firing(ImmutableList.copyOf(firing))
                    .resolved(ImmutableList.copyOf(resolved))
                    .createdAt(now)
                    .build());
        }
        return due;
    }

    private boolean isDue(NotificationGroup group, List<AlertInstance> firing,
                          List<AlertInstance> resolved, Instant now) {
        Route route = group.getRoute();
        boolean failed = group.getLastStatus() == DeliveryStatus.FAILED;
        if (failed && now.isBefore(group.getLastAttempt().plus(route.getGroupInterval()))) {
            return false;
        }
        if (group.getLastSent() == null) {
            return !now.isBefore(group.getFirstSeen().plus(route.getGroupWait()));
        }
        if (failed) {
            return true;
        }

        Set<AlertKey> current = new HashSet<>();
        for (AlertInstance instance : firing) {
            current.add(instance.getKey());
        }
        boolean changed = !resolved.isEmpty() || !current.equals(group.getLastNotifiedFiring());
        return !now.isBefore(group.getLastSent().plus(changed ? route.getGroupInterval() : route.getRepeatInterval()));
    }

    private void dropResolved(NotificationGroup group, List<AlertInstance> resolved) {
        Set<AlertKey> notified = new HashSet<>(group.getLastNotifiedFiring());
        for (AlertInstance instance : resolved) {
            group.getMembers().remove(instance.getKey());
            notified.remove(instance.getKey());
        }
        group.setLastNotifiedFiring(notified);
    }

    /**
     * 记录投递结果并释放投递标记
     */
    public synchronized void recordOutcome(GroupNotification notification, DeliveryOutcome outcome) {
        NotificationGroup group = groups.get(notification.getGroupKey());
        if (group == null) {
            return;
        }
        group.setInFlight(false);
        group.setLastAttempt(outcome.getCompletedAt());
        group.setLastStatus(outcome.getStatus());
        group.setLastError(outcome.getError());
        if (!outcome.isSuccess()) {
            logger.warn("通知组投递失败，{} 后重试: {}, 错误: {}",
                    group.getRoute().getGroupInterval(), group.getKey(), outcome.getError());
            return;
        }

        group.setLastSent(outcome.getCompletedAt());
        Set<AlertKey> notified = new HashSet<>();
        for (AlertInstance instance : notification.getFiring()) {
            notified.add(instance.getKey());
        }
        group.setLastNotifiedFiring(notified);
        for (AlertInstance instance : notification.getResolved()) {
            AlertInstance member = group.getMembers().get(instance.getKey());
            if (member != null && member.isResolved()) {
                group.getMembers().remove(instance.getKey());
            }
        }
    }

    /**
     * 通知组状态视图
     */
    public synchronized List<GroupStatus> groups() {
        List<GroupStatus> result = new ArrayList<>(groups.size());
        for (NotificationGroup group : groups.values()) {
            int firing = (int) group.getMembers().values().stream().filter(AlertInstance::isFiring).count();
            result.add(GroupStatus.builder()
                    .groupKey(group.getKey().toString())
                    .receiver(group.getReceiver())
                    .route(group.getRoute().getPath())
                    .groupLabels(group.getKey().getGroupLabels().asMap())
                    .members(group.getMembers().size())
                    .firing(firing)
                    .firstSeen(group.getFirstSeen())
                    .lastSent(group.getLastSent())
                    .lastAttempt(group.getLastAttempt())
                    .lastStatus(group.getLastStatus())
                    .lastError(group.getLastError())
                    .build());
        }
        return result;
    }

    public synchronized int groupCount() {
        return groups.size();
    }
}
