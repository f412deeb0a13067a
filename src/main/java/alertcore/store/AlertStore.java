package alertcore.store;

import alertcore.label.LabelSet;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 告警实例表 - 单写(规则执行器)多读(路由、静默、状态查询)
 *
 * <p>写操作只在单次变更期间持有写锁；读操作返回不可变快照，不会看到写了一半的数据。
 */
public class AlertStore {
    private static final Logger logger = LoggerFactory.getLogger(AlertStore.class);

    // ruleName -> (labels -> instance)
    private final Map<String, Map<LabelSet, AlertInstance>> instances = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * 新建实例，键已存在未解除的实例时视为不变量被破坏
     */
    public void create(AlertInstance instance) {
        lock.writeLock().lock();
        try {
            Map<LabelSet, AlertInstance> byLabels = instances.computeIfAbsent(instance.getRuleName(), k -> new HashMap<>());
            AlertInstance existing = byLabels.get(instance.getLabels());
            if (existing != null && !existing.isResolved()) {
                throw new IllegalStateException("重复的告警实例: " + instance.getKey() + ", 当前状态: " + existing.getState());
            }
            byLabels.put(instance.getLabels(), instance);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 插入或替换实例
     */
    public void upsert(AlertInstance instance) {
        lock.writeLock().lock();
        try {
            instances.computeIfAbsent(instance.getRuleName(), k -> new HashMap<>())
                    .put(instance.getLabels(), instance);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean remove(AlertKey key) {
        lock.writeLock().lock();
        try {
            Map<LabelSet, AlertInstance> byLabels = instances.get(key.getRuleName());
            if (byLabels == null) {
                return false;
            }
            boolean removed = byLabels.remove(key.getLabels()) != null;
            if (byLabels.isEmpty()) {
                instances.remove(key.getRuleName());
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 删除某条规则的全部实例，规则被移除时调用
     */
    public int removeRule(String ruleName) {
        lock.writeLock().lock();
        try {
            Map<LabelSet, AlertInstance> removed = instances.remove(ruleName);
            int count = removed == null ? 0 : removed.size();
            if (count > 0) {
                logger.info("已清除规则 {} 的 {} 个告警实例", ruleName, count);
            }
            return count;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<AlertInstance> get(AlertKey key) {
        lock.readLock().lock();
        try {
            Map<LabelSet, AlertInstance> byLabels = instances.get(key.getRuleName());
            return byLabels == null ? Optional.empty() : Optional.ofNullable(byLabels.get(key.getLabels()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<AlertInstance> getAll() {
        lock.readLock().lock();
        try {
            ImmutableList.Builder<AlertInstance> builder = ImmutableList.builder();
            for (Map<LabelSet, AlertInstance> byLabels : instances.values()) {
                builder.addAll(byLabels.values());
            }
            return builder.build();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<AlertInstance> getForRule(String ruleName) {
        lock.readLock().lock();
        try {
            Map<LabelSet, AlertInstance> byLabels = instances.get(ruleName);
            return byLabels == null ? ImmutableList.of() : ImmutableList.copyOf(byLabels.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Collection<String> ruleNames() {
        lock.readLock().lock();
        try {
            return ImmutableList.copyOf(instances.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            int total = 0;
            for (Map<LabelSet, AlertInstance> byLabels : instances.values()) {
                total += byLabels.size();
            }
            return total;
        } finally {
            lock.readLock().unlock();
        }
    }
}
