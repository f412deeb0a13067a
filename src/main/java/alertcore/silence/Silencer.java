package alertcore.silence;

import alertcore.label.LabelSet;
import alertcore.label.Matcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 静默管理 - 维护静默窗口，只影响通知，不影响规则执行和告警状态
 *
 * <p>静默列表为写时复制，读路径无锁；所有变更先持久化再替换引用。
 */
public class Silencer {
    private static final Logger logger = LoggerFactory.getLogger(Silencer.class);

    private final SilenceStore store;
    private final Clock clock;
    private final Duration retention;
    private final AtomicReference<ImmutableMap<String, Silence>> silences;
    private final Object writeLock = new Object();

    public Silencer(SilenceStore store, Clock clock, Duration retention) {
        this.store = store;
        this.clock = clock;
        this.retention = retention == null ? Duration.ofHours(24) : retention;

        ImmutableMap.Builder<String, Silence> builder = ImmutableMap.builder();
        for (Silence silence : store.loadAll()) {
            builder.put(silence.getId(), silence);
        }
        this.silences = new AtomicReference<>(builder.buildKeepingLast());
        logger.info("静默管理初始化完成，已加载 {} 条静默", this.silences.get().size());
    }

    /**
     * 创建静默
     *
     * @param startsAt 为空时从当前时间开始
     * @return 新静默的id
     */
    public String create(List<Matcher> matchers, Instant startsAt, Instant endsAt, String createdBy, String comment) {
        Instant now = clock.instant();
        Instant start = startsAt == null ? now : startsAt;
        validate(matchers, start, endsAt, now, createdBy);

        Silence silence = Silence.builder()
                .id(UUID.randomUUID().toString())
                .matchers(ImmutableList.copyOf(matchers))
                .startsAt(start)
                .endsAt(endsAt)
                .createdBy(createdBy)
                .comment(comment)
                .createdAt(now)
                .build();

        synchronized (writeLock) {
            store.save(silence);
            Map<String, Silence> next = new LinkedHashMap<>(silences.get());
            next.put(silence.getId(), silence);
            silences.set(ImmutableMap.copyOf(next));
        }
        logger.info("创建静默: id={}, matchers={}, 时间窗口=[{}, {}), 创建人={}",
                silence.getId(), silence.getMatchers(), start, endsAt, createdBy);
        return silence.getId();
    }

    private void validate(List<Matcher> matchers, Instant start, Instant endsAt, Instant now, String createdBy) {
        if (CollectionUtils.isEmpty(matchers)) {
            throw new IllegalArgumentException("静默至少需要一个匹配条件");
        }
        // 全部条件都匹配空标签集的静默会屏蔽所有告警
        if (matchers.stream().allMatch(m -> m.matches(LabelSet.EMPTY))) {
            throw new IllegalArgumentException("静默条件至少要有一个不匹配空标签");
        }
        if (endsAt == null) {
            throw new IllegalArgumentException("静默结束时间不能为空");
        }
        if (!endsAt.isAfter(start)) {
            throw new IllegalArgumentException("静默结束时间必须晚于开始时间");
        }
        if (!endsAt.isAfter(now)) {
            throw new IllegalArgumentException("静默结束时间不能早于当前时间");
        }
        if (StringUtils.isBlank(createdBy)) {
            throw new IllegalArgumentException("静默创建人不能为空");
        }
    }

    /**
     * 删除静默
     *
     * @throws NoSuchElementException id不存在
     */
    public void delete(String id) {
        synchronized (writeLock) {
            if (!silences.get().containsKey(id)) {
                throw new NoSuchElementException("静默不存在: " + id);
            }
            store.delete(id);
            Map<String, Silence> next = new LinkedHashMap<>(silences.get());
            next.remove(id);
            silences.set(ImmutableMap.copyOf(next));
        }
        logger.info("删除静默: {}", id);
    }

    public boolean isSilenced(LabelSet labels, Instant now) {
        for (Silence silence : silences.get().values()) {
            if (silence.isActive(now) && silence.matches(labels)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 返回当前命中该标签集的静默id
     */
    public List<String> silencedBy(LabelSet labels, Instant now) {
        List<String> ids = new ArrayList<>();
        for (Silence silence : silences.get().values()) {
            if (silence.isActive(now) && silence.matches(labels)) {
                ids.add(silence.getId());
            }
        }
        return ids;
    }

    public List<Silence> listActive(Instant now) {
        List<Silence> active = new ArrayList<>();
        for (Silence silence : silences.get().values()) {
            if (silence.isActive(now)) {
                active.add(silence);
            }
        }
        active.sort(Comparator.comparing(Silence::getEndsAt));
        return active;
    }

    public List<Silence> listAll() {
        return ImmutableList.copyOf(silences.get().values());
    }

    public Silence get(String id) {
        Silence silence = silences.get().get(id);
        if (silence == null) {
            throw new NoSuchElementException("静默不存在: " + id);
        }
        return silence;
    }

    /**
     * 清理结束时间早于保留期的静默
     *
     * @return 清理数量
     */
    public int reap(Instant now) {
        Instant cutoff = now.minus(retention);
        List<String> expired = new ArrayList<>();
        synchronized (writeLock) {
            Map<String, Silence> next = new LinkedHashMap<>(silences.get());
            for (Silence silence : silences.get().values()) {
                if (silence.getEndsAt().isBefore(cutoff)) {
                    store.delete(silence.getId());
                    next.remove(silence.getId());
                    expired.add(silence.getId());
                }
            }
            if (!expired.isEmpty()) {
                silences.set(ImmutableMap.copyOf(next));
            }
        }
        if (!expired.isEmpty()) {
            logger.info("清理过期静默 {} 条: {}", expired.size(), expired);
        }
        return expired.size();
    }
}
