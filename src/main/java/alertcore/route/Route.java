package alertcore.route;

import alertcore.config.ConfigurationException;
import alertcore.label.LabelSet;
import alertcore.label.Matcher;
import alertcore.label.Matchers;
import lombok.Builder;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * 路由树节点 - 匹配条件、接收器、分组标签和通知时序
 *
 * <p>子节点未设置的接收器、分组和时序继承自父节点，由配置加载时完成展开，
 * 因此这里的每个字段都是生效值。
 */
@Getter
@Builder
public class Route {
    public static final Duration DEFAULT_GROUP_WAIT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_GROUP_INTERVAL = Duration.ofMinutes(5);
    public static final Duration DEFAULT_REPEAT_INTERVAL = Duration.ofHours(4);

    // 按全部标签分组
    public static final String GROUP_BY_ALL = "...";

    private final String path;                 // 节点在树中的位置，如 root.0.1
    @Builder.Default
    private final List<Matcher> matchers = Collections.emptyList();
    private final String receiver;
    @Builder.Default
    private final List<String> groupBy = Collections.emptyList();
    @Builder.Default
    private final Duration groupWait = DEFAULT_GROUP_WAIT;
    @Builder.Default
    private final Duration groupInterval = DEFAULT_GROUP_INTERVAL;
    @Builder.Default
    private final Duration repeatInterval = DEFAULT_REPEAT_INTERVAL;
    private final boolean continueMatching;    // 匹配后是否继续尝试后续兄弟节点
    @Builder.Default
    private final List<Route> children = Collections.emptyList();

    /**
     * 深度优先匹配：子节点按顺序尝试，首个匹配的子节点生效，除非它设置了continue；
     * 没有子节点匹配时返回当前节点
     *
     * @return 匹配到的节点，当前节点不匹配时为空
     */
    public List<Route> match(LabelSet labels) {
        if (!Matchers.matchesAll(labels, matchers)) {
            return Collections.emptyList();
        }
        List<Route> result = new ArrayList<>();
        for (Route child : children) {
            List<Route> matched = child.match(labels);
            if (matched.isEmpty()) {
                continue;
            }
            result.addAll(matched);
            if (!child.isContinueMatching()) {
                break;
            }
        }
        if (result.isEmpty()) {
            result.add(this);
        }
        return result;
    }

    /**
     * 计算分组标签
     */
    public LabelSet groupLabels(LabelSet labels) {
        if (groupBy.contains(GROUP_BY_ALL)) {
            return labels;
        }
        return labels.project(groupBy);
    }

    /**
     * 校验整棵树：接收器存在、无环、无不可达节点
     */
    public void validate(Set<String> receivers) {
        if (!matchers.isEmpty()) {
            throw new ConfigurationException("根路由不能设置匹配条件");
        }
        validateNode(receivers, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private void validateNode(Set<String> receivers, Set<Route> visited) {
        if (!visited.add(this)) {
            throw new ConfigurationException("路由树存在环: " + path);
        }
        if (StringUtils.isBlank(receiver)) {
            throw new ConfigurationException("路由未指定接收器: " + path);
        }
        if (!receivers.contains(receiver)) {
            throw new ConfigurationException("路由引用了未知接收器: " + receiver + " (" + path + ")");
        }
        if (Matchers.isContradictory(matchers)) {
            throw new ConfigurationException("路由匹配条件互相矛盾，节点不可达: " + path);
        }
        if (groupInterval.isZero() || groupInterval.isNegative()
                || repeatInterval.isZero() || repeatInterval.isNegative() || groupWait.isNegative()) {
            throw new ConfigurationException("路由时序参数无效: " + path);
        }

        Route catchAll = null;
        for (Route child : children) {
            if (catchAll != null) {
                throw new ConfigurationException("路由节点不可达，前面的兄弟节点 " + catchAll.getPath()
                        + " 匹配所有告警: " + child.getPath());
            }
            child.validateNode(receivers, visited);
            if (child.getMatchers().isEmpty() && !child.isContinueMatching()) {
                catchAll = child;
            }
        }
    }

    @Override
    public String toString() {
        return "Route{" + path + ", receiver=" + receiver + ", matchers=" + matchers + "}";
    }
}
