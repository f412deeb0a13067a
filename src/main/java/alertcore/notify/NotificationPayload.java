package alertcore.notify;

import alertcore.label.LabelSet;
import alertcore.route.GroupNotification;
import alertcore.store.AlertInstance;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Webhook通知体
 */
@Data
@Builder
public class NotificationPayload {
    public static final String VERSION = "1";

    private final String version;
    private final String groupKey;
    private final String receiver;
    private final String status;                        // firing / resolved
    private final int firingCount;
    private final int resolvedCount;
    private final Map<String, String> groupLabels;
    private final Map<String, String> commonLabels;
    private final Map<String, String> commonAnnotations;
    private final List<Alert> alerts;

    @Data
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Alert {
        private final String status;
        private final Map<String, String> labels;
        private final Map<String, String> annotations;
        private final Instant startsAt;
        private final Instant endsAt;
        private final String fingerprint;
    }

    /**
     * 从到期通知组快照构建通知体，Firing在前
     */
    public static NotificationPayload from(GroupNotification notification) {
        List<AlertInstance> all = new ArrayList<>(notification.getFiring());
        all.addAll(notification.getResolved());

        List<Alert> alerts = new ArrayList<>(all.size());
        List<Map<String, String>> labelMaps = new ArrayList<>(all.size());
        List<Map<String, String>> annotationMaps = new ArrayList<>(all.size());
        for (AlertInstance instance : all) {
            alerts.add(toAlert(instance));
            labelMaps.add(instance.getLabels().asMap());
            annotationMaps.add(instance.getAnnotations());
        }

        return NotificationPayload.builder()
                .version(VERSION)
                .groupKey(notification.getGroupKey().toString())
                .receiver(notification.getReceiver())
                .status(notification.getFiring().isEmpty() ? "resolved" : "firing")
                .firingCount(notification.getFiring().size())
                .resolvedCount(notification.getResolved().size())
                .groupLabels(notification.getGroupKey().getGroupLabels().asMap())
                .commonLabels(common(labelMaps))
                .commonAnnotations(common(annotationMaps))
                .alerts(alerts)
                .build();
    }

    private static Alert toAlert(AlertInstance instance) {
        LabelSet labels = instance.getLabels();
        return Alert.builder()
                .status(instance.isResolved() ? "resolved" : "firing")
                .labels(labels.asMap())
                .annotations(instance.getAnnotations())
                .startsAt(instance.getFiringSince() != null ? instance.getFiringSince() : instance.getActiveSince())
                .endsAt(instance.isResolved() ? instance.getResolvedAt() : null)
                .fingerprint(instance.fingerprint())
                .build();
    }

    /**
     * 所有告警上取值都相同的键
     */
    private static Map<String, String> common(List<Map<String, String>> maps) {
        if (maps.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, String> result = new TreeMap<>(maps.get(0));
        for (int i = 1; i < maps.size(); i++) {
            Map<String, String> other = maps.get(i);
            result.entrySet().removeIf(e -> !e.getValue().equals(other.get(e.getKey())));
        }
        return new LinkedHashMap<>(result);
    }
}
