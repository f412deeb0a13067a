package alertcore.api;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 告警实例查询结果
 */
@Data
@Builder
public class AlertView {
    private final String rule;
    private final String state;
    private final Map<String, String> labels;
    private final Map<String, String> annotations;
    private final double value;
    private final Instant activeSince;
    private final Instant firingSince;
    private final Instant resolvedAt;
    private final Instant lastEvaluatedAt;
    private final String fingerprint;
    private final boolean silenced;
    private final List<String> silencedBy;
}
