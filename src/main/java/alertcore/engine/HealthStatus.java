package alertcore.engine;

import alertcore.rule.RuleHealthStatus;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 健康状态类
 */
@Data
public class HealthStatus {
    private String status;  // HEALTHY, DEGRADED
    private Instant startedAt;
    private Instant lastCheckTime;
    private String configHash;
    private Instant configLoadedAt;
    private ReloadResult lastReload;
    private Map<String, RuleHealthStatus> ruleHealth;
    private int pendingAlerts;
    private int firingAlerts;
    private int resolvedAlerts;
    private int notificationGroups;
    private int activeSilences;
    private List<String> issues = new ArrayList<>();
}
