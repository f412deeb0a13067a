package alertcore.rule;

import lombok.Data;

import java.time.Instant;

/**
 * 规则健康状态类
 */
@Data
public class RuleHealthStatus {
    private String ruleName;
    private String status;  // OK, ERROR, UNKNOWN
    private Instant lastExecutionTime;
    private long lastDurationMillis;
    private int consecutiveFailures;
    private long totalFailures;
    private String lastError;
    private int pendingCount;
    private int firingCount;
}
