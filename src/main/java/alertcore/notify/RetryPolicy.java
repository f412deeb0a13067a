package alertcore.notify;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * 指数退避重试策略
 */
@Data
@Builder
public class RetryPolicy {
    @Builder.Default
    private final int maxAttempts = 5;
    @Builder.Default
    private final Duration initialBackoff = Duration.ofMillis(500);
    @Builder.Default
    private final double multiplier = 2.0;
    @Builder.Default
    private final Duration maxBackoff = Duration.ofSeconds(10);

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    /**
     * 第attempt次失败后的等待时长，attempt从1开始
     */
    public Duration backoff(int attempt) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
        if (millis >= maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis((long) millis);
    }
}
