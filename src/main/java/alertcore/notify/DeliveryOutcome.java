package alertcore.notify;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * 一次投递(含重试)的最终结果
 */
@Data
@Builder
public class DeliveryOutcome {
    private final DeliveryStatus status;
    private final int attempts;
    private final int statusCode;        // 最后一次HTTP状态码，没有响应时为0
    private final String error;
    private final Instant completedAt;   // 最后一次尝试的完成时间

    public boolean isSuccess() {
        return status == DeliveryStatus.SUCCESS;
    }

    public static DeliveryOutcome success(int attempts, int statusCode, Instant completedAt) {
        return DeliveryOutcome.builder()
                .status(DeliveryStatus.SUCCESS)
                .attempts(attempts)
                .statusCode(statusCode)
                .completedAt(completedAt)
                .build();
    }

    public static DeliveryOutcome failed(int attempts, int statusCode, String error, Instant completedAt) {
        return DeliveryOutcome.builder()
                .status(DeliveryStatus.FAILED)
                .attempts(attempts)
                .statusCode(statusCode)
                .error(error)
                .completedAt(completedAt)
                .build();
    }
}
