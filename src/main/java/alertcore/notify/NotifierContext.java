package alertcore.notify;

import lombok.Builder;
import lombok.Data;

import java.time.Clock;
import java.time.Duration;
import java.util.function.Function;

/**
 * 构建接收器时共享的全局参数
 */
@Data
@Builder(toBuilder = true)
public class NotifierContext {
    @Builder.Default
    private final RetryPolicy retryPolicy = RetryPolicy.defaults();
    @Builder.Default
    private final Duration timeout = Duration.ofSeconds(10);
    @Builder.Default
    private final Clock clock = Clock.systemUTC();
    private final WebhookNotifier.Sleeper sleeper;           // 为空时真实休眠
    @Builder.Default
    private final Function<String, String> environment = System::getenv;
}
