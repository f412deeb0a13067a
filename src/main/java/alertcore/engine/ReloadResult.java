package alertcore.engine;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * 一次配置重载的结果
 */
@Data
@Builder
public class ReloadResult {
    private final boolean success;
    private final String trigger;     // startup / api / file-change
    private final String message;
    private final String hash;
    private final int rules;
    private final int receivers;
    private final Instant time;
}
