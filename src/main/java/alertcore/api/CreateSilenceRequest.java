package alertcore.api;

import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * 创建静默请求，endsAt和duration二选一
 */
@Data
public class CreateSilenceRequest {
    private List<String> matchers;   // 如 alertname="HighCpu"
    private Instant startsAt;
    private Instant endsAt;
    private String duration;         // 如 2h，从startsAt起算
    private String createdBy;
    private String comment;
}
