package alertcore.silence;

import alertcore.label.LabelSet;
import alertcore.label.Matcher;
import alertcore.label.Matchers;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * 静默 - 按标签匹配在时间窗口内抑制通知，不影响告警实例状态
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Silence {
    private String id;
    private List<Matcher> matchers;   // 全部满足才算匹配
    private Instant startsAt;
    private Instant endsAt;
    private String createdBy;
    private String comment;
    private Instant createdAt;

    /**
     * startsAt <= now < endsAt
     */
    public boolean isActive(Instant now) {
        return !now.isBefore(startsAt) && now.isBefore(endsAt);
    }

    public boolean matches(LabelSet labels) {
        return Matchers.matchesAll(labels, matchers);
    }
}
