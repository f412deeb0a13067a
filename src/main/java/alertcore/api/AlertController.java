package alertcore.api;

import alertcore.silence.Silencer;
import alertcore.store.AlertInstance;
import alertcore.store.AlertStore;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/v1/alerts")
public class AlertController {

    private final AlertStore alertStore;
    private final Silencer silencer;
    private final Clock clock;

    public AlertController(AlertStore alertStore, Silencer silencer, Clock clock) {
        this.alertStore = alertStore;
        this.silencer = silencer;
        this.clock = clock;
    }

    /**
     * 查询告警实例，静默只体现在silenced标记上
     */
    @GetMapping
    public List<AlertView> list(@RequestParam(name = "rule", required = false) String rule) {
        Instant now = clock.instant();
        List<AlertInstance> instances = StringUtils.isBlank(rule) ? alertStore.getAll() : alertStore.getForRule(rule);
        List<AlertView> views = new ArrayList<>(instances.size());
        for (AlertInstance instance : instances) {
            List<String> silencedBy = silencer.silencedBy(instance.getLabels(), now);
            views.add(AlertView.builder()
                    .rule(instance.getRuleName())
                    .state(instance.getState().value())
                    .labels(instance.getLabels().asMap())
                    .annotations(instance.getAnnotations())
                    .value(instance.getValue())
                    .activeSince(instance.getActiveSince())
                    .firingSince(instance.getFiringSince())
                    .resolvedAt(instance.getResolvedAt())
                    .lastEvaluatedAt(instance.getLastEvaluatedAt())
                    .fingerprint(instance.fingerprint())
                    .silenced(!silencedBy.isEmpty())
                    .silencedBy(silencedBy)
                    .build());
        }
        return views;
    }
}
