package alertcore.api;

import alertcore.label.Matcher;
import alertcore.label.Matchers;
import alertcore.silence.Silence;
import alertcore.silence.Silencer;
import alertcore.utils.Durations;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/silences")
public class SilenceController {

    private final Silencer silencer;
    private final Clock clock;

    public SilenceController(Silencer silencer, Clock clock) {
        this.silencer = silencer;
        this.clock = clock;
    }

    @PostMapping
    public Map<String, String> create(@RequestBody CreateSilenceRequest request) {
        List<Matcher> matchers = Matchers.parseAll(request.getMatchers());
        Instant startsAt = request.getStartsAt() != null ? request.getStartsAt() : clock.instant();
        Instant endsAt = request.getEndsAt();
        if (endsAt == null && StringUtils.isNotBlank(request.getDuration())) {
            endsAt = startsAt.plus(Durations.parseString(request.getDuration()));
        }
        String id = silencer.create(matchers, startsAt, endsAt, request.getCreatedBy(), request.getComment());
        return Collections.singletonMap("id", id);
    }

    @DeleteMapping("/{id}")
    public Map<String, String> delete(@PathVariable("id") String id) {
        silencer.delete(id);
        return Collections.singletonMap("id", id);
    }

    @GetMapping
    public List<Silence> list(@RequestParam(name = "all", defaultValue = "false") boolean all) {
        return all ? silencer.listAll() : silencer.listActive(clock.instant());
    }

    @GetMapping("/{id}")
    public Silence get(@PathVariable("id") String id) {
        return silencer.get(id);
    }
}
