package alertcore.api;

import alertcore.engine.AlertCoreApplication;
import alertcore.engine.HealthStatus;
import alertcore.engine.ReloadResult;
import alertcore.route.GroupStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
public class ConfigController {

    private final AlertCoreApplication app;

    public ConfigController(AlertCoreApplication app) {
        this.app = app;
    }

    // 重新加载规则、路由和接收器配置
    @PostMapping("/-/reload")
    public ResponseEntity<ReloadResult> reload() {
        ReloadResult result = app.reload("api");
        log.info("配置重载请求完成: success={}", result.isSuccess());
        return ResponseEntity.status(result.isSuccess() ? HttpStatus.OK : HttpStatus.BAD_REQUEST).body(result);
    }

    @GetMapping("/api/v1/status")
    public HealthStatus status() {
        return app.getHealthStatus();
    }

    @GetMapping("/api/v1/groups")
    public List<GroupStatus> groups() {
        return app.getRouter().groups();
    }
}
