package alertcore.config;

import alertcore.engine.AlertCoreApplication;
import alertcore.notify.NotifierContext;
import alertcore.silence.Silencer;
import alertcore.store.AlertStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;

@Slf4j
@Configuration
public class AlertCoreConfiguration {

    @Autowired
    private ConfigFilePathManage configFilePathManage;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ConfigLoader configLoader(Clock clock) {
        NotifierContext context = NotifierContext.builder()
                .clock(clock)
                .environment(System::getenv)
                .build();
        return new ConfigLoader(
                Paths.get(configFilePathManage.alertCoreConfigPath),
                Paths.get(configFilePathManage.rulesPath),
                context);
    }

    @Bean(destroyMethod = "close")
    public AlertCoreApplication alertCoreApplication(ConfigLoader configLoader, Clock clock) {
        AlertCoreApplication app = new AlertCoreApplication(configLoader, null, null, clock);
        try {
            app.start();
        } catch (RuntimeException e) {
            log.error("告警引擎启动失败", e);
            app.close();
            throw e;
        }
        return app;
    }

    @Bean
    public Silencer silencer(AlertCoreApplication app) {
        return app.getSilencer();
    }

    @Bean
    public AlertStore alertStore(AlertCoreApplication app) {
        return app.getAlertStore();
    }
}
