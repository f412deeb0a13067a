package alertcore.engine;

import alertcore.config.ConfigLoader;
import alertcore.notify.NotifierContext;
import alertcore.silence.InMemorySilenceStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class AlertCoreApplicationTest {

    private static final String CONFIG = String.join("\n",
            "evaluation:",
            "  interval: 1m",
            "config:",
            "  check_interval: 0",
            "route:",
            "  receiver: default",
            "  group_by: [alertname]",
            "receivers:",
            "  - name: default",
            "    type: log",
            "");

    private static final String RULES = String.join("\n",
            "rules:",
            "  - alert: HighCpu",
            "    expr: cpu > 90",
            "    for: 5m",
            "");

    @TempDir
    Path dir;

    private Path configFile;
    private Path rulesDir;
    private AlertCoreApplication app;

    @BeforeEach
    void setUp() throws IOException {
        configFile = dir.resolve("alertcore.yml");
        rulesDir = Files.createDirectory(dir.resolve("rules"));
        Files.writeString(configFile, CONFIG);
        Files.writeString(rulesDir.resolve("node.yml"), RULES);

        ConfigLoader loader = new ConfigLoader(configFile, rulesDir, NotifierContext.builder().build());
        app = new AlertCoreApplication(loader, (expression, instant) -> Collections.emptyList(),
                new InMemorySilenceStore(), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        app.close();
    }

    @Test
    void invalidReloadKeepsCurrentConfiguration() throws IOException {
        String hash = app.getActiveConfiguration().getHash();
        Files.writeString(configFile, CONFIG.replace("receiver: default", "receiver: nobody"));

        ReloadResult result = app.reload("api");

        assertFalse(result.isSuccess());
        assertTrue(result.getMessage().contains("nobody"));
        assertEquals(hash, app.getActiveConfiguration().getHash());
        assertEquals("default", app.getRouter().getRoot().getReceiver());
        assertEquals("DEGRADED", app.getHealthStatus().getStatus());
    }

    @Test
    void validReloadSwapsConfiguration() throws IOException {
        app.start();
        Files.writeString(rulesDir.resolve("extra.yml"), "rules:\n  - alert: InstanceDown\n    expr: up == 0\n");

        ReloadResult result = app.reload("api");

        assertTrue(result.isSuccess());
        assertEquals(2, result.getRules());
        assertEquals(2, app.getActiveConfiguration().getRules().size());
        assertEquals("HEALTHY", app.getHealthStatus().getStatus());
    }

    @Test
    void closeStopsEngine() {
        app.start();
        assertTrue(app.isRunning());

        app.close();

        assertFalse(app.isRunning());
        assertThrows(IllegalStateException.class, app::start);
    }
}
