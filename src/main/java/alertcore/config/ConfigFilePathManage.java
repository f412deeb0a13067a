package alertcore.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class ConfigFilePathManage {

    @Value("${alertcore.config.path}")
    public String alertCoreConfigPath;

    @Value("${alertcore.rules.path}")
    public String rulesPath;
}
