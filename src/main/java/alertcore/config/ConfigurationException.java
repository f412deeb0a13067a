package alertcore.config;

/**
 * 配置异常 - 规则、路由、接收器或静默配置不合法
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
