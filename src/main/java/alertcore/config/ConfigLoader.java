package alertcore.config;

import alertcore.label.LabelSet;
import alertcore.label.Matcher;
import alertcore.label.Matchers;
import alertcore.notify.LogNotifier;
import alertcore.notify.Notifier;
import alertcore.notify.NotifierContext;
import alertcore.notify.RetryPolicy;
import alertcore.notify.WebhookNotifier;
import alertcore.route.Route;
import alertcore.rule.AlertRule;
import alertcore.utils.Durations;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 配置加载器 - 读取全局配置文件和规则目录，构建并校验 {@link ActiveConfiguration}
 *
 * <p>任何一处错误都会导致整体加载失败，调用方保留旧配置继续运行。
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configFile;
    private final Path rulesDirectory;
    private final ObjectMapper yamlMapper;
    private final Clock clock;
    private final NotifierContext notifierContext;

    // 接收器类型注册表
    private final Map<String, NotifierFactory> notifierFactories;

    public ConfigLoader(Path configFile, Path rulesDirectory, NotifierContext notifierContext) {
        this.configFile = configFile;
        this.rulesDirectory = rulesDirectory;
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.notifierContext = notifierContext;
        this.clock = notifierContext.getClock();
        this.notifierFactories = new ConcurrentHashMap<>();

        registerDefaultNotifierFactories();
    }

    /**
     * 注册默认的接收器类型
     */
    private void registerDefaultNotifierFactories() {
        registerNotifierFactory("webhook", this::createWebhookNotifier);
        registerNotifierFactory("log", (name, config, context) -> new LogNotifier(name,
                asBoolean(config.get("send_resolved"), true), context.getClock()));
    }

    /**
     * 注册接收器工厂
     */
    public void registerNotifierFactory(String type, NotifierFactory factory) {
        notifierFactories.put(type.toLowerCase(), factory);
        logger.info("注册接收器类型: {}", type);
    }

    /**
     * 加载全部配置
     *
     * @throws ConfigurationException 配置无效
     */
    public ActiveConfiguration load() {
        logger.info("开始加载配置: {}, 规则目录: {}", configFile, rulesDirectory);

        AlertCoreConfig global = AlertCoreConfig.load(configFile.toString());
        global.validate();

        Map<String, Notifier> receivers = loadReceivers(global, notifierContext(global));
        Route route = buildRoute(global.getSubConfig("route"), null, "root");
        route.validate(receivers.keySet());

        Duration defaultInterval = global.getDuration("evaluation.interval", Duration.ofMinutes(1));
        List<AlertRule> rules = loadAllRules(defaultInterval);

        ActiveConfiguration configuration = ActiveConfiguration.builder()
                .global(global)
                .rules(Collections.unmodifiableList(rules))
                .route(route)
                .receivers(Collections.unmodifiableMap(receivers))
                .hash(currentHash())
                .loadedAt(clock.instant())
                .build();
        logger.info("配置加载成功: 规则 {} 条, 接收器 {} 个, hash={}",
                rules.size(), receivers.size(), configuration.getHash());
        return configuration;
    }

    // ---------------------------------------------------------------- 接收器

    /**
     * 全局配置中的重试和超时参数覆盖默认值
     */
    private NotifierContext notifierContext(AlertCoreConfig global) {
        RetryPolicy defaults = RetryPolicy.defaults();
        RetryPolicy retryPolicy = RetryPolicy.builder()
                .maxAttempts(global.getInt("notifier.retry.max_attempts", defaults.getMaxAttempts()))
                .initialBackoff(global.getDuration("notifier.retry.initial_backoff", defaults.getInitialBackoff()))
                .multiplier(global.getDouble("notifier.retry.multiplier", defaults.getMultiplier()))
                .maxBackoff(global.getDuration("notifier.retry.max_backoff", defaults.getMaxBackoff()))
                .build();
        return notifierContext.toBuilder()
                .retryPolicy(retryPolicy)
                .timeout(global.getDuration("notifier.timeout", notifierContext.getTimeout()))
                .build();
    }

    private Map<String, Notifier> loadReceivers(AlertCoreConfig global, NotifierContext context) {
        List<Map<String, Object>> receiverConfigs = global.getMapList("receivers");
        if (receiverConfigs.isEmpty()) {
            throw new ConfigurationException("至少需要配置一个接收器");
        }

        Map<String, Notifier> receivers = new LinkedHashMap<>();
        for (Map<String, Object> config : receiverConfigs) {
            String name = asString(config.get("name"));
            if (StringUtils.isBlank(name)) {
                throw new ConfigurationException("接收器必须指定name");
            }
            if (receivers.containsKey(name)) {
                throw new ConfigurationException("接收器名称重复: " + name);
            }

            String type = asString(config.get("type"));
            if (type == null) {
                type = config.containsKey("url") ? "webhook" : "log";
            }
            NotifierFactory factory = notifierFactories.get(type.toLowerCase());
            if (factory == null) {
                throw new ConfigurationException("不支持的接收器类型: " + type + " (" + name + ")");
            }

            try {
                receivers.put(name, factory.create(name, config, context));
            } catch (ConfigurationException e) {
                throw e;
            } catch (Exception e) {
                throw new ConfigurationException("创建接收器失败: " + name + ", " + e.getMessage(), e);
            }
        }
        return receivers;
    }

    @SuppressWarnings("unchecked")
    private Notifier createWebhookNotifier(String name, Map<String, Object> config, NotifierContext context) {
        String url = asString(config.get("url"));
        Map<String, String> headers = new LinkedHashMap<>();
        Object headerConfig = config.get("headers");
        if (headerConfig instanceof Map) {
            ((Map<String, Object>) headerConfig).forEach((k, v) -> headers.put(k, String.valueOf(v)));
        }

        // 凭证只从环境变量读取，不写入任何配置对象
        String token = null;
        String tokenEnv = asString(config.get("bearer_token_env"));
        if (StringUtils.isNotBlank(tokenEnv)) {
            token = context.getEnvironment().apply(tokenEnv);
            if (StringUtils.isBlank(token)) {
                throw new ConfigurationException("接收器 " + name + " 的凭证环境变量未设置: " + tokenEnv);
            }
        }

        Duration timeout = Durations.parse(config.get("timeout"), context.getTimeout());
        return new WebhookNotifier(name, url, headers, token,
                asBoolean(config.get("send_resolved"), true), timeout,
                context.getRetryPolicy(), context.getClock(), context.getSleeper());
    }

    // ---------------------------------------------------------------- 路由

    /**
     * 构建路由节点，未设置的字段继承父节点
     */
    @SuppressWarnings("unchecked")
    private Route buildRoute(Map<String, Object> config, Route parent, String path) {
        if (parent == null && config.isEmpty()) {
            throw new ConfigurationException("缺少route配置");
        }

        List<Matcher> matchers = parseRouteMatchers(config, path);
        String receiver = asString(config.get("receiver"));
        List<String> groupBy = config.containsKey("group_by")
                ? asStringList(config.get("group_by"), path + ".group_by")
                : (parent != null ? parent.getGroupBy() : Collections.emptyList());

        Route.RouteBuilder builder = Route.builder()
                .path(path)
                .matchers(matchers)
                .receiver(receiver != null ? receiver : (parent != null ? parent.getReceiver() : null))
                .groupBy(groupBy)
                .groupWait(Durations.parse(config.get("group_wait"),
                        parent != null ? parent.getGroupWait() : Route.DEFAULT_GROUP_WAIT))
                .groupInterval(Durations.parse(config.get("group_interval"),
                        parent != null ? parent.getGroupInterval() : Route.DEFAULT_GROUP_INTERVAL))
                .repeatInterval(Durations.parse(config.get("repeat_interval"),
                        parent != null ? parent.getRepeatInterval() : Route.DEFAULT_REPEAT_INTERVAL))
                .continueMatching(asBoolean(config.get("continue"), false));

        // 先构建不含子节点的当前节点作为子节点的继承来源
        Route self = builder.build();
        Object children = config.get("routes");
        if (children == null) {
            return self;
        }
        if (!(children instanceof List)) {
            throw new ConfigurationException("routes必须是列表: " + path);
        }
        List<Route> childRoutes = new ArrayList<>();
        List<Object> childConfigs = (List<Object>) children;
        for (int i = 0; i < childConfigs.size(); i++) {
            Object child = childConfigs.get(i);
            if (!(child instanceof Map)) {
                throw new ConfigurationException("路由节点必须是对象: " + path + "." + i);
            }
            childRoutes.add(buildRoute((Map<String, Object>) child, self, path + "." + i));
        }
        return builder.children(Collections.unmodifiableList(childRoutes)).build();
    }

    /**
     * 解析路由匹配条件，支持 matchers 文本列表和 match / match_re 映射
     */
    @SuppressWarnings("unchecked")
    private List<Matcher> parseRouteMatchers(Map<String, Object> config, String path) {
        List<Matcher> matchers = new ArrayList<>();
        try {
            if (config.containsKey("matchers")) {
                matchers.addAll(Matchers.parseAll(asStringList(config.get("matchers"), path + ".matchers")));
            }
            Object match = config.get("match");
            if (match instanceof Map) {
                ((Map<String, Object>) match).forEach((k, v) -> matchers.add(Matcher.equal(k, String.valueOf(v))));
            }
            Object matchRe = config.get("match_re");
            if (matchRe instanceof Map) {
                ((Map<String, Object>) matchRe).forEach((k, v) -> matchers.add(Matcher.regex(k, String.valueOf(v))));
            }
        } catch (ConfigurationException e) {
            throw new ConfigurationException("路由 " + path + " 匹配条件无效: " + e.getMessage(), e);
        }
        return Collections.unmodifiableList(matchers);
    }

    // ---------------------------------------------------------------- 规则

    /**
     * 加载规则目录下的所有规则文件
     */
    private List<AlertRule> loadAllRules(Duration defaultInterval) {
        if (!Files.isDirectory(rulesDirectory)) {
            throw new ConfigurationException("规则目录不存在: " + rulesDirectory);
        }

        Map<String, AlertRule> rules = new LinkedHashMap<>();
        for (Path path : listRuleFiles()) {
            for (AlertRule rule : loadRuleFile(path, defaultInterval)) {
                AlertRule existing = rules.get(rule.getName());
                if (existing != null) {
                    throw new ConfigurationException(String.format("规则名称 '%s' 重复: %s, %s",
                            rule.getName(), existing.getSourcePath(), rule.getSourcePath()));
                }
                rules.put(rule.getName(), rule);
            }
        }
        return new ArrayList<>(rules.values());
    }

    /**
     * 加载单个规则文件
     */
    @SuppressWarnings("unchecked")
    private List<AlertRule> loadRuleFile(Path path, Duration defaultInterval) {
        logger.debug("加载规则文件: {}", path);

        Map<String, Object> fileMap;
        try {
            fileMap = yamlMapper.readValue(path.toFile(), Map.class);
        } catch (IOException e) {
            throw new ConfigurationException("读取规则文件失败: " + path + ", " + e.getMessage(), e);
        }
        if (fileMap == null) {
            return Collections.emptyList();
        }

        List<AlertRule> rules = new ArrayList<>();
        try {
            if (fileMap.containsKey("groups")) {
                AlertCoreConfig file = AlertCoreConfig.of(fileMap);
                for (Map<String, Object> group : file.getMapList("groups")) {
                    String groupName = asString(group.get("name"));
                    Duration interval = Durations.parse(group.get("interval"), defaultInterval);
                    for (Map<String, Object> ruleMap : AlertCoreConfig.of(group).getMapList("rules")) {
                        rules.add(buildRule(ruleMap, groupName, interval, path));
                    }
                }
            } else {
                for (Map<String, Object> ruleMap : AlertCoreConfig.of(fileMap).getMapList("rules")) {
                    rules.add(buildRule(ruleMap, null, defaultInterval, path));
                }
            }
        } catch (ConfigurationException e) {
            throw new ConfigurationException("规则文件无效: " + path + ", " + e.getMessage(), e);
        }
        return rules;
    }

    /**
     * 构建规则对象
     */
    @SuppressWarnings("unchecked")
    private AlertRule buildRule(Map<String, Object> config, String group, Duration groupInterval, Path path) {
        String name = asString(config.containsKey("name") ? config.get("name") : config.get("alert"));
        String expression = asString(config.containsKey("expr") ? config.get("expr") : config.get("expression"));

        Map<String, String> labels = new TreeMap<>();
        Object labelConfig = config.get("labels");
        if (labelConfig instanceof Map) {
            ((Map<String, Object>) labelConfig).forEach((k, v) -> labels.put(k, String.valueOf(v)));
        }
        Map<String, String> annotations = new LinkedHashMap<>();
        Object annotationConfig = config.get("annotations");
        if (annotationConfig instanceof Map) {
            ((Map<String, Object>) annotationConfig).forEach((k, v) -> annotations.put(k, String.valueOf(v)));
        }

        AlertRule rule = AlertRule.builder()
                .name(name)
                .expression(expression)
                .hold(Durations.parse(config.get("for"), Duration.ZERO))
                .labels(LabelSet.of(labels))
                .annotations(Collections.unmodifiableMap(annotations))
                .severity(asString(config.get("severity")))
                .interval(Durations.parse(config.get("interval"), groupInterval))
                .group(group)
                .sourcePath(path.toString())
                .build();
        rule.validate();
        return rule;
    }

    private List<Path> listRuleFiles() {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(rulesDirectory, "*.{yaml,yml}")) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    files.add(path);
                }
            }
        } catch (IOException e) {
            throw new ConfigurationException("读取规则目录失败: " + rulesDirectory, e);
        }
        Collections.sort(files);
        return files;
    }

    // ---------------------------------------------------------------- 变更检测

    /**
     * 计算所有配置文件内容的摘要，用于定期检查是否需要重载
     */
    public String currentHash() {
        StringBuilder digest = new StringBuilder();
        try {
            digest.append(configFile.getFileName()).append('=').append(calculateFileHash(configFile)).append('\n');
            if (Files.isDirectory(rulesDirectory)) {
                for (Path path : listRuleFiles()) {
                    digest.append(path.getFileName()).append('=').append(calculateFileHash(path)).append('\n');
                }
            }
        } catch (IOException e) {
            throw new ConfigurationException("读取配置文件失败: " + e.getMessage(), e);
        }
        return DigestUtils.md5Hex(digest.toString());
    }

    /**
     * 计算文件hash
     */
    private String calculateFileHash(Path path) throws IOException {
        return DigestUtils.md5Hex(Files.readAllBytes(path));
    }

    // ---------------------------------------------------------------- 工具方法

    private static String asString(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static boolean asBoolean(Object value, boolean defaultValue) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    @SuppressWarnings("unchecked")
    private static List<String> asStringList(Object value, String key) {
        if (value instanceof String) {
            return Collections.singletonList((String) value);
        }
        if (!(value instanceof List)) {
            throw new ConfigurationException("配置项必须是字符串列表: " + key);
        }
        List<String> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Object item : (List<Object>) value) {
            String text = String.valueOf(item);
            if (seen.add(text)) {
                result.add(text);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * 接收器工厂接口
     */
    @FunctionalInterface
    public interface NotifierFactory {
        Notifier create(String name, Map<String, Object> config, NotifierContext context);
    }
}
