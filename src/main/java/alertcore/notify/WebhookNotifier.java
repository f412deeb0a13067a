package alertcore.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Webhook接收器 - JSON POST，临时性失败按指数退避重试
 */
public class WebhookNotifier extends Notifier {
    private static final Logger logger = LoggerFactory.getLogger(WebhookNotifier.class);

    private static final String AUTHORIZATION = "Authorization";
    private static final String MASK = "******";

    /**
     * 重试等待，测试中替换为不真正休眠的实现
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final String webhookUrl;
    private final Map<String, String> headers;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final Sleeper sleeper;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    /**
     * @param bearerToken 从环境变量解析出的凭证，只保存在内存中
     */
    public WebhookNotifier(String name, String webhookUrl, Map<String, String> customHeaders, String bearerToken,
                           boolean sendResolved, Duration timeout, RetryPolicy retryPolicy,
                           Clock clock, Sleeper sleeper) {
        super(NotifierType.WEBHOOK, name, sendResolved);
        this.webhookUrl = webhookUrl;
        this.timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
        this.retryPolicy = retryPolicy == null ? RetryPolicy.defaults() : retryPolicy;
        this.clock = clock;
        this.sleeper = sleeper == null ? d -> Thread.sleep(d.toMillis()) : sleeper;

        // 初始化请求头
        Map<String, String> allHeaders = new LinkedHashMap<>();
        allHeaders.put("Content-Type", "application/json");
        allHeaders.put("User-Agent", "AlertCore/1.0");
        if (customHeaders != null) {
            allHeaders.putAll(customHeaders);
        }
        if (StringUtils.isNotBlank(bearerToken)) {
            allHeaders.put(AUTHORIZATION, "Bearer " + bearerToken);
        }
        this.headers = Collections.unmodifiableMap(allHeaders);

        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(this.timeout)
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        validate();
    }

    @Override
    public DeliveryOutcome deliver(NotificationPayload payload) {
        String content;
        try {
            content = buildContent(payload);
        } catch (JsonProcessingException e) {
            logger.error("[{}] 通知序列化失败: {}", name, payload.getGroupKey(), e);
            return DeliveryOutcome.failed(0, 0, "序列化失败: " + e.getMessage(), clock.instant());
        }
        HttpRequest request = buildHttpRequest(content);

        int attempt = 0;
        while (true) {
            attempt++;
            try {
                HttpResponse<String> response = sendRequest(request);
                handleResponse(response);
                logger.info("[{}] 通知发送成功: groupKey={}, status={}, 尝试次数={}",
                        name, payload.getGroupKey(), payload.getStatus(), attempt);
                return DeliveryOutcome.success(attempt, response.statusCode(), clock.instant());
            } catch (DeliveryException e) {
                if (!e.isTransient() || attempt >= retryPolicy.getMaxAttempts()) {
                    logger.error("[{}] 通知发送失败，放弃: groupKey={}, 尝试次数={}, 错误: {}",
                            name, payload.getGroupKey(), attempt, e.getMessage());
                    return DeliveryOutcome.failed(attempt, e.getStatusCode(), e.getMessage(), clock.instant());
                }
                Duration backoff = retryPolicy.backoff(attempt);
                logger.warn("[{}] 通知发送失败，{}ms后重试: groupKey={}, 尝试次数={}, 错误: {}",
                        name, backoff.toMillis(), payload.getGroupKey(), attempt, e.getMessage());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return DeliveryOutcome.failed(attempt, e.getStatusCode(), "重试被中断", clock.instant());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return DeliveryOutcome.failed(attempt, 0, "发送被中断", clock.instant());
            }
        }
    }

    /**
     * 构建通知内容
     */
    String buildContent(NotificationPayload payload) throws JsonProcessingException {
        return objectMapper.writeValueAsString(payload);
    }

    /**
     * 构建HTTP请求
     */
    private HttpRequest buildHttpRequest(String content) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(webhookUrl))
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(content));
        headers.forEach(builder::header);
        if (logger.isDebugEnabled()) {
            logger.debug("[{}] Webhook请求: url={}, headers={}", name, webhookUrl, maskedHeaders());
        }
        return builder.build();
    }

    /**
     * 发送请求，网络错误和超时视为临时性失败
     */
    private HttpResponse<String> sendRequest(HttpRequest request) throws InterruptedException {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DeliveryException("Webhook请求异常: " + e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * 处理响应，5xx和429可重试，其他非2xx直接失败
     */
    private void handleResponse(HttpResponse<String> response) {
        int statusCode = response.statusCode();
        if (statusCode >= 200 && statusCode < 300) {
            return;
        }
        boolean retryable = statusCode >= 500 || statusCode == 429;
        throw new DeliveryException(String.format("Webhook请求失败: status=%d, body=%s",
                statusCode, StringUtils.abbreviate(response.body(), 200)), retryable, statusCode);
    }

    /**
     * 日志中使用的请求头，凭证被替换
     */
    public Map<String, String> maskedHeaders() {
        Map<String, String> masked = new LinkedHashMap<>(headers);
        masked.computeIfPresent(AUTHORIZATION, (k, v) -> MASK);
        return masked;
    }

    /**
     * 验证配置
     */
    private void validate() {
        if (StringUtils.isBlank(webhookUrl)) {
            throw new IllegalArgumentException("Webhook URL不能为空: " + name);
        }
        try {
            new URI(webhookUrl).toURL();
        } catch (URISyntaxException | MalformedURLException | IllegalArgumentException e) {
            throw new IllegalArgumentException("无效的Webhook URL: " + webhookUrl);
        }
    }
}
