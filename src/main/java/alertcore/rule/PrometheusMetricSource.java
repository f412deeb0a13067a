package alertcore.rule;

import alertcore.label.LabelSet;
import alertcore.utils.HttpUtils;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 基于Prometheus HTTP API的指标源，执行 GET /api/v1/query
 */
public class PrometheusMetricSource implements MetricSource {
    private static final Logger logger = LoggerFactory.getLogger(PrometheusMetricSource.class);

    private final HttpUrl queryUrl;
    private final Map<String, String> headers;
    private final OkHttpClient httpClient;

    public PrometheusMetricSource(String endpoint, Duration timeout, Map<String, String> headers) {
        if (StringUtils.isBlank(endpoint)) {
            throw new IllegalArgumentException("Prometheus地址不能为空");
        }
        HttpUrl base = HttpUrl.parse(endpoint);
        if (base == null) {
            throw new IllegalArgumentException("无效的Prometheus地址: " + endpoint);
        }
        this.queryUrl = base.newBuilder().addPathSegments("api/v1/query").build();
        this.headers = headers == null ? Collections.emptyMap() : new HashMap<>(headers);
        Duration effective = timeout == null ? Duration.ofSeconds(10) : timeout;
        this.httpClient = HttpUtils.newClient(Duration.ofSeconds(5), effective);
    }

    @Override
    public List<MetricSample> evaluate(String expression, Instant instant) {
        String url = queryUrl.newBuilder()
                .addQueryParameter("query", expression)
                .addQueryParameter("time", String.format(Locale.ROOT, "%.3f", instant.toEpochMilli() / 1000.0))
                .build()
                .toString();

        PrometheusQueryResponse response;
        try {
            response = HttpUtils.get(httpClient, url, headers, PrometheusQueryResponse.class);
        } catch (IOException e) {
            throw new EvaluationException("Prometheus查询失败: " + expression, e);
        }

        if (response == null || !"success".equals(response.getStatus())) {
            String error = response == null ? "空响应" : response.getErrorType() + ": " + response.getError();
            throw new EvaluationException("Prometheus返回错误状态: " + error);
        }
        if (response.getData() == null || response.getData().getResult() == null) {
            return Collections.emptyList();
        }

        List<MetricSample> samples = parse(response.getData());
        logger.debug("PromQL执行完成: {}, 返回 {} 条样本", expression, samples.size());
        return samples;
    }

    private List<MetricSample> parse(PrometheusQueryResponse.QueryData data) {
        JSONArray result = data.getResult();
        String resultType = data.getResultType();

        if ("vector".equals(resultType)) {
            List<MetricSample> samples = new ArrayList<>(result.size());
            for (int i = 0; i < result.size(); i++) {
                JSONObject item = result.getJSONObject(i);
                JSONObject metric = item.getJSONObject("metric");
                Map<String, String> labels = new HashMap<>();
                if (metric != null) {
                    for (String key : metric.keySet()) {
                        labels.put(key, metric.getString(key));
                    }
                }
                samples.add(MetricSample.of(LabelSet.of(labels), parseValue(item.getJSONArray("value"))));
            }
            return samples;
        }
        if ("scalar".equals(resultType)) {
            return Collections.singletonList(MetricSample.of(LabelSet.EMPTY, parseValue(result)));
        }
        throw new EvaluationException("不支持的结果类型: " + resultType);
    }

    private double parseValue(JSONArray pair) {
        if (pair == null || pair.size() < 2) {
            throw new EvaluationException("无效的样本值: " + pair);
        }
        String raw = pair.getString(1);
        switch (raw) {
            case "+Inf":
                return Double.POSITIVE_INFINITY;
            case "-Inf":
                return Double.NEGATIVE_INFINITY;
            default:
                try {
                    return Double.parseDouble(raw);
                } catch (NumberFormatException e) {
                    throw new EvaluationException("无效的样本值: " + raw, e);
                }
        }
    }
}
