package alertcore.rule;

import com.alibaba.fastjson2.JSONArray;
import lombok.Data;

/*
 *  Prometheus /api/v1/query 返回实体
 * */
@Data
public class PrometheusQueryResponse {
    private String status;
    private String errorType;
    private String error;
    private QueryData data;

    @Data
    public static class QueryData {
        // vector / scalar / matrix / string
        private String resultType;
        // vector: [{metric: {...}, value: [ts, "v"]}]，scalar: [ts, "v"]
        private JSONArray result;
    }
}
