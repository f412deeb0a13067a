package alertcore.utils;

import com.alibaba.fastjson2.JSON;
import okhttp3.Headers;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.collections4.MapUtils;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

public class HttpUtils {

    private HttpUtils() {
    }

    public static OkHttpClient newClient(Duration connectTimeout, Duration readTimeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .writeTimeout(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(readTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .callTimeout(readTimeout.plus(connectTimeout).toMillis(), TimeUnit.MILLISECONDS)
                .build();
    }

    public static <T> T get(OkHttpClient httpClient, String url, Map<String, String> headers, Class<T> clazz) throws IOException {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .get();
        if (MapUtils.isNotEmpty(headers)) {
            builder.headers(Headers.of(headers));
        }
        return getResult(httpClient, clazz, builder.build());
    }

    private static <T> T getResult(OkHttpClient httpClient, Class<T> clazz, Request request) throws IOException {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String result = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                throw new IOException("Unexpected code " + response.code() + ": " + result);
            }
            return JSON.parseObject(result, clazz);
        }
    }
}
