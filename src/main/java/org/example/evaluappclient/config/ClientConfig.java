package org.example.evaluappclient.config;

import common.constant.ApiConfig;
import common.constant.ApiRoutes;
import lombok.Builder;
import lombok.Data;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;

@Slf4j
@Data
@Builder
public class ClientConfig {

    @Builder.Default
    private String baseUrl = ApiConfig.DEFAULT_BASE_URL;

    @ToString.Exclude
    @Builder.Default
    private String token = "";

    @Builder.Default
    private String resultsPath = ApiConfig.DEFAULT_RESULTS_PATH;

    @Builder.Default
    private Duration connectTimeout = Duration.ofSeconds(ApiConfig.DEFAULT_CONNECT_TIMEOUT_SECONDS);

    @Builder.Default
    private Duration requestTimeout = Duration.ofSeconds(ApiConfig.DEFAULT_TIMEOUT_SECONDS);

    @Builder.Default
    private int maxJsonDepth = ApiConfig.DEFAULT_JSON_MAX_DEPTH;

    public static ClientConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    /**
     * Reads the recognised keys from {@code env}; missing or malformed values keep their defaults.
     */
    public static ClientConfig fromMap(Map<String, String> env) {
        ClientConfigBuilder builder = ClientConfig.builder();

        String baseUrl = env.get(ApiConfig.ENV_BASE_URL);
        if (baseUrl != null && !baseUrl.isBlank()) {
            builder.baseUrl(baseUrl.trim());
        }

        String token = env.get(ApiConfig.ENV_TOKEN);
        if (token != null) {
            builder.token(token.trim());
        }

        String resultsPath = env.get(ApiConfig.ENV_RESULTS_PATH);
        if (resultsPath != null && !resultsPath.isBlank()) {
            builder.resultsPath(resultsPath.trim());
        }

        Integer timeout = parsePositiveInt(env, ApiConfig.ENV_TIMEOUT_SECONDS);
        if (timeout != null) {
            builder.requestTimeout(Duration.ofSeconds(timeout));
        }

        Integer depth = parsePositiveInt(env, ApiConfig.ENV_JSON_MAX_DEPTH);
        if (depth != null) {
            builder.maxJsonDepth(depth);
        }

        return builder.build();
    }

    public ApiRoutes routes() {
        return ApiRoutes.withResultsPath(resultsPath);
    }

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }

    private static Integer parsePositiveInt(Map<String, String> env, String key) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value > 0) {
                return value;
            }
            log.warn("⚠️ Ignoring non-positive value for {}: {}", key, value);
        } catch (NumberFormatException e) {
            log.warn("⚠️ Ignoring invalid value for {}: '{}'", key, raw);
        }
        return null;
    }
}
