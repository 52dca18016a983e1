package org.example.evaluappclient.api;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import common.constant.ApiConfig;
import common.constant.ApiRoutes;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.example.evaluappclient.config.ClientConfig;
import org.example.evaluappclient.utils.JsonUtil;

import java.io.IOException;
import java.lang.reflect.Type;
import java.net.ConnectException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * HTTP access to the exam backend.
 *
 * <p>Every call resolves its URL through {@link ApiRoutes}, carries the bearer token, and
 * comes back as an {@link ApiResult}: network failures, non-2xx statuses, non-JSON bodies and
 * undecodable JSON are all returned as {@link ApiError}s, never thrown. An unknown endpoint
 * name is the one exception, since it can only be a programming error.
 */
@Slf4j
public class ApiClient {

    public static final String GET = "GET";
    public static final String POST = "POST";
    public static final String PUT = "PUT";
    public static final String DELETE = "DELETE";

    private static final String JSON_MEDIA_TYPE = "application/json";
    private static final int NO_CONTENT = 204;

    private final HttpClient httpClient;
    @Getter
    private final ApiRoutes routes;
    @Getter
    private final String baseUrl;
    private final String token;
    private final Duration requestTimeout;
    private final JsonDecoder decoder;
    private final Gson gson;

    public ApiClient(ClientConfig config) {
        this(config, HttpClient.newBuilder()
                .connectTimeout(config.getConnectTimeout())
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public ApiClient(ClientConfig config, HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.routes = config.routes();
        this.baseUrl = config.getBaseUrl();
        this.token = config.getToken();
        this.requestTimeout = config.getRequestTimeout();
        this.decoder = new JsonDecoder(config.getMaxJsonDepth());
        this.gson = JsonUtil.gson();

        if (!config.hasToken()) {
            log.warn("⚠️ No bearer token configured, requests will be sent unauthenticated");
        }
    }

    /**
     * Sends one request.
     *
     * @param method   HTTP method
     * @param endpoint logical endpoint name from {@link ApiRoutes}
     * @param suffix   nested path under the endpoint (e.g. {@code "7/preguntas"}), or null
     * @param headers  extra headers, sent after the default ones
     * @param body     object serialized as the JSON body, or null
     * @param query    query parameters, or null
     */
    public ApiResult<ApiResponse> request(String method, String endpoint, String suffix,
                                          Map<String, String> headers, Object body,
                                          Map<String, String> query) {
        String url = routes.resolveWithSuffix(baseUrl, endpoint, suffix) + queryString(query);

        HttpRequest httpRequest;
        try {
            httpRequest = buildRequest(method, url, headers, body);
        } catch (IllegalArgumentException e) {
            // Unparseable URL, usually a bad API_BASE_URL
            log.error("❌ Cannot build request {} {}: {}", method, url, e.getMessage());
            return ApiResult.failure(ApiError.connection("Invalid request: " + e.getMessage(), url));
        }

        log.debug("➡️ {} {}", method, url);

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            log.warn("⏱️ Request timed out - {} {}", method, url);
            return ApiResult.failure(ApiError.connection("Request timed out: " + e.getMessage(), url));
        } catch (ConnectException e) {
            log.warn("🔌 Connection failed - {} {}: {}", method, url, e.getMessage());
            return ApiResult.failure(ApiError.connection("Connection failed: " + describe(e), url));
        } catch (IOException e) {
            log.warn("❌ Request failed - {} {}: {}", method, url, e.getMessage());
            return ApiResult.failure(ApiError.connection("Request failed: " + describe(e), url));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ApiResult.failure(ApiError.connection("Request interrupted", url));
        }

        return interpret(response, url);
    }

    ApiResult<ApiResponse> interpret(HttpResponse<String> response, String url) {
        int status = response.statusCode();
        String rawBody = response.body() == null ? "" : response.body();

        log.debug("⬅️ {} {} - bodyPreview={}", status, url, JsonUtil.safePreview(rawBody, 200));

        if (status < 200 || status >= 300) {
            log.warn("❌ HTTP {} from {}: {}", status, url, JsonUtil.safePreview(rawBody, 300));
            return ApiResult.failure(ApiError.http(status, url, rawBody));
        }

        // Status-only success: nothing to type-check or decode
        if (status == NO_CONTENT || rawBody.isEmpty()) {
            return ApiResult.success(new ApiResponse(status, url, decodeQuietly(""), rawBody));
        }

        String contentType = response.headers().firstValue("Content-Type").orElse("");
        if (!contentType.toLowerCase(Locale.ROOT).contains(JSON_MEDIA_TYPE)) {
            log.warn("❌ Non-JSON response from {} (Content-Type: {})", url, contentType);
            return ApiResult.failure(ApiError.unexpectedContentType(contentType, rawBody, url));
        }

        try {
            JsonElement decoded = decoder.decode(rawBody);
            return ApiResult.success(new ApiResponse(status, url, decoded, rawBody));
        } catch (JsonDecodeException e) {
            log.warn("❌ Could not decode response from {}: {}", url, e.getMessage());
            return ApiResult.failure(ApiError.decode(e.getMessage(), rawBody, url));
        }
    }

    /**
     * Maps a decoded body onto {@code type}. A body of the wrong shape is a {@link ErrorKind#DECODE} error.
     */
    public <T> ApiResult<T> as(ApiResponse response, Type type) {
        try {
            T value = gson.fromJson(response.getBody(), type);
            if (value == null) {
                return ApiResult.failure(ApiError.decode("Response body is null", response.getRawBody(), response.getUrl()));
            }
            return ApiResult.success(value);
        } catch (JsonParseException | IllegalStateException | NumberFormatException e) {
            log.warn("❌ Unexpected response shape from {}: {}", response.getUrl(), e.getMessage());
            return ApiResult.failure(ApiError.decode("Unexpected response shape: " + e.getMessage(),
                    response.getRawBody(), response.getUrl()));
        }
    }

    public <T> ApiResult<List<T>> asList(ApiResponse response, Class<T> elementType) {
        Type listType = TypeToken.getParameterized(List.class, elementType).getType();
        ApiResult<List<T>> mapped = as(response, listType);
        return mapped.map(list -> list.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(ArrayList::new)));
    }

    public <T> ApiResult<List<T>> getList(String endpoint, String suffix, Class<T> elementType) {
        return request(GET, endpoint, suffix, null, null, null)
                .flatMap(response -> asList(response, elementType));
    }

    public <T> ApiResult<T> post(String endpoint, Object body, Class<T> responseType) {
        return request(POST, endpoint, null, null, body, null)
                .flatMap(response -> as(response, responseType));
    }

    public ApiResult<ApiResponse> put(String endpoint, String suffix, Object body) {
        return request(PUT, endpoint, suffix, null, body, null);
    }

    public ApiResult<ApiResponse> delete(String endpoint, String suffix) {
        return request(DELETE, endpoint, suffix, null, null, null);
    }

    public Map<String, String> defaultHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", JSON_MEDIA_TYPE);
        headers.put("User-Agent", ApiConfig.USER_AGENT);
        if (token != null && !token.isBlank()) {
            headers.put("Authorization", "Bearer " + token);
        }
        return Collections.unmodifiableMap(headers);
    }

    private HttpRequest buildRequest(String method, String url, Map<String, String> headers, Object body) {
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(gson.toJson(body), StandardCharsets.UTF_8);

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(requestTimeout)
                .method(method, publisher);

        defaultHeaders().forEach(builder::header);
        if (body != null) {
            builder.header("Content-Type", JSON_MEDIA_TYPE + "; charset=UTF-8");
        }
        if (headers != null) {
            headers.forEach(builder::setHeader);
        }
        return builder.build();
    }

    private JsonElement decodeQuietly(String body) {
        try {
            return decoder.decode(body);
        } catch (JsonDecodeException e) {
            throw new IllegalStateException("Empty body must always decode", e);
        }
    }

    private static String queryString(Map<String, String> query) {
        if (query == null || query.isEmpty()) {
            return "";
        }
        return query.entrySet().stream()
                .map(entry -> encode(entry.getKey()) + "=" + encode(entry.getValue() == null ? "" : entry.getValue()))
                .collect(Collectors.joining("&", "?", ""));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String describe(Exception e) {
        if (e.getMessage() != null) {
            return e.getMessage();
        }
        return e.getCause() != null && e.getCause().getMessage() != null
                ? e.getCause().getMessage()
                : e.getClass().getSimpleName();
    }
}
