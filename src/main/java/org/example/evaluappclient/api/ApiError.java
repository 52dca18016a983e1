package org.example.evaluappclient.api;

import common.constant.ApiConfig;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import org.example.evaluappclient.utils.JsonUtil;

/**
 * A failure handed back to the caller instead of thrown. Carries enough context
 * (status, URL, truncated body) to be shown to the user as is.
 */
@Getter
@Builder(access = AccessLevel.PRIVATE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ApiError {

    private final ErrorKind kind;
    private final String message;
    private final String url;
    private final Integer statusCode;
    private final String contentType;
    private final String bodySnippet;

    private final Long questionId;
    private final String label;

    public static ApiError validation(String message) {
        return ApiError.builder()
                .kind(ErrorKind.VALIDATION)
                .message(message)
                .build();
    }

    public static ApiError unresolvedOption(Long questionId, String label) {
        return ApiError.builder()
                .kind(ErrorKind.UNRESOLVED_OPTION)
                .message(String.format("No option of question %s matches '%s'", questionId, label))
                .questionId(questionId)
                .label(label)
                .build();
    }

    public static ApiError connection(String message, String url) {
        return ApiError.builder()
                .kind(ErrorKind.CONNECTION)
                .message(message)
                .url(url)
                .build();
    }

    public static ApiError http(int statusCode, String url, String body) {
        return ApiError.builder()
                .kind(ErrorKind.HTTP)
                .message("HTTP " + statusCode)
                .statusCode(statusCode)
                .url(url)
                .bodySnippet(snippet(body))
                .build();
    }

    public static ApiError unexpectedStatus(int expected, int actual, String url, String body) {
        return ApiError.builder()
                .kind(ErrorKind.HTTP)
                .message(String.format("Expected HTTP %d but got %d", expected, actual))
                .statusCode(actual)
                .url(url)
                .bodySnippet(snippet(body))
                .build();
    }

    public static ApiError unexpectedContentType(String contentType, String body, String url) {
        return ApiError.builder()
                .kind(ErrorKind.UNEXPECTED_CONTENT_TYPE)
                .message("Response is not JSON")
                .contentType(contentType)
                .bodySnippet(snippet(body))
                .url(url)
                .build();
    }

    public static ApiError decode(String message, String body, String url) {
        return ApiError.builder()
                .kind(ErrorKind.DECODE)
                .message(message)
                .bodySnippet(snippet(body))
                .url(url)
                .build();
    }

    public boolean is(ErrorKind other) {
        return kind == other;
    }

    public String toDisplayMessage() {
        StringBuilder sb = new StringBuilder("❌ ").append(message);
        if (statusCode != null && kind != ErrorKind.HTTP) {
            sb.append(" (HTTP ").append(statusCode).append(')');
        }
        if (contentType != null) {
            sb.append(" | Content-Type: ").append(contentType.isEmpty() ? "<none>" : contentType);
        }
        if (url != null) {
            sb.append(" | URL: ").append(url);
        }
        if (bodySnippet != null && !bodySnippet.isEmpty()) {
            sb.append(" | Body: ").append(bodySnippet);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return kind + ": " + toDisplayMessage();
    }

    static String snippet(String body) {
        return JsonUtil.safePreview(body, ApiConfig.BODY_SNIPPET_LENGTH);
    }
}
