package org.example.evaluappclient.api;

import com.google.gson.JsonElement;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * A decoded 2xx response. {@code body} is an empty array when the backend sent no content.
 */
@Getter
@ToString
@AllArgsConstructor
public class ApiResponse {
    private final int statusCode;
    private final String url;
    private final JsonElement body;
    private final String rawBody;
}
