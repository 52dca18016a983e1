package org.example.evaluappclient.api;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;

/**
 * Turns a response body into a JSON tree.
 *
 * <p>An empty body is an empty array. Otherwise the body is parsed strictly; if that fails,
 * it is trimmed and, when the result is delimited by {@code []} or {@code {}}, parsed once
 * more. The top-level value must be an object or an array, and containers may not nest
 * deeper than {@code maxDepth}.
 */
@Slf4j
public class JsonDecoder {

    @Getter
    private final int maxDepth;

    public JsonDecoder(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public JsonElement decode(String body) throws JsonDecodeException {
        if (body == null || body.isEmpty()) {
            return new JsonArray();
        }

        try {
            return parseStrict(body);
        } catch (JsonDecodeException e) {
            if (e.isDepthExceeded()) {
                throw e;
            }
            String trimmed = body.trim();
            if (trimmed.length() == body.length() || !isBracketDelimited(trimmed)) {
                throw e;
            }
            log.debug("Strict parse failed ({}), retrying on trimmed body", e.getMessage());
            return parseStrict(trimmed);
        }
    }

    private JsonElement parseStrict(String text) throws JsonDecodeException {
        JsonReader reader = new JsonReader(new StringReader(text));
        reader.setLenient(false);
        try {
            JsonToken first = reader.peek();
            if (first != JsonToken.BEGIN_ARRAY && first != JsonToken.BEGIN_OBJECT) {
                throw new JsonDecodeException("Expected a JSON object or array but found " + first);
            }
            JsonElement element = readElement(reader, 0);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new JsonDecodeException("Unexpected content after the JSON value");
            }
            return element;
        } catch (IOException | IllegalStateException | NumberFormatException e) {
            throw new JsonDecodeException("Malformed JSON: " + e.getMessage(), e);
        }
    }

    // depth = number of containers enclosing the value about to be read
    private JsonElement readElement(JsonReader reader, int depth) throws IOException, JsonDecodeException {
        JsonToken token = reader.peek();
        switch (token) {
            case BEGIN_ARRAY: {
                checkDepth(depth + 1);
                JsonArray array = new JsonArray();
                reader.beginArray();
                while (reader.hasNext()) {
                    array.add(readElement(reader, depth + 1));
                }
                reader.endArray();
                return array;
            }
            case BEGIN_OBJECT: {
                checkDepth(depth + 1);
                JsonObject object = new JsonObject();
                reader.beginObject();
                while (reader.hasNext()) {
                    String name = reader.nextName();
                    object.add(name, readElement(reader, depth + 1));
                }
                reader.endObject();
                return object;
            }
            case STRING:
                return new JsonPrimitive(reader.nextString());
            case NUMBER:
                return new JsonPrimitive(new BigDecimal(reader.nextString()));
            case BOOLEAN:
                return new JsonPrimitive(reader.nextBoolean());
            case NULL:
                reader.nextNull();
                return JsonNull.INSTANCE;
            default:
                throw new JsonDecodeException("Unexpected token " + token);
        }
    }

    private void checkDepth(int depth) throws JsonDecodeException {
        if (depth > maxDepth) {
            throw JsonDecodeException.depthExceeded(maxDepth);
        }
    }

    private static boolean isBracketDelimited(String text) {
        return (text.startsWith("[") && text.endsWith("]"))
                || (text.startsWith("{") && text.endsWith("}"));
    }
}
