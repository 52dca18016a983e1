package org.example.evaluappclient.api;

import com.google.gson.JsonElement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JsonDecoder")
class JsonDecoderTest {

    private final JsonDecoder decoder = new JsonDecoder(100);

    @Nested
    @DisplayName("accepted bodies")
    class Accepted {

        @Test
        @DisplayName("empty body decodes to an empty array")
        void emptyBody_isEmptyArray() throws Exception {
            JsonElement element = decoder.decode("");

            assertThat(element.isJsonArray()).isTrue();
            assertThat(element.getAsJsonArray()).isEmpty();
            assertThat(decoder.decode(null).getAsJsonArray()).isEmpty();
        }

        @Test
        @DisplayName("surrounding whitespace is tolerated")
        void surroundingWhitespace() throws Exception {
            JsonElement element = decoder.decode("  [1,2,3]  ");

            assertThat(element.getAsJsonArray()).hasSize(3);
            assertThat(element.getAsJsonArray().get(0).getAsInt()).isEqualTo(1);
            assertThat(element.getAsJsonArray().get(2).getAsInt()).isEqualTo(3);
        }

        @Test
        @DisplayName("control characters around a bracketed body are trimmed on retry")
        void controlCharacters_trimmedOnRetry() throws Exception {
            JsonElement element = decoder.decode("\013\f{\"id\": 4}\0");

            assertThat(element.getAsJsonObject().get("id").getAsLong()).isEqualTo(4L);
        }

        @Test
        @DisplayName("objects keep nested values")
        void nestedObject() throws Exception {
            JsonElement element = decoder.decode("{\"titulo\":\"Algebra\",\"preguntasIds\":[1,2],\"x\":null,\"ok\":true}");

            assertThat(element.getAsJsonObject().get("titulo").getAsString()).isEqualTo("Algebra");
            assertThat(element.getAsJsonObject().getAsJsonArray("preguntasIds")).hasSize(2);
            assertThat(element.getAsJsonObject().get("x").isJsonNull()).isTrue();
            assertThat(element.getAsJsonObject().get("ok").getAsBoolean()).isTrue();
        }
    }

    @Nested
    @DisplayName("rejected bodies")
    class Rejected {

        @ParameterizedTest
        @ValueSource(strings = {"not json", "  [1,2", "{\"a\":1} trailing", "[1,2]]", "   "})
        @DisplayName("malformed bodies fail to decode")
        void malformed(String body) {
            assertThatThrownBy(() -> decoder.decode(body))
                    .isInstanceOf(JsonDecodeException.class);
        }

        @ParameterizedTest
        @ValueSource(strings = {"42", "\"text\"", "true", "null"})
        @DisplayName("top-level value must be an object or an array")
        void primitiveTopLevel(String body) {
            assertThatThrownBy(() -> decoder.decode(body))
                    .isInstanceOf(JsonDecodeException.class);
        }
    }

    @Nested
    @DisplayName("depth bound")
    class DepthBound {

        @Test
        @DisplayName("nesting up to the bound is accepted")
        void atBound() throws Exception {
            JsonDecoder shallow = new JsonDecoder(3);

            assertThat(shallow.decode("[[[1]]]").isJsonArray()).isTrue();
            assertThat(shallow.decode("{\"a\":{\"b\":[1]}}").isJsonObject()).isTrue();
        }

        @Test
        @DisplayName("nesting past the bound is a decode failure")
        void pastBound() {
            JsonDecoder shallow = new JsonDecoder(3);

            assertThatThrownBy(() -> shallow.decode("[[[[1]]]]"))
                    .isInstanceOf(JsonDecodeException.class)
                    .matches(e -> ((JsonDecodeException) e).isDepthExceeded());
        }

        @Test
        @DisplayName("pathologically deep payloads are rejected with the default bound")
        void pathological() {
            String body = "[".repeat(5000) + "]".repeat(5000);

            assertThatThrownBy(() -> decoder.decode(body))
                    .isInstanceOf(JsonDecodeException.class)
                    .hasMessageContaining("100");
        }

        @Test
        @DisplayName("bound must be positive")
        void nonPositiveBound() {
            assertThatThrownBy(() -> new JsonDecoder(0)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
