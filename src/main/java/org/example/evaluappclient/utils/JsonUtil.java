package org.example.evaluappclient.utils;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

public class JsonUtil {

    private static final Gson GSON = new GsonBuilder()
            .registerTypeAdapter(LocalDate.class, new LocalDateAdapter().nullSafe())
            .disableHtmlEscaping()
            .create();

    private JsonUtil() {
    }

    public static Gson gson() {
        return GSON;
    }

    /**
     * Truncates {@code text} for log lines and error messages.
     */
    public static String safePreview(String text, int maxLength) {
        if (text == null) return "";
        if (text.length() <= maxLength) return text;
        return text.substring(0, maxLength) + "... (truncated)";
    }

    /**
     * ISO-8601 dates. Date-times such as {@code 2025-03-01T00:00:00} are cut to their date part.
     */
    static class LocalDateAdapter extends TypeAdapter<LocalDate> {

        @Override
        public void write(JsonWriter out, LocalDate value) throws IOException {
            out.value(value.toString());
        }

        @Override
        public LocalDate read(JsonReader in) throws IOException {
            if (in.peek() != JsonToken.STRING) {
                throw new JsonParseException("Expected an ISO date string but found " + in.peek());
            }
            String raw = in.nextString().trim();
            if (raw.isEmpty()) {
                return null;
            }
            int timeSeparator = raw.indexOf('T');
            if (timeSeparator > 0) {
                raw = raw.substring(0, timeSeparator);
            }
            try {
                return LocalDate.parse(raw);
            } catch (DateTimeParseException e) {
                throw new JsonParseException("Invalid date: " + raw, e);
            }
        }
    }
}
