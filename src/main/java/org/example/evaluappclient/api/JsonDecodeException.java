package org.example.evaluappclient.api;

public class JsonDecodeException extends Exception {

    private final boolean depthExceeded;

    public JsonDecodeException(String message) {
        this(message, null, false);
    }

    public JsonDecodeException(String message, Throwable cause) {
        this(message, cause, false);
    }

    private JsonDecodeException(String message, Throwable cause, boolean depthExceeded) {
        super(message, cause);
        this.depthExceeded = depthExceeded;
    }

    public static JsonDecodeException depthExceeded(int maxDepth) {
        return new JsonDecodeException("Nesting deeper than " + maxDepth + " levels", null, true);
    }

    public boolean isDepthExceeded() {
        return depthExceeded;
    }
}
