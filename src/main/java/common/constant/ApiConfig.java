package common.constant;

// Default values for the backend connection, overridable through the environment
public class ApiConfig {
    public static final String ENV_BASE_URL = "API_BASE_URL";
    public static final String ENV_TOKEN = "TOKEN";
    public static final String ENV_RESULTS_PATH = "RESULTS_PATH";
    public static final String ENV_TIMEOUT_SECONDS = "API_TIMEOUT_SECONDS";
    public static final String ENV_JSON_MAX_DEPTH = "JSON_MAX_DEPTH";

    public static final String DEFAULT_BASE_URL = "http://localhost:5000";
    public static final String DEFAULT_RESULTS_PATH = "resultados";

    public static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 10;
    public static final int DEFAULT_TIMEOUT_SECONDS = 30;

    // Nesting bound for decoded response bodies
    public static final int DEFAULT_JSON_MAX_DEPTH = 100;

    // Response bodies are cut to this many characters in error messages
    public static final int BODY_SNIPPET_LENGTH = 500;

    public static final String USER_AGENT = "EvaluAppClient/1.0";
}
