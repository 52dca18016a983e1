package common.constant;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Logical backend resources and the relative paths they live under.
 *
 * <p>The mapping is fixed apart from the results path, which deployments relocate.
 * Asking for a name that is not registered is a programming error.
 */
public final class ApiRoutes {
    public static final String EXAMS = "examenes";
    public static final String QUESTIONS = "preguntas";
    public static final String RESULTS = "results";
    public static final String USERS = "users";

    // Suffix for the questions of one exam: /examenes/{id}/preguntas
    public static final String EXAM_QUESTIONS_SUFFIX = "preguntas";

    private static final Map<String, String> DEFAULT_PATHS;

    static {
        Map<String, String> paths = new LinkedHashMap<>();
        paths.put(EXAMS, "/examenes");
        paths.put(QUESTIONS, "/preguntas");
        paths.put(RESULTS, ApiConfig.DEFAULT_RESULTS_PATH);
        paths.put(USERS, "admin/users");
        DEFAULT_PATHS = Collections.unmodifiableMap(paths);
    }

    private final Map<String, String> paths;

    private ApiRoutes(Map<String, String> paths) {
        this.paths = Collections.unmodifiableMap(paths);
    }

    public static ApiRoutes defaults() {
        return new ApiRoutes(new LinkedHashMap<>(DEFAULT_PATHS));
    }

    public static ApiRoutes withResultsPath(String resultsPath) {
        Map<String, String> paths = new LinkedHashMap<>(DEFAULT_PATHS);
        if (resultsPath != null && !resultsPath.isBlank()) {
            paths.put(RESULTS, resultsPath.trim());
        }
        return new ApiRoutes(paths);
    }

    public String path(String logicalName) {
        String path = paths.get(logicalName);
        if (path == null) {
            throw new IllegalArgumentException("Unknown endpoint: " + logicalName);
        }
        return path;
    }

    public String resolve(String baseUrl, String logicalName) {
        return join(baseUrl, path(logicalName));
    }

    /**
     * Resolves a nested resource, e.g. {@code resolveWithSuffix(base, EXAMS, "7/preguntas")}
     * gives {@code base/examenes/7/preguntas}.
     */
    public String resolveWithSuffix(String baseUrl, String logicalName, String suffix) {
        String url = resolve(baseUrl, logicalName);
        if (suffix == null || suffix.isEmpty()) {
            return url;
        }
        return join(url, suffix);
    }

    public static String join(String base, String path) {
        String left = base == null ? "" : base.trim();
        while (left.endsWith("/")) {
            left = left.substring(0, left.length() - 1);
        }
        String right = path == null ? "" : path.trim();
        while (right.startsWith("/")) {
            right = right.substring(1);
        }
        if (right.isEmpty()) {
            return left;
        }
        return left + "/" + right;
    }
}
