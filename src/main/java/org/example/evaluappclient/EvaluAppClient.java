package org.example.evaluappclient;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.example.evaluappclient.api.ApiClient;
import org.example.evaluappclient.config.ClientConfig;
import org.example.evaluappclient.service.ExamCreationService;
import org.example.evaluappclient.service.ExamService;
import org.example.evaluappclient.service.QuestionService;
import org.example.evaluappclient.service.SubmissionService;
import org.example.evaluappclient.service.UserService;
import org.example.evaluappclient.session.SessionContext;

/**
 * Wires the API client and the services for one configuration.
 */
@Slf4j
public class EvaluAppClient {
    private static EvaluAppClient instance;

    @Getter
    private final ClientConfig config;

    @Getter
    private final ApiClient apiClient;

    @Getter
    private final ExamService examService;

    @Getter
    private final QuestionService questionService;

    @Getter
    private final ExamCreationService examCreationService;

    @Getter
    private final SubmissionService submissionService;

    @Getter
    private final UserService userService;

    @Getter
    private final SessionContext session = new SessionContext();

    public EvaluAppClient(ClientConfig config) {
        this(config, new ApiClient(config));
    }

    public EvaluAppClient(ClientConfig config, ApiClient apiClient) {
        this.config = config;
        this.apiClient = apiClient;
        this.examService = new ExamService(apiClient);
        this.questionService = new QuestionService(apiClient);
        this.examCreationService = new ExamCreationService(examService, questionService);
        this.submissionService = new SubmissionService(apiClient);
        this.userService = new UserService(apiClient);
    }

    /**
     * Client configured from the environment (API_BASE_URL, TOKEN, ...).
     */
    public static synchronized EvaluAppClient getInstance() {
        if (instance == null) {
            instance = new EvaluAppClient(ClientConfig.fromEnvironment());
        }
        return instance;
    }

    public String getConnectionInfo() {
        String role = session.hasRole() ? session.getRole().name() : "no role";
        return String.format("🔌 Backend %s (%s, %s)",
                config.getBaseUrl(),
                config.hasToken() ? "token set" : "no token",
                role);
    }
}
