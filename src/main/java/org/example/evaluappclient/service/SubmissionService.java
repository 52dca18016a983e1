package org.example.evaluappclient.service;

import common.constant.ApiRoutes;
import common.model.exam.Submission;
import lombok.extern.slf4j.Slf4j;
import org.example.evaluappclient.api.ApiClient;
import org.example.evaluappclient.api.ApiError;
import org.example.evaluappclient.api.ApiResult;
import org.example.evaluappclient.session.ExamSession;

@Slf4j
public class SubmissionService {
    private static final int CREATED = 201;

    private final ApiClient apiClient;

    public SubmissionService(ApiClient apiClient) {
        this.apiClient = apiClient;
    }

    /**
     * The session is marked submitted only on HTTP 201, with or without a body; any other
     * outcome leaves its answers in place for another try.
     */
    public ApiResult<Submission> submit(ExamSession session) {
        if (session.isSubmitted()) {
            return ApiResult.failure(ApiError.validation("Exam " + session.getExamId() + " was already submitted"));
        }
        if (!session.hasAnswers()) {
            return ApiResult.failure(ApiError.validation("No answers recorded"));
        }

        ApiResult<Submission> built = session.buildSubmission();
        if (built.isFailure()) {
            log.warn("⚠️ Submission for exam {} not built: {}", session.getExamId(), built.getError().getMessage());
            return built;
        }
        Submission submission = built.getValue();

        ApiResult<Submission> result = apiClient
                .request(ApiClient.POST, ApiRoutes.RESULTS, null, null, submission, null)
                .flatMap(response -> {
                    if (response.getStatusCode() != CREATED) {
                        return ApiResult.failure(ApiError.unexpectedStatus(CREATED, response.getStatusCode(),
                                response.getUrl(), response.getRawBody()));
                    }
                    return ApiResult.success(submission);
                });

        if (result.isSuccess()) {
            session.markSubmitted();
            log.info("✅ Submitted exam {}: {} options, {} text answers", session.getExamId(),
                    submission.getSelectedOptionIds().size(), submission.getTextAnswers().size());
        } else {
            log.error("❌ Submit exam {} failed: {}", session.getExamId(), result.getError().toDisplayMessage());
        }
        return result;
    }
}
