package org.example.evaluappclient.service;

import common.constant.ApiRoutes;
import common.enums.QuestionType;
import common.model.exam.Option;
import common.model.exam.Question;
import common.model.exam.QuestionDraft;
import common.model.exam.QuestionRequest;
import lombok.extern.slf4j.Slf4j;
import org.example.evaluappclient.api.ApiClient;
import org.example.evaluappclient.api.ApiError;
import org.example.evaluappclient.api.ApiResult;

import java.util.List;
import java.util.stream.Collectors;

@Slf4j
public class QuestionService {
    public static final int MIN_OPTIONS = 2;
    public static final int MAX_OPTIONS = 6;

    private final ApiClient apiClient;

    public QuestionService(ApiClient apiClient) {
        this.apiClient = apiClient;
    }

    /**
     * New options are always sent as not correct.
     */
    public ApiResult<Question> createQuestion(Long examId, QuestionDraft draft) {
        if (examId == null) {
            return ApiResult.failure(ApiError.validation("Exam id is required"));
        }
        ApiError invalid = validate(draft);
        if (invalid != null) {
            return ApiResult.failure(invalid);
        }

        QuestionRequest request = QuestionRequest.builder()
                .text(draft.getText().trim())
                .type(draft.getType())
                .examId(examId)
                .points(draft.getPoints() > 0 ? draft.getPoints() : Question.DEFAULT_POINTS)
                .options(draft.getType() == QuestionType.SELECCION_UNICA
                        ? toOptions(draft.getOptionTexts())
                        : null)
                .build();

        ApiResult<Question> result = apiClient.post(ApiRoutes.QUESTIONS, request, Question.class);
        if (result.isSuccess()) {
            log.info("✅ Question added to exam {}: {}", examId, request.getText());
        } else {
            log.error("❌ Add question to exam {} failed: {}", examId, result.getError().toDisplayMessage());
        }
        return result;
    }

    static ApiError validate(QuestionDraft draft) {
        if (draft == null) {
            return ApiError.validation("Question is missing");
        }
        if (draft.getText() == null || draft.getText().trim().isEmpty()) {
            return ApiError.validation("Question text is required");
        }
        if (draft.getType() == null) {
            return ApiError.validation("Question type is required");
        }
        if (draft.getType() == QuestionType.SELECCION_UNICA) {
            List<String> texts = draft.getOptionTexts();
            int count = texts == null ? 0 : texts.size();
            if (count < MIN_OPTIONS || count > MAX_OPTIONS) {
                return ApiError.validation(String.format(
                        "Single-choice questions need %d to %d options, got %d", MIN_OPTIONS, MAX_OPTIONS, count));
            }
            if (texts.stream().anyMatch(text -> text == null || text.trim().isEmpty())) {
                return ApiError.validation("Option text is required");
            }
        }
        return null;
    }

    private static List<Option> toOptions(List<String> texts) {
        return texts.stream()
                .map(text -> Option.of(text.trim()))
                .collect(Collectors.toList());
    }
}
