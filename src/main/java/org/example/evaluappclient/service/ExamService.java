package org.example.evaluappclient.service;

import common.constant.ApiRoutes;
import common.model.exam.Exam;
import common.model.exam.ExamRequest;
import common.model.exam.Option;
import common.model.exam.Question;
import lombok.extern.slf4j.Slf4j;
import org.example.evaluappclient.api.ApiClient;
import org.example.evaluappclient.api.ApiError;
import org.example.evaluappclient.api.ApiResult;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@Slf4j
public class ExamService {
    private final ApiClient apiClient;

    public ExamService(ApiClient apiClient) {
        this.apiClient = apiClient;
    }

    /**
     * Creates an exam with no questions yet. Title and date range are checked here;
     * a rejected exam never reaches the backend.
     */
    public ApiResult<Exam> createExam(String title, String description,
                                      LocalDate startDate, LocalDate endDate, Long creatorId) {
        ApiError invalid = validate(title, startDate, endDate);
        if (invalid != null) {
            log.warn("⚠️ Exam rejected: {}", invalid.getMessage());
            return ApiResult.failure(invalid);
        }

        ExamRequest request = ExamRequest.builder()
                .title(title.trim())
                .description(description == null ? "" : description)
                .startDate(startDate)
                .endDate(endDate)
                .creatorId(creatorId)
                .questionIds(new ArrayList<>())
                .build();

        ApiResult<Exam> result = apiClient.post(ApiRoutes.EXAMS, request, Exam.class)
                .flatMap(exam -> {
                    if (exam.getId() == null) {
                        return ApiResult.failure(ApiError.decode("Created exam has no id", null,
                                apiClient.getRoutes().resolve(apiClient.getBaseUrl(), ApiRoutes.EXAMS)));
                    }
                    return ApiResult.success(exam);
                });

        if (result.isSuccess()) {
            log.info("✅ Exam created: {} ({})", result.getValue().getId(), result.getValue().getTitle());
        } else {
            log.error("❌ Create exam failed: {}", result.getError().toDisplayMessage());
        }
        return result;
    }

    public ApiResult<List<Exam>> listExams() {
        ApiResult<List<Exam>> result = apiClient.getList(ApiRoutes.EXAMS, null, Exam.class);
        if (result.isFailure()) {
            log.error("❌ List exams failed: {}", result.getError().toDisplayMessage());
        }
        return result;
    }

    /**
     * Exams a student may take on {@code today}.
     */
    public ApiResult<List<Exam>> listActiveExams(LocalDate today) {
        return listExams().map(exams -> exams.stream()
                .filter(exam -> isActive(exam, today))
                .collect(Collectors.toList()));
    }

    /**
     * Full replace (PUT). Fields left out, question ids included, are lost on the backend.
     */
    public ApiResult<Void> updateExam(Long examId, String title, String description,
                                      LocalDate startDate, LocalDate endDate, Long creatorId,
                                      List<Long> questionIds) {
        if (examId == null) {
            return ApiResult.failure(ApiError.validation("Exam id is required"));
        }
        ApiError invalid = validate(title, startDate, endDate);
        if (invalid != null) {
            log.warn("⚠️ Exam update rejected: {}", invalid.getMessage());
            return ApiResult.failure(invalid);
        }

        ExamRequest request = ExamRequest.builder()
                .title(title.trim())
                .description(description == null ? "" : description)
                .startDate(startDate)
                .endDate(endDate)
                .creatorId(creatorId)
                .questionIds(questionIds == null ? new ArrayList<>() : new ArrayList<>(questionIds))
                .build();

        ApiResult<Void> result = apiClient.put(ApiRoutes.EXAMS, String.valueOf(examId), request)
                .map(response -> null);
        if (result.isSuccess()) {
            log.info("✅ Exam updated: {}", examId);
        } else {
            log.error("❌ Update exam {} failed: {}", examId, result.getError().toDisplayMessage());
        }
        return result;
    }

    public ApiResult<Void> updateExam(Exam exam) {
        return updateExam(exam.getId(), exam.getTitle(), exam.getDescription(),
                exam.getStartDate(), exam.getEndDate(), exam.getCreatorId(), exam.getQuestionIds());
    }

    /**
     * Resends the whole exam with {@code questionId} appended.
     */
    public ApiResult<Exam> attachQuestion(Exam exam, Long questionId) {
        if (questionId == null) {
            return ApiResult.failure(ApiError.validation("Question id is required"));
        }
        List<Long> questionIds = exam.getQuestionIds() == null
                ? new ArrayList<>()
                : new ArrayList<>(exam.getQuestionIds());
        if (!questionIds.contains(questionId)) {
            questionIds.add(questionId);
        }
        Exam updated = exam.toBuilder().questionIds(questionIds).build();
        return updateExam(updated).map(ignored -> updated);
    }

    /**
     * Only 204 No Content counts as success.
     */
    public ApiResult<Void> deleteExam(Long examId) {
        if (examId == null) {
            return ApiResult.failure(ApiError.validation("Exam id is required"));
        }
        ApiResult<Void> result = apiClient.delete(ApiRoutes.EXAMS, String.valueOf(examId))
                .flatMap(response -> {
                    if (response.getStatusCode() != 204) {
                        return ApiResult.failure(ApiError.unexpectedStatus(204, response.getStatusCode(),
                                response.getUrl(), response.getRawBody()));
                    }
                    return ApiResult.success(null);
                });
        if (result.isSuccess()) {
            log.info("✅ Exam deleted: {}", examId);
        } else {
            log.error("❌ Delete exam {} failed: {}", examId, result.getError().toDisplayMessage());
        }
        return result;
    }

    /**
     * Lấy danh sách câu hỏi của bài thi.
     */
    public ApiResult<List<Question>> getQuestions(Long examId) {
        if (examId == null) {
            return ApiResult.failure(ApiError.validation("Exam id is required"));
        }
        ApiResult<List<Question>> result = apiClient.getList(ApiRoutes.EXAMS,
                examId + "/" + ApiRoutes.EXAM_QUESTIONS_SUFFIX, Question.class);
        if (result.isFailure()) {
            log.error("❌ Get questions of exam {} failed: {}", examId, result.getError().toDisplayMessage());
        }
        return result;
    }

    /**
     * Same as {@link #getQuestions(Long)} with every option's correctness flag cleared.
     */
    public ApiResult<List<Question>> getQuestionsForStudent(Long examId) {
        return getQuestions(examId).map(questions -> questions.stream()
                .map(ExamService::withoutCorrectness)
                .collect(Collectors.toList()));
    }

    /**
     * An exam is active when {@code today} lies in [start, end], both ends included,
     * and it has at least one question attached.
     */
    public static boolean isActive(Exam exam, LocalDate today) {
        if (exam == null || today == null) {
            return false;
        }
        LocalDate start = exam.getStartDate();
        LocalDate end = exam.getEndDate();
        if (start == null || end == null) {
            return false;
        }
        return !today.isBefore(start) && !today.isAfter(end) && exam.hasQuestions();
    }

    static ApiError validate(String title, LocalDate startDate, LocalDate endDate) {
        if (title == null || title.trim().isEmpty()) {
            return ApiError.validation("Title is required");
        }
        if (startDate == null || endDate == null) {
            return ApiError.validation("Start and end dates are required");
        }
        if (!startDate.isBefore(endDate)) {
            return ApiError.validation("Start date must be before end date");
        }
        return null;
    }

    private static Question withoutCorrectness(Question question) {
        List<Option> options = question.getOptions() == null
                ? new ArrayList<>()
                : question.getOptions().stream()
                        .filter(Objects::nonNull)
                        .map(option -> option.toBuilder().correct(false).build())
                        .collect(Collectors.toList());
        return question.toBuilder().options(options).build();
    }
}
