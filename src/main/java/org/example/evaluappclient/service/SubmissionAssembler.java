package org.example.evaluappclient.service;

import common.enums.QuestionType;
import common.model.exam.Option;
import common.model.exam.Question;
import common.model.exam.StudentAnswer;
import common.model.exam.Submission;
import common.model.exam.TextAnswer;
import org.example.evaluappclient.api.ApiError;
import org.example.evaluappclient.api.ApiResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a session's answers into the payload the results endpoint expects.
 * Single-choice labels are resolved to option ids; open-text answers are copied as is.
 */
public final class SubmissionAssembler {

    private SubmissionAssembler() {
    }

    public static ApiResult<Submission> build(Long examId, Map<Long, StudentAnswer> answers,
                                              Collection<Question> questions) {
        if (examId == null) {
            return ApiResult.failure(ApiError.validation("Exam id is required"));
        }
        if (answers == null) {
            return ApiResult.failure(ApiError.validation("Answers are required"));
        }

        Map<Long, Question> questionsById = new HashMap<>();
        if (questions != null) {
            questions.stream()
                    .filter(Objects::nonNull)
                    .filter(question -> question.getId() != null)
                    .forEach(question -> questionsById.put(question.getId(), question));
        }

        List<Long> selectedOptionIds = new ArrayList<>();
        List<TextAnswer> textAnswers = new ArrayList<>();

        for (StudentAnswer answer : answers.values()) {
            Long questionId = answer.getQuestionId();
            if (answer.getType() == QuestionType.SELECCION_UNICA) {
                Question question = questionsById.get(questionId);
                Option option = question == null ? null : question.findOptionByText(answer.getChosenLabel());
                if (option == null || option.getId() == null) {
                    return ApiResult.failure(ApiError.unresolvedOption(questionId, answer.getChosenLabel()));
                }
                selectedOptionIds.add(option.getId());
            } else if (answer.getType() == QuestionType.TEXTO_ABIERTO) {
                textAnswers.add(new TextAnswer(questionId, answer.getText()));
            } else {
                return ApiResult.failure(ApiError.validation("Answer to question " + questionId + " has no type"));
            }
        }

        return ApiResult.success(Submission.builder()
                .examId(examId)
                .selectedOptionIds(selectedOptionIds)
                .textAnswers(textAnswers)
                .build());
    }
}
