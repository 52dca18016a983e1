package org.example.evaluappclient.service;

import common.model.exam.Exam;
import lombok.Getter;
import org.example.evaluappclient.api.ApiError;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The exam (or why it could not be created) plus one outcome per pending question,
 * in input order.
 */
@Getter
public class ExamCreationResult {
    private final Exam exam;
    private final ApiError examError;
    private final List<QuestionOutcome> questionOutcomes;

    private ExamCreationResult(Exam exam, ApiError examError, List<QuestionOutcome> questionOutcomes) {
        this.exam = exam;
        this.examError = examError;
        this.questionOutcomes = Collections.unmodifiableList(questionOutcomes);
    }

    public static ExamCreationResult examFailed(ApiError error) {
        return new ExamCreationResult(null, error, List.of());
    }

    public static ExamCreationResult created(Exam exam, List<QuestionOutcome> outcomes) {
        return new ExamCreationResult(exam, null, outcomes);
    }

    public boolean isExamCreated() {
        return exam != null;
    }

    public boolean isComplete() {
        return isExamCreated() && failedCount() == 0;
    }

    public long succeededCount() {
        return questionOutcomes.stream().filter(QuestionOutcome::isSuccess).count();
    }

    public long failedCount() {
        return questionOutcomes.size() - succeededCount();
    }

    public List<QuestionOutcome> getFailures() {
        return questionOutcomes.stream()
                .filter(outcome -> !outcome.isSuccess())
                .collect(Collectors.toList());
    }

    public List<Long> getCreatedQuestionIds() {
        return questionOutcomes.stream()
                .filter(QuestionOutcome::isSuccess)
                .map(outcome -> outcome.getCreated().getId())
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    /**
     * e.g. {@code Exam 12 created, 3/5 questions added, 2 failed: #2 Question text is required; #4 HTTP 500}
     */
    public String summary() {
        if (!isExamCreated()) {
            return "Exam not created: " + examError.getMessage();
        }
        StringBuilder sb = new StringBuilder()
                .append("Exam ").append(exam.getId()).append(" created, ")
                .append(succeededCount()).append('/').append(questionOutcomes.size())
                .append(" questions added");
        if (failedCount() > 0) {
            sb.append(", ").append(failedCount()).append(" failed: ");
            sb.append(getFailures().stream()
                    .map(outcome -> "#" + (outcome.getIndex() + 1) + " " + outcome.getError().getMessage())
                    .collect(Collectors.joining("; ")));
        }
        return sb.toString();
    }
}
