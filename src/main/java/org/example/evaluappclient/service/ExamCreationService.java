package org.example.evaluappclient.service;

import common.model.exam.Exam;
import common.model.exam.Question;
import common.model.exam.QuestionDraft;
import lombok.extern.slf4j.Slf4j;
import org.example.evaluappclient.api.ApiResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Creates an exam and then its questions, one call each.
 *
 * <p>If the exam cannot be created nothing else is sent. Once it exists, every question
 * is attempted regardless of earlier failures; nothing already created is rolled back.
 */
@Slf4j
public class ExamCreationService {
    private final ExamService examService;
    private final QuestionService questionService;

    public ExamCreationService(ExamService examService, QuestionService questionService) {
        this.examService = examService;
        this.questionService = questionService;
    }

    public ExamCreationResult createExamWithQuestions(Exam draft, List<QuestionDraft> questions) {
        ApiResult<Exam> created = examService.createExam(
                draft.getTitle(),
                draft.getDescription(),
                draft.getStartDate(),
                draft.getEndDate(),
                draft.getCreatorId()
        );

        if (created.isFailure()) {
            log.error("❌ Exam not created, skipping {} questions", questions == null ? 0 : questions.size());
            return ExamCreationResult.examFailed(created.getError());
        }

        Exam exam = created.getValue();
        List<QuestionOutcome> outcomes = new ArrayList<>();

        if (questions != null) {
            for (int i = 0; i < questions.size(); i++) {
                QuestionDraft question = questions.get(i);
                ApiResult<Question> result = questionService.createQuestion(exam.getId(), question);
                if (result.isSuccess()) {
                    outcomes.add(QuestionOutcome.success(i, question, result.getValue()));
                } else {
                    log.warn("⚠️ Question #{} of exam {} failed: {}", i + 1, exam.getId(), result.getError().getMessage());
                    outcomes.add(QuestionOutcome.failure(i, question, result.getError()));
                }
            }
        }

        ExamCreationResult result = ExamCreationResult.created(withCreatedQuestions(exam, outcomes), outcomes);
        log.info("✅ {}", result.summary());
        return result;
    }

    // The exam as it stands on the backend once its questions exist
    private static Exam withCreatedQuestions(Exam exam, List<QuestionOutcome> outcomes) {
        List<Long> questionIds = exam.getQuestionIds() == null
                ? new ArrayList<>()
                : new ArrayList<>(exam.getQuestionIds());
        for (QuestionOutcome outcome : outcomes) {
            Long id = outcome.isSuccess() ? outcome.getCreated().getId() : null;
            if (id != null && !questionIds.contains(id)) {
                questionIds.add(id);
            }
        }
        return exam.toBuilder().questionIds(questionIds).build();
    }
}
