package org.example.evaluappclient.service;

import common.model.exam.Exam;
import common.model.exam.Question;
import common.model.exam.QuestionDraft;
import org.example.evaluappclient.api.ApiError;
import org.example.evaluappclient.api.ApiResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ExamCreationService call order")
class ExamCreationServiceOrderTest {

    @Mock
    private ExamService examService;

    @Mock
    private QuestionService questionService;

    private ExamCreationService creationService;

    private final Exam draft = Exam.builder()
            .title("Biologia")
            .description("")
            .startDate(LocalDate.of(2025, 6, 1))
            .endDate(LocalDate.of(2025, 6, 2))
            .creatorId(8L)
            .build();

    private final QuestionDraft first = QuestionDraft.openText("Primera");
    private final QuestionDraft second = QuestionDraft.openText("Segunda");
    private final QuestionDraft third = QuestionDraft.openText("Tercera");

    @BeforeEach
    void setUp() {
        creationService = new ExamCreationService(examService, questionService);
    }

    @Test
    @DisplayName("questions are created in input order with the new exam id, after a failure too")
    void inputOrderAfterFailure() {
        when(examService.createExam("Biologia", "", draft.getStartDate(), draft.getEndDate(), 8L))
                .thenReturn(ApiResult.success(draft.toBuilder().id(77L).build()));
        when(questionService.createQuestion(77L, first))
                .thenReturn(ApiResult.success(Question.builder().id(1L).build()));
        when(questionService.createQuestion(77L, second))
                .thenReturn(ApiResult.failure(ApiError.connection("Connection failed", "http://x/preguntas")));
        when(questionService.createQuestion(77L, third))
                .thenReturn(ApiResult.success(Question.builder().id(3L).build()));

        ExamCreationResult result = creationService.createExamWithQuestions(draft, List.of(first, second, third));

        InOrder order = inOrder(examService, questionService);
        order.verify(examService).createExam(any(), any(), any(), any(), any());
        order.verify(questionService).createQuestion(eq(77L), eq(first));
        order.verify(questionService).createQuestion(eq(77L), eq(second));
        order.verify(questionService).createQuestion(eq(77L), eq(third));

        assertThat(result.getQuestionOutcomes()).extracting(QuestionOutcome::isSuccess)
                .containsExactly(true, false, true);
        assertThat(result.summary()).endsWith("#2 Connection failed");
    }

    @Test
    @DisplayName("a failed exam means no question is attempted")
    void examFailureStopsEverything() {
        when(examService.createExam(any(), any(), any(), any(), any()))
                .thenReturn(ApiResult.failure(ApiError.http(502, "http://x/examenes", "bad gateway")));

        ExamCreationResult result = creationService.createExamWithQuestions(draft, List.of(first, second));

        assertThat(result.isExamCreated()).isFalse();
        verifyNoInteractions(questionService);
    }
}
