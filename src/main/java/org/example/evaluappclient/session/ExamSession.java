package org.example.evaluappclient.session;

import common.enums.SessionState;
import common.model.exam.Exam;
import common.model.exam.Question;
import common.model.exam.StudentAnswer;
import common.model.exam.Submission;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.example.evaluappclient.api.ApiResult;
import org.example.evaluappclient.service.SubmissionAssembler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One student's attempt at one exam. Holds at most one answer per question; recording
 * again for the same question replaces the earlier answer.
 *
 * <p>EMPTY → IN_PROGRESS on the first answer; IN_PROGRESS → SUBMITTED only once the
 * backend has accepted the submission. Not shared between sessions.
 */
@Slf4j
public class ExamSession {

    @Getter
    private final Exam exam;

    @Getter
    private final List<Question> questions;

    private final Map<Long, StudentAnswer> answers = new LinkedHashMap<>();  // questionId -> answer

    @Getter
    private SessionState state = SessionState.EMPTY;

    public ExamSession(Exam exam, List<Question> questions) {
        this.exam = Objects.requireNonNull(exam, "exam");
        this.questions = questions == null
                ? List.of()
                : Collections.unmodifiableList(questions.stream().filter(Objects::nonNull).collect(Collectors.toList()));
    }

    public Long getExamId() {
        return exam.getId();
    }

    public void recordSingleChoice(Long questionId, String chosenLabel) {
        if (chosenLabel == null) {
            clearAnswer(questionId);
            return;
        }
        record(StudentAnswer.singleChoice(questionId, chosenLabel));
    }

    /**
     * Blank text counts as no answer and removes any earlier one.
     */
    public void recordOpenText(Long questionId, String text) {
        if (text == null || text.isBlank()) {
            clearAnswer(questionId);
            return;
        }
        record(StudentAnswer.openText(questionId, text));
    }

    public void record(StudentAnswer answer) {
        ensureOpen();
        Long questionId = answer.getQuestionId();
        checkQuestion(questionId);
        answers.put(questionId, answer);
        state = SessionState.IN_PROGRESS;
        log.debug("💾 Saved answer for question: {}", questionId);
    }

    public void clearAnswer(Long questionId) {
        ensureOpen();
        checkQuestion(questionId);
        answers.remove(questionId);
    }

    public StudentAnswer getAnswer(Long questionId) {
        return answers.get(questionId);
    }

    public Map<Long, StudentAnswer> getAnswers() {
        return Collections.unmodifiableMap(answers);
    }

    public boolean hasAnswers() {
        return !answers.isEmpty();
    }

    public boolean isSubmitted() {
        return state == SessionState.SUBMITTED;
    }

    public ApiResult<Submission> buildSubmission() {
        return SubmissionAssembler.build(exam.getId(), answers, questions);
    }

    /**
     * Called once the backend has accepted this session's submission.
     */
    public void markSubmitted() {
        ensureOpen();
        state = SessionState.SUBMITTED;
        log.info("✅ Exam {} submitted", exam.getId());
    }

    private void ensureOpen() {
        if (state == SessionState.SUBMITTED) {
            throw new IllegalStateException("Exam " + exam.getId() + " has already been submitted");
        }
    }

    // Only questions of this exam may be answered when the question list is known
    private void checkQuestion(Long questionId) {
        if (questionId == null) {
            throw new IllegalArgumentException("Question id is required");
        }
        if (!questions.isEmpty() && questions.stream().noneMatch(q -> questionId.equals(q.getId()))) {
            throw new IllegalArgumentException("Question " + questionId + " is not part of exam " + exam.getId());
        }
    }
}
