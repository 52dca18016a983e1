package org.example.evaluappclient.session;

import common.enums.UserRole;
import common.model.exam.Exam;
import common.model.exam.Question;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * State owned by the current interactive session: the selected role and, for students,
 * the exam being answered. Passed explicitly to whatever needs it.
 */
@Slf4j
public class SessionContext {

    @Getter
    private UserRole role;

    private ExamSession examSession;

    /**
     * Changing to a different role discards the exam in progress.
     */
    public void selectRole(UserRole newRole) {
        if (newRole == null) {
            throw new IllegalArgumentException("Role is required");
        }
        if (newRole != role) {
            log.info("👤 Role selected: {}", newRole);
            closeExam();
        }
        role = newRole;
    }

    public void clearRole() {
        role = null;
        closeExam();
    }

    public boolean hasRole() {
        return role != null;
    }

    public List<DashboardSection> availableSections() {
        return DashboardSection.forRole(role);
    }

    public boolean canAccess(DashboardSection section) {
        return availableSections().contains(section);
    }

    /**
     * Opens {@code exam} for answering. Reopening the exam already in progress keeps its
     * answers; any other exam replaces the current session.
     */
    public ExamSession openExam(Exam exam, List<Question> questions) {
        if (!canAccess(DashboardSection.TAKE_EXAM)) {
            throw new IllegalStateException("Role " + role + " cannot take exams");
        }
        if (examSession != null
                && !examSession.isSubmitted()
                && exam.getId() != null
                && exam.getId().equals(examSession.getExamId())) {
            return examSession;
        }
        examSession = new ExamSession(exam, questions);
        log.info("📝 Opened exam {} ({} questions)", exam.getId(), examSession.getQuestions().size());
        return examSession;
    }

    public Optional<ExamSession> getExamSession() {
        return Optional.ofNullable(examSession);
    }

    public void closeExam() {
        examSession = null;
    }
}
