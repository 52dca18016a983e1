package org.example.evaluappclient;

import common.enums.UserRole;
import common.model.User;
import common.model.exam.Exam;
import lombok.extern.slf4j.Slf4j;
import org.example.evaluappclient.api.ApiResult;
import org.example.evaluappclient.service.ExamStatistics;
import org.example.evaluappclient.session.DashboardSection;

import java.io.PrintStream;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;

/**
 * Console dashboard: {@code ClientMain [admin|teacher|student]}.
 */
@Slf4j
public class ClientMain {

    private final EvaluAppClient client;
    private final PrintStream out;

    public ClientMain(EvaluAppClient client, PrintStream out) {
        this.client = client;
        this.out = out;
    }

    public static void main(String[] args) {
        log.info("========================================");
        log.info("   EVALUAPP CLIENT - STARTING UP");
        log.info("========================================");

        UserRole role = UserRole.fromName(args.length > 0 ? args[0] : null);
        if (role == null) {
            System.err.println("Usage: ClientMain <admin|teacher|student>");
            System.exit(2);
        }

        int status = new ClientMain(EvaluAppClient.getInstance(), System.out).run(role, LocalDate.now());
        System.exit(status);
    }

    /**
     * Prints the role's sections and what it can see. Returns 0, or 1 if a call failed.
     */
    public int run(UserRole role, LocalDate today) {
        client.getSession().selectRole(role);
        out.println(client.getConnectionInfo());

        out.println("Menú:");
        for (DashboardSection section : client.getSession().availableSections()) {
            out.println("  - " + section.getTitle());
        }

        boolean ok = true;
        if (client.getSession().canAccess(DashboardSection.TAKE_EXAM)) {
            ok &= printExams("Exámenes disponibles", client.getExamService().listActiveExams(today));
        }

        // One GET serves both the exam table and the statistics
        ApiResult<List<Exam>> allExams = null;
        if (client.getSession().canAccess(DashboardSection.EXAMS)) {
            allExams = client.getExamService().listExams();
            ok &= printExams("Exámenes registrados", allExams);
        }
        if (client.getSession().canAccess(DashboardSection.USERS)) {
            ok &= printUsers(client.getUserService().listUsers());
        }
        if (client.getSession().canAccess(DashboardSection.STATISTICS)) {
            if (allExams == null) {
                allExams = client.getExamService().listExams();
            }
            ok &= printStatistics(allExams);
        }
        return ok ? 0 : 1;
    }

    private boolean printExams(String heading, ApiResult<List<Exam>> result) {
        out.println(heading + ":");
        if (result.isFailure()) {
            out.println("  " + result.getError().toDisplayMessage());
            return false;
        }
        if (result.getValue().isEmpty()) {
            out.println("  No hay exámenes disponibles.");
        }
        for (Exam exam : result.getValue()) {
            out.printf("  [%s] %s (%s → %s, %d preguntas)%n",
                    exam.getId(), exam.getTitle(), exam.getStartDate(), exam.getEndDate(),
                    exam.getQuestionIds() == null ? 0 : exam.getQuestionIds().size());
        }
        return true;
    }

    private boolean printUsers(ApiResult<List<User>> result) {
        out.println("Usuarios:");
        if (result.isFailure()) {
            out.println("  " + result.getError().toDisplayMessage());
            return false;
        }
        for (User user : result.getValue()) {
            out.printf("  [%s] %s <%s> %s%n", user.getId(), user.getFullName(), user.getEmail(), user.getRole());
        }
        return true;
    }

    private boolean printStatistics(ApiResult<List<Exam>> result) {
        out.println("Exámenes por mes:");
        if (result.isFailure()) {
            out.println("  " + result.getError().toDisplayMessage());
            return false;
        }
        Map<YearMonth, Long> counts = ExamStatistics.countByMonth(result.getValue());
        counts.forEach((month, count) -> out.printf("  %s: %d%n", month, count));
        return true;
    }
}
