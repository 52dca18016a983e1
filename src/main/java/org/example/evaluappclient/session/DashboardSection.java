package org.example.evaluappclient.session;

import common.enums.UserRole;
import lombok.Getter;

import java.util.List;

public enum DashboardSection {
    HOME("Inicio"),
    EXAMS("Exámenes"),
    TAKE_EXAM("Realizar Examen"),
    RESULTS("Resultados"),
    USERS("Usuarios"),
    STATISTICS("Estadísticas");

    @Getter
    private final String title;

    DashboardSection(String title) {
        this.title = title;
    }

    public static List<DashboardSection> forRole(UserRole role) {
        if (role == null) {
            return List.of();
        }
        switch (role) {
            case ADMIN:
                return List.of(HOME, EXAMS, RESULTS, USERS, STATISTICS);
            case STUDENT:
                return List.of(HOME, TAKE_EXAM, RESULTS);
            case TEACHER:
            default:
                return List.of(HOME, EXAMS, RESULTS);
        }
    }
}
