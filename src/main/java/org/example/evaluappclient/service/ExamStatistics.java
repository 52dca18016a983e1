package org.example.evaluappclient.service;

import common.model.exam.Exam;

import java.time.YearMonth;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

public final class ExamStatistics {

    private ExamStatistics() {
    }

    /**
     * Exams per month of their end date, oldest month first. Exams without an end date are skipped.
     */
    public static Map<YearMonth, Long> countByMonth(Collection<Exam> exams) {
        if (exams == null) {
            return new LinkedHashMap<>();
        }
        TreeMap<YearMonth, Long> counts = exams.stream()
                .filter(Objects::nonNull)
                .filter(exam -> exam.getEndDate() != null)
                .collect(Collectors.groupingBy(exam -> YearMonth.from(exam.getEndDate()),
                        TreeMap::new, Collectors.counting()));
        return new LinkedHashMap<>(counts);
    }
}
