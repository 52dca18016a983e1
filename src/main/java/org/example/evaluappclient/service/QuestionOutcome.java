package org.example.evaluappclient.service;

import common.model.exam.Question;
import common.model.exam.QuestionDraft;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.example.evaluappclient.api.ApiError;

/**
 * What happened to one pending question during exam creation.
 */
@Getter
@ToString
@AllArgsConstructor
public class QuestionOutcome {
    private final int index;              // Position in the input, 0-based
    private final QuestionDraft draft;
    private final Question created;       // Null on failure
    private final ApiError error;         // Null on success

    public static QuestionOutcome success(int index, QuestionDraft draft, Question created) {
        return new QuestionOutcome(index, draft, created, null);
    }

    public static QuestionOutcome failure(int index, QuestionDraft draft, ApiError error) {
        return new QuestionOutcome(index, draft, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
