package common.model.exam;

import common.enums.QuestionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * An answer held by an exam session until submission: the chosen option label for
 * single-choice questions, free text for open ones.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StudentAnswer implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long questionId;
    private QuestionType type;

    private String chosenLabel;    // Single choice
    private String text;           // Open text

    @Builder.Default
    private long answeredAt = System.currentTimeMillis();

    public static StudentAnswer singleChoice(Long questionId, String chosenLabel) {
        return StudentAnswer.builder()
                .questionId(questionId)
                .type(QuestionType.SELECCION_UNICA)
                .chosenLabel(chosenLabel)
                .build();
    }

    public static StudentAnswer openText(Long questionId, String text) {
        return StudentAnswer.builder()
                .questionId(questionId)
                .type(QuestionType.TEXTO_ABIERTO)
                .text(text)
                .build();
    }
}
