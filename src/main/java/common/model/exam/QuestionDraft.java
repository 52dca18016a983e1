package common.model.exam;

import common.enums.QuestionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A question typed in while an exam is being created; it has no exam yet.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QuestionDraft {

    private String text;
    private QuestionType type;

    @Builder.Default
    private int points = Question.DEFAULT_POINTS;

    @Builder.Default
    private List<String> optionTexts = new ArrayList<>();

    public static QuestionDraft openText(String text) {
        return QuestionDraft.builder()
                .text(text)
                .type(QuestionType.TEXTO_ABIERTO)
                .build();
    }

    public static QuestionDraft singleChoice(String text, List<String> optionTexts) {
        return QuestionDraft.builder()
                .text(text)
                .type(QuestionType.SELECCION_UNICA)
                .optionTexts(new ArrayList<>(optionTexts))
                .build();
    }
}
