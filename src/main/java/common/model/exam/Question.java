package common.model.exam;

import com.google.gson.annotations.SerializedName;
import common.enums.QuestionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Question implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_POINTS = 1;

    private Long id;

    @SerializedName("examenId")
    private Long examId;

    @SerializedName("textoPregunta")
    private String text;

    @SerializedName(value = "tipoPregunta", alternate = {"tipo"})
    private QuestionType type;

    @SerializedName("puntos")
    @Builder.Default
    private Integer points = DEFAULT_POINTS;

    @SerializedName("opciones")
    @Builder.Default
    private List<Option> options = new ArrayList<>();

    public boolean isSingleChoice() {
        return type == QuestionType.SELECCION_UNICA;
    }

    /**
     * Exact-text lookup of an option, as shown to the student.
     */
    public Option findOptionByText(String text) {
        if (options == null || text == null) {
            return null;
        }
        return options.stream()
                .filter(Objects::nonNull)
                .filter(option -> text.equals(option.getText()))
                .findFirst()
                .orElse(null);
    }
}
