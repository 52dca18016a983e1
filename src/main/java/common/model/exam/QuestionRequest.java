package common.model.exam;

import com.google.gson.annotations.SerializedName;
import common.enums.QuestionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of POST /preguntas. Options are only sent for single-choice questions.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QuestionRequest {

    @SerializedName("textoPregunta")
    private String text;

    @SerializedName("tipoPregunta")
    private QuestionType type;

    @SerializedName("examenId")
    private Long examId;

    @SerializedName("puntos")
    private Integer points;

    @SerializedName("opciones")
    private List<Option> options;
}
