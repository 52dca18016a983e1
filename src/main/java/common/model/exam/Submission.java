package common.model.exam;

import com.google.gson.annotations.SerializedName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Submission {

    @SerializedName("examenId")
    private Long examId;

    @SerializedName("opcionesSeleccionadas")
    @Builder.Default
    private List<Long> selectedOptionIds = new ArrayList<>();

    @SerializedName("respuestasTexto")
    @Builder.Default
    private List<TextAnswer> textAnswers = new ArrayList<>();
}
