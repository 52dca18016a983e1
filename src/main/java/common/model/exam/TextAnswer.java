package common.model.exam;

import com.google.gson.annotations.SerializedName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TextAnswer {

    @SerializedName("preguntaId")
    private Long questionId;

    @SerializedName("respuesta")
    private String text;
}
