package common.model.exam;

import com.google.gson.annotations.SerializedName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Option implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;

    @SerializedName(value = "texto", alternate = {"textoPregunta", "textoOpcion"})
    private String text;

    @SerializedName("esCorrecta")
    @Builder.Default
    private boolean correct = false;

    public static Option of(String text) {
        return Option.builder().text(text).correct(false).build();
    }
}
