package common.model.exam;

import com.google.gson.annotations.SerializedName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Exam implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;               // Assigned by the backend

    @SerializedName("titulo")
    private String title;

    @SerializedName("descripcion")
    private String description;

    @SerializedName("fechaInicio")
    private LocalDate startDate;

    @SerializedName("fechaFin")
    private LocalDate endDate;

    @SerializedName("creadorId")
    private Long creatorId;

    @SerializedName("creadorNombre")
    private String creatorName;

    @SerializedName("preguntasIds")
    @Builder.Default
    private List<Long> questionIds = new ArrayList<>();

    public boolean hasQuestions() {
        return questionIds != null && !questionIds.isEmpty();
    }
}
