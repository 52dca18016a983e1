package common.model.exam;

import com.google.gson.annotations.SerializedName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Body of the create (POST) and full-replace (PUT) exam calls.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExamRequest {

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

    @SerializedName("preguntasIds")
    @Builder.Default
    private List<Long> questionIds = new ArrayList<>();

    public static ExamRequest from(Exam exam) {
        return ExamRequest.builder()
                .title(exam.getTitle())
                .description(exam.getDescription() == null ? "" : exam.getDescription())
                .startDate(exam.getStartDate())
                .endDate(exam.getEndDate())
                .creatorId(exam.getCreatorId())
                .questionIds(exam.getQuestionIds() == null
                        ? new ArrayList<>()
                        : new ArrayList<>(exam.getQuestionIds()))
                .build();
    }
}
