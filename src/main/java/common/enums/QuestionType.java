package common.enums;

import com.google.gson.annotations.SerializedName;

public enum QuestionType {
    @SerializedName("SELECCION_UNICA")
    SELECCION_UNICA,

    @SerializedName("TEXTO_ABIERTO")
    TEXTO_ABIERTO
}
