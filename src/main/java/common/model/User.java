package common.model;

import com.google.gson.annotations.SerializedName;
import common.enums.UserRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class User implements Serializable {
    private static final long serialVersionUID = 1L;

    private Long id;

    @SerializedName(value = "nombre", alternate = {"name", "fullName"})
    private String fullName;

    private String email;

    // Kept as text: the backend may know roles this client does not
    @SerializedName(value = "rol", alternate = {"role"})
    private String role;

    public UserRole getUserRole() {
        return UserRole.fromName(role);
    }
}
