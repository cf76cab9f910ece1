package info.mouts.foodorders.dto;

import java.util.List;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserProfileRequestDTO {
    @NotBlank(message = "userId is required")
    private String userId;

    @NotBlank(message = "email is required")
    @Email(message = "email must be a valid address")
    private String email;

    private String displayName;
    private List<String> phoneNumbers;
}
