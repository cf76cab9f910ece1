package info.mouts.foodorders.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AdminLoginResponseDTO {
    private boolean success;
    private String token;
    private String adminId;
    private String email;
    private String name;
}
