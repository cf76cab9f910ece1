package info.mouts.foodorders.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeviceTokenRequestDTO {
    @NotBlank(message = "Device token is required")
    @Size(max = 512, message = "Device token must be at most 512 characters")
    private String token;
}
