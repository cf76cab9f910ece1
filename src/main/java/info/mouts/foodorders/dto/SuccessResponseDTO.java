package info.mouts.foodorders.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SuccessResponseDTO {
    private boolean success;

    public static SuccessResponseDTO ok() {
        return new SuccessResponseDTO(true);
    }
}
