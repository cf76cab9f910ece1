package info.mouts.foodorders.dto;

import java.time.Instant;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserProfileResponseDTO {
    private String id;
    private String email;
    private String displayName;
    private List<String> phoneNumbers;
    private Instant createdAt;
}
