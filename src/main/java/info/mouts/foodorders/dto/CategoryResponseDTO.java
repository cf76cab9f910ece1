package info.mouts.foodorders.dto;

import java.time.Instant;
import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CategoryResponseDTO {
    private UUID id;
    private String name;
    private String description;
    private String imageUrl;
    private int sortOrder;
    private boolean active;
    private Instant createdAt;
}
