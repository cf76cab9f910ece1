package info.mouts.foodorders.dto;

import java.math.BigDecimal;
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
public class ProductResponseDTO {
    private UUID id;
    private String name;
    private BigDecimal price;
    private String category;
    private String imageUrl;
    private String description;
    private boolean inStock;
    private boolean active;
    private Instant createdAt;
}
