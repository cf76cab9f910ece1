package info.mouts.foodorders.dto;

import java.time.Instant;
import java.util.UUID;

import info.mouts.foodorders.domain.NotificationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NotificationResponseDTO {
    private UUID id;
    private String title;
    private String body;
    private NotificationType type;
    private String orderId;
    private String status;
    private Instant createdAt;
    private boolean read;
}
