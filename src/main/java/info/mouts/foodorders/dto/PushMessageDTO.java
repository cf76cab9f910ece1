package info.mouts.foodorders.dto;

import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Message handed to the push-delivery gateway for a single device.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PushMessageDTO {
    public static final String PRIORITY_HIGH = "high";

    private String token;
    private String title;
    private String body;

    @Builder.Default
    private String priority = PRIORITY_HIGH;

    private Map<String, String> data;
}
