package info.mouts.foodorders.dto;

import java.math.BigDecimal;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderAnalyticsDTO {
    private long totalOrders;
    private BigDecimal totalRevenue;
    private Map<String, Long> statusCounts;
}
