package info.mouts.foodorders.service;

import java.math.BigDecimal;

import lombok.Value;

/**
 * Outcome of a sequential order submission.
 */
@Value
public class SubmittedOrder {
    String orderId;
    long orderNumber;
    BigDecimal totalAmount;
}
