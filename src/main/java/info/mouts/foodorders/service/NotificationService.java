package info.mouts.foodorders.service;

import java.math.BigDecimal;
import java.util.List;

import info.mouts.foodorders.domain.Notification;

public interface NotificationService {
    /**
     * Records a notification for the user and pushes it to the user's device
     * when one is registered. Delivery failures are logged, never thrown.
     *
     * @param userId  The recipient principal id.
     * @param orderId The order the notification is about.
     * @param status  The status value that triggered it.
     * @param title   The notification title.
     * @param body    The notification body.
     * @return The stored {@link Notification}.
     */
    Notification notifyOrderStatus(String userId, String orderId, String status, String title, String body);

    /**
     * Pushes a new-order alert to every administrator with a registered
     * device. Per-administrator failures are logged and skipped.
     *
     * @param orderId     The new order's identifier.
     * @param totalAmount The new order's total.
     * @return The number of administrators the alert was delivered to.
     */
    int alertAdminsOfNewOrder(String orderId, BigDecimal totalAmount);

    List<Notification> findForUser(String userId);
}
