package info.mouts.foodorders.service;

import java.util.List;
import java.util.Optional;

import info.mouts.foodorders.domain.Order;
import info.mouts.foodorders.dto.OrderAnalyticsDTO;
import info.mouts.foodorders.dto.OrderPatchRequestDTO;
import info.mouts.foodorders.dto.OrderRequestDTO;
import info.mouts.foodorders.exception.OrderNotFoundException;

public interface OrderService {
    /**
     * Creates an order in {@code PENDING} status. The identifier is the
     * client-supplied {@code orderId} when present, otherwise a random UUID.
     *
     * @param ownerId The principal id of the caller.
     * @param request The order payload.
     * @return The saved {@link Order}.
     * @throws info.mouts.foodorders.exception.InvalidRequestException   if the payload is invalid.
     * @throws info.mouts.foodorders.exception.ResourceConflictException if the identifier is taken.
     */
    Order createOrder(String ownerId, OrderRequestDTO request);

    /**
     * Applies a partial update. Status changes are checked against the order
     * lifecycle; when an administrator names a status, the owner is notified
     * after the update is stored.
     *
     * @param orderId     The order to update.
     * @param requesterId The principal id of the caller.
     * @param patch       The fields to change.
     * @param admin       Whether the caller is an administrator.
     * @return The updated {@link Order}.
     * @throws OrderNotFoundException if the order does not exist or is not visible to the caller.
     */
    Order updateOrder(String orderId, String requesterId, OrderPatchRequestDTO patch, boolean admin);

    void deleteOrder(String orderId, String requesterId, boolean admin);

    /**
     * Finds an order visible to the caller.
     *
     * @param orderId     The order identifier.
     * @param requesterId The principal id of the caller.
     * @param admin       Whether the caller is an administrator.
     * @return The found {@link Order}.
     * @throws OrderNotFoundException if no such order is visible to the caller.
     */
    Order findOrder(String orderId, String requesterId, boolean admin);

    /**
     * Lists orders newest first.
     *
     * @param ownerId Restricts the list to one owner when present.
     * @return The matching orders.
     */
    List<Order> listOrders(Optional<String> ownerId);

    List<Order> findRecentOrders(int limit);

    OrderAnalyticsDTO computeAnalytics(Optional<String> ownerId);
}
