package info.mouts.foodorders.service;

import info.mouts.foodorders.dto.OrderRequestDTO;
import info.mouts.foodorders.exception.InvalidRequestException;
import info.mouts.foodorders.exception.SequenceAllocationException;

public interface OrderSubmissionService {
    /**
     * Creates an order under the next sequential identifier {@code ORD<n>}.
     * Any client-supplied identifier in the request is ignored.
     *
     * @param ownerId The principal id of the caller.
     * @param request The order payload.
     * @return The identifier and number the order was stored under.
     * @throws InvalidRequestException     if the payload is invalid.
     * @throws SequenceAllocationException if no number could be allocated.
     */
    SubmittedOrder submitOrder(String ownerId, OrderRequestDTO request);
}
