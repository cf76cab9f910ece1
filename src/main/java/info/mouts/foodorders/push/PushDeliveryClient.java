package info.mouts.foodorders.push;

import info.mouts.foodorders.dto.PushMessageDTO;
import info.mouts.foodorders.exception.PushDeliveryException;

/**
 * Gateway to the push-delivery service.
 */
public interface PushDeliveryClient {
    /**
     * Hands one message to the push-delivery service and waits for it to be
     * accepted.
     *
     * @param message the message, addressed by its device token
     * @throws PushDeliveryException if the service did not accept the message
     */
    void send(PushMessageDTO message);
}
