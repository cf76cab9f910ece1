package info.mouts.foodorders.event;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import info.mouts.foodorders.domain.Order;
import jakarta.persistence.PostPersist;
import jakarta.persistence.PostRemove;
import jakarta.persistence.PostUpdate;
import lombok.extern.slf4j.Slf4j;

/**
 * JPA entity listener that turns order writes into {@link OrderChangedEvent}s.
 * Hibernate obtains it from the Spring container, so the publisher is
 * injected.
 */
@Component
@Slf4j
public class OrderEntityListener {
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Constructs an instance of {@code OrderEntityListener}.
     *
     * @param eventPublisher publisher the change events are sent through
     */
    public OrderEntityListener(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    @PostPersist
    public void onInsert(Order order) {
        publish(OrderChangeType.ADDED, order);
    }

    @PostUpdate
    public void onUpdate(Order order) {
        publish(OrderChangeType.MODIFIED, order);
    }

    @PostRemove
    public void onDelete(Order order) {
        publish(OrderChangeType.REMOVED, order);
    }

    private void publish(OrderChangeType type, Order order) {
        log.debug("Order {} {}", order.getId(), type);
        eventPublisher.publishEvent(new OrderChangedEvent(this, OrderChange.of(type, order)));
    }
}
