package info.mouts.foodorders.event;

import org.springframework.context.ApplicationEvent;

import lombok.Getter;

/**
 * Internal event published for every insert, update or delete of an order.
 */
@Getter
public class OrderChangedEvent extends ApplicationEvent {
    private final OrderChange change;

    public OrderChangedEvent(Object source, OrderChange change) {
        super(source);
        this.change = change;
    }
}
