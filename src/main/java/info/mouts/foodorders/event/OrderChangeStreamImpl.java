package info.mouts.foodorders.event;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import info.mouts.foodorders.domain.Order;
import info.mouts.foodorders.repository.OrderRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link OrderChangeStream} fed by {@link OrderChangedEvent}s after the
 * originating transaction commits, so rolled-back writes are never observed.
 * Replays and dispatches are serialized on a single monitor so a new
 * subscriber sees its snapshot before any live change.
 */
@Component
@Slf4j
public class OrderChangeStreamImpl implements OrderChangeStream {
    private final OrderRepository orderRepository;
    private final List<WindowedSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private final Object monitor = new Object();

    /**
     * Constructs an instance of {@code OrderChangeStreamImpl}.
     *
     * @param orderRepository repository used to read the subscription windows
     * @param meterRegistry   registry exposing the number of open subscriptions
     */
    public OrderChangeStreamImpl(OrderRepository orderRepository, MeterRegistry meterRegistry) {
        this.orderRepository = orderRepository;

        Gauge.builder("orders.feed.sessions", subscriptions, List::size)
                .description("Number of open order change subscriptions")
                .register(meterRegistry);
    }

    @Override
    public OrderChangeSubscription subscribe(int windowSize, OrderChangeListener listener) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("Window size must be positive, got " + windowSize);
        }

        WindowedSubscription subscription = new WindowedSubscription(windowSize, listener);
        synchronized (monitor) {
            List<Order> window = orderRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, windowSize));
            for (Order order : window) {
                subscription.deliver(OrderChange.of(OrderChangeType.ADDED, order));
            }
            subscriptions.add(subscription);
        }

        log.info("Opened order change subscription (window {}), {} active", windowSize, subscriptions.size());
        return subscription;
    }

    @Override
    public int activeSubscriptions() {
        return subscriptions.size();
    }

    /**
     * Dispatches a committed order change to every subscription whose window
     * contains the order.
     *
     * @param event the change published by {@link OrderEntityListener}
     */
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onOrderChanged(OrderChangedEvent event) {
        OrderChange change = event.getChange();
        synchronized (monitor) {
            if (subscriptions.isEmpty()) {
                return;
            }
            Map<Integer, Boolean> insideWindow = new HashMap<>();
            for (WindowedSubscription subscription : subscriptions) {
                if (change.isRemoval()
                        || insideWindow.computeIfAbsent(subscription.windowSize, size -> isInsideWindow(change, size))) {
                    subscription.deliver(change);
                }
            }
        }
    }

    private boolean isInsideWindow(OrderChange change, int windowSize) {
        if (change.getCreatedAt() == null) {
            return true;
        }
        List<Instant> recent = orderRepository.findRecentCreationTimes(PageRequest.of(0, windowSize));
        if (recent.size() < windowSize) {
            return true;
        }
        Instant oldestInWindow = recent.get(recent.size() - 1);
        return !change.getCreatedAt().isBefore(oldestInWindow);
    }

    private final class WindowedSubscription implements OrderChangeSubscription {
        private final int windowSize;
        private final OrderChangeListener listener;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private WindowedSubscription(int windowSize, OrderChangeListener listener) {
            this.windowSize = windowSize;
            this.listener = listener;
        }

        private void deliver(OrderChange change) {
            if (!active.get()) {
                return;
            }
            try {
                listener.onChange(change);
            } catch (RuntimeException e) {
                log.error("Order change listener failed for order {}: {}", change.getOrderId(), e.getMessage(), e);
            }
        }

        @Override
        public boolean cancel() {
            if (!active.compareAndSet(true, false)) {
                return false;
            }
            subscriptions.remove(this);
            log.info("Cancelled order change subscription, {} active", subscriptions.size());
            return true;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}
