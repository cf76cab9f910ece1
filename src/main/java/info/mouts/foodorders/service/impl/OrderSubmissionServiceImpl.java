package info.mouts.foodorders.service.impl;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import info.mouts.foodorders.domain.Order;
import info.mouts.foodorders.dto.OrderRequestDTO;
import info.mouts.foodorders.exception.SequenceAllocationException;
import info.mouts.foodorders.mapper.OrderMapper;
import info.mouts.foodorders.repository.OrderRepository;
import info.mouts.foodorders.service.NotificationService;
import info.mouts.foodorders.service.OrderRequestValidator;
import info.mouts.foodorders.service.OrderSubmissionService;
import info.mouts.foodorders.service.SequenceAllocator;
import info.mouts.foodorders.service.SubmittedOrder;
import info.mouts.foodorders.util.OrderIdentifiers;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of the {@link OrderSubmissionService} interface.
 * <p>
 * Each attempt allocates the next number and inserts the order in one fresh
 * transaction. An attempt that loses a race with another submission is rolled
 * back as a whole and retried with a linear back-off, so the counter and the
 * orders never diverge.
 * </p>
 */
@Service
@Slf4j
public class OrderSubmissionServiceImpl implements OrderSubmissionService {
    private final SequenceAllocator sequenceAllocator;
    private final OrderRepository orderRepository;
    private final OrderMapper orderMapper;
    private final OrderRequestValidator validator;
    private final NotificationService notificationService;
    private final TransactionTemplate transactionTemplate;
    private final int maxAttempts;
    private final long backoffMillis;

    private Counter ordersSubmittedCounter;
    private Counter allocationRetriesCounter;
    private Timer orderProcessingTimer;

    /**
     * Constructs an instance of {@code OrderSubmissionServiceImpl}.
     *
     * @param sequenceAllocator   The allocator handing out order numbers.
     * @param orderRepository     The repository for order data access.
     * @param orderMapper         The mapper for converting between DTOs and entities.
     * @param validator           The validator for order payloads.
     * @param notificationService The dispatcher alerting administrators.
     * @param transactionManager  The transaction manager each attempt runs under.
     * @param meterRegistry       The registry for collecting metrics.
     * @param maxAttempts         Attempts before giving up on a submission.
     * @param backoffMillis       Pause after the first failed attempt, grown linearly.
     */
    public OrderSubmissionServiceImpl(SequenceAllocator sequenceAllocator, OrderRepository orderRepository,
            OrderMapper orderMapper, OrderRequestValidator validator, NotificationService notificationService,
            PlatformTransactionManager transactionManager, MeterRegistry meterRegistry,
            @Value("${app.orders.allocation.max-attempts:10}") int maxAttempts,
            @Value("${app.orders.allocation.backoff-millis:20}") long backoffMillis) {
        this.sequenceAllocator = sequenceAllocator;
        this.orderRepository = orderRepository;
        this.orderMapper = orderMapper;
        this.validator = validator;
        this.notificationService = notificationService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffMillis = Math.max(0, backoffMillis);

        initializeMetrics(meterRegistry);
    }

    @Override
    public SubmittedOrder submitOrder(String ownerId, OrderRequestDTO request) {
        validator.validate(request);

        SubmittedOrder submitted = orderProcessingTimer.record(() -> allocateAndInsert(ownerId, request));
        ordersSubmittedCounter.increment();
        log.info("Order {} submitted by user {}", submitted.getOrderId(), ownerId);

        try {
            notificationService.alertAdminsOfNewOrder(submitted.getOrderId(), submitted.getTotalAmount());
        } catch (RuntimeException e) {
            log.error("Failed to alert administrators of order {}: {}", submitted.getOrderId(), e.getMessage(), e);
        }

        return submitted;
    }

    private SubmittedOrder allocateAndInsert(String ownerId, OrderRequestDTO request) {
        DataAccessException lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Order saved = transactionTemplate.execute(status -> {
                    long orderNumber = sequenceAllocator.allocateNext();
                    Order order = orderMapper.toNewOrder(request, ownerId);
                    order.setId(OrderIdentifiers.sequential(orderNumber));
                    order.setOrderNumber(orderNumber);
                    return orderRepository.saveAndFlush(order);
                });
                return new SubmittedOrder(saved.getId(), saved.getOrderNumber(), saved.getTotalAmount());
            } catch (ConcurrencyFailureException | DataIntegrityViolationException e) {
                lastFailure = e;
                allocationRetriesCounter.increment();
                log.warn("Order number allocation attempt {}/{} conflicted: {}", attempt, maxAttempts,
                        e.getMessage());
                if (attempt < maxAttempts) {
                    pause(attempt, lastFailure);
                }
            }
        }

        log.error("Giving up order submission for user {} after {} attempts", ownerId, maxAttempts);
        throw new SequenceAllocationException(maxAttempts, lastFailure);
    }

    private void pause(int attempt, DataAccessException lastFailure) {
        if (backoffMillis == 0) {
            return;
        }
        try {
            Thread.sleep(backoffMillis * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SequenceAllocationException(attempt, lastFailure);
        }
    }

    /**
     * Initializes the Micrometer metrics for order submission.
     * Registers counters for submitted orders and allocation retries, and a
     * timer for the allocation duration.
     *
     * @param registry The meter registry to register the metrics with.
     */
    private void initializeMetrics(MeterRegistry registry) {
        this.ordersSubmittedCounter = Counter.builder("orders.submitted")
                .description("Number of orders submitted under a sequential identifier")
                .register(registry);

        this.allocationRetriesCounter = Counter.builder("orders.allocation.retries")
                .description("Number of order number allocation attempts lost to a concurrent submission")
                .register(registry);

        this.orderProcessingTimer = Timer.builder("orders.processing.time")
                .description("Time taken to allocate a number and store a submitted order")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }
}
