package info.mouts.foodorders.service.impl;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import info.mouts.foodorders.domain.Order;
import info.mouts.foodorders.domain.OrderStatus;
import info.mouts.foodorders.dto.OrderAnalyticsDTO;
import info.mouts.foodorders.dto.OrderPatchRequestDTO;
import info.mouts.foodorders.dto.OrderRequestDTO;
import info.mouts.foodorders.exception.ForbiddenException;
import info.mouts.foodorders.exception.InvalidRequestException;
import info.mouts.foodorders.exception.OrderNotFoundException;
import info.mouts.foodorders.exception.OrderStateConflictException;
import info.mouts.foodorders.exception.ResourceConflictException;
import info.mouts.foodorders.mapper.OrderMapper;
import info.mouts.foodorders.repository.OrderRepository;
import info.mouts.foodorders.service.NotificationService;
import info.mouts.foodorders.service.OrderRequestValidator;
import info.mouts.foodorders.service.OrderService;
import info.mouts.foodorders.service.OrderStatusMessages;
import info.mouts.foodorders.util.OrderIdentifiers;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of the {@link OrderService} interface.
 * Handles validation, ownership checks, lifecycle transitions and persistence
 * of orders. Writes run in their own transaction; the owner is notified of an
 * administrator's status change only once that transaction has committed.
 */
@Service
@Slf4j
public class OrderServiceImpl implements OrderService {
    private static final Pattern RESERVED_ID = Pattern.compile(OrderIdentifiers.SEQUENTIAL_PREFIX + "\\d+");

    private final OrderRepository orderRepository;
    private final OrderMapper orderMapper;
    private final OrderRequestValidator validator;
    private final NotificationService notificationService;
    private final TransactionTemplate transactionTemplate;

    private Counter ordersCreatedCounter;
    private Counter statusChangesCounter;

    /**
     * Constructs an instance of {@code OrderServiceImpl}.
     *
     * @param orderRepository     The repository for order data access.
     * @param orderMapper         The mapper for converting between DTOs and entities.
     * @param validator           The validator for order payloads.
     * @param notificationService The dispatcher notifying owners of status changes.
     * @param transactionManager  The transaction manager writes run under.
     * @param meterRegistry       The registry for collecting metrics.
     */
    public OrderServiceImpl(OrderRepository orderRepository, OrderMapper orderMapper,
            OrderRequestValidator validator, NotificationService notificationService,
            PlatformTransactionManager transactionManager, MeterRegistry meterRegistry) {
        this.orderRepository = orderRepository;
        this.orderMapper = orderMapper;
        this.validator = validator;
        this.notificationService = notificationService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);

        initializeMetrics(meterRegistry);
    }

    @Override
    public Order createOrder(String ownerId, OrderRequestDTO request) {
        validator.validate(request);

        String orderId = request.getOrderId();
        if (orderId != null && RESERVED_ID.matcher(orderId).matches()) {
            throw new InvalidRequestException("orderId",
                    "Order IDs of the form " + OrderIdentifiers.SEQUENTIAL_PREFIX + "<number> are reserved");
        }
        String id = orderId != null ? orderId : OrderIdentifiers.random();

        log.info("Creating order {} for user {}", id, ownerId);
        try {
            Order saved = transactionTemplate.execute(status -> {
                if (orderRepository.existsById(id)) {
                    throw new ResourceConflictException("Order with ID " + id + " already exists");
                }
                Order order = orderMapper.toNewOrder(request, ownerId);
                order.setId(id);
                return orderRepository.saveAndFlush(order);
            });

            ordersCreatedCounter.increment();
            log.info("Order {} created with status {}", saved.getId(), saved.getStatus());
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.warn("Order {} was created concurrently: {}", id, e.getMessage());
            throw new ResourceConflictException("Order with ID " + id + " already exists");
        }
    }

    @Override
    public Order updateOrder(String orderId, String requesterId, OrderPatchRequestDTO patch, boolean admin) {
        validator.validate(patch);
        if (patch.isEmpty()) {
            throw new InvalidRequestException("Order update must change at least one field");
        }

        OrderStatus requestedStatus = patch.hasStatus() ? parseStatus(patch.getStatus()) : null;

        Order updated = transactionTemplate.execute(status -> {
            Order order = loadVisibleOrder(orderId, requesterId, admin);

            if (!admin && requestedStatus != null && requestedStatus != OrderStatus.CANCELLED) {
                log.warn("User {} tried to set order {} to {}", requesterId, orderId, requestedStatus);
                throw new ForbiddenException("Only administrators may set an order to " + requestedStatus);
            }
            if (requestedStatus != null) {
                OrderStatus current = order.getStatus();
                if (!current.canTransitionTo(requestedStatus)) {
                    log.warn("Rejected status change of order {} from {} to {}", orderId, current, requestedStatus);
                    throw new OrderStateConflictException(orderId, current, requestedStatus);
                }
                order.setStatus(requestedStatus);
                log.info("Order {} status {} -> {}", orderId, current, requestedStatus);
            }
            if (patch.getItems() != null) {
                order.replaceItems(orderMapper.toEntityList(patch.getItems()));
            }
            if (patch.getTotalAmount() != null) {
                order.setTotalAmount(patch.getTotalAmount());
            }
            if (patch.getDeliveryLocation() != null) {
                order.setDeliveryLocation(patch.getDeliveryLocation());
            }

            return orderRepository.saveAndFlush(order);
        });

        if (requestedStatus != null) {
            statusChangesCounter.increment();
            if (admin) {
                notifyOwner(updated, requestedStatus);
            }
        }

        return updated;
    }

    @Override
    public void deleteOrder(String orderId, String requesterId, boolean admin) {
        transactionTemplate.executeWithoutResult(status -> {
            Order order = loadVisibleOrder(orderId, requesterId, admin);
            orderRepository.delete(order);
            orderRepository.flush();
        });
        log.info("Order {} deleted by {}", orderId, admin ? "administrator " + requesterId : requesterId);
    }

    @Override
    @Transactional(readOnly = true)
    public Order findOrder(String orderId, String requesterId, boolean admin) {
        return loadVisibleOrder(orderId, requesterId, admin);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Order> listOrders(Optional<String> ownerId) {
        log.debug("Listing orders for {}", ownerId.orElse("all users"));

        return ownerId.map(orderRepository::findByUserIdOrderByCreatedAtDesc)
                .orElseGet(orderRepository::findAllByOrderByCreatedAtDesc);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Order> findRecentOrders(int limit) {
        return orderRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, limit));
    }

    @Override
    @Transactional(readOnly = true)
    public OrderAnalyticsDTO computeAnalytics(Optional<String> ownerId) {
        List<Order> orders = listOrders(ownerId);

        BigDecimal revenue = orders.stream()
                .map(Order::getTotalAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        Map<String, Long> statusCounts = orders.stream()
                .collect(Collectors.groupingBy(order -> order.getStatus().name(), TreeMap::new,
                        Collectors.counting()));

        return OrderAnalyticsDTO.builder()
                .totalOrders(orders.size())
                .totalRevenue(revenue)
                .statusCounts(statusCounts)
                .build();
    }

    /**
     * Loads an order, hiding orders owned by someone else from non-admin
     * callers.
     *
     * @throws OrderNotFoundException if the order is absent or not visible.
     */
    private Order loadVisibleOrder(String orderId, String requesterId, boolean admin) {
        return orderRepository.findById(orderId)
                .filter(order -> admin || order.getUserId().equals(requesterId))
                .orElseThrow(() -> {
                    log.warn("Order not found for ID: {} (requested by {})", orderId, requesterId);
                    return new OrderNotFoundException(orderId);
                });
    }

    private OrderStatus parseStatus(String value) {
        return OrderStatus.fromValue(value)
                .orElseThrow(() -> new InvalidRequestException("status", "Invalid status value: " + value));
    }

    private void notifyOwner(Order order, OrderStatus status) {
        try {
            notificationService.notifyOrderStatus(order.getUserId(), order.getId(), status.name(),
                    OrderStatusMessages.TITLE, OrderStatusMessages.bodyFor(status));
        } catch (RuntimeException e) {
            log.error("Failed to notify user {} about order {} moving to {}: {}", order.getUserId(),
                    order.getId(), status, e.getMessage(), e);
        }
    }

    /**
     * Initializes the Micrometer metrics for the order service.
     *
     * @param registry The meter registry to register the metrics with.
     */
    private void initializeMetrics(MeterRegistry registry) {
        this.ordersCreatedCounter = Counter.builder("orders.created")
                .description("Number of orders created with a client-supplied or random identifier")
                .register(registry);

        this.statusChangesCounter = Counter.builder("orders.status.changes")
                .description("Number of accepted order status changes")
                .register(registry);
    }
}
