package info.mouts.foodorders.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.transaction.PlatformTransactionManager;

import info.mouts.foodorders.domain.Order;
import info.mouts.foodorders.domain.OrderItem;
import info.mouts.foodorders.domain.OrderStatus;
import info.mouts.foodorders.dto.OrderAnalyticsDTO;
import info.mouts.foodorders.dto.OrderItemRequestDTO;
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
import info.mouts.foodorders.service.OrderStatusMessages;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
public class OrderServiceImplTest {
    @Mock
    private OrderRepository orderRepository;

    @Mock
    private OrderMapper orderMapper;

    @Mock
    private NotificationService notificationService;

    @Mock
    private PlatformTransactionManager transactionManager;

    @Captor
    private ArgumentCaptor<Order> orderCaptor;

    private MeterRegistry meterRegistry;

    private OrderServiceImpl orderService;

    private OrderRequestDTO orderRequestDTO;

    @BeforeEach
    public void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        OrderRequestValidator validator = new OrderRequestValidator(
                Validation.buildDefaultValidatorFactory().getValidator());
        orderService = new OrderServiceImpl(orderRepository, orderMapper, validator, notificationService,
                transactionManager, meterRegistry);

        OrderItemRequestDTO itemDTO = OrderItemRequestDTO.builder().productId("prod-1").name("Burger")
                .quantity(BigDecimal.valueOf(2)).price(new BigDecimal("9.50")).build();
        orderRequestDTO = OrderRequestDTO.builder().items(List.of(itemDTO))
                .totalAmount(new BigDecimal("19.00")).deliveryLocation("Main Street 1").build();

        when(orderMapper.toNewOrder(any(OrderRequestDTO.class), anyString()))
                .thenAnswer(invocation -> newOrder(invocation.getArgument(1)));
        when(orderRepository.saveAndFlush(any(Order.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private static Order newOrder(String ownerId) {
        Order order = Order.builder().userId(ownerId).status(OrderStatus.PENDING)
                .totalAmount(new BigDecimal("19.00")).deliveryLocation("Main Street 1").build();
        order.addItem(OrderItem.builder().productId("prod-1").name("Burger")
                .quantity(BigDecimal.valueOf(2)).price(new BigDecimal("9.50")).build());
        return order;
    }

    private static Order storedOrder(String id, String ownerId, OrderStatus status) {
        Order order = newOrder(ownerId);
        order.setId(id);
        order.setStatus(status);
        order.setNewEntity(false);
        return order;
    }

    @Nested
    @DisplayName("createOrder")
    class CreateOrder {
        @Test
        @DisplayName("Should store a new PENDING order under a random ID")
        void shouldCreateOrderWithRandomId() {
            Order created = orderService.createOrder("user-1", orderRequestDTO);

            verify(orderRepository).saveAndFlush(orderCaptor.capture());
            Order saved = orderCaptor.getValue();
            assertThat(saved.getId()).isNotBlank();
            assertEquals("user-1", saved.getUserId());
            assertEquals(OrderStatus.PENDING, saved.getStatus());
            assertEquals(saved, created);
            assertEquals(1.0, meterRegistry.counter("orders.created").count());
        }

        @Test
        @DisplayName("Should keep a client-supplied ID")
        void shouldUseClientId() {
            orderRequestDTO.setOrderId("client-42");

            Order created = orderService.createOrder("user-1", orderRequestDTO);

            assertEquals("client-42", created.getId());
        }

        @Test
        @DisplayName("Should reject an ID that already exists")
        void shouldRejectDuplicateId() {
            orderRequestDTO.setOrderId("client-42");
            when(orderRepository.existsById("client-42")).thenReturn(true);

            ResourceConflictException ex = assertThrows(ResourceConflictException.class,
                    () -> orderService.createOrder("user-1", orderRequestDTO));

            assertEquals("Order with ID client-42 already exists", ex.getMessage());
            verify(orderRepository, never()).saveAndFlush(any(Order.class));
        }

        @Test
        @DisplayName("Should reserve IDs of the sequential form")
        void shouldRejectSequentialLookingId() {
            orderRequestDTO.setOrderId("ORD7");

            InvalidRequestException ex = assertThrows(InvalidRequestException.class,
                    () -> orderService.createOrder("user-1", orderRequestDTO));

            assertThat(ex.getFieldErrors()).containsOnlyKeys("orderId");
        }

        @Test
        @DisplayName("Should reject invalid payloads before touching storage")
        void shouldValidateFirst() {
            orderRequestDTO.setItems(new ArrayList<>());

            assertThrows(InvalidRequestException.class, () -> orderService.createOrder("user-1", orderRequestDTO));

            verify(orderRepository, never()).existsById(anyString());
        }
    }

    @Nested
    @DisplayName("updateOrder")
    class UpdateOrder {
        @Test
        @DisplayName("Should move the order forward and notify the owner when an admin changes status")
        void shouldAdvanceStatusAndNotify() {
            when(orderRepository.findById("o-1"))
                    .thenReturn(Optional.of(storedOrder("o-1", "user-1", OrderStatus.PENDING)));

            Order updated = orderService.updateOrder("o-1", "admin-1",
                    OrderPatchRequestDTO.builder().status("confirmed").build(), true);

            assertEquals(OrderStatus.CONFIRMED, updated.getStatus());
            verify(notificationService).notifyOrderStatus("user-1", "o-1", "CONFIRMED",
                    OrderStatusMessages.TITLE, OrderStatusMessages.bodyFor(OrderStatus.CONFIRMED));
            assertEquals(1.0, meterRegistry.counter("orders.status.changes").count());
        }

        @Test
        @DisplayName("Should keep the update when the notification fails")
        void shouldSurviveNotificationFailure() {
            when(orderRepository.findById("o-1"))
                    .thenReturn(Optional.of(storedOrder("o-1", "user-1", OrderStatus.CONFIRMED)));
            when(notificationService.notifyOrderStatus(anyString(), anyString(), anyString(), anyString(),
                    anyString())).thenThrow(new IllegalStateException("push down"));

            Order updated = orderService.updateOrder("o-1", "admin-1",
                    OrderPatchRequestDTO.builder().status("PREPARING").build(), true);

            assertEquals(OrderStatus.PREPARING, updated.getStatus());
        }

        @Test
        @DisplayName("Should refuse any change on a terminal order")
        void shouldRejectTransitionFromTerminal() {
            when(orderRepository.findById("o-1"))
                    .thenReturn(Optional.of(storedOrder("o-1", "user-1", OrderStatus.DELIVERED)));

            assertThrows(OrderStateConflictException.class, () -> orderService.updateOrder("o-1", "admin-1",
                    OrderPatchRequestDTO.builder().status("CANCELLED").build(), true));

            verify(orderRepository, never()).saveAndFlush(any(Order.class));
            verify(notificationService, never()).notifyOrderStatus(anyString(), anyString(), anyString(),
                    anyString(), anyString());
        }

        @Test
        @DisplayName("Should reject an unknown status value")
        void shouldRejectUnknownStatus() {
            InvalidRequestException ex = assertThrows(InvalidRequestException.class,
                    () -> orderService.updateOrder("o-1", "admin-1",
                            OrderPatchRequestDTO.builder().status("SHIPPED").build(), true));

            assertEquals("Invalid status value: SHIPPED", ex.getMessage());
        }

        @Test
        @DisplayName("Should let the owner cancel but not advance the order")
        void shouldRestrictUsersToCancellation() {
            when(orderRepository.findById("o-1"))
                    .thenReturn(Optional.of(storedOrder("o-1", "user-1", OrderStatus.PENDING)));

            assertThrows(ForbiddenException.class, () -> orderService.updateOrder("o-1", "user-1",
                    OrderPatchRequestDTO.builder().status("DELIVERED").build(), false));

            Order cancelled = orderService.updateOrder("o-1", "user-1",
                    OrderPatchRequestDTO.builder().status("CANCELLED").build(), false);

            assertEquals(OrderStatus.CANCELLED, cancelled.getStatus());
            verify(notificationService, never()).notifyOrderStatus(anyString(), anyString(), anyString(),
                    anyString(), anyString());
        }

        @Test
        @DisplayName("Should answer 404 before checking status rights on another user's order")
        void shouldHideForeignOrderFromStatusChange() {
            when(orderRepository.findById("o-1"))
                    .thenReturn(Optional.of(storedOrder("o-1", "user-1", OrderStatus.PENDING)));

            assertThrows(OrderNotFoundException.class, () -> orderService.updateOrder("o-1", "user-2",
                    OrderPatchRequestDTO.builder().status("CONFIRMED").build(), false));

            verify(orderRepository, never()).saveAndFlush(any(Order.class));
        }

        @Test
        @DisplayName("Should answer 404 before checking status rights on a missing order")
        void shouldReportMissingOrderOnStatusChange() {
            when(orderRepository.findById("does-not-exist")).thenReturn(Optional.empty());

            assertThrows(OrderNotFoundException.class, () -> orderService.updateOrder("does-not-exist", "user-1",
                    OrderPatchRequestDTO.builder().status("CONFIRMED").build(), false));
        }

        @Test
        @DisplayName("Should hide orders owned by another user")
        void shouldHideForeignOrders() {
            when(orderRepository.findById("o-1"))
                    .thenReturn(Optional.of(storedOrder("o-1", "user-1", OrderStatus.PENDING)));

            assertThrows(OrderNotFoundException.class, () -> orderService.updateOrder("o-1", "user-2",
                    OrderPatchRequestDTO.builder().deliveryLocation("Elsewhere").build(), false));
        }

        @Test
        @DisplayName("Should reject an update that changes nothing")
        void shouldRejectEmptyPatch() {
            assertThrows(InvalidRequestException.class,
                    () -> orderService.updateOrder("o-1", "user-1", new OrderPatchRequestDTO(), false));
        }

        @Test
        @DisplayName("Should merge only the fields present in the patch")
        void shouldMergePresentFields() {
            Order stored = storedOrder("o-1", "user-1", OrderStatus.PENDING);
            when(orderRepository.findById("o-1")).thenReturn(Optional.of(stored));

            Order updated = orderService.updateOrder("o-1", "user-1",
                    OrderPatchRequestDTO.builder().deliveryLocation("Second Street 2").build(), false);

            assertEquals("Second Street 2", updated.getDeliveryLocation());
            assertEquals(new BigDecimal("19.00"), updated.getTotalAmount());
            assertEquals(OrderStatus.PENDING, updated.getStatus());
        }
    }

    @Nested
    @DisplayName("deleteOrder and queries")
    class DeleteAndQuery {
        @Test
        void shouldDeleteOwnOrder() {
            Order stored = storedOrder("o-1", "user-1", OrderStatus.PENDING);
            when(orderRepository.findById("o-1")).thenReturn(Optional.of(stored));

            orderService.deleteOrder("o-1", "user-1", false);

            verify(orderRepository).delete(stored);
        }

        @Test
        void shouldNotDeleteMissingOrder() {
            when(orderRepository.findById("missing")).thenReturn(Optional.empty());

            OrderNotFoundException ex = assertThrows(OrderNotFoundException.class,
                    () -> orderService.deleteOrder("missing", "admin-1", true));

            assertEquals("Order not found for ID: missing", ex.getMessage());
        }

        @Test
        void shouldListOnlyOwnerOrders() {
            orderService.listOrders(Optional.of("user-1"));

            verify(orderRepository).findByUserIdOrderByCreatedAtDesc(eq("user-1"));
            verify(orderRepository, never()).findAllByOrderByCreatedAtDesc();
        }

        @Test
        void shouldComputeAnalytics() {
            Order first = storedOrder("o-1", "user-1", OrderStatus.PENDING);
            Order second = storedOrder("o-2", "user-1", OrderStatus.DELIVERED);
            second.setTotalAmount(new BigDecimal("5.50"));
            when(orderRepository.findAllByOrderByCreatedAtDesc()).thenReturn(List.of(first, second));

            OrderAnalyticsDTO analytics = orderService.computeAnalytics(Optional.empty());

            assertEquals(2L, analytics.getTotalOrders());
            assertEquals(new BigDecimal("24.50"), analytics.getTotalRevenue());
            assertThat(analytics.getStatusCounts()).containsEntry("PENDING", 1L).containsEntry("DELIVERED", 1L);
        }
    }
}
