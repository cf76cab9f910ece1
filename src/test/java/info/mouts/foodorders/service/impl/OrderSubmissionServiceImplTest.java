package info.mouts.foodorders.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.PlatformTransactionManager;

import info.mouts.foodorders.domain.Order;
import info.mouts.foodorders.domain.OrderCounter;
import info.mouts.foodorders.domain.OrderStatus;
import info.mouts.foodorders.dto.OrderItemRequestDTO;
import info.mouts.foodorders.dto.OrderRequestDTO;
import info.mouts.foodorders.exception.InvalidRequestException;
import info.mouts.foodorders.exception.SequenceAllocationException;
import info.mouts.foodorders.mapper.OrderMapper;
import info.mouts.foodorders.repository.OrderRepository;
import info.mouts.foodorders.service.NotificationService;
import info.mouts.foodorders.service.OrderRequestValidator;
import info.mouts.foodorders.service.SequenceAllocator;
import info.mouts.foodorders.service.SubmittedOrder;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
public class OrderSubmissionServiceImplTest {
    private static final int MAX_ATTEMPTS = 3;

    @Mock
    private SequenceAllocator sequenceAllocator;

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

    private OrderSubmissionServiceImpl submissionService;

    private OrderRequestDTO request;

    @BeforeEach
    public void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        OrderRequestValidator validator = new OrderRequestValidator(
                Validation.buildDefaultValidatorFactory().getValidator());
        submissionService = new OrderSubmissionServiceImpl(sequenceAllocator, orderRepository, orderMapper,
                validator, notificationService, transactionManager, meterRegistry, MAX_ATTEMPTS, 0);

        request = OrderRequestDTO.builder()
                .orderId("ignored-client-id")
                .items(List.of(OrderItemRequestDTO.builder().productId("p-1").name("Pizza")
                        .quantity(BigDecimal.ONE).price(new BigDecimal("19.00")).build()))
                .totalAmount(new BigDecimal("19.00"))
                .deliveryLocation("Main Street 1")
                .build();

        when(orderMapper.toNewOrder(any(OrderRequestDTO.class), anyString())).thenAnswer(invocation -> Order
                .builder().userId(invocation.getArgument(1)).status(OrderStatus.PENDING)
                .totalAmount(new BigDecimal("19.00")).deliveryLocation("Main Street 1").build());
        when(orderRepository.saveAndFlush(any(Order.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    @DisplayName("Should store the order under the allocated sequential ID")
    void shouldSubmitWithSequentialId() {
        when(sequenceAllocator.allocateNext()).thenReturn(42L);

        SubmittedOrder submitted = submissionService.submitOrder("user-1", request);

        assertEquals("ORD42", submitted.getOrderId());
        assertEquals(42L, submitted.getOrderNumber());

        verify(orderRepository).saveAndFlush(orderCaptor.capture());
        assertEquals("ORD42", orderCaptor.getValue().getId());
        assertEquals(42L, orderCaptor.getValue().getOrderNumber());
        assertEquals("user-1", orderCaptor.getValue().getUserId());

        verify(notificationService).alertAdminsOfNewOrder("ORD42", new BigDecimal("19.00"));
        assertEquals(1.0, meterRegistry.counter("orders.submitted").count());
        assertEquals(1L, meterRegistry.timer("orders.processing.time").count());
    }

    @Test
    @DisplayName("Should retry with a fresh number after losing a race")
    void shouldRetryAfterConflict() {
        when(sequenceAllocator.allocateNext()).thenReturn(7L, 8L);
        when(orderRepository.saveAndFlush(any(Order.class)))
                .thenThrow(new ObjectOptimisticLockingFailureException(OrderCounter.class, OrderCounter.ORDERS))
                .thenAnswer(invocation -> invocation.getArgument(0));

        SubmittedOrder submitted = submissionService.submitOrder("user-1", request);

        assertEquals("ORD8", submitted.getOrderId());
        verify(sequenceAllocator, times(2)).allocateNext();
        verify(transactionManager).rollback(any());
        assertEquals(1.0, meterRegistry.counter("orders.allocation.retries").count());
    }

    @Test
    @DisplayName("Should give up after the configured number of attempts")
    void shouldFailWhenAttemptsAreExhausted() {
        when(sequenceAllocator.allocateNext()).thenThrow(new DataIntegrityViolationException("duplicate counter"));

        SequenceAllocationException ex = assertThrows(SequenceAllocationException.class,
                () -> submissionService.submitOrder("user-1", request));

        assertThat(ex.getCause()).isInstanceOf(DataIntegrityViolationException.class);
        verify(sequenceAllocator, times(MAX_ATTEMPTS)).allocateNext();
        verify(notificationService, never()).alertAdminsOfNewOrder(anyString(), any());
        assertEquals(0.0, meterRegistry.counter("orders.submitted").count());
    }

    @Test
    @DisplayName("Should not consume a number for an invalid order")
    void shouldValidateBeforeAllocating() {
        request.setTotalAmount(BigDecimal.ZERO);

        assertThrows(InvalidRequestException.class, () -> submissionService.submitOrder("user-1", request));

        verify(sequenceAllocator, never()).allocateNext();
    }

    @Test
    @DisplayName("Should report success even when administrators cannot be alerted")
    void shouldIgnoreAlertFailure() {
        when(sequenceAllocator.allocateNext()).thenReturn(1L);
        when(notificationService.alertAdminsOfNewOrder(eq("ORD1"), any()))
                .thenThrow(new IllegalStateException("broker down"));

        SubmittedOrder submitted = submissionService.submitOrder("user-1", request);

        assertEquals("ORD1", submitted.getOrderId());
    }
}
