package info.mouts.foodorders.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

public class OrderStatusTest {
    @Test
    void testTerminalStatuses() {
        assertTrue(OrderStatus.DELIVERED.isTerminal());
        assertTrue(OrderStatus.CANCELLED.isTerminal());
        assertTrue(OrderStatus.RETURNED.isTerminal());
        assertFalse(OrderStatus.PENDING.isTerminal());
        assertFalse(OrderStatus.OUT_FOR_DELIVERY.isTerminal());
    }

    @Test
    void testForwardTransitions() {
        assertTrue(OrderStatus.PENDING.canTransitionTo(OrderStatus.CONFIRMED));
        assertTrue(OrderStatus.CONFIRMED.canTransitionTo(OrderStatus.PREPARING));
        assertTrue(OrderStatus.PREPARING.canTransitionTo(OrderStatus.READY_FOR_PICKUP));
        assertTrue(OrderStatus.PREPARING.canTransitionTo(OrderStatus.OUT_FOR_DELIVERY));
        assertTrue(OrderStatus.READY_FOR_PICKUP.canTransitionTo(OrderStatus.OUT_FOR_DELIVERY));
        assertTrue(OrderStatus.READY_FOR_PICKUP.canTransitionTo(OrderStatus.DELIVERED));
        assertTrue(OrderStatus.OUT_FOR_DELIVERY.canTransitionTo(OrderStatus.DELIVERED));
    }

    @Test
    void testSkippingAndGoingBackIsRejected() {
        assertFalse(OrderStatus.PENDING.canTransitionTo(OrderStatus.DELIVERED));
        assertFalse(OrderStatus.PREPARING.canTransitionTo(OrderStatus.CONFIRMED));
        assertFalse(OrderStatus.OUT_FOR_DELIVERY.canTransitionTo(OrderStatus.PENDING));
    }

    @Test
    void testSameStatusAllowedWhileActive() {
        assertTrue(OrderStatus.PREPARING.canTransitionTo(OrderStatus.PREPARING));
    }

    @ParameterizedTest
    @EnumSource(value = OrderStatus.class, names = { "DELIVERED", "CANCELLED", "RETURNED" })
    @DisplayName("Terminal statuses accept no transition, not even to themselves")
    void testTerminalStatusesAreFinal(OrderStatus terminal) {
        for (OrderStatus target : OrderStatus.values()) {
            assertFalse(terminal.canTransitionTo(target), terminal + " -> " + target);
        }
    }

    @ParameterizedTest
    @EnumSource(value = OrderStatus.class, names = { "DELIVERED", "CANCELLED", "RETURNED" }, mode = EnumSource.Mode.EXCLUDE)
    void testActiveStatusesMayBeCancelled(OrderStatus active) {
        assertTrue(active.canTransitionTo(OrderStatus.CANCELLED));
        assertTrue(active.canTransitionTo(OrderStatus.RETURNED));
    }

    @Test
    void testFromValueAcceptsNamesAndAliases() {
        assertEquals(Optional.of(OrderStatus.PREPARING), OrderStatus.fromValue("preparing_order"));
        assertEquals(Optional.of(OrderStatus.OUT_FOR_DELIVERY), OrderStatus.fromValue("ON_WAY"));
        assertEquals(Optional.of(OrderStatus.CONFIRMED), OrderStatus.fromValue(" confirmed "));
        assertEquals(Optional.empty(), OrderStatus.fromValue("SHIPPED"));
        assertEquals(Optional.empty(), OrderStatus.fromValue(" "));
        assertEquals(Optional.empty(), OrderStatus.fromValue(null));
    }
}
