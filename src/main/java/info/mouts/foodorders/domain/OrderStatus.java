package info.mouts.foodorders.domain;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Represents the current status of an order in the system.
 * This enum tracks the lifecycle of an order from placement to delivery,
 * cancellation or return.
 */
public enum OrderStatus {
    /**
     * Initial state when a client places an order.
     * The order is waiting to be confirmed by the restaurant.
     */
    PENDING,

    /**
     * The restaurant accepted the order.
     */
    CONFIRMED,

    /**
     * The kitchen is preparing the order.
     */
    PREPARING("PREPARING_ORDER"),

    /**
     * The order is packed and waiting for the client to collect it.
     */
    READY_FOR_PICKUP,

    /**
     * A courier is carrying the order to the delivery location.
     */
    OUT_FOR_DELIVERY("ON_WAY"),

    /**
     * The order reached the client. Terminal.
     */
    DELIVERED,

    /**
     * The order was cancelled before delivery. Terminal.
     */
    CANCELLED,

    /**
     * The order was sent back after dispatch. Terminal.
     */
    RETURNED;

    private final Set<String> aliases;

    OrderStatus(String... aliases) {
        this.aliases = Set.of(aliases);
    }

    public Set<String> getAliases() {
        return aliases;
    }

    public boolean isTerminal() {
        return this == DELIVERED || this == CANCELLED || this == RETURNED;
    }

    /**
     * Returns the statuses an order may move to from this one.
     * Terminal statuses have no successors; every non-terminal status may
     * move to {@link #CANCELLED} or {@link #RETURNED}.
     *
     * @return an unmodifiable set of reachable statuses
     */
    public Set<OrderStatus> successors() {
        EnumSet<OrderStatus> next = switch (this) {
            case PENDING -> EnumSet.of(CONFIRMED);
            case CONFIRMED -> EnumSet.of(PREPARING);
            case PREPARING -> EnumSet.of(READY_FOR_PICKUP, OUT_FOR_DELIVERY);
            case READY_FOR_PICKUP -> EnumSet.of(OUT_FOR_DELIVERY, DELIVERED);
            case OUT_FOR_DELIVERY -> EnumSet.of(DELIVERED);
            case DELIVERED, CANCELLED, RETURNED -> EnumSet.noneOf(OrderStatus.class);
        };

        if (!isTerminal()) {
            next.add(CANCELLED);
            next.add(RETURNED);
        }

        return Collections.unmodifiableSet(next);
    }

    /**
     * Checks whether an order in this status may be moved to {@code target}.
     * Re-stating the current status of a non-terminal order is allowed.
     *
     * @param target the requested status
     * @return true if the transition is legal
     */
    public boolean canTransitionTo(OrderStatus target) {
        if (isTerminal()) {
            return false;
        }
        return this == target || successors().contains(target);
    }

    /**
     * Resolves a wire value (canonical name or alias, case-insensitive).
     *
     * @param value the raw status value
     * @return the matching status, or empty if the value is not part of the
     *         enumeration
     */
    public static Optional<OrderStatus> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }

        String normalized = value.trim().toUpperCase(Locale.ROOT);

        return Arrays.stream(values())
                .filter(status -> status.name().equals(normalized) || status.aliases.contains(normalized))
                .findFirst();
    }
}
