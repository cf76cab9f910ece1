package info.mouts.foodorders.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.springframework.data.domain.Persistable;

import info.mouts.foodorders.event.OrderEntityListener;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Represents a client order.
 * <p>
 * The identifier is assigned by the application (sequential {@code ORD<n>},
 * client-supplied or a random UUID), so the entity implements
 * {@link Persistable} to tell Spring Data whether a save is an insert.
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = "items")
@EqualsAndHashCode(exclude = { "items", "newEntity" })
@Entity
@EntityListeners(OrderEntityListener.class)
@Table(name = "orders", indexes = {
        @Index(name = "idx_order_user_id", columnList = "user_id"),
        @Index(name = "idx_order_created_at", columnList = "created_at"),
        @Index(name = "idx_order_status", columnList = "status")
})
public class Order implements Persistable<String> {
    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "order_number", unique = true)
    private Long orderNumber;

    @NotBlank(message = "Order owner cannot be blank")
    @Column(nullable = false, name = "user_id")
    private String userId;

    @NotNull(message = "Order status cannot be null")
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private OrderStatus status;

    @NotEmpty(message = "Order must have at least one item")
    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderColumn(name = "position")
    @Builder.Default
    private List<OrderItem> items = new ArrayList<OrderItem>();

    @NotNull(message = "Total amount cannot be null")
    @DecimalMin(value = "0", inclusive = false, message = "Total amount must be positive")
    @Column(nullable = false, name = "total_amount", precision = 12, scale = 2)
    private BigDecimal totalAmount;

    @NotBlank(message = "Delivery location cannot be blank")
    @Column(nullable = false, name = "delivery_location", length = 512)
    private String deliveryLocation;

    @CreationTimestamp
    @Column(nullable = false, updatable = false, name = "created_at")
    private Instant createdAt;

    @UpdateTimestamp
    @Column(nullable = false, name = "updated_at")
    private Instant updatedAt;

    @Transient
    @Builder.Default
    private boolean newEntity = true;

    /**
     * Adds an {@link OrderItem} to the order's item list and sets the bidirectional
     * relationship.
     *
     * @param item The {@link OrderItem} instance to add.
     */
    public void addItem(OrderItem item) {
        this.items.add(item);
        item.setOrder(this);
    }

    /**
     * Replaces every line item, keeping the managed collection instance so that
     * orphan removal applies to the dropped items.
     *
     * @param newItems the items that make up the order from now on
     */
    public void replaceItems(List<OrderItem> newItems) {
        this.items.forEach(item -> item.setOrder(null));
        this.items.clear();
        newItems.forEach(this::addItem);
    }

    @Override
    public boolean isNew() {
        return newEntity;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.newEntity = false;
    }
}
