package info.mouts.foodorders.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Singleton row holding the last order number handed out by the
 * {@link info.mouts.foodorders.service.SequenceAllocator}.
 * Only the allocator writes it, always inside a transaction.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@Entity
@Table(name = "order_counters")
public class OrderCounter {
    public static final String ORDERS = "orders";

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, name = "counter_value")
    private long value;

    // Wrapper type: a null version marks a row that has never been persisted.
    @Version
    private Long version;
}
