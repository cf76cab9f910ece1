package info.mouts.foodorders.repository;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageRequest;

import info.mouts.foodorders.domain.Order;
import info.mouts.foodorders.domain.OrderItem;
import info.mouts.foodorders.domain.OrderStatus;
import info.mouts.foodorders.event.OrderEntityListener;

@DataJpaTest
@Import(OrderEntityListener.class)
public class OrderRepositoryTest {
    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private OrderRepository orderRepository;

    private Order createTestOrder(String id, String userId) {
        Order order = Order.builder()
                .id(id)
                .userId(userId)
                .status(OrderStatus.PENDING)
                .totalAmount(new BigDecimal("12.50"))
                .deliveryLocation("Main Street 1")
                .build();

        order.addItem(OrderItem.builder()
                .productId("prod-123")
                .name("Soup")
                .quantity(new BigDecimal("1.5"))
                .price(new BigDecimal("5.00"))
                .build());
        order.addItem(OrderItem.builder()
                .productId("prod-456")
                .name("Bread")
                .quantity(BigDecimal.ONE)
                .price(new BigDecimal("5.00"))
                .build());
        return order;
    }

    @Test
    @DisplayName("Should save and retrieve an order with its items in order")
    public void testSaveAndFindById() {
        orderRepository.saveAndFlush(createTestOrder("ORD1", "user-1"));
        entityManager.clear();

        Optional<Order> found = orderRepository.findById("ORD1");

        assertThat(found).isPresent();
        Order order = found.get();
        assertThat(order.getUserId()).isEqualTo("user-1");
        assertThat(order.getItems()).extracting(OrderItem::getProductId).containsExactly("prod-123", "prod-456");
        assertThat(order.getItems().get(0).getQuantity()).isEqualByComparingTo("1.5");
        assertThat(order.getCreatedAt()).isNotNull();
        assertThat(order.getUpdatedAt()).isNotNull();
        assertThat(order.isNew()).isFalse();
    }

    @Test
    @DisplayName("Should list only the owner's orders, newest first")
    void testFindByUserId() {
        Order older = createTestOrder("o-1", "user-1");
        Order newer = createTestOrder("o-2", "user-1");
        orderRepository.saveAndFlush(older);
        orderRepository.saveAndFlush(newer);
        orderRepository.saveAndFlush(createTestOrder("o-3", "user-2"));
        entityManager.getEntityManager()
                .createNativeQuery("update orders set created_at = ?1 where id = ?2")
                .setParameter(1, Timestamp.from(Instant.parse("2024-01-01T00:00:00Z")))
                .setParameter(2, "o-1")
                .executeUpdate();
        entityManager.clear();

        List<Order> orders = orderRepository.findByUserIdOrderByCreatedAtDesc("user-1");

        assertThat(orders).extracting(Order::getId).containsExactly("o-2", "o-1");
    }

    @Test
    @DisplayName("Should return the creation times of the newest orders")
    void testFindRecentCreationTimes() {
        orderRepository.saveAndFlush(createTestOrder("o-1", "user-1"));
        orderRepository.saveAndFlush(createTestOrder("o-2", "user-1"));
        orderRepository.saveAndFlush(createTestOrder("o-3", "user-1"));

        List<Instant> times = orderRepository.findRecentCreationTimes(PageRequest.of(0, 2));

        assertThat(times).hasSize(2);
        assertThat(times.get(0)).isAfterOrEqualTo(times.get(1));
    }

    @Test
    void testReplaceItemsRemovesOrphans() {
        orderRepository.saveAndFlush(createTestOrder("o-1", "user-1"));
        entityManager.clear();

        Order order = orderRepository.findById("o-1").orElseThrow();
        order.replaceItems(List.of(OrderItem.builder().productId("prod-789").name("Tea")
                .quantity(BigDecimal.ONE).price(new BigDecimal("2.00")).build()));
        orderRepository.saveAndFlush(order);
        entityManager.clear();

        assertThat(orderRepository.findById("o-1").orElseThrow().getItems())
                .extracting(OrderItem::getProductId).containsExactly("prod-789");
        Long itemCount = entityManager.getEntityManager()
                .createQuery("select count(i) from OrderItem i", Long.class).getSingleResult();
        assertThat(itemCount).isEqualTo(1L);
    }
}
