package info.mouts.foodorders.repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import info.mouts.foodorders.domain.Order;

/**
 * Repository interface for managing {@link Order} entities.
 */
@Repository
public interface OrderRepository extends JpaRepository<Order, String> {
    /**
     * Finds an order by its identifier, fetching its line items.
     *
     * @param id the order identifier
     * @return an optional containing the order if found, or empty if not found
     */
    @Override
    @EntityGraph(attributePaths = "items")
    Optional<Order> findById(String id);

    /**
     * Finds every order owned by the given user, newest first.
     *
     * @param userId the owner principal id
     * @return the user's orders
     */
    @EntityGraph(attributePaths = "items")
    List<Order> findByUserIdOrderByCreatedAtDesc(String userId);

    /**
     * Finds every order, newest first.
     *
     * @return all orders
     */
    @EntityGraph(attributePaths = "items")
    List<Order> findAllByOrderByCreatedAtDesc();

    /**
     * Finds the most recent orders.
     *
     * @param pageable page holding the number of orders to return
     * @return the newest orders, newest first
     */
    @EntityGraph(attributePaths = "items")
    List<Order> findAllByOrderByCreatedAtDesc(Pageable pageable);

    /**
     * Returns the creation timestamps of the most recent orders, newest first.
     * Used to compute the boundary of a live-feed window without loading the
     * orders themselves.
     *
     * @param pageable page holding the window size
     * @return creation timestamps, newest first
     */
    @Query("select o.createdAt from Order o order by o.createdAt desc")
    List<Instant> findRecentCreationTimes(Pageable pageable);
}
