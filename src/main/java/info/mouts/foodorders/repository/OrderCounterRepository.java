package info.mouts.foodorders.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import info.mouts.foodorders.domain.OrderCounter;

/**
 * Repository interface for the {@link OrderCounter} singleton.
 */
@Repository
public interface OrderCounterRepository extends JpaRepository<OrderCounter, String> {
}
