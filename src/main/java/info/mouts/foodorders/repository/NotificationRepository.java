package info.mouts.foodorders.repository;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import info.mouts.foodorders.domain.Notification;

/**
 * Repository interface for managing {@link Notification} entities.
 */
@Repository
public interface NotificationRepository extends JpaRepository<Notification, UUID> {
    List<Notification> findByUserIdOrderByCreatedAtDesc(String userId);

    List<Notification> findByOrderId(String orderId);
}
