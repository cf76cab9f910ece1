package info.mouts.foodorders.service.impl;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import info.mouts.foodorders.domain.AdminAccount;
import info.mouts.foodorders.domain.Notification;
import info.mouts.foodorders.domain.NotificationType;
import info.mouts.foodorders.domain.UserProfile;
import info.mouts.foodorders.dto.PushMessageDTO;
import info.mouts.foodorders.push.PushDeliveryClient;
import info.mouts.foodorders.repository.AdminAccountRepository;
import info.mouts.foodorders.repository.NotificationRepository;
import info.mouts.foodorders.repository.UserProfileRepository;
import info.mouts.foodorders.service.NotificationService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of the {@link NotificationService} interface.
 * The notification record is stored before any push is attempted, so the
 * user's notification list is complete even when a device is unreachable.
 */
@Service
@Slf4j
public class NotificationServiceImpl implements NotificationService {
    static final String ORDER_STATUS_TYPE = "order_status";
    static final String NEW_ORDER_TYPE = "new_order";
    static final String NEW_ORDER_TITLE = "🛒 New Order";

    private final NotificationRepository notificationRepository;
    private final UserProfileRepository userProfileRepository;
    private final AdminAccountRepository adminAccountRepository;
    private final PushDeliveryClient pushDeliveryClient;
    private final MeterRegistry meterRegistry;

    private Counter notificationsCreatedCounter;
    private Counter pushSentCounter;
    private Counter adminAlertsCounter;

    /**
     * Constructs an instance of {@code NotificationServiceImpl}.
     *
     * @param notificationRepository The repository notifications are stored in.
     * @param userProfileRepository  The repository holding user device tokens.
     * @param adminAccountRepository The repository holding administrator device tokens.
     * @param pushDeliveryClient     The client handing messages to the push gateway.
     * @param meterRegistry          The registry for collecting metrics.
     */
    public NotificationServiceImpl(NotificationRepository notificationRepository,
            UserProfileRepository userProfileRepository, AdminAccountRepository adminAccountRepository,
            PushDeliveryClient pushDeliveryClient, MeterRegistry meterRegistry) {
        this.notificationRepository = notificationRepository;
        this.userProfileRepository = userProfileRepository;
        this.adminAccountRepository = adminAccountRepository;
        this.pushDeliveryClient = pushDeliveryClient;
        this.meterRegistry = meterRegistry;

        initializeMetrics(meterRegistry);
    }

    @Override
    public Notification notifyOrderStatus(String userId, String orderId, String status, String title, String body) {
        Notification notification = notificationRepository.save(Notification.builder()
                .userId(userId)
                .orderId(orderId)
                .status(status)
                .title(title)
                .body(body)
                .type(NotificationType.ORDER)
                .build());
        notificationsCreatedCounter.increment();
        log.info("Stored notification {} for user {} about order {} ({})", notification.getId(), userId, orderId,
                status);

        String deviceToken = userProfileRepository.findById(userId)
                .map(UserProfile::getFcmToken)
                .filter(token -> !token.isBlank())
                .orElse(null);
        if (deviceToken == null) {
            log.info("User {} has no registered device, skipping push for order {}", userId, orderId);
            recordFailure("no_device");
            return notification;
        }

        send(PushMessageDTO.builder()
                .token(deviceToken)
                .title(title)
                .body(body)
                .data(Map.of(
                        "type", ORDER_STATUS_TYPE,
                        "orderId", orderId,
                        "status", status,
                        "title", title,
                        "body", body))
                .build(), "user " + userId);

        return notification;
    }

    @Override
    public int alertAdminsOfNewOrder(String orderId, BigDecimal totalAmount) {
        String amount = totalAmount.setScale(2, RoundingMode.HALF_UP).toPlainString();
        String body = "Order " + orderId + " received - total " + amount;

        int delivered = 0;
        for (AdminAccount admin : adminAccountRepository.findByFcmTokenIsNotNull()) {
            if (!admin.hasDeviceToken()) {
                continue;
            }
            boolean sent = send(PushMessageDTO.builder()
                    .token(admin.getFcmToken())
                    .title(NEW_ORDER_TITLE)
                    .body(body)
                    .data(Map.of(
                            "type", NEW_ORDER_TYPE,
                            "orderId", orderId,
                            "totalAmount", amount))
                    .build(), "administrator " + admin.getId());
            if (sent) {
                delivered++;
                adminAlertsCounter.increment();
            }
        }

        log.info("New order {} alert delivered to {} administrator(s)", orderId, delivered);
        return delivered;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Notification> findForUser(String userId) {
        return notificationRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    private boolean send(PushMessageDTO message, String recipient) {
        try {
            pushDeliveryClient.send(message);
            pushSentCounter.increment();
            log.debug("Push delivered to {}", recipient);
            return true;
        } catch (RuntimeException e) {
            recordFailure("delivery_error");
            log.error("Failed to push '{}' to {}: {}", message.getTitle(), recipient, e.getMessage(), e);
            return false;
        }
    }

    private void recordFailure(String reason) {
        Counter.builder("notifications.push.failed")
                .description("Number of notifications that could not be pushed")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    /**
     * Initializes the Micrometer metrics for the notification dispatcher.
     *
     * @param registry The meter registry to register the metrics with.
     */
    private void initializeMetrics(MeterRegistry registry) {
        this.notificationsCreatedCounter = Counter.builder("notifications.created")
                .description("Number of notifications stored")
                .register(registry);

        this.pushSentCounter = Counter.builder("notifications.push.sent")
                .description("Number of push messages accepted by the gateway")
                .register(registry);

        this.adminAlertsCounter = Counter.builder("notifications.admin.alerts")
                .description("Number of new-order alerts delivered to administrators")
                .register(registry);
    }
}
