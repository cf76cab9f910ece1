package info.mouts.foodorders.domain;

/**
 * Discriminator stored on every {@link Notification}.
 */
public enum NotificationType {
    ORDER
}
