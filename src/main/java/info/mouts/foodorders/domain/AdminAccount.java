package info.mouts.foodorders.domain;

import java.time.Instant;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * An administrator. The id doubles as the administrator's bearer token.
 * {@code fcmToken} and {@code fcmTokenUpdatedAt} form the device registration
 * used to address new-order alerts.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = "passwordHash")
@Entity
@Table(name = "admins")
public class AdminAccount {
    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, unique = true)
    private String email;

    @Column(nullable = false, name = "password_hash")
    private String passwordHash;

    private String name;

    @Column(name = "fcm_token", length = 512)
    private String fcmToken;

    @Column(name = "fcm_token_updated_at")
    private Instant fcmTokenUpdatedAt;

    public boolean hasDeviceToken() {
        return fcmToken != null && !fcmToken.isBlank();
    }
}
