package info.mouts.foodorders.service.impl;

import java.time.Clock;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import info.mouts.foodorders.domain.AdminAccount;
import info.mouts.foodorders.exception.AuthenticationRequiredException;
import info.mouts.foodorders.exception.ResourceNotFoundException;
import info.mouts.foodorders.repository.AdminAccountRepository;
import info.mouts.foodorders.security.PasswordHashVerifier;
import info.mouts.foodorders.service.AdminService;
import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
public class AdminServiceImpl implements AdminService {
    private static final String INVALID_CREDENTIALS = "Invalid credentials";

    private final AdminAccountRepository adminAccountRepository;
    private final PasswordHashVerifier passwordHashVerifier;
    private final Clock clock;

    /**
     * Constructs an instance of {@code AdminServiceImpl}.
     *
     * @param adminAccountRepository The repository for administrator accounts.
     * @param passwordHashVerifier   The checker for stored password hashes.
     * @param clock                  The clock device registrations are stamped with.
     */
    public AdminServiceImpl(AdminAccountRepository adminAccountRepository,
            PasswordHashVerifier passwordHashVerifier, Clock clock) {
        this.adminAccountRepository = adminAccountRepository;
        this.passwordHashVerifier = passwordHashVerifier;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public AdminAccount login(String email, String password) {
        AdminAccount admin = adminAccountRepository.findByEmailIgnoreCase(email.trim())
                .orElseThrow(() -> {
                    log.warn("Login attempt for unknown administrator email");
                    return new AuthenticationRequiredException(INVALID_CREDENTIALS);
                });

        if (!passwordHashVerifier.matches(password, admin.getPasswordHash())) {
            log.warn("Wrong password for administrator {}", admin.getId());
            throw new AuthenticationRequiredException(INVALID_CREDENTIALS);
        }

        log.info("Administrator {} logged in", admin.getId());
        return admin;
    }

    @Override
    @Transactional
    public AdminAccount registerDeviceToken(String adminId, String deviceToken) {
        AdminAccount admin = adminAccountRepository.findById(adminId)
                .orElseThrow(() -> new ResourceNotFoundException("Administrator", adminId));

        admin.setFcmToken(deviceToken);
        admin.setFcmTokenUpdatedAt(clock.instant());
        log.info("Registered device for administrator {}", adminId);

        return adminAccountRepository.save(admin);
    }
}
