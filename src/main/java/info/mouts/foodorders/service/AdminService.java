package info.mouts.foodorders.service;

import info.mouts.foodorders.domain.AdminAccount;

public interface AdminService {
    /**
     * Checks an administrator's credentials.
     *
     * @param email    The account email.
     * @param password The clear-text password.
     * @return The authenticated account; its id is the bearer token.
     * @throws info.mouts.foodorders.exception.AuthenticationRequiredException if the credentials do not match.
     */
    AdminAccount login(String email, String password);

    AdminAccount registerDeviceToken(String adminId, String deviceToken);
}
