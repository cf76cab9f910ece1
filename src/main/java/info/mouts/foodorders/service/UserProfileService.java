package info.mouts.foodorders.service;

import java.util.List;

import info.mouts.foodorders.domain.UserProfile;
import info.mouts.foodorders.dto.UserProfileRequestDTO;

public interface UserProfileService {
    /**
     * Creates the profile of a user, replacing any existing profile with the
     * same id. A registered device token is kept.
     *
     * @param request The profile fields.
     * @return The stored profile.
     */
    UserProfile saveProfile(UserProfileRequestDTO request);

    /**
     * @param requesterId The principal id of the caller.
     * @param userId      The requested profile.
     * @return The profile.
     * @throws info.mouts.foodorders.exception.ForbiddenException        if the caller asks for someone else's profile.
     * @throws info.mouts.foodorders.exception.ResourceNotFoundException if there is no such profile.
     */
    UserProfile findProfile(String requesterId, String userId);

    UserProfile registerDeviceToken(String userId, String deviceToken);

    List<UserProfile> findAll();
}
