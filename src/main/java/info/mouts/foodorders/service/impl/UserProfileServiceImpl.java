package info.mouts.foodorders.service.impl;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import info.mouts.foodorders.domain.UserProfile;
import info.mouts.foodorders.dto.UserProfileRequestDTO;
import info.mouts.foodorders.exception.ForbiddenException;
import info.mouts.foodorders.exception.ResourceNotFoundException;
import info.mouts.foodorders.repository.UserProfileRepository;
import info.mouts.foodorders.service.UserProfileService;
import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
public class UserProfileServiceImpl implements UserProfileService {
    private final UserProfileRepository userProfileRepository;
    private final Clock clock;

    /**
     * Constructs an instance of {@code UserProfileServiceImpl}.
     *
     * @param userProfileRepository The repository for user profiles.
     * @param clock                 The clock device registrations are stamped with.
     */
    public UserProfileServiceImpl(UserProfileRepository userProfileRepository, Clock clock) {
        this.userProfileRepository = userProfileRepository;
        this.clock = clock;
    }

    @Override
    @Transactional
    public UserProfile saveProfile(UserProfileRequestDTO request) {
        UserProfile profile = userProfileRepository.findById(request.getUserId())
                .orElseGet(() -> UserProfile.builder().id(request.getUserId()).build());

        profile.setEmail(request.getEmail());
        profile.setDisplayName(request.getDisplayName());
        profile.setPhoneNumbers(request.getPhoneNumbers() == null ? new ArrayList<>()
                : new ArrayList<>(request.getPhoneNumbers()));

        log.info("Saving profile of user {}", request.getUserId());
        return userProfileRepository.save(profile);
    }

    @Override
    @Transactional(readOnly = true)
    public UserProfile findProfile(String requesterId, String userId) {
        if (!userId.equals(requesterId)) {
            log.warn("User {} asked for the profile of {}", requesterId, userId);
            throw new ForbiddenException("Unauthorized");
        }
        return userProfileRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));
    }

    @Override
    @Transactional
    public UserProfile registerDeviceToken(String userId, String deviceToken) {
        UserProfile profile = userProfileRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));

        profile.setFcmToken(deviceToken);
        profile.setFcmTokenUpdatedAt(clock.instant());
        log.info("Registered device for user {}", userId);

        return userProfileRepository.save(profile);
    }

    @Override
    @Transactional(readOnly = true)
    public List<UserProfile> findAll() {
        return userProfileRepository.findAll();
    }
}
