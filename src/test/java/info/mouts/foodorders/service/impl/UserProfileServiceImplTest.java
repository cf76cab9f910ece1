package info.mouts.foodorders.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import info.mouts.foodorders.domain.UserProfile;
import info.mouts.foodorders.dto.UserProfileRequestDTO;
import info.mouts.foodorders.exception.ForbiddenException;
import info.mouts.foodorders.exception.ResourceNotFoundException;
import info.mouts.foodorders.repository.UserProfileRepository;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
public class UserProfileServiceImplTest {
    private static final Instant NOW = Instant.parse("2025-04-01T12:00:00Z");

    @Mock
    private UserProfileRepository userProfileRepository;

    private UserProfileServiceImpl userProfileService;

    @BeforeEach
    void setUp() {
        userProfileService = new UserProfileServiceImpl(userProfileRepository, Clock.fixed(NOW, ZoneOffset.UTC));
        when(userProfileRepository.save(any(UserProfile.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private static UserProfileRequestDTO request() {
        UserProfileRequestDTO request = new UserProfileRequestDTO();
        request.setUserId("user-1");
        request.setEmail("ana@example.com");
        request.setDisplayName("Ana");
        request.setPhoneNumbers(List.of("+5511999990000"));
        return request;
    }

    @Test
    void testSaveProfileKeepsRegisteredDevice() {
        UserProfile existing = UserProfile.builder().id("user-1").email("old@example.com").fcmToken("device-1")
                .build();
        when(userProfileRepository.findById("user-1")).thenReturn(Optional.of(existing));

        UserProfile saved = userProfileService.saveProfile(request());

        assertEquals("ana@example.com", saved.getEmail());
        assertEquals("device-1", saved.getFcmToken());
        assertThat(saved.getPhoneNumbers()).containsExactly("+5511999990000");
    }

    @Test
    void testSaveProfileCreatesMissingProfile() {
        when(userProfileRepository.findById("user-1")).thenReturn(Optional.empty());

        UserProfile saved = userProfileService.saveProfile(request());

        assertEquals("user-1", saved.getId());
        assertEquals("Ana", saved.getDisplayName());
    }

    @Test
    void testUsersOnlyReadTheirOwnProfile() {
        assertThrows(ForbiddenException.class, () -> userProfileService.findProfile("user-2", "user-1"));

        verify(userProfileRepository, never()).findById("user-1");
    }

    @Test
    void testMissingProfile() {
        when(userProfileRepository.findById("user-1")).thenReturn(Optional.empty());

        ResourceNotFoundException ex = assertThrows(ResourceNotFoundException.class,
                () -> userProfileService.findProfile("user-1", "user-1"));

        assertEquals("User not found for ID: user-1", ex.getMessage());
    }

    @Test
    void testRegisterDeviceToken() {
        when(userProfileRepository.findById("user-1"))
                .thenReturn(Optional.of(UserProfile.builder().id("user-1").email("ana@example.com").build()));

        UserProfile updated = userProfileService.registerDeviceToken("user-1", "device-2");

        assertEquals("device-2", updated.getFcmToken());
        assertEquals(NOW, updated.getFcmTokenUpdatedAt());
    }
}
