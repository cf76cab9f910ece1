package info.mouts.foodorders.controller;

import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import info.mouts.foodorders.domain.Notification;
import info.mouts.foodorders.domain.UserProfile;
import info.mouts.foodorders.dto.NotificationResponseDTO;
import info.mouts.foodorders.dto.UserProfileRequestDTO;
import info.mouts.foodorders.dto.UserProfileResponseDTO;
import info.mouts.foodorders.exception.ForbiddenException;
import info.mouts.foodorders.mapper.CatalogMapper;
import info.mouts.foodorders.mapper.OrderMapper;
import info.mouts.foodorders.repository.AdminAccountRepository;
import info.mouts.foodorders.security.AuthenticationInterceptor;
import info.mouts.foodorders.security.IdentityVerifier;
import info.mouts.foodorders.service.NotificationService;
import info.mouts.foodorders.service.UserProfileService;

@WebMvcTest(UserController.class)
@Import(AuthenticationInterceptor.class)
public class UserControllerTest {
    private static final String USER_TOKEN = "Bearer user-token";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private UserProfileService userProfileService;

    @MockitoBean
    private NotificationService notificationService;

    @MockitoBean
    private CatalogMapper catalogMapper;

    @MockitoBean
    private OrderMapper orderMapper;

    @MockitoBean
    private AdminAccountRepository adminAccountRepository;

    @MockitoBean
    private IdentityVerifier identityVerifier;

    @BeforeEach
    void authenticate() {
        given(identityVerifier.verify("user-token")).willReturn(Optional.of("user-1"));
    }

    @Nested
    @DisplayName("POST /api/users")
    class CreateProfile {
        @Test
        @DisplayName("Should store the profile without requiring a credential")
        void createProfile_shouldReturnCreated() throws Exception {
            mockMvc.perform(post("/api/users").contentType(MediaType.APPLICATION_JSON)
                    .content("{\"userId\":\"user-1\",\"email\":\"ana@example.com\",\"displayName\":\"Ana\","
                            + "\"phoneNumbers\":[\"+5511999990000\"]}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.success", is(true)));

            ArgumentCaptor<UserProfileRequestDTO> captor = ArgumentCaptor.forClass(UserProfileRequestDTO.class);
            verify(userProfileService).saveProfile(captor.capture());
            assertEquals("ana@example.com", captor.getValue().getEmail());
        }

        @Test
        @DisplayName("Should return 400 Bad Request for an invalid email")
        void createProfile_withInvalidEmail_shouldReturnBadRequest() throws Exception {
            mockMvc.perform(post("/api/users").contentType(MediaType.APPLICATION_JSON)
                    .content("{\"userId\":\"user-1\",\"email\":\"not-an-email\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.details.email", is("email must be a valid address")));

            verify(userProfileService, never()).saveProfile(any());
        }
    }

    @Nested
    @DisplayName("GET /api/users/{userId}")
    class FindProfile {
        @Test
        @DisplayName("Should return the caller's own profile")
        void findProfile_ownProfile_shouldReturnUser() throws Exception {
            UserProfile profile = UserProfile.builder().id("user-1").email("ana@example.com").build();
            given(userProfileService.findProfile("user-1", "user-1")).willReturn(profile);
            given(catalogMapper.toUserProfileResponseDto(profile)).willReturn(
                    UserProfileResponseDTO.builder().id("user-1").email("ana@example.com").build());

            mockMvc.perform(get("/api/users/{userId}", "user-1").header(HttpHeaders.AUTHORIZATION, USER_TOKEN))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.user.id", is("user-1")))
                    .andExpect(jsonPath("$.user.email", is("ana@example.com")));
        }

        @Test
        @DisplayName("Should return 403 Forbidden for another user's profile")
        void findProfile_foreignProfile_shouldReturnForbidden() throws Exception {
            given(userProfileService.findProfile("user-1", "user-2"))
                    .willThrow(new ForbiddenException("Unauthorized"));

            mockMvc.perform(get("/api/users/{userId}", "user-2").header(HttpHeaders.AUTHORIZATION, USER_TOKEN))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.message", is("Unauthorized")));
        }

        @Test
        @DisplayName("Should return 401 Unauthorized without a credential")
        void findProfile_withoutCredential_shouldReturnUnauthorized() throws Exception {
            mockMvc.perform(get("/api/users/{userId}", "user-1"))
                    .andExpect(status().isUnauthorized());

            verify(userProfileService, never()).findProfile(any(), any());
        }
    }

    @Test
    @DisplayName("Should register the device of the calling user")
    void registerDevice_shouldUseCallerId() throws Exception {
        mockMvc.perform(post("/api/users/fcm-token").header(HttpHeaders.AUTHORIZATION, USER_TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"token\":\"device-7\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success", is(true)));

        verify(userProfileService).registerDeviceToken("user-1", "device-7");
    }

    @Test
    @DisplayName("Should list the caller's notifications")
    void listNotifications_shouldWrapCallerNotifications() throws Exception {
        List<Notification> notifications = List.of(new Notification());
        given(notificationService.findForUser("user-1")).willReturn(notifications);
        given(orderMapper.toNotificationResponseDtoList(notifications)).willReturn(
                List.of(NotificationResponseDTO.builder().title("Order Update").orderId("ORD1").build()));

        mockMvc.perform(get("/api/notifications").header(HttpHeaders.AUTHORIZATION, USER_TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.notifications[0].orderId", is("ORD1")));
    }
}
