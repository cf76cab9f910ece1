package info.mouts.foodorders.controller;

import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import info.mouts.foodorders.dto.DeviceTokenRequestDTO;
import info.mouts.foodorders.dto.NotificationResponseDTO;
import info.mouts.foodorders.dto.SuccessResponseDTO;
import info.mouts.foodorders.dto.UserProfileRequestDTO;
import info.mouts.foodorders.dto.UserProfileResponseDTO;
import info.mouts.foodorders.mapper.CatalogMapper;
import info.mouts.foodorders.mapper.OrderMapper;
import info.mouts.foodorders.security.RequestPrincipal;
import info.mouts.foodorders.service.NotificationService;
import info.mouts.foodorders.service.UserProfileService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;

/**
 * User profiles, device registration and the notification inbox.
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Users API", description = "User profiles, devices and notifications")
public class UserController {
    private final UserProfileService userProfileService;
    private final NotificationService notificationService;
    private final CatalogMapper catalogMapper;
    private final OrderMapper orderMapper;

    public UserController(UserProfileService userProfileService, NotificationService notificationService,
            CatalogMapper catalogMapper, OrderMapper orderMapper) {
        this.userProfileService = userProfileService;
        this.notificationService = notificationService;
        this.catalogMapper = catalogMapper;
        this.orderMapper = orderMapper;
    }

    @PostMapping(value = "/users", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Create a User Profile", description = "Creates or replaces the profile stored under userId.")
    public ResponseEntity<SuccessResponseDTO> createProfile(@Validated @RequestBody UserProfileRequestDTO request) {
        userProfileService.saveProfile(request);

        return ResponseEntity.status(HttpStatus.CREATED).body(SuccessResponseDTO.ok());
    }

    @GetMapping("/users/{userId}")
    @Operation(summary = "Get a User Profile", description = "Users may only read their own profile.")
    public ResponseEntity<Map<String, UserProfileResponseDTO>> findProfile(@PathVariable String userId,
            @Parameter(hidden = true) @RequestAttribute(RequestPrincipal.ATTRIBUTE) RequestPrincipal principal) {
        return ResponseEntity.ok(Map.of("user",
                catalogMapper.toUserProfileResponseDto(userProfileService.findProfile(principal.getId(), userId))));
    }

    @PostMapping(value = "/users/fcm-token", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Register User Device", description = "Stores the device token order notifications are pushed to.")
    public ResponseEntity<SuccessResponseDTO> registerDevice(@Validated @RequestBody DeviceTokenRequestDTO request,
            @Parameter(hidden = true) @RequestAttribute(RequestPrincipal.ATTRIBUTE) RequestPrincipal principal) {
        userProfileService.registerDeviceToken(principal.getId(), request.getToken());

        return ResponseEntity.ok(SuccessResponseDTO.ok());
    }

    @GetMapping("/notifications")
    @Operation(summary = "List My Notifications", description = "Retrieves the caller's notifications, newest first.")
    public ResponseEntity<Map<String, List<NotificationResponseDTO>>> listNotifications(
            @Parameter(hidden = true) @RequestAttribute(RequestPrincipal.ATTRIBUTE) RequestPrincipal principal) {
        return ResponseEntity.ok(Map.of("notifications",
                orderMapper.toNotificationResponseDtoList(notificationService.findForUser(principal.getId()))));
    }
}
