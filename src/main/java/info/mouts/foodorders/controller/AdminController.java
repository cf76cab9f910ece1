package info.mouts.foodorders.controller;

import java.util.List;
import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import info.mouts.foodorders.domain.AdminAccount;
import info.mouts.foodorders.dto.AdminLoginRequestDTO;
import info.mouts.foodorders.dto.AdminLoginResponseDTO;
import info.mouts.foodorders.dto.DeviceTokenRequestDTO;
import info.mouts.foodorders.dto.ErrorResponseDTO;
import info.mouts.foodorders.dto.SuccessResponseDTO;
import info.mouts.foodorders.dto.UserProfileResponseDTO;
import info.mouts.foodorders.mapper.CatalogMapper;
import info.mouts.foodorders.security.RequestPrincipal;
import info.mouts.foodorders.service.AdminService;
import info.mouts.foodorders.service.UserProfileService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

/**
 * Administrator session and device registration, plus the user directory.
 */
@RestController
@RequestMapping("/api/admin")
@Tag(name = "Admin API", description = "Administrator login, device registration and user directory")
public class AdminController {
    private final AdminService adminService;
    private final UserProfileService userProfileService;
    private final CatalogMapper catalogMapper;

    public AdminController(AdminService adminService, UserProfileService userProfileService,
            CatalogMapper catalogMapper) {
        this.adminService = adminService;
        this.userProfileService = userProfileService;
        this.catalogMapper = catalogMapper;
    }

    /**
     * Logs an administrator in. The returned token is the administrator id and
     * authorizes every other {@code /api/admin} endpoint.
     *
     * @param request The credentials.
     * @return The token and the administrator's identity.
     */
    @PostMapping(value = "/login", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Admin Login", description = "Exchanges email and password for the administrator token.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Logged in"),
            @ApiResponse(responseCode = "400", description = "Email or password missing", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ErrorResponseDTO.class))),
            @ApiResponse(responseCode = "401", description = "Invalid credentials", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ErrorResponseDTO.class)))
    })
    public ResponseEntity<AdminLoginResponseDTO> login(@Validated @RequestBody AdminLoginRequestDTO request) {
        AdminAccount admin = adminService.login(request.getEmail(), request.getPassword());

        return ResponseEntity.ok(AdminLoginResponseDTO.builder()
                .success(true)
                .token(admin.getId())
                .adminId(admin.getId())
                .email(admin.getEmail())
                .name(admin.getName() == null ? "" : admin.getName())
                .build());
    }

    @PostMapping(value = "/fcm-token", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Register Admin Device", description = "Stores the device token new-order alerts are pushed to.")
    public ResponseEntity<SuccessResponseDTO> registerDevice(@Validated @RequestBody DeviceTokenRequestDTO request,
            @Parameter(hidden = true) @RequestAttribute(RequestPrincipal.ATTRIBUTE) RequestPrincipal principal) {
        adminService.registerDeviceToken(principal.getId(), request.getToken());

        return ResponseEntity.ok(SuccessResponseDTO.ok());
    }

    @GetMapping("/users")
    @Operation(summary = "List Users", description = "Retrieves every user profile.")
    public ResponseEntity<Map<String, List<UserProfileResponseDTO>>> listUsers() {
        return ResponseEntity.ok(Map.of("users",
                catalogMapper.toUserProfileResponseDtoList(userProfileService.findAll())));
    }
}
