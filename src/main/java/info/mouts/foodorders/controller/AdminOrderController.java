package info.mouts.foodorders.controller;

import static org.springframework.hateoas.server.mvc.WebMvcLinkBuilder.linkTo;
import static org.springframework.hateoas.server.mvc.WebMvcLinkBuilder.methodOn;

import java.util.List;
import java.util.Optional;

import org.springframework.hateoas.CollectionModel;
import org.springframework.hateoas.MediaTypes;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import info.mouts.foodorders.domain.Order;
import info.mouts.foodorders.dto.ErrorResponseDTO;
import info.mouts.foodorders.dto.OrderAnalyticsDTO;
import info.mouts.foodorders.dto.OrderPatchRequestDTO;
import info.mouts.foodorders.dto.OrderResponseDTO;
import info.mouts.foodorders.dto.SuccessResponseDTO;
import info.mouts.foodorders.feed.LiveOrderFeedService;
import info.mouts.foodorders.mapper.OrderMapper;
import info.mouts.foodorders.security.RequestPrincipal;
import info.mouts.foodorders.service.OrderService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;

/**
 * REST controller for administrators managing every {@link Order}.
 * A status change made here notifies the order's owner.
 */
@RestController
@RequestMapping("/api/admin")
@Tag(name = "Admin Orders API", description = "Endpoints for administrators to follow and drive orders")
@Slf4j
public class AdminOrderController {
    static final int RECENT_ORDERS_LIMIT = 10;

    private final OrderService orderService;
    private final LiveOrderFeedService liveOrderFeedService;
    private final OrderMapper orderMapper;

    /**
     * Constructs an instance of {@code AdminOrderController}.
     *
     * @param orderService         Service for order lifecycle operations.
     * @param liveOrderFeedService Service streaming order changes.
     * @param orderMapper          Mapper for converting between entities and DTOs.
     */
    public AdminOrderController(OrderService orderService, LiveOrderFeedService liveOrderFeedService,
            OrderMapper orderMapper) {
        this.orderService = orderService;
        this.liveOrderFeedService = liveOrderFeedService;
        this.orderMapper = orderMapper;
    }

    @GetMapping(value = "/orders", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "List All Orders", description = "Retrieves every order, optionally restricted to one user.")
    public ResponseEntity<CollectionModel<OrderResponseDTO>> listOrders(
            @RequestParam(required = false) String userId) {
        return ResponseEntity.ok(toCollection(orderService.listOrders(Optional.ofNullable(userId))));
    }

    /**
     * Polling fallback of the live feed.
     *
     * @return The ten most recent orders, newest first.
     */
    @GetMapping(value = "/orders/recent", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Recent Orders", description = "Retrieves the 10 most recent orders, newest first.")
    public ResponseEntity<CollectionModel<OrderResponseDTO>> recentOrders() {
        return ResponseEntity.ok(toCollection(orderService.findRecentOrders(RECENT_ORDERS_LIMIT)));
    }

    @GetMapping(value = "/orders/{orderId}", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Get Any Order by ID", description = "Retrieves an order regardless of its owner.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order retrieved successfully", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = OrderResponseDTO.class))),
            @ApiResponse(responseCode = "404", description = "Order not found", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ErrorResponseDTO.class)))
    })
    public ResponseEntity<OrderResponseDTO> findOrder(@PathVariable String orderId,
            @Parameter(hidden = true) @RequestAttribute(RequestPrincipal.ATTRIBUTE) RequestPrincipal principal) {
        Order order = orderService.findOrder(orderId, principal.getId(), true);

        return ResponseEntity.ok(withLinks(orderMapper.toOrderResponseDto(order)));
    }

    /**
     * Updates an order. When the update names a status, the transition is
     * checked against the order lifecycle and the owner is notified.
     *
     * @param orderId   The order identifier.
     * @param patch     The fields to change.
     * @param principal The authenticated administrator.
     * @return The updated order.
     */
    @PutMapping(value = "/orders/{orderId}", consumes = MediaType.APPLICATION_JSON_VALUE, produces = {
            MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Update Any Order", description = "Partially updates an order; a status change notifies the owner.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order updated"),
            @ApiResponse(responseCode = "400", description = "Invalid field or status value", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ErrorResponseDTO.class))),
            @ApiResponse(responseCode = "404", description = "Order not found", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ErrorResponseDTO.class))),
            @ApiResponse(responseCode = "409", description = "Illegal status transition", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ErrorResponseDTO.class)))
    })
    public ResponseEntity<OrderResponseDTO> updateOrder(@PathVariable String orderId,
            @RequestBody OrderPatchRequestDTO patch,
            @Parameter(hidden = true) @RequestAttribute(RequestPrincipal.ATTRIBUTE) RequestPrincipal principal) {
        Order order = orderService.updateOrder(orderId, principal.getId(), patch, true);

        return ResponseEntity.ok(withLinks(orderMapper.toOrderResponseDto(order)));
    }

    @DeleteMapping("/orders/{orderId}")
    @Operation(summary = "Delete Any Order")
    public ResponseEntity<SuccessResponseDTO> deleteOrder(@PathVariable String orderId,
            @Parameter(hidden = true) @RequestAttribute(RequestPrincipal.ATTRIBUTE) RequestPrincipal principal) {
        orderService.deleteOrder(orderId, principal.getId(), true);

        return ResponseEntity.ok(SuccessResponseDTO.ok());
    }

    /**
     * Opens the live order feed: a {@code connected} event, then
     * {@code new_order} and {@code order_update} events for the 50 most recent
     * orders, with heartbeats while idle.
     *
     * @param principal The authenticated administrator.
     * @return The event stream.
     */
    @GetMapping(value = "/stream/orders", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Live Order Feed", description = "Server-Sent Events stream of new and updated orders.")
    public SseEmitter streamOrders(
            @Parameter(hidden = true) @RequestAttribute(RequestPrincipal.ATTRIBUTE) RequestPrincipal principal) {
        log.info("Administrator {} opened the live order feed", principal.getId());

        return liveOrderFeedService.openFeed();
    }

    @GetMapping("/analytics")
    @Operation(summary = "Order Statistics", description = "Counts and totals over all orders.")
    public ResponseEntity<OrderAnalyticsDTO> analytics() {
        return ResponseEntity.ok(orderService.computeAnalytics(Optional.empty()));
    }

    private CollectionModel<OrderResponseDTO> toCollection(List<Order> orders) {
        List<OrderResponseDTO> dtos = orderMapper.toOrderResponseDtoList(orders);
        dtos.forEach(this::withLinks);
        return CollectionModel.of(dtos);
    }

    private OrderResponseDTO withLinks(OrderResponseDTO dto) {
        dto.add(linkTo(methodOn(AdminOrderController.class).findOrder(dto.getId(), null)).withSelfRel());
        return dto;
    }
}
