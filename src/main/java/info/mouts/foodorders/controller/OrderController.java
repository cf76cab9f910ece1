package info.mouts.foodorders.controller;

import static org.springframework.hateoas.server.mvc.WebMvcLinkBuilder.linkTo;
import static org.springframework.hateoas.server.mvc.WebMvcLinkBuilder.methodOn;

import java.net.URI;
import java.util.List;
import java.util.Optional;

import org.springframework.hateoas.CollectionModel;
import org.springframework.hateoas.MediaTypes;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import info.mouts.foodorders.domain.Order;
import info.mouts.foodorders.dto.ErrorResponseDTO;
import info.mouts.foodorders.dto.OrderAnalyticsDTO;
import info.mouts.foodorders.dto.OrderCreatedResponseDTO;
import info.mouts.foodorders.dto.OrderPatchRequestDTO;
import info.mouts.foodorders.dto.OrderRequestDTO;
import info.mouts.foodorders.dto.OrderResponseDTO;
import info.mouts.foodorders.dto.SubmitOrderRequestDTO;
import info.mouts.foodorders.dto.SubmitOrderResponseDTO;
import info.mouts.foodorders.dto.SuccessResponseDTO;
import info.mouts.foodorders.exception.InvalidRequestException;
import info.mouts.foodorders.mapper.OrderMapper;
import info.mouts.foodorders.security.RequestPrincipal;
import info.mouts.foodorders.service.OrderService;
import info.mouts.foodorders.service.OrderSubmissionService;
import info.mouts.foodorders.service.SubmittedOrder;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;

/**
 * REST controller through which clients place and manage their own
 * {@link Order}s. Every operation is scoped to the authenticated caller.
 * Uses HATEOAS to provide navigational links in responses.
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Orders API", description = "Endpoints for placing and managing the caller's orders")
@Slf4j
public class OrderController {
    private final OrderService orderService;
    private final OrderSubmissionService orderSubmissionService;
    private final OrderMapper orderMapper;

    /**
     * Constructs an instance of {@code OrderController}.
     *
     * @param orderService           Service for order lifecycle operations.
     * @param orderSubmissionService Service for sequential order submission.
     * @param orderMapper            Mapper for converting between entities and DTOs.
     */
    public OrderController(OrderService orderService, OrderSubmissionService orderSubmissionService,
            OrderMapper orderMapper) {
        this.orderService = orderService;
        this.orderSubmissionService = orderSubmissionService;
        this.orderMapper = orderMapper;
    }

    /**
     * Lists the caller's orders, newest first.
     *
     * @param principal The authenticated caller.
     * @return A {@link CollectionModel} of {@link OrderResponseDTO}s with links.
     */
    @GetMapping(value = "/orders", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "List My Orders", description = "Retrieves every order of the authenticated user.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Orders retrieved successfully"),
            @ApiResponse(responseCode = "401", description = "Missing or invalid credential", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ErrorResponseDTO.class)))
    })
    public ResponseEntity<CollectionModel<OrderResponseDTO>> listOrders(
            @Parameter(hidden = true) @RequestAttribute(RequestPrincipal.ATTRIBUTE) RequestPrincipal principal) {
        List<OrderResponseDTO> orders = orderMapper
                .toOrderResponseDtoList(orderService.listOrders(Optional.of(principal.getId())));
        orders.forEach(dto -> dto.add(linkTo(methodOn(OrderController.class).findOrder(dto.getId(), null))
                .withSelfRel()));

        return ResponseEntity.ok(CollectionModel.of(orders,
                linkTo(methodOn(OrderController.class).listOrders(null)).withSelfRel()));
    }

    /**
     * Retrieves one of the caller's orders.
     *
     * @param orderId   The order identifier.
     * @param principal The authenticated caller.
     * @return The {@link OrderResponseDTO} with a self link.
     */
    @GetMapping(value = "/orders/{orderId}", produces = { MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Get an Order by ID", description = "Retrieves one order of the authenticated user.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order retrieved successfully", content = @Content(mediaType = MediaTypes.HAL_JSON_VALUE, schema = @Schema(implementation = OrderResponseDTO.class))),
            @ApiResponse(responseCode = "404", description = "Order not found for the caller", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ErrorResponseDTO.class)))
    })
    public ResponseEntity<OrderResponseDTO> findOrder(@PathVariable String orderId,
            @Parameter(hidden = true) @RequestAttribute(RequestPrincipal.ATTRIBUTE) RequestPrincipal principal) {
        Order order = orderService.findOrder(orderId, principal.getId(), false);

        return ResponseEntity.ok(withLinks(orderMapper.toOrderResponseDto(order)));
    }

    /**
     * Creates an order under a client-supplied or random identifier.
     *
     * @param request   The order payload.
     * @param principal The authenticated caller.
     * @return 201 with the identifier of the new order.
     */
    @PostMapping(value = "/orders", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Create an Order", description = "Creates an order in PENDING status. The identifier is the optional orderId or a random UUID.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Order created"),
            @ApiResponse(responseCode = "400", description = "Invalid order data", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ErrorResponseDTO.class))),
            @ApiResponse(responseCode = "409", description = "The orderId is already taken", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ErrorResponseDTO.class)))
    })
    public ResponseEntity<OrderCreatedResponseDTO> createOrder(@RequestBody OrderRequestDTO request,
            @Parameter(hidden = true) @RequestAttribute(RequestPrincipal.ATTRIBUTE) RequestPrincipal principal) {
        Order order = orderService.createOrder(principal.getId(), request);

        URI location = linkTo(methodOn(OrderController.class).findOrder(order.getId(), null)).toUri();
        return ResponseEntity.created(location).body(new OrderCreatedResponseDTO(true, order.getId()));
    }

    /**
     * Applies a partial update to one of the caller's orders. A user may only
     * set the status to {@code CANCELLED}.
     *
     * @param orderId   The order identifier.
     * @param patch     The fields to change.
     * @param principal The authenticated caller.
     * @return The updated order.
     */
    @PutMapping(value = "/orders/{orderId}", consumes = MediaType.APPLICATION_JSON_VALUE, produces = {
            MediaTypes.HAL_JSON_VALUE })
    @Operation(summary = "Update an Order", description = "Partially updates an order of the authenticated user.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order updated"),
            @ApiResponse(responseCode = "400", description = "Invalid field or status value", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ErrorResponseDTO.class))),
            @ApiResponse(responseCode = "403", description = "Status change reserved to administrators", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ErrorResponseDTO.class))),
            @ApiResponse(responseCode = "404", description = "Order not found for the caller", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ErrorResponseDTO.class))),
            @ApiResponse(responseCode = "409", description = "Order can no longer change status", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ErrorResponseDTO.class)))
    })
    public ResponseEntity<OrderResponseDTO> updateOrder(@PathVariable String orderId,
            @RequestBody OrderPatchRequestDTO patch,
            @Parameter(hidden = true) @RequestAttribute(RequestPrincipal.ATTRIBUTE) RequestPrincipal principal) {
        Order order = orderService.updateOrder(orderId, principal.getId(), patch, false);

        return ResponseEntity.ok(withLinks(orderMapper.toOrderResponseDto(order)));
    }

    @DeleteMapping("/orders/{orderId}")
    @Operation(summary = "Delete an Order", description = "Deletes an order of the authenticated user.")
    public ResponseEntity<SuccessResponseDTO> deleteOrder(@PathVariable String orderId,
            @Parameter(hidden = true) @RequestAttribute(RequestPrincipal.ATTRIBUTE) RequestPrincipal principal) {
        orderService.deleteOrder(orderId, principal.getId(), false);

        return ResponseEntity.ok(SuccessResponseDTO.ok());
    }

    /**
     * Submits an order under the next sequential identifier.
     *
     * @param request   The wrapped order payload.
     * @param principal The authenticated caller.
     * @return The allocated identifier and number.
     */
    @PostMapping(value = "/order/submit", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Submit an Order", description = "Stores the order as ORD<n>, n being the next number of a gap-free sequence.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order submitted", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = SubmitOrderResponseDTO.class))),
            @ApiResponse(responseCode = "400", description = "Invalid order data", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ErrorResponseDTO.class))),
            @ApiResponse(responseCode = "500", description = "No order number could be allocated", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ErrorResponseDTO.class)))
    })
    public ResponseEntity<SubmitOrderResponseDTO> submitOrder(@RequestBody SubmitOrderRequestDTO request,
            @Parameter(hidden = true) @RequestAttribute(RequestPrincipal.ATTRIBUTE) RequestPrincipal principal) {
        if (request.getOrder() == null) {
            throw new InvalidRequestException("order", "Order cannot be null in submit request");
        }
        SubmittedOrder submitted = orderSubmissionService.submitOrder(principal.getId(), request.getOrder());

        return ResponseEntity.status(HttpStatus.OK).body(SubmitOrderResponseDTO.builder()
                .success(true)
                .orderId(submitted.getOrderId())
                .orderNumber(submitted.getOrderNumber())
                .build());
    }

    @GetMapping("/analytics/orders")
    @Operation(summary = "My Order Statistics", description = "Counts and totals over the authenticated user's orders.")
    public ResponseEntity<OrderAnalyticsDTO> analytics(
            @Parameter(hidden = true) @RequestAttribute(RequestPrincipal.ATTRIBUTE) RequestPrincipal principal) {
        return ResponseEntity.ok(orderService.computeAnalytics(Optional.of(principal.getId())));
    }

    private OrderResponseDTO withLinks(OrderResponseDTO dto) {
        dto.add(linkTo(methodOn(OrderController.class).findOrder(dto.getId(), null)).withSelfRel());
        return dto;
    }
}
