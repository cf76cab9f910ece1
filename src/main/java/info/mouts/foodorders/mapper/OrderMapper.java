package info.mouts.foodorders.mapper;

import java.util.List;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Mappings;

import info.mouts.foodorders.domain.Notification;
import info.mouts.foodorders.domain.Order;
import info.mouts.foodorders.domain.OrderItem;
import info.mouts.foodorders.domain.OrderStatus;
import info.mouts.foodorders.dto.NotificationResponseDTO;
import info.mouts.foodorders.dto.OrderFeedEventDTO;
import info.mouts.foodorders.dto.OrderItemRequestDTO;
import info.mouts.foodorders.dto.OrderItemResponseDTO;
import info.mouts.foodorders.dto.OrderRequestDTO;
import info.mouts.foodorders.dto.OrderResponseDTO;
import info.mouts.foodorders.event.OrderChange;

/**
 * Mapper interface for converting between Order DTOs (Data Transfer Objects)
 * and Order domain entities using MapStruct.
 * Provides mappings for {@link Order}, {@link OrderItem}, feed payloads and
 * {@link Notification}s.
 */
@Mapper(componentModel = "spring")
public interface OrderMapper {

    /**
     * Maps an {@link OrderItemRequestDTO} to an {@link OrderItem} entity.
     * Ignores the 'id' and 'order' fields during mapping.
     *
     * @param dto The source {@link OrderItemRequestDTO}.
     * @return The mapped {@link OrderItem} entity.
     */
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "order", ignore = true)
    OrderItem toEntity(OrderItemRequestDTO dto);

    List<OrderItem> toEntityList(List<OrderItemRequestDTO> dtoList);

    /**
     * Maps an {@link OrderRequestDTO} to an {@link Order} entity. Identifier,
     * owner and status are assigned by the service; items are attached through
     * {@link Order#addItem(OrderItem)} so the back reference is set.
     *
     * @param dto The source {@link OrderRequestDTO}.
     * @return The mapped {@link Order} entity.
     */
    @Mappings({
            @Mapping(target = "id", ignore = true),
            @Mapping(target = "orderNumber", ignore = true),
            @Mapping(target = "userId", ignore = true),
            @Mapping(target = "status", ignore = true),
            @Mapping(target = "items", ignore = true),
            @Mapping(target = "createdAt", ignore = true),
            @Mapping(target = "updatedAt", ignore = true),
            @Mapping(target = "newEntity", ignore = true)
    })
    Order toEntity(OrderRequestDTO dto);

    /**
     * Builds a new {@link Order} in {@link OrderStatus#PENDING} owned by
     * {@code ownerId}, with its items attached. The identifier is left for the
     * caller to assign.
     *
     * @param dto     The validated order request.
     * @param ownerId The principal id of the owner.
     * @return A transient order ready to be persisted.
     */
    default Order toNewOrder(OrderRequestDTO dto, String ownerId) {
        Order order = toEntity(dto);
        toEntityList(dto.getItems()).forEach(order::addItem);
        order.setUserId(ownerId);
        order.setStatus(OrderStatus.PENDING);
        return order;
    }

    OrderItemResponseDTO toOrderItemResponseDto(OrderItem entity);

    List<OrderItemResponseDTO> toOrderItemResponseDtoList(List<OrderItem> entityList);

    /**
     * Maps an {@link Order} entity to an {@link OrderResponseDTO}.
     *
     * @param entity The source {@link Order} entity.
     * @return The mapped {@link OrderResponseDTO}.
     */
    OrderResponseDTO toOrderResponseDto(Order entity);

    List<OrderResponseDTO> toOrderResponseDtoList(List<Order> entityList);

    /**
     * Maps an {@link OrderChange} onto the payload pushed to the live order
     * feed. The event type is set by the caller.
     *
     * @param change The order snapshot taken at the change.
     * @return The feed payload without its type.
     */
    @Mappings({
            @Mapping(target = "type", ignore = true),
            @Mapping(source = "orderId", target = "id"),
            @Mapping(source = "orderId", target = "orderId"),
            @Mapping(source = "updatedAt", target = "timestamp")
    })
    OrderFeedEventDTO toFeedEventDto(OrderChange change);

    NotificationResponseDTO toNotificationResponseDto(Notification entity);

    List<NotificationResponseDTO> toNotificationResponseDtoList(List<Notification> entityList);
}
