package info.mouts.foodorders.mapper;

import java.util.List;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Mappings;

import info.mouts.foodorders.domain.Category;
import info.mouts.foodorders.domain.Product;
import info.mouts.foodorders.domain.UserProfile;
import info.mouts.foodorders.dto.CategoryResponseDTO;
import info.mouts.foodorders.dto.ProductRequestDTO;
import info.mouts.foodorders.dto.ProductResponseDTO;
import info.mouts.foodorders.dto.UserProfileResponseDTO;

/**
 * MapStruct mapper for the catalog and user profile resources.
 */
@Mapper(componentModel = "spring")
public interface CatalogMapper {

    CategoryResponseDTO toCategoryResponseDto(Category entity);

    List<CategoryResponseDTO> toCategoryResponseDtoList(List<Category> entityList);

    /**
     * Maps a {@link ProductRequestDTO} to a new {@link Product}. Optional
     * flags and the description are defaulted by the service when absent.
     *
     * @param dto The source {@link ProductRequestDTO}.
     * @return The mapped {@link Product} entity.
     */
    @Mappings({
            @Mapping(target = "id", ignore = true),
            @Mapping(target = "createdAt", ignore = true),
            @Mapping(target = "inStock", ignore = true),
            @Mapping(target = "active", ignore = true),
            @Mapping(target = "description", ignore = true)
    })
    Product toEntity(ProductRequestDTO dto);

    ProductResponseDTO toProductResponseDto(Product entity);

    List<ProductResponseDTO> toProductResponseDtoList(List<Product> entityList);

    UserProfileResponseDTO toUserProfileResponseDto(UserProfile entity);

    List<UserProfileResponseDTO> toUserProfileResponseDtoList(List<UserProfile> entityList);
}
