package info.mouts.foodorders.controller;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import info.mouts.foodorders.domain.Product;
import info.mouts.foodorders.dto.CategoryRequestDTO;
import info.mouts.foodorders.dto.CategoryResponseDTO;
import info.mouts.foodorders.dto.ProductPatchRequestDTO;
import info.mouts.foodorders.dto.ProductRequestDTO;
import info.mouts.foodorders.dto.ProductResponseDTO;
import info.mouts.foodorders.dto.SuccessResponseDTO;
import info.mouts.foodorders.mapper.CatalogMapper;
import info.mouts.foodorders.service.CategoryService;
import info.mouts.foodorders.service.ProductService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

/**
 * Products and categories. Reads are public; category writes are reserved to
 * administrators, product writes to authenticated users.
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Catalog API", description = "Products and categories")
public class CatalogController {
    private final ProductService productService;
    private final CategoryService categoryService;
    private final CatalogMapper catalogMapper;

    /**
     * Constructs an instance of {@code CatalogController}.
     *
     * @param productService  Service for products.
     * @param categoryService Service for categories.
     * @param catalogMapper   Mapper for converting between entities and DTOs.
     */
    public CatalogController(ProductService productService, CategoryService categoryService,
            CatalogMapper catalogMapper) {
        this.productService = productService;
        this.categoryService = categoryService;
        this.catalogMapper = catalogMapper;
    }

    @GetMapping("/products")
    @Operation(summary = "List Products", description = "Retrieves up to 100 products, only active ones by default.")
    public ResponseEntity<Map<String, List<ProductResponseDTO>>> listProducts(
            @RequestParam(defaultValue = "true") boolean active,
            @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(Map.of("products",
                catalogMapper.toProductResponseDtoList(productService.findProducts(active, limit))));
    }

    @PostMapping(value = "/products", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Create a Product")
    public ResponseEntity<Map<String, Object>> createProduct(@Validated @RequestBody ProductRequestDTO request) {
        Product product = productService.create(request);

        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("success", true, "productId", product.getId()));
    }

    @PutMapping(value = "/products/{productId}", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Update a Product", description = "Changes the fields present in the request.")
    public ResponseEntity<ProductResponseDTO> updateProduct(@PathVariable UUID productId,
            @Validated @RequestBody ProductPatchRequestDTO request) {
        return ResponseEntity.ok(catalogMapper.toProductResponseDto(productService.update(productId, request)));
    }

    @DeleteMapping("/products/{productId}")
    @Operation(summary = "Delete a Product")
    public ResponseEntity<SuccessResponseDTO> deleteProduct(@PathVariable UUID productId) {
        productService.delete(productId);

        return ResponseEntity.ok(SuccessResponseDTO.ok());
    }

    @GetMapping("/categories")
    @Operation(summary = "List Active Categories", description = "Retrieves the active categories in display order.")
    public ResponseEntity<Map<String, List<CategoryResponseDTO>>> listActiveCategories() {
        return ResponseEntity.ok(Map.of("categories",
                catalogMapper.toCategoryResponseDtoList(categoryService.findActive())));
    }

    @GetMapping("/admin/categories")
    @Operation(summary = "List All Categories", description = "Retrieves every category, active or not.")
    public ResponseEntity<Map<String, List<CategoryResponseDTO>>> listCategories() {
        return ResponseEntity.ok(Map.of("categories",
                catalogMapper.toCategoryResponseDtoList(categoryService.findAll())));
    }

    @GetMapping("/admin/categories/{categoryId}")
    @Operation(summary = "Get a Category by ID")
    public ResponseEntity<CategoryResponseDTO> findCategory(@PathVariable UUID categoryId) {
        return ResponseEntity.ok(catalogMapper.toCategoryResponseDto(categoryService.findById(categoryId)));
    }

    @PostMapping(value = "/admin/categories", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Create a Category", description = "Category names are unique regardless of case.")
    public ResponseEntity<CategoryResponseDTO> createCategory(@Validated @RequestBody CategoryRequestDTO request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(catalogMapper.toCategoryResponseDto(categoryService.create(request)));
    }

    @PutMapping(value = "/admin/categories/{categoryId}", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Update a Category")
    public ResponseEntity<CategoryResponseDTO> updateCategory(@PathVariable UUID categoryId,
            @Validated @RequestBody CategoryRequestDTO request) {
        return ResponseEntity.ok(catalogMapper.toCategoryResponseDto(categoryService.update(categoryId, request)));
    }

    @DeleteMapping("/admin/categories/{categoryId}")
    @Operation(summary = "Delete a Category")
    public ResponseEntity<SuccessResponseDTO> deleteCategory(@PathVariable UUID categoryId) {
        categoryService.delete(categoryId);

        return ResponseEntity.ok(SuccessResponseDTO.ok());
    }
}
