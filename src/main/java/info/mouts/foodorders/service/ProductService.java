package info.mouts.foodorders.service;

import java.util.List;
import java.util.UUID;

import info.mouts.foodorders.domain.Product;
import info.mouts.foodorders.dto.ProductPatchRequestDTO;
import info.mouts.foodorders.dto.ProductRequestDTO;

public interface ProductService {
    /**
     * Lists products.
     *
     * @param activeOnly Whether inactive products are left out.
     * @param limit      Maximum number of products, capped at 100.
     * @return The products.
     */
    List<Product> findProducts(boolean activeOnly, int limit);

    Product create(ProductRequestDTO request);

    Product update(UUID id, ProductPatchRequestDTO request);

    void delete(UUID id);
}
