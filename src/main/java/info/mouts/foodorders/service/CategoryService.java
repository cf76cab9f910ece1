package info.mouts.foodorders.service;

import java.util.List;
import java.util.UUID;

import info.mouts.foodorders.domain.Category;
import info.mouts.foodorders.dto.CategoryRequestDTO;

public interface CategoryService {
    /**
     * Lists the active categories ordered for display. Served from a
     * short-lived cache.
     *
     * @return The active categories.
     */
    List<Category> findActive();

    List<Category> findAll();

    Category findById(UUID id);

    Category create(CategoryRequestDTO request);

    Category update(UUID id, CategoryRequestDTO request);

    void delete(UUID id);
}
