package info.mouts.foodorders.service.impl;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import info.mouts.foodorders.domain.Category;
import info.mouts.foodorders.dto.CategoryRequestDTO;
import info.mouts.foodorders.exception.ResourceConflictException;
import info.mouts.foodorders.exception.ResourceNotFoundException;
import info.mouts.foodorders.repository.CategoryRepository;
import info.mouts.foodorders.service.CategoryCache;
import info.mouts.foodorders.service.CategoryService;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of the {@link CategoryService} interface.
 * Active categories are read through a {@link CategoryCache} that every write
 * invalidates.
 */
@Service
@Slf4j
public class CategoryServiceImpl implements CategoryService {
    private final CategoryRepository categoryRepository;
    private final CategoryCache cache;

    /**
     * Constructs an instance of {@code CategoryServiceImpl}.
     *
     * @param categoryRepository The repository for categories.
     * @param clock              The clock the cache measures its age with.
     * @param cacheTtl           How long the active categories are cached.
     */
    public CategoryServiceImpl(CategoryRepository categoryRepository, Clock clock,
            @Value("${app.catalog.category-cache-ttl:5m}") Duration cacheTtl) {
        this.categoryRepository = categoryRepository;
        this.cache = new CategoryCache(cacheTtl, clock);
    }

    @Override
    public List<Category> findActive() {
        return cache.get(() -> {
            log.debug("Reloading active categories");
            return categoryRepository.findAllByOrderBySortOrderAscNameAsc().stream()
                    .filter(Category::isActive)
                    .toList();
        });
    }

    @Override
    @Transactional(readOnly = true)
    public List<Category> findAll() {
        return categoryRepository.findAllByOrderBySortOrderAscNameAsc();
    }

    @Override
    @Transactional(readOnly = true)
    public Category findById(UUID id) {
        return categoryRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Category", id));
    }

    @Override
    @Transactional
    public Category create(CategoryRequestDTO request) {
        String name = request.getName().trim();
        if (categoryRepository.existsByNameIgnoreCase(name)) {
            throw new ResourceConflictException("Category '" + name + "' already exists");
        }

        Category category = Category.builder()
                .name(name)
                .description(request.getDescription())
                .imageUrl(request.getImageUrl())
                .sortOrder(request.getSortOrder() == null ? 0 : request.getSortOrder())
                .active(request.getActive() == null || request.getActive())
                .build();

        Category saved = categoryRepository.save(category);
        cache.invalidate();
        log.info("Category {} created with ID {}", saved.getName(), saved.getId());
        return saved;
    }

    @Override
    @Transactional
    public Category update(UUID id, CategoryRequestDTO request) {
        Category category = findById(id);

        String name = request.getName().trim();
        if (categoryRepository.existsByNameIgnoreCaseAndIdNot(name, id)) {
            throw new ResourceConflictException("Category '" + name + "' already exists");
        }

        category.setName(name);
        category.setDescription(request.getDescription());
        category.setImageUrl(request.getImageUrl());
        if (request.getSortOrder() != null) {
            category.setSortOrder(request.getSortOrder());
        }
        if (request.getActive() != null) {
            category.setActive(request.getActive());
        }

        Category saved = categoryRepository.save(category);
        cache.invalidate();
        log.info("Category {} updated", id);
        return saved;
    }

    @Override
    @Transactional
    public void delete(UUID id) {
        Category category = findById(id);
        categoryRepository.delete(category);
        cache.invalidate();
        log.info("Category {} deleted", id);
    }
}
