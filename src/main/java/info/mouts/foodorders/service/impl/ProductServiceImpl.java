package info.mouts.foodorders.service.impl;

import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import info.mouts.foodorders.domain.Product;
import info.mouts.foodorders.dto.ProductPatchRequestDTO;
import info.mouts.foodorders.dto.ProductRequestDTO;
import info.mouts.foodorders.exception.InvalidRequestException;
import info.mouts.foodorders.exception.ResourceNotFoundException;
import info.mouts.foodorders.mapper.CatalogMapper;
import info.mouts.foodorders.repository.ProductRepository;
import info.mouts.foodorders.service.ProductService;
import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
public class ProductServiceImpl implements ProductService {
    static final int MAX_LIMIT = 100;

    private final ProductRepository productRepository;
    private final CatalogMapper catalogMapper;

    /**
     * Constructs an instance of {@code ProductServiceImpl}.
     *
     * @param productRepository The repository for products.
     * @param catalogMapper     The mapper for converting between DTOs and entities.
     */
    public ProductServiceImpl(ProductRepository productRepository, CatalogMapper catalogMapper) {
        this.productRepository = productRepository;
        this.catalogMapper = catalogMapper;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Product> findProducts(boolean activeOnly, int limit) {
        if (limit <= 0) {
            throw new InvalidRequestException("limit", "limit must be positive");
        }
        PageRequest page = PageRequest.of(0, Math.min(limit, MAX_LIMIT), Sort.by("name"));

        return activeOnly ? productRepository.findByActiveTrue(page) : productRepository.findAll(page).getContent();
    }

    @Override
    @Transactional
    public Product create(ProductRequestDTO request) {
        Product product = catalogMapper.toEntity(request);
        product.setDescription(request.getDescription() == null ? "" : request.getDescription());
        product.setInStock(request.getInStock() == null || request.getInStock());
        product.setActive(request.getActive() == null || request.getActive());

        Product saved = productRepository.save(product);
        log.info("Product {} created with ID {}", saved.getName(), saved.getId());
        return saved;
    }

    @Override
    @Transactional
    public Product update(UUID id, ProductPatchRequestDTO request) {
        Product product = productRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Product", id));

        if (request.getName() != null) {
            product.setName(request.getName());
        }
        if (request.getPrice() != null) {
            product.setPrice(request.getPrice());
        }
        if (request.getCategory() != null) {
            product.setCategory(request.getCategory());
        }
        if (request.getImageUrl() != null) {
            product.setImageUrl(request.getImageUrl());
        }
        if (request.getDescription() != null) {
            product.setDescription(request.getDescription());
        }
        if (request.getInStock() != null) {
            product.setInStock(request.getInStock());
        }
        if (request.getActive() != null) {
            product.setActive(request.getActive());
        }

        log.info("Product {} updated", id);
        return productRepository.save(product);
    }

    @Override
    @Transactional
    public void delete(UUID id) {
        Product product = productRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Product", id));
        productRepository.delete(product);
        log.info("Product {} deleted", id);
    }
}
