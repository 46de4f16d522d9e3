package com.example.supermarket.product;

import com.example.supermarket.category.CategoryNotFoundException;
import com.example.supermarket.category.CategoryRepository;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class ProductService {

  private final ProductRepository productRepository;
  private final CategoryRepository categoryRepository;

  @Transactional
  public Product create(@NotNull @Valid NewProduct cmd) {
    log.info("🗂️ CATALOG Creating product title={} category={}", cmd.title(), cmd.categorySlug());
    Product p = new Product();
    p.setTitle(cmd.title());
    p.setDescription(cmd.description());
    p.setPrice(cmd.price());
    p.setCategorySlug(cmd.categorySlug());
    p.setInStock(cmd.inStock());
    p.setImage(cmd.image());
    if (cmd.rating() != null) p.setRating(cmd.rating());
    try {
      return productRepository.saveAndFlush(p);
    } catch (DataIntegrityViolationException e) {
      if (categoryRepository.existsBySlug(cmd.categorySlug())) {
        log.warn("🗂️ CATALOG Product rejected title={}", cmd.title(), e);
        throw e;
      }
      log.warn("🗂️ CATALOG Product rejected: unknown category {}", cmd.categorySlug());
      throw new CategoryNotFoundException(cmd.categorySlug(), e);
    }
  }

  /**
   * Lists at most 100 products, newest first, optionally narrowed to one
   * category and to titles containing {@code query} (case-insensitive). Blank
   * filters are ignored.
   */
  @Transactional(readOnly = true)
  public List<Product> search(String categorySlug, String query) {
    String category = categorySlug == null || categorySlug.isBlank() ? null : categorySlug.trim();
    String q = query == null || query.isBlank() ? null : query.trim();
    if (category != null && q != null) {
      return productRepository.findTop100ByCategorySlugAndTitleContainingIgnoreCaseOrderByCreatedAtDescIdDesc(category, q);
    }
    if (category != null) {
      return productRepository.findTop100ByCategorySlugOrderByCreatedAtDescIdDesc(category);
    }
    if (q != null) {
      return productRepository.findTop100ByTitleContainingIgnoreCaseOrderByCreatedAtDescIdDesc(q);
    }
    return productRepository.findTop100ByOrderByCreatedAtDescIdDesc();
  }

  @Transactional(readOnly = true)
  public List<Product> findByCategory(String categorySlug) {
    return productRepository.findByCategorySlugOrderByIdAsc(categorySlug);
  }
}
